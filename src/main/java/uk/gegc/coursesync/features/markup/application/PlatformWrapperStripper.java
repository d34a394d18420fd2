package uk.gegc.coursesync.features.markup.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finds the author content inside platform page HTML. Selectors are tried most specific first;
 * the document body is the fallback.
 */
@Component
public class PlatformWrapperStripper {

    static final List<String> CONTENT_SELECTORS = List.of(
            ".user_content",
            ".show-content",
            "#wiki_page_show",
            ".page-content",
            "article",
            ".content");

    public Element extract(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        for (String selector : CONTENT_SELECTORS) {
            Element content = document.selectFirst(selector);
            if (content != null) {
                return content;
            }
        }
        return document.body();
    }
}
