package uk.gegc.coursesync.features.markup.application.template;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Handles a header that opens a wrapping element closed by the footer. When the parsed header is a
 * single empty element and the content is one element with the same tag and classes, that element is
 * unwrapped. The footer side of such a pair has no element of its own and is reported as matched.
 */
public class UnwrapStripStrategy implements TemplateStripStrategy {

    @Override
    public String name() {
        return "unwrap";
    }

    @Override
    public StripOutcome strip(Element container, String fragmentHtml, Edge edge) {
        String trimmed = fragmentHtml.strip();
        if (edge == Edge.END) {
            boolean closingOnly = trimmed.matches("(</[a-zA-Z][a-zA-Z0-9]*>\\s*)+");
            return closingOnly
                    ? StripOutcome.matched(name(), edge, "closing tags only")
                    : StripOutcome.noMatch(name(), edge, "not a closing fragment");
        }
        List<Element> fragment = Jsoup.parseBodyFragment(trimmed).body().children();
        if (fragment.size() != 1 || fragment.get(0).childNodeSize() > 0) {
            return StripOutcome.noMatch(name(), edge, "not a single opening element");
        }
        Element opener = fragment.get(0);
        List<Element> elements = container.children();
        if (elements.size() != 1) {
            return StripOutcome.noMatch(name(), edge, "content is not a single wrapper");
        }
        Element wrapper = elements.get(0);
        if (!wrapper.normalName().equals(opener.normalName()) || !wrapper.classNames().equals(opener.classNames())) {
            return StripOutcome.noMatch(name(), edge, "wrapper differs");
        }
        wrapper.unwrap();
        return StripOutcome.matched(name(), edge, "unwrapped <" + opener.normalName() + ">");
    }
}
