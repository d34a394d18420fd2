package uk.gegc.coursesync.features.markup.application.template;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the fragment when the elements at the given edge serialize to the same markup, whitespace
 * collapsed.
 */
public class ExactMarkupStripStrategy implements TemplateStripStrategy {

    @Override
    public String name() {
        return "exact";
    }

    @Override
    public StripOutcome strip(Element container, String fragmentHtml, Edge edge) {
        List<Element> fragment = Jsoup.parseBodyFragment(fragmentHtml).body().children();
        List<Element> content = container.children();
        if (fragment.isEmpty() || fragment.size() > content.size()) {
            return StripOutcome.noMatch(name(), edge, "fragment larger than content");
        }
        int offset = edge == Edge.START ? 0 : content.size() - fragment.size();
        List<Element> candidates = new ArrayList<>(content.subList(offset, offset + fragment.size()));
        for (int i = 0; i < fragment.size(); i++) {
            if (!normalize(fragment.get(i).outerHtml()).equals(normalize(candidates.get(i).outerHtml()))) {
                return StripOutcome.noMatch(name(), edge, "markup differs");
            }
        }
        candidates.forEach(Element::remove);
        return StripOutcome.matched(name(), edge, fragment.size() + " element(s)");
    }

    private static String normalize(String html) {
        return html.replaceAll(">\\s+<", "><").replaceAll("\\s+", " ").strip();
    }
}
