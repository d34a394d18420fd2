package uk.gegc.coursesync.features.markup.application.template;

import org.jsoup.nodes.Element;

/**
 * Terminal strategy: leaves the content as it is.
 */
public class NoMatchStripStrategy implements TemplateStripStrategy {

    @Override
    public String name() {
        return "none";
    }

    @Override
    public StripOutcome strip(Element container, String fragmentHtml, Edge edge) {
        return StripOutcome.noMatch(name(), edge, "left as-is");
    }
}
