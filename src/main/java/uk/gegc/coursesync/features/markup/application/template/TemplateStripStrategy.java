package uk.gegc.coursesync.features.markup.application.template;

import org.jsoup.nodes.Element;

/**
 * One way of finding and removing an injected template fragment. A strategy that cannot find the
 * fragment must leave {@code container} untouched and report no match.
 */
public interface TemplateStripStrategy {

    String name();

    StripOutcome strip(Element container, String fragmentHtml, Edge edge);
}
