package uk.gegc.coursesync.features.markup.application.template;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.markup.application.MarkdownRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort removal of header and footer fragments injected by a template set. Each fragment is tried
 * against the strategies in order; the terminal {@link NoMatchStripStrategy} always ends the chain, so
 * an unrecognised fragment leaves the content untouched.
 */
@Slf4j
@Component
public class TemplateStripper {

    private final MarkdownRenderer markdownRenderer;
    private final List<TemplateStripStrategy> strategies;

    @Autowired
    public TemplateStripper(MarkdownRenderer markdownRenderer) {
        this(markdownRenderer, List.of(
                new UnwrapStripStrategy(),
                new ExactMarkupStripStrategy(),
                new FuzzyTextStripStrategy()));
    }

    public TemplateStripper(MarkdownRenderer markdownRenderer, List<TemplateStripStrategy> strategies) {
        this.markdownRenderer = markdownRenderer;
        List<TemplateStripStrategy> chain = new ArrayList<>(strategies);
        chain.add(new NoMatchStripStrategy());
        this.strategies = List.copyOf(chain);
    }

    public List<StripOutcome> strip(Element container, TemplateSet templates) {
        List<StripOutcome> outcomes = new ArrayList<>();
        if (templates == null || templates.isEmpty()) {
            return outcomes;
        }
        // Raw HTML fragments wrap the converted Markdown, so they are the outermost on each edge
        stripEach(container, Edge.START,
                List.of(templates.headerHtml(), markdownRenderer.render(templates.headerMarkdown())), outcomes);
        stripEach(container, Edge.END,
                List.of(templates.footerHtml(), markdownRenderer.render(templates.footerMarkdown())), outcomes);
        return outcomes;
    }

    private void stripEach(Element container, Edge edge, List<String> fragments, List<StripOutcome> outcomes) {
        for (String fragment : fragments) {
            if (fragment == null || fragment.isBlank()) {
                continue;
            }
            StripOutcome outcome = apply(container, fragment, edge);
            outcomes.add(outcome);
            if (outcome.matched()) {
                log.debug("Stripped template {} fragment with {} ({})", edge, outcome.strategy(), outcome.detail());
            }
        }
    }

    private StripOutcome apply(Element container, String fragment, Edge edge) {
        StripOutcome last = null;
        for (TemplateStripStrategy strategy : strategies) {
            last = strategy.strip(container, fragment, edge);
            if (last.matched()) {
                return last;
            }
        }
        return last;
    }
}
