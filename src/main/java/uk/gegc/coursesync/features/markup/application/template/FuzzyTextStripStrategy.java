package uk.gegc.coursesync.features.markup.application.template;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Text-level match for fragments the platform rewrote: consumes elements from the given edge while the
 * normalized text of each is contained in the fragment text, or the fragment text in it.
 */
public class FuzzyTextStripStrategy implements TemplateStripStrategy {

    @Override
    public String name() {
        return "fuzzy-text";
    }

    @Override
    public StripOutcome strip(Element container, String fragmentHtml, Edge edge) {
        String fragmentText = normalize(Jsoup.parseBodyFragment(fragmentHtml).body().text());
        if (fragmentText.isEmpty()) {
            return StripOutcome.noMatch(name(), edge, "fragment has no text");
        }
        List<Element> elements = new ArrayList<>(container.children());
        if (edge == Edge.END) {
            Collections.reverse(elements);
        }
        List<Element> matched = new ArrayList<>();
        for (Element element : elements) {
            String text = normalize(element.text());
            if (text.isEmpty()) {
                break;
            }
            if (fragmentText.contains(text)) {
                matched.add(element);
                continue;
            }
            if (matched.isEmpty() && text.contains(fragmentText) && text.length() <= fragmentText.length() * 2) {
                matched.add(element);
            }
            break;
        }
        if (matched.isEmpty()) {
            return StripOutcome.noMatch(name(), edge, "no similar element at edge");
        }
        matched.forEach(Element::remove);
        return StripOutcome.matched(name(), edge, matched.size() + " element(s)");
    }

    private static String normalize(String text) {
        return String.join(" ", text.trim().split("\\s+")).toLowerCase(Locale.ROOT).trim();
    }
}
