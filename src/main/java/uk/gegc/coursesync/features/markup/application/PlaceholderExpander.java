package uk.gegc.coursesync.features.markup.application;

import org.springframework.stereotype.Component;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {{include:name}}} and {@code {{var:name}}} placeholders. Includes may contain
 * placeholders themselves, up to a fixed depth. Unknown names stay in place and raise a warning.
 */
@Component
public class PlaceholderExpander {

    static final int MAX_INCLUDE_DEPTH = 5;

    private static final Pattern INCLUDE = Pattern.compile("\\{\\{\\s*include:\\s*([\\w./-]+)\\s*}}");
    private static final Pattern VARIABLE = Pattern.compile("\\{\\{\\s*var:\\s*([\\w.-]+)\\s*}}");

    public String expand(String text, RenderContext context) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String expanded = expandIncludes(text, context, 0);
        return replace(expanded, VARIABLE, name -> context.variables().variable(name).orElseGet(() -> {
            context.warnings().accept("Unknown variable '" + name + "'");
            return null;
        }));
    }

    private String expandIncludes(String text, RenderContext context, int depth) {
        if (depth >= MAX_INCLUDE_DEPTH) {
            if (INCLUDE.matcher(text).find()) {
                context.warnings().accept("Include nesting deeper than " + MAX_INCLUDE_DEPTH + " levels, stopped");
            }
            return text;
        }
        return replace(text, INCLUDE, name -> context.includes().include(name)
                .map(content -> expandIncludes(content.strip(), context, depth + 1))
                .orElseGet(() -> {
                    context.warnings().accept("Unknown include '" + name + "'");
                    return null;
                }));
    }

    private static String replace(String text, Pattern pattern, Function<String, String> lookup) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = lookup.apply(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
