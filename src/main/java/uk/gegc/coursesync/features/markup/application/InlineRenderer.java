package uk.gegc.coursesync.features.markup.application;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline Markdown spans. Code spans, inline HTML, links and images are swapped for placeholders before
 * emphasis runs so their content is never re-interpreted.
 */
class InlineRenderer {

    private static final Pattern CODE_SPAN = Pattern.compile("(`+)(.+?)\\1", Pattern.DOTALL);
    private static final Pattern AUTOLINK = Pattern.compile("<((?:https?|mailto|ftp):[^\\s>]+)>");
    private static final Pattern INLINE_HTML =
            Pattern.compile("<!--.*?-->|</?[A-Za-z][A-Za-z0-9-]*(?:\\s+[^<>]*?)?\\s*/?>", Pattern.DOTALL);
    private static final Pattern IMAGE =
            Pattern.compile("!\\[([^\\]]*)\\]\\(\\s*<?([^)\\s>]*)>?(?:\\s+\"([^\"]*)\")?\\s*\\)");
    private static final Pattern LINK =
            Pattern.compile("\\[([^\\]]+)\\]\\(\\s*<?([^)\\s>]*)>?(?:\\s+\"([^\"]*)\")?\\s*\\)");
    private static final Pattern STRONG = Pattern.compile("(\\*\\*|__)(?=\\S)(.+?)(?<=\\S)\\1");
    private static final Pattern EM_STAR = Pattern.compile("(?<![\\w*])\\*(?=\\S)(.+?)(?<=\\S)\\*(?![\\w*])");
    private static final Pattern EM_UNDERSCORE = Pattern.compile("(?<![\\w_])_(?=\\S)(.+?)(?<=\\S)_(?![\\w_])");
    private static final Pattern STRIKE = Pattern.compile("~~(?=\\S)(.+?)(?<=\\S)~~");
    private static final Pattern HARD_BREAK = Pattern.compile(" {2,}\n");
    private static final Pattern PLACEHOLDER = Pattern.compile("\u0000(\\d+)\u0000");

    String render(String text) {
        List<String> stash = new ArrayList<>();
        String work = text;

        work = replace(work, CODE_SPAN, m -> stash(stash, "<code>" + escape(m.group(2).strip()) + "</code>"));
        work = replace(work, AUTOLINK, m -> stash(stash,
                "<a href=\"" + escapeAttribute(m.group(1)) + "\">" + escape(m.group(1)) + "</a>"));
        work = replace(work, INLINE_HTML, m -> stash(stash, m.group()));
        work = replace(work, IMAGE, m -> stash(stash, image(m)));
        work = replace(work, LINK, m -> stash(stash, link(m, stash)));

        work = escape(work);
        work = replace(work, STRONG, m -> "<strong>" + m.group(2) + "</strong>");
        work = replace(work, EM_STAR, m -> "<em>" + m.group(1) + "</em>");
        work = replace(work, EM_UNDERSCORE, m -> "<em>" + m.group(1) + "</em>");
        work = replace(work, STRIKE, m -> "<del>" + m.group(1) + "</del>");
        work = HARD_BREAK.matcher(work).replaceAll("<br />\n");

        return restore(work, stash);
    }

    private String image(Matcher m) {
        StringBuilder html = new StringBuilder("<img alt=\"").append(escapeAttribute(m.group(1)))
                .append("\" src=\"").append(escapeAttribute(m.group(2))).append('"');
        if (m.group(3) != null) {
            html.append(" title=\"").append(escapeAttribute(m.group(3))).append('"');
        }
        return html.append(" />").toString();
    }

    private String link(Matcher m, List<String> stash) {
        String label = render(restore(m.group(1), stash));
        StringBuilder html = new StringBuilder("<a href=\"").append(escapeAttribute(m.group(2))).append('"');
        if (m.group(3) != null) {
            html.append(" title=\"").append(escapeAttribute(m.group(3))).append('"');
        }
        return html.append('>').append(label).append("</a>").toString();
    }

    private static String stash(List<String> stash, String html) {
        stash.add(html);
        return "\u0000" + (stash.size() - 1) + "\u0000";
    }

    private static String restore(String text, List<String> stash) {
        String current = text;
        // Placeholders may nest (a link label holding code), so restore until stable
        for (int pass = 0; pass < 4 && current.indexOf('\u0000') >= 0; pass++) {
            current = replace(current, PLACEHOLDER, m -> stash.get(Integer.parseInt(m.group(1))));
        }
        return current;
    }

    private static String replace(String input, Pattern pattern, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String escape(String text) {
        return text.replaceAll("&(?!#?\\w+;)", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    static String escapeAttribute(String text) {
        return escape(text).replace("\"", "&quot;");
    }
}
