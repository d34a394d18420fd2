package uk.gegc.coursesync.features.markup.application;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown to HTML for page, assignment and quiz-description bodies.
 * <p>
 * Supports headings, paragraphs, emphasis, inline code, links, images, fenced and indented code, block
 * quotes, rules, pipe tables, raw HTML blocks and inline HTML. Raw HTML passes through untouched and is
 * never balanced, so a header fragment may open an element that a footer fragment closes.
 * <p>
 * List nesting follows the classic rule of four spaces per level: a sub-item indented by two spaces is a
 * sibling of the item above it, not a child.
 */
@Component
public class MarkdownRenderer {

    static final int LIST_INDENT = 4;

    private static final Pattern FENCE = Pattern.compile("^\\s{0,3}(`{3,}|~{3,})\\s*([\\w+#.-]*)\\s*$");
    private static final Pattern HEADING = Pattern.compile("^\\s{0,3}(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern RULE = Pattern.compile("^\\s{0,3}([-*_])(\\s*\\1){2,}\\s*$");
    private static final Pattern HTML_BLOCK = Pattern.compile("^\\s{0,3}(<!--|</?(?i:" + String.join("|",
            "div", "p", "table", "thead", "tbody", "tr", "td", "th", "section", "article", "header", "footer",
            "aside", "nav", "main", "figure", "figcaption", "details", "summary", "blockquote", "pre", "ul", "ol",
            "li", "dl", "h[1-6]", "hr", "iframe", "video", "audio", "script", "style", "form", "center",
            "object", "embed", "noscript") + ")(\\s|>|/>|$))");
    private static final Pattern LIST_ITEM = Pattern.compile("^( *)([-*+]|\\d+[.)])\\s+(.*)$");
    private static final Pattern QUOTE = Pattern.compile("^\\s{0,3}>\\s?(.*)$");
    private static final Pattern TABLE_SEPARATOR =
            Pattern.compile("^\\s*\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?\\s*$");
    private static final Pattern INDENTED_CODE = Pattern.compile("^( {4}|\\t)(.*)$");

    private final InlineRenderer inline = new InlineRenderer();

    public String render(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = List.of(normalized.split("\n", -1));
        StringBuilder out = new StringBuilder();
        renderBlocks(lines, out);
        return out.toString().trim();
    }

    private void renderBlocks(List<String> lines, StringBuilder out) {
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            Matcher fence = FENCE.matcher(line);
            if (fence.matches()) {
                i = renderFence(lines, i, fence.group(1), fence.group(2), out);
                continue;
            }
            if (HTML_BLOCK.matcher(line).find()) {
                i = renderHtmlBlock(lines, i, out);
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                int level = heading.group(1).length();
                out.append("<h").append(level).append('>')
                        .append(inline.render(heading.group(2)))
                        .append("</h").append(level).append(">\n");
                i++;
                continue;
            }
            if (RULE.matcher(line).matches()) {
                out.append("<hr />\n");
                i++;
                continue;
            }
            if (isTableStart(lines, i)) {
                i = renderTable(lines, i, out);
                continue;
            }
            if (QUOTE.matcher(line).matches()) {
                i = renderQuote(lines, i, out);
                continue;
            }
            Matcher item = LIST_ITEM.matcher(line);
            if (item.matches() && item.group(1).length() < LIST_INDENT) {
                i = renderList(lines, i, out);
                continue;
            }
            if (INDENTED_CODE.matcher(line).matches()) {
                i = renderIndentedCode(lines, i, out);
                continue;
            }
            i = renderParagraph(lines, i, out);
        }
    }

    private int renderFence(List<String> lines, int start, String marker, String language, StringBuilder out) {
        StringBuilder code = new StringBuilder();
        int i = start + 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (trimmed.startsWith(marker.substring(0, 3)) && trimmed.chars().allMatch(c -> c == marker.charAt(0))
                    && trimmed.length() >= marker.length()) {
                i++;
                break;
            }
            code.append(line).append('\n');
            i++;
        }
        out.append("<pre><code");
        if (!language.isEmpty()) {
            out.append(" class=\"language-").append(InlineRenderer.escape(language)).append('"');
        }
        out.append('>').append(InlineRenderer.escape(code.toString())).append("</code></pre>\n");
        return i;
    }

    private int renderHtmlBlock(List<String> lines, int start, StringBuilder out) {
        int i = start;
        while (i < lines.size() && !lines.get(i).isBlank()) {
            out.append(lines.get(i)).append('\n');
            i++;
        }
        return i;
    }

    private int renderIndentedCode(List<String> lines, int start, StringBuilder out) {
        List<String> code = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            Matcher m = INDENTED_CODE.matcher(line);
            if (m.matches()) {
                code.add(m.group(2));
            } else if (line.isBlank() && i + 1 < lines.size() && INDENTED_CODE.matcher(lines.get(i + 1)).matches()) {
                code.add("");
            } else {
                break;
            }
            i++;
        }
        out.append("<pre><code>")
                .append(InlineRenderer.escape(String.join("\n", code)))
                .append("\n</code></pre>\n");
        return i;
    }

    private int renderParagraph(List<String> lines, int start, StringBuilder out) {
        List<String> text = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank() || (i > start && startsBlock(lines, i))) {
                break;
            }
            text.add(line.strip());
            i++;
        }
        out.append("<p>").append(inline.render(String.join("\n", text))).append("</p>\n");
        return i;
    }

    private boolean startsBlock(List<String> lines, int i) {
        String line = lines.get(i);
        Matcher item = LIST_ITEM.matcher(line);
        return FENCE.matcher(line).matches()
                || HEADING.matcher(line).matches()
                || RULE.matcher(line).matches()
                || QUOTE.matcher(line).matches()
                || HTML_BLOCK.matcher(line).find()
                || (item.matches() && item.group(1).length() < LIST_INDENT)
                || isTableStart(lines, i);
    }

    private int renderQuote(List<String> lines, int start, StringBuilder out) {
        List<String> inner = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            Matcher m = QUOTE.matcher(lines.get(i));
            if (m.matches()) {
                inner.add(m.group(1));
            } else if (!lines.get(i).isBlank() && !inner.isEmpty() && !inner.get(inner.size() - 1).isBlank()) {
                inner.add(lines.get(i));
            } else {
                break;
            }
            i++;
        }
        out.append("<blockquote>\n");
        renderBlocks(inner, out);
        out.append("</blockquote>\n");
        return i;
    }

    private boolean isTableStart(List<String> lines, int i) {
        return i + 1 < lines.size()
                && lines.get(i).contains("|")
                && TABLE_SEPARATOR.matcher(lines.get(i + 1)).matches()
                && lines.get(i + 1).contains("-");
    }

    private int renderTable(List<String> lines, int start, StringBuilder out) {
        List<String> header = splitRow(lines.get(start));
        List<String> alignments = new ArrayList<>();
        for (String cell : splitRow(lines.get(start + 1))) {
            boolean left = cell.startsWith(":");
            boolean right = cell.endsWith(":");
            alignments.add(left && right ? "center" : right ? "right" : left ? "left" : null);
        }
        out.append("<table>\n<thead>\n<tr>\n");
        for (int c = 0; c < header.size(); c++) {
            out.append(cellTag("th", alignment(alignments, c))).append(inline.render(header.get(c))).append("</th>\n");
        }
        out.append("</tr>\n</thead>\n<tbody>\n");
        int i = start + 2;
        while (i < lines.size() && !lines.get(i).isBlank() && lines.get(i).contains("|")) {
            List<String> cells = splitRow(lines.get(i));
            out.append("<tr>\n");
            for (int c = 0; c < header.size(); c++) {
                String cell = c < cells.size() ? cells.get(c) : "";
                out.append(cellTag("td", alignment(alignments, c))).append(inline.render(cell)).append("</td>\n");
            }
            out.append("</tr>\n");
            i++;
        }
        out.append("</tbody>\n</table>\n");
        return i;
    }

    private static String alignment(List<String> alignments, int column) {
        return column < alignments.size() ? alignments.get(column) : null;
    }

    private static String cellTag(String tag, String align) {
        return align == null ? "<" + tag + ">" : "<" + tag + " style=\"text-align: " + align + ";\">";
    }

    private static List<String> splitRow(String row) {
        String trimmed = row.trim();
        if (trimmed.startsWith("|")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("|") && !trimmed.endsWith("\\|")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : trimmed.split("(?<!\\\\)\\|", -1)) {
            cells.add(cell.trim().replace("\\|", "|"));
        }
        return cells;
    }

    private int renderList(List<String> lines, int start, StringBuilder out) {
        List<ListLine> items = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            Matcher m = LIST_ITEM.matcher(line);
            if (m.matches()) {
                int indent = m.group(1).length();
                boolean ordered = Character.isDigit(m.group(2).charAt(0));
                items.add(new ListLine(indent / LIST_INDENT, ordered, new StringBuilder(m.group(3).strip())));
                i++;
                continue;
            }
            if (line.isBlank()) {
                int next = i + 1;
                if (next < lines.size() && (LIST_ITEM.matcher(lines.get(next)).matches()
                        || lines.get(next).startsWith("  "))) {
                    i++;
                    continue;
                }
                break;
            }
            if (!items.isEmpty() && (line.startsWith("  ") || !startsBlock(lines, i))) {
                items.get(items.size() - 1).text().append('\n').append(line.strip());
                i++;
                continue;
            }
            break;
        }
        buildList(items, 0, items.get(0).level(), out);
        return i;
    }

    private int buildList(List<ListLine> items, int start, int level, StringBuilder out) {
        String tag = items.get(start).ordered() ? "ol" : "ul";
        out.append('<').append(tag).append(">\n");
        int i = start;
        while (i < items.size() && items.get(i).level() >= level) {
            ListLine item = items.get(i);
            out.append("<li>").append(inline.render(item.text().toString()));
            i++;
            if (i < items.size() && items.get(i).level() > level) {
                out.append('\n');
                i = buildList(items, i, items.get(i).level(), out);
            }
            out.append("</li>\n");
        }
        out.append("</").append(tag).append(">\n");
        return i;
    }

    private record ListLine(int level, boolean ordered, StringBuilder text) {
    }
}
