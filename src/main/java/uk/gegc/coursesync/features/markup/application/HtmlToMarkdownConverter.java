package uk.gegc.coursesync.features.markup.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rich text back to author Markdown. Nested lists are written with four spaces per level so that
 * {@link MarkdownRenderer} nests them again. Embedded media without a Markdown form stays as raw HTML.
 */
@Component
public class HtmlToMarkdownConverter {

    private static final Set<String> RAW_HTML_TAGS = Set.of("iframe", "video", "audio", "object", "embed", "details");
    private static final Set<String> DROPPED_TAGS = Set.of("script", "style", "head", "title", "meta", "link");
    private static final Pattern LANGUAGE_CLASS = Pattern.compile("(?:^|\\s)(?:language|lang)-([\\w+#-]+)");
    private static final Pattern CODE_SENTINEL =
            Pattern.compile("\\[code(?:=([\\w+#-]+))?\\](.*?)\\[/code\\]", Pattern.DOTALL);
    private static final String INDENT = " ".repeat(MarkdownRenderer.LIST_INDENT);

    public String convert(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return convert(Jsoup.parseBodyFragment(html).body());
    }

    public String convert(Element root) {
        String markdown = children(root, false);
        return cleanup(convertCodeSentinels(markdown));
    }

    /**
     * Pseudo code blocks written as {@code [code]...[/code]} become fenced blocks.
     */
    static String convertCodeSentinels(String markdown) {
        Matcher m = CODE_SENTINEL.matcher(markdown);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String language = m.group(1) == null ? "" : m.group(1);
            String code = m.group(2).strip();
            m.appendReplacement(sb, Matcher.quoteReplacement("\n\n```" + language + "\n" + code + "\n```\n\n"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String cleanup(String markdown) {
        String normalized = markdown.replace("\r\n", "\n").replace('\u00a0', ' ');
        List<String> lines = new ArrayList<>();
        for (String line : normalized.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        return String.join("\n", lines).replaceAll("\n{3,}", "\n\n").strip();
    }

    private String children(Element element, boolean preformatted) {
        StringBuilder out = new StringBuilder();
        for (Node child : element.childNodes()) {
            out.append(node(child, preformatted));
        }
        return out.toString();
    }

    private String node(Node node, boolean preformatted) {
        if (node instanceof TextNode text) {
            return preformatted ? text.getWholeText() : text.getWholeText().replaceAll("\\s+", " ");
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        String tag = element.normalName();
        if (DROPPED_TAGS.contains(tag)) {
            return "";
        }
        if (RAW_HTML_TAGS.contains(tag)) {
            return block(element.outerHtml());
        }
        return switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" ->
                    block("#".repeat(tag.charAt(1) - '0') + " " + inlineOneLine(element));
            case "p" -> block(children(element, false).strip());
            case "br" -> "<br />\n";
            case "hr" -> block("---");
            case "strong", "b" -> wrap(children(element, false), "**");
            case "em", "i" -> wrap(children(element, false), "*");
            case "del", "s", "strike" -> wrap(children(element, false), "~~");
            case "code" -> "`" + element.wholeText() + "`";
            case "pre" -> fence(element);
            case "a" -> anchor(element);
            case "img" -> image(element);
            case "ul" -> list(element, false, 0);
            case "ol" -> list(element, true, 0);
            case "blockquote" -> quote(element);
            case "table" -> table(element);
            case "div", "section", "article", "header", "footer", "main", "aside", "nav", "figure" ->
                    block(children(element, false).strip());
            default -> children(element, preformatted);
        };
    }

    private static String block(String content) {
        return content.isBlank() ? "" : "\n\n" + content + "\n\n";
    }

    private static String wrap(String content, String marker) {
        String trimmed = content.strip();
        if (trimmed.isEmpty()) {
            return content;
        }
        String leading = content.startsWith(" ") ? " " : "";
        String trailing = content.endsWith(" ") ? " " : "";
        return leading + marker + trimmed + marker + trailing;
    }

    private String inlineOneLine(Element element) {
        return children(element, false).replaceAll("\\s*\n\\s*", " ").strip();
    }

    private String fence(Element pre) {
        Element code = pre.selectFirst("> code");
        Element source = code != null ? code : pre;
        String language = language(source.className());
        if (language.isEmpty() && source != pre) {
            language = language(pre.className());
        }
        String text = source.wholeText();
        if (text.startsWith("\n")) {
            text = text.substring(1);
        }
        return "\n\n```" + language + "\n" + text.stripTrailing() + "\n```\n\n";
    }

    private static String language(String className) {
        if (className == null || className.isBlank()) {
            return "";
        }
        Matcher m = LANGUAGE_CLASS.matcher(className);
        return m.find() ? m.group(1) : "";
    }

    private String anchor(Element element) {
        String href = element.attr("href").trim();
        String label = inlineOneLine(element);
        if (href.isEmpty()) {
            return label;
        }
        if (label.isEmpty()) {
            label = href;
        }
        String title = element.attr("title");
        return "[" + label + "](" + href + (title.isBlank() ? "" : " \"" + title + "\"") + ")";
    }

    private static String image(Element element) {
        String src = element.attr("src").trim();
        if (src.isEmpty()) {
            return "";
        }
        String title = element.attr("title");
        return "![" + element.attr("alt") + "](" + src + (title.isBlank() ? "" : " \"" + title + "\"") + ")";
    }

    private String list(Element list, boolean ordered, int depth) {
        StringBuilder out = new StringBuilder(depth == 0 ? "\n\n" : "");
        String indent = INDENT.repeat(depth);
        int number = 1;
        for (Element item : list.children()) {
            if (!"li".equals(item.normalName())) {
                continue;
            }
            StringBuilder text = new StringBuilder();
            StringBuilder nested = new StringBuilder();
            for (Node child : item.childNodes()) {
                if (child instanceof Element sub && ("ul".equals(sub.normalName()) || "ol".equals(sub.normalName()))) {
                    nested.append(list(sub, "ol".equals(sub.normalName()), depth + 1));
                } else {
                    text.append(node(child, false));
                }
            }
            String marker = ordered ? (number++) + ". " : "- ";
            String body = text.toString().strip().replaceAll("\n\\s*\n", "\n");
            String continuation = "\n" + indent + INDENT;
            out.append(indent).append(marker).append(body.replace("\n", continuation)).append('\n');
            out.append(nested);
        }
        if (depth == 0) {
            out.append('\n');
        }
        return out.toString();
    }

    private String quote(Element element) {
        String inner = cleanup(children(element, false));
        if (inner.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String line : inner.split("\n", -1)) {
            out.append(line.isBlank() ? ">" : "> " + line).append('\n');
        }
        return block(out.toString().stripTrailing());
    }

    private String table(Element table) {
        List<List<String>> rows = new ArrayList<>();
        for (Element row : table.select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
                    cells.add(inlineOneLine(cell).replace("|", "\\|"));
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        if (rows.isEmpty()) {
            return "";
        }
        int columns = rows.stream().mapToInt(List::size).max().orElse(1);
        StringBuilder out = new StringBuilder();
        for (int r = 0; r < rows.size(); r++) {
            out.append(row(rows.get(r), columns)).append('\n');
            if (r == 0) {
                out.append("|").append(" --- |".repeat(columns)).append('\n');
            }
        }
        return block(out.toString().stripTrailing());
    }

    private static String row(List<String> cells, int columns) {
        StringBuilder out = new StringBuilder("|");
        for (int c = 0; c < columns; c++) {
            out.append(' ').append(c < cells.size() ? cells.get(c) : "").append(" |");
        }
        return out.toString();
    }
}
