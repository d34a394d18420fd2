package uk.gegc.coursesync.features.markup.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.markup.application.template.StripOutcome;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.markup.application.template.TemplateStripper;
import uk.gegc.coursesync.shared.exception.AmbiguousReferenceException;
import uk.gegc.coursesync.shared.exception.UnresolvedReferenceException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between author Markdown and platform HTML in both directions.
 * <p>
 * Forward, template Markdown fragments are joined with the body and converted in one pass, then the raw
 * HTML fragments are put around the result. Converting fragments one by one would lose wrappers that a
 * header opens and a footer closes.
 * <p>
 * Reverse, platform wrappers and template fragments are stripped, asset URLs are mapped back to local
 * paths and the HTML is converted to Markdown with four-space list nesting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarkupNormalizer {

    private static final Pattern MARKDOWN_TARGET =
            Pattern.compile("(!?\\[[^\\]]*\\]\\(\\s*<?)([^)\\s>]+)(>?(?:\\s+\"[^\"]*\")?\\s*\\))");
    private static final Pattern HTML_TARGET =
            Pattern.compile("(\\s(?:src|href)\\s*=\\s*\")([^\"]+)(\")", Pattern.CASE_INSENSITIVE);
    private static final Pattern VIDEO = Pattern.compile("\\{\\{\\s*video:\\s*\"?([^}\"]+?)\"?\\s*}}");
    private static final Set<String> PAGE_EXTENSIONS = Set.of("", "html", "htm", "md");

    private final MarkdownRenderer markdownRenderer;
    private final HtmlToMarkdownConverter htmlToMarkdownConverter;
    private final PlaceholderExpander placeholderExpander;
    private final PlatformWrapperStripper wrapperStripper;
    private final TemplateStripper templateStripper;

    /**
     * Body to platform HTML, with template wrapping.
     */
    public String toPlatformHtml(String markdown, RenderContext context) {
        TemplateSet templates = context.templates();
        String combined = join(templates.headerMarkdown(), markdown, templates.footerMarkdown());
        String html = renderFragment(combined, context);
        String header = linkAssets(templates.headerHtml(), HTML_TARGET, context);
        String footer = linkAssets(templates.footerHtml(), HTML_TARGET, context);
        return join(header.strip(), html, footer.strip()).strip();
    }

    /**
     * Markdown to HTML with placeholders and assets resolved, without templates. Used for quiz
     * descriptions and question text.
     */
    public String renderFragment(String markdown, RenderContext context) {
        String expanded = placeholderExpander.expand(markdown, context);
        expanded = expandVideos(expanded, context);
        expanded = linkAssets(expanded, MARKDOWN_TARGET, context);
        expanded = linkAssets(expanded, HTML_TARGET, context);
        return markdownRenderer.render(expanded);
    }

    public String toAuthorMarkdown(String html, ReverseContext context) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Element content = wrapperStripper.extract(html);
        List<StripOutcome> outcomes = templateStripper.strip(content, context.templates());
        outcomes.stream()
                .filter(o -> !o.matched() && "none".equals(o.strategy()))
                .forEach(o -> context.warnings().accept("Template " + o.edge() + " fragment of '"
                        + context.templates().name() + "' not found, content left as-is"));
        mapAssetUrls(content, context);
        return htmlToMarkdownConverter.convert(content);
    }

    /**
     * Plain Markdown conversion of an HTML fragment, no stripping or mapping.
     */
    public String htmlToMarkdown(String html) {
        return htmlToMarkdownConverter.convert(html);
    }

    public String markdownToHtml(String markdown) {
        return markdownRenderer.render(markdown);
    }

    private void mapAssetUrls(Element content, ReverseContext context) {
        for (Element element : content.select("[src], a[href]")) {
            String attribute = element.hasAttr("src") ? "src" : "href";
            String url = element.attr(attribute);
            context.assetPathMapper().localPath(url).ifPresent(local -> element.attr(attribute, local));
        }
    }

    private String expandVideos(String text, RenderContext context) {
        Matcher m = VIDEO.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String reference = m.group(1).strip();
            String replacement = link(reference, context)
                    .map(url -> "<video controls=\"controls\" src=\"" + url + "\"></video>")
                    .orElse(m.group());
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private String linkAssets(String text, Pattern pattern, RenderContext context) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String target = m.group(2);
            String replacement = m.group();
            if (isLocalAsset(target)) {
                replacement = link(target, context)
                        .map(url -> m.group(1) + url + m.group(3))
                        .orElse(m.group());
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private Optional<String> link(String reference, RenderContext context) {
        try {
            return context.assetLinker().link(reference, context.itemDir());
        } catch (AmbiguousReferenceException | UnresolvedReferenceException ex) {
            log.warn(ex.getMessage());
            context.warnings().accept(ex.getMessage());
            return Optional.empty();
        }
    }

    static boolean isLocalAsset(String target) {
        if (target == null || target.isBlank()) {
            return false;
        }
        String lower = target.toLowerCase(Locale.ROOT);
        if (lower.startsWith("#") || lower.startsWith("//") || lower.startsWith("$") || lower.contains(":")) {
            return false;
        }
        String path = lower.replaceAll("[?#].*$", "");
        return !PAGE_EXTENSIONS.contains(FilenameUtils.getExtension(path));
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append("\n\n");
            }
            sb.append(part.strip());
        }
        return sb.toString();
    }
}
