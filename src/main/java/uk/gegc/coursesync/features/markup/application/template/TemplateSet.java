package uk.gegc.coursesync.features.markup.application.template;

/**
 * Header and footer fragments of one template set. Markdown fragments join the body before conversion;
 * HTML fragments wrap the converted result.
 */
public record TemplateSet(String name, String headerMarkdown, String footerMarkdown,
                          String headerHtml, String footerHtml) {

    public static final TemplateSet EMPTY = new TemplateSet("none", "", "", "", "");

    public TemplateSet {
        headerMarkdown = headerMarkdown == null ? "" : headerMarkdown;
        footerMarkdown = footerMarkdown == null ? "" : footerMarkdown;
        headerHtml = headerHtml == null ? "" : headerHtml;
        footerHtml = footerHtml == null ? "" : footerHtml;
    }

    public boolean isEmpty() {
        return headerMarkdown.isBlank() && footerMarkdown.isBlank() && headerHtml.isBlank() && footerHtml.isBlank();
    }
}
