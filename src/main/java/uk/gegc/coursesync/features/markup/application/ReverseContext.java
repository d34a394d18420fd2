package uk.gegc.coursesync.features.markup.application;

import uk.gegc.coursesync.features.markup.application.template.TemplateSet;

import java.util.function.Consumer;

/**
 * Inputs of one reverse conversion.
 */
public record ReverseContext(TemplateSet templates, AssetPathMapper assetPathMapper, Consumer<String> warnings) {

    public ReverseContext {
        templates = templates == null ? TemplateSet.EMPTY : templates;
        assetPathMapper = assetPathMapper == null ? AssetPathMapper.NONE : assetPathMapper;
        warnings = warnings == null ? w -> { } : warnings;
    }

    public static ReverseContext plain() {
        return new ReverseContext(null, null, null);
    }
}
