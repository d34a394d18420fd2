package uk.gegc.coursesync.features.markup.application;

import uk.gegc.coursesync.features.markup.application.placeholder.IncludeResolver;
import uk.gegc.coursesync.features.markup.application.placeholder.VariableResolver;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Inputs of one forward conversion.
 */
public record RenderContext(
        Path itemDir,
        AssetLinker assetLinker,
        IncludeResolver includes,
        VariableResolver variables,
        TemplateSet templates,
        Consumer<String> warnings
) {

    public RenderContext {
        assetLinker = assetLinker == null ? AssetLinker.NONE : assetLinker;
        includes = includes == null ? IncludeResolver.NONE : includes;
        variables = variables == null ? VariableResolver.NONE : variables;
        templates = templates == null ? TemplateSet.EMPTY : templates;
        warnings = warnings == null ? w -> { } : warnings;
    }

    public static RenderContext plain() {
        return new RenderContext(null, null, null, null, null, null);
    }

    public RenderContext withoutTemplates() {
        return new RenderContext(itemDir, assetLinker, includes, variables, TemplateSet.EMPTY, warnings);
    }
}
