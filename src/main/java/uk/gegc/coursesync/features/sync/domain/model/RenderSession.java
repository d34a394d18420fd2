package uk.gegc.coursesync.features.sync.domain.model;

import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContent;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.shared.run.RunReport;

import java.nio.file.Path;
import java.util.Map;

/**
 * Read-only inputs shared by every render task of one sync run. Template sets are loaded before the
 * tasks start.
 *
 * @param templateSets loaded sets by name
 * @param defaultSet   set used by items that name none
 */
public record RenderSession(Path courseRoot, long courseId, AssetRegistry registry, SharedContent shared,
                            Map<String, TemplateSet> templateSets, String defaultSet, RunReport report) {

    public RenderSession {
        templateSets = Map.copyOf(templateSets);
    }

    public TemplateSet templatesFor(ContentItem item) {
        String name = item.getTemplate() != null ? item.getTemplate() : defaultSet;
        return templateSets.getOrDefault(name, TemplateSet.EMPTY);
    }

    public Path itemDir(ContentItem item) {
        return item.getSourcePath() == null ? courseRoot : courseRoot.resolve(item.getSourcePath());
    }
}
