package uk.gegc.coursesync.features.course.domain;

import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the module list of a course from item memberships, applying {@link ItemOrdering}.
 */
public final class ModuleAssembler {

    private ModuleAssembler() {
    }

    /**
     * @param explicitOrder module titles in declared order, may be empty
     * @param folderNames   module title to folder name, used for the numeric prefix fallback
     * @param emptyModules  modules that exist without any item, kept in the result
     */
    public static void assemble(CourseModel model, List<String> explicitOrder,
                                Map<String, String> folderNames, Set<String> emptyModules) {
        Map<String, List<Placed>> byModule = new LinkedHashMap<>();
        for (ContentItem item : model.items()) {
            for (ModuleMembership membership : item.getMemberships()) {
                byModule.computeIfAbsent(membership.module(), k -> new ArrayList<>())
                        .add(new Placed(item, membership));
            }
        }

        Set<String> titles = new LinkedHashSet<>(byModule.keySet());
        titles.addAll(emptyModules);
        List<String> ordered = new ArrayList<>(titles);
        ordered.sort(ItemOrdering.moduleOrder(explicitOrder, folderNames));

        model.getModules().clear();
        int position = 1;
        for (String title : ordered) {
            CourseModule module = new CourseModule(title);
            module.setPosition(position++);
            List<Placed> placed = byModule.getOrDefault(title, List.of());
            placed.stream()
                    .sorted(Comparator.comparing(Placed::key, ItemOrdering.itemOrder()))
                    .forEach(p -> module.addItem(p.item().getId(), p.membership().indent()));
            model.getModules().add(module);
        }
    }

    private record Placed(ContentItem item, ModuleMembership membership) {
        ItemOrdering.ItemKey key() {
            String name = item.getSourceName() != null ? item.getSourceName() : item.getTitle();
            return new ItemOrdering.ItemKey(membership.position(), name);
        }
    }
}
