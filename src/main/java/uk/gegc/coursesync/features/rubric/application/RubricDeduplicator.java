package uk.gegc.coursesync.features.rubric.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.rubric.domain.model.RubricDedupResult;
import uk.gegc.coursesync.shared.hash.CanonicalJsonDigester;
import uk.gegc.coursesync.shared.hash.ContentAddressableStore;
import uk.gegc.coursesync.shared.util.Slugs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Post-import deduplication in two passes. First, inline rubrics whose criteria are identical across
 * two or more assignments become one shared rubric referenced by key. Then criteria that still occur
 * in two or more distinct rubrics are lifted out as shared rows.
 * <p>
 * Identity is the canonical JSON hash of the criteria (trimmed strings, sorted keys), computed
 * through the same {@link ContentAddressableStore} used for asset bytes.
 */
@Slf4j
@Component
public class RubricDeduplicator {

    public static final int KEY_LENGTH = 16;

    private final ObjectMapper objectMapper;

    public RubricDeduplicator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RubricDedupResult deduplicate(CourseModel model) {
        int extracted = deduplicateRubrics(model);
        Map<String, RubricCriterion> rows = deduplicateRows(model);
        if (extracted > 0 || !rows.isEmpty()) {
            log.info("Rubric deduplication: {} shared rubrics extracted, {} shared rows", extracted, rows.size());
        }
        return new RubricDedupResult(extracted, rows);
    }

    private int deduplicateRubrics(CourseModel model) {
        ContentAddressableStore<Rubric, Usage> store =
                new ContentAddressableStore<>(new CanonicalJsonDigester<>(objectMapper, Rubric::criteria, KEY_LENGTH));

        for (Map.Entry<String, Rubric> shared : model.getSharedRubrics().entrySet()) {
            Usage usage = store.intern(shared.getValue(), k -> new Usage(shared.getValue()));
            usage.slug = usage.slug == null ? shared.getKey() : usage.slug;
        }
        for (Assignment assignment : model.itemsOf(Assignment.class)) {
            if (assignment.getRubricRef() != null || assignment.getRubric() == null) {
                continue;
            }
            store.intern(assignment.getRubric(), k -> new Usage(assignment.getRubric())).users.add(assignment);
        }

        Set<String> taken = new HashSet<>(model.getSharedRubrics().keySet());
        int extracted = 0;
        for (Usage usage : store.snapshot().values()) {
            boolean alreadyShared = usage.slug != null;
            if (!alreadyShared && usage.users.size() < 2) {
                continue;
            }
            if (!alreadyShared) {
                usage.slug = Slugs.unique(Slugs.slugify(slugSource(usage.rubric), "rubric"), taken);
                taken.add(usage.slug);
                model.getSharedRubrics().put(usage.slug, usage.rubric);
                extracted++;
            }
            for (Assignment user : usage.users) {
                user.setRubricRef(usage.slug);
                user.setRubric(null);
            }
        }
        return extracted;
    }

    private Map<String, RubricCriterion> deduplicateRows(CourseModel model) {
        List<Rubric> rubrics = new ArrayList<>(model.getSharedRubrics().values());
        model.itemsOf(Assignment.class).stream()
                .filter(a -> a.getRubricRef() == null && a.getRubric() != null)
                .forEach(a -> rubrics.add(a.getRubric()));

        ContentAddressableStore<RubricCriterion, RowUsage> store =
                new ContentAddressableStore<>(new CanonicalJsonDigester<>(objectMapper, KEY_LENGTH));
        for (int i = 0; i < rubrics.size(); i++) {
            int rubricIndex = i;
            for (RubricCriterion criterion : rubrics.get(i).criteria()) {
                store.intern(criterion, k -> new RowUsage(criterion)).rubrics.add(rubricIndex);
            }
        }

        Set<String> taken = new HashSet<>();
        Map<String, RubricCriterion> rows = new LinkedHashMap<>();
        for (Map.Entry<String, RowUsage> entry : store.snapshot().entrySet()) {
            RowUsage usage = entry.getValue();
            if (usage.rubrics.size() < 2) {
                continue;
            }
            String slug = Slugs.unique(Slugs.slugify(usage.criterion.description(), entry.getKey().substring(0, 12)), taken);
            taken.add(slug);
            rows.put(slug, usage.criterion);
        }
        return rows;
    }

    private static String slugSource(Rubric rubric) {
        if (rubric.title() != null && !rubric.title().isBlank()) {
            return rubric.title();
        }
        return rubric.criteria().isEmpty() ? null : rubric.criteria().get(0).description();
    }

    private static final class Usage {
        private final Rubric rubric;
        private final List<Assignment> users = new ArrayList<>();
        private String slug;

        private Usage(Rubric rubric) {
            this.rubric = rubric;
        }
    }

    private static final class RowUsage {
        private final RubricCriterion criterion;
        private final Set<Integer> rubrics = new LinkedHashSet<>();

        private RowUsage(RubricCriterion criterion) {
            this.criterion = criterion;
        }
    }
}
