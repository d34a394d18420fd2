package uk.gegc.coursesync.features.source.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.ItemSettings;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML form of rubrics and of shared rubric rows.
 * <pre>
 * title: Essay rubric
 * criteria:
 *   - description: Thesis
 *     points: 10
 *     ratings:
 *       - {description: Clear, points: 10}
 *       - {description: Missing, points: 0}
 *   - "{{rubric_row:citations}}"
 * </pre>
 * A file holding only {@code use_rubric: slug} points at a shared rubric.
 */
@Component
@RequiredArgsConstructor
public class RubricYamlCodec {

    public static final String USE_RUBRIC = "use_rubric";
    private static final Pattern ROW_REFERENCE = Pattern.compile("^\\{\\{\\s*rubric_row:\\s*([\\w-]+)\\s*}}$");

    private final YAMLMapper yamlMapper;

    public Map<String, Object> readMap(String yaml, String location) {
        try {
            Map<String, Object> values = yamlMapper.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return values == null ? Map.of() : values;
        } catch (JsonProcessingException ex) {
            throw new ValidationException(location, "invalid rubric YAML: " + ex.getOriginalMessage());
        }
    }

    public Optional<String> sharedReference(Map<String, Object> values) {
        Object reference = values.get(USE_RUBRIC);
        return reference == null ? Optional.empty() : Optional.of(reference.toString().trim());
    }

    public Rubric toRubric(Map<String, Object> values, Function<String, Optional<RubricCriterion>> rows, String location) {
        ItemSettings settings = new ItemSettings(values);
        List<RubricCriterion> criteria = new ArrayList<>();
        Object raw = values.get("criteria");
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new ValidationException(location, "rubric has no criteria");
        }
        for (Object element : list) {
            if (element instanceof Map<?, ?> map) {
                criteria.add(toCriterion(map, location));
            } else if (element != null) {
                Matcher reference = ROW_REFERENCE.matcher(element.toString().trim());
                if (!reference.matches()) {
                    throw new ValidationException(location, "unexpected rubric criterion '" + element + "'");
                }
                String slug = reference.group(1);
                criteria.add(rows.apply(slug).orElseThrow(() ->
                        new ValidationException(location, "unknown rubric row '" + slug + "'")));
            }
        }
        return new Rubric(settings.string("title"), settings.bool("free_form_criterion_comments", false), criteria);
    }

    public RubricCriterion toCriterion(Map<?, ?> raw, String location) {
        @SuppressWarnings("unchecked")
        ItemSettings settings = new ItemSettings((Map<String, Object>) raw);
        List<RubricRating> ratings = new ArrayList<>();
        for (Map<String, Object> rating : settings.mapList("ratings")) {
            ItemSettings r = new ItemSettings(rating);
            Double points = r.decimal("points");
            ratings.add(new RubricRating(r.string("description"), points == null ? 0 : points,
                    r.string("long_description")));
        }
        Double points = settings.decimal("points");
        if (points == null) {
            points = ratings.stream().mapToDouble(RubricRating::points).max().orElse(0);
        }
        try {
            return new RubricCriterion(settings.string("description"), settings.string("long_description"),
                    points, ratings);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(location, ex.getMessage());
        }
    }

    public Map<String, Object> toMap(Rubric rubric) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("title", rubric.title());
        if (rubric.freeFormComments()) {
            values.put("free_form_criterion_comments", true);
        }
        values.put("criteria", rubric.criteria().stream().map(this::toMap).toList());
        return values;
    }

    public Map<String, Object> toMap(RubricCriterion criterion) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("description", criterion.description());
        if (criterion.longDescription() != null && !criterion.longDescription().isBlank()) {
            values.put("long_description", criterion.longDescription());
        }
        values.put("points", criterion.points());
        values.put("ratings", criterion.ratings().stream().map(r -> {
            Map<String, Object> rating = new LinkedHashMap<>();
            rating.put("description", r.description());
            rating.put("points", r.points());
            if (r.longDescription() != null && !r.longDescription().isBlank()) {
                rating.put("long_description", r.longDescription());
            }
            return rating;
        }).toList());
        return values;
    }

    public static String rowReference(String slug) {
        return "{{rubric_row:" + slug + "}}";
    }

    public String write(Object values) {
        try {
            return yamlMapper.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to write rubric YAML", ex);
        }
    }
}
