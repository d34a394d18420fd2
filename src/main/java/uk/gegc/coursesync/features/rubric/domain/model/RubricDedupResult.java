package uk.gegc.coursesync.features.rubric.domain.model;

import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;

import java.util.Map;

/**
 * @param extractedRubrics number of inline rubrics turned into shared ones
 * @param rows             criteria shared by two or more rubrics, by slug
 */
public record RubricDedupResult(int extractedRubrics, Map<String, RubricCriterion> rows) {

    public RubricDedupResult {
        rows = Map.copyOf(rows);
    }
}
