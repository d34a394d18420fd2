package uk.gegc.coursesync.features.course.domain.model;

import java.util.List;

/**
 * Criterion with a point cap and rating levels in display order.
 */
public record RubricCriterion(String description, String longDescription, double points, List<RubricRating> ratings) {

    public RubricCriterion {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Rubric criterion description cannot be null or blank");
        }
        ratings = ratings == null ? List.of() : List.copyOf(ratings);
    }
}
