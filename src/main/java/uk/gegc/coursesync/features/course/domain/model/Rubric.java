package uk.gegc.coursesync.features.course.domain.model;

import java.util.List;

public record Rubric(String title, boolean freeFormComments, List<RubricCriterion> criteria) {

    public Rubric {
        if (title == null || title.isBlank()) {
            title = "Rubric";
        }
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }

    public double pointsPossible() {
        return criteria.stream().mapToDouble(RubricCriterion::points).sum();
    }
}
