package uk.gegc.coursesync.features.course.domain.model;

public record RubricRating(String description, double points, String longDescription) {
}
