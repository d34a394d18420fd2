package uk.gegc.coursesync.features.course.domain.model;

public record ModuleItemRef(String itemId, int position, int indent) {
}
