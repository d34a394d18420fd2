package uk.gegc.coursesync.features.course.domain.model;

/**
 * Placement of an item in one module. {@code position} is the explicit position tag, null when the
 * item relies on its folder prefix or name for ordering.
 */
public record ModuleMembership(String module, Integer position, int indent) {

    public ModuleMembership {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("Module title cannot be null or blank");
        }
        if (indent < 0) {
            indent = 0;
        }
    }
}
