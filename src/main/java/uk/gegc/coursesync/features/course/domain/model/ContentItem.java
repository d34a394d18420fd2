package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of every publishable item. The variant is fixed by the subclass, never stored as a field.
 */
@Getter
@Setter
public abstract class ContentItem {

    private final String id;
    private String title;
    private String body = "";
    private boolean published = true;
    private List<ModuleMembership> memberships = new ArrayList<>();

    /**
     * Folder name in the author tree, e.g. {@code 02-welcome.page}. Used for ordering and write-back.
     */
    private String sourceName;

    /**
     * Folder path relative to the course root, null for items that do not come from an author tree.
     */
    private String sourcePath;

    /**
     * Template set override, null for the course default.
     */
    private String template;

    protected ContentItem(String id, String title) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Content item id cannot be null or blank");
        }
        this.id = id;
        this.title = title;
    }

    public abstract ContentType type();

    public void addMembership(ModuleMembership membership) {
        boolean known = memberships.stream().anyMatch(m -> m.module().equals(membership.module()));
        if (!known) {
            memberships.add(membership);
        }
    }
}
