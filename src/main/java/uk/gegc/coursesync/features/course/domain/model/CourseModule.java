package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered container referencing content items by identifier.
 */
@Getter
@Setter
public class CourseModule {

    private final String title;
    private String id;
    private int position;
    private boolean published = true;
    private final List<ModuleItemRef> items = new ArrayList<>();

    public CourseModule(String title) {
        this.title = title;
    }

    public void addItem(String itemId, int indent) {
        items.add(new ModuleItemRef(itemId, items.size() + 1, indent));
    }
}
