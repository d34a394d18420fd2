package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Direction-agnostic representation of one course. Source reader, remote fetcher and archive importer
 * produce it; renderer, publisher, exporter and source writer consume it through the same accessors.
 */
@Getter
@Setter
public class CourseModel {

    private String title;
    private String courseCode;

    /**
     * Platform course id from {@code course.yaml}, null when the course was never linked.
     */
    private Long remoteCourseId;
    private String defaultTemplate;
    private final Map<String, ContentItem> items = new LinkedHashMap<>();
    private final List<CourseModule> modules = new ArrayList<>();
    private final Map<String, QuestionBank> banks = new LinkedHashMap<>();
    private final Map<String, Rubric> sharedRubrics = new LinkedHashMap<>();

    public CourseModel(String title) {
        this.title = title == null || title.isBlank() ? "Untitled Course" : title;
    }

    public void addItem(ContentItem item) {
        ContentItem previous = items.putIfAbsent(item.getId(), item);
        if (previous != null && previous != item) {
            throw new IllegalArgumentException("Duplicate content item id " + item.getId()
                    + " (" + previous.getTitle() + ", " + item.getTitle() + ")");
        }
    }

    public Collection<ContentItem> items() {
        return items.values();
    }

    public Optional<ContentItem> findItem(String id) {
        return Optional.ofNullable(items.get(id));
    }

    public <T extends ContentItem> List<T> itemsOf(Class<T> variant) {
        return items.values().stream()
                .filter(variant::isInstance)
                .map(variant::cast)
                .toList();
    }

    public void addBank(QuestionBank bank) {
        QuestionBank previous = banks.putIfAbsent(bank.id(), bank);
        if (previous != null && previous != bank) {
            throw new IllegalArgumentException("Duplicate question bank id " + bank.id()
                    + " (" + previous.title() + ", " + bank.title() + ")");
        }
    }

    public Optional<QuestionBank> findBank(String idOrTitle) {
        QuestionBank byId = banks.get(idOrTitle);
        if (byId != null) {
            return Optional.of(byId);
        }
        return banks.values().stream().filter(b -> b.title().equals(idOrTitle)).findFirst();
    }

    public Optional<CourseModule> findModule(String title) {
        return modules.stream().filter(m -> m.getTitle().equals(title)).findFirst();
    }
}
