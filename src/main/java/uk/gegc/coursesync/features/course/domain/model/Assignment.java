package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class Assignment extends ContentItem {

    private List<String> submissionTypes = new ArrayList<>(List.of("online_upload"));
    private String dueAt;
    private String unlockAt;
    private String lockAt;
    private Double pointsPossible;
    private String gradingType = "points";
    private String allowedExtensions;

    /**
     * Inline rubric owned by this assignment.
     */
    private Rubric rubric;

    /**
     * Key of a shared rubric; takes precedence over {@link #rubric} when both are set.
     */
    private String rubricRef;

    public Assignment(String id, String title) {
        super(id, title);
    }

    @Override
    public ContentType type() {
        return ContentType.ASSIGNMENT;
    }
}
