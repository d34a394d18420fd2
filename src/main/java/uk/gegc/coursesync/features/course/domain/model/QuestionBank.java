package uk.gegc.coursesync.features.course.domain.model;

import java.util.List;

public record QuestionBank(String id, String title, List<Question> questions) {

    public QuestionBank {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Question bank id cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            title = id;
        }
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
