package uk.gegc.coursesync.features.source.domain.model;

import uk.gegc.coursesync.features.course.domain.model.Question;

import java.util.List;

/**
 * Parsed quiz body: instructional text before the first question, then the questions.
 */
public record QuizText(String description, List<Question> questions) {

    public QuizText {
        description = description == null ? "" : description.strip();
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
