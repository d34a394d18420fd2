package uk.gegc.coursesync.features.course.domain.model;

import java.util.List;

/**
 * One question of a quiz or bank. {@code points} is null when the quiz default applies.
 */
public record Question(String id, QuestionType type, String text, List<AnswerChoice> answers, Double points) {

    public Question {
        if (type == null) {
            throw new IllegalArgumentException("Question type cannot be null");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question text cannot be null or blank");
        }
        text = text.strip();
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    public Question(QuestionType type, String text, List<AnswerChoice> answers) {
        this(null, type, text, answers, null);
    }

    public List<AnswerChoice> correctAnswers() {
        return answers.stream().filter(AnswerChoice::correct).toList();
    }

    public Question withId(String newId) {
        return new Question(newId, type, text, answers, points);
    }
}
