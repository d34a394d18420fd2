package uk.gegc.coursesync.features.course.domain.model;

public record AnswerChoice(String text, boolean correct) {

    public AnswerChoice {
        text = text == null ? "" : text.strip();
    }
}
