package uk.gegc.coursesync.features.course.domain.model;

/**
 * Draw of {@code pick} questions from the bank named {@code bank}.
 */
public record QuestionGroup(String bank, int pick, Double pointsPerQuestion) {

    public QuestionGroup {
        if (bank == null || bank.isBlank()) {
            throw new IllegalArgumentException("Question group bank cannot be null or blank");
        }
        if (pick < 1) {
            throw new IllegalArgumentException("Question group must pick at least one question");
        }
    }
}
