package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A quiz either embeds questions or draws from banks through groups. The description is the
 * instructional text that precedes the first question and is kept apart from the questions.
 */
@Getter
@Setter
public class Quiz extends ContentItem {

    private String description = "";
    private List<Question> questions = new ArrayList<>();
    private List<QuestionGroup> groups = new ArrayList<>();
    private Integer timeLimit;
    private Integer allowedAttempts;
    private boolean shuffleAnswers;
    private Double pointsPossible;
    private String quizType = "assignment";
    private double pointsPerQuestion = 1.0;

    public Quiz(String id, String title) {
        super(id, title);
    }

    @Override
    public ContentType type() {
        return ContentType.QUIZ;
    }

    /**
     * Explicit point total, else the sum of inline question points and group draws.
     */
    public double totalPoints() {
        if (pointsPossible != null) {
            return pointsPossible;
        }
        double inline = questions.stream()
                .mapToDouble(q -> q.points() != null ? q.points() : pointsPerQuestion)
                .sum();
        double drawn = groups.stream()
                .mapToDouble(g -> g.pick() * (g.pointsPerQuestion() != null ? g.pointsPerQuestion() : pointsPerQuestion))
                .sum();
        return inline + drawn;
    }
}
