package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasQuiz(
        Long id,
        String title,
        String description,
        @JsonProperty("quiz_type") String quizType,
        @JsonProperty("time_limit") Integer timeLimit,
        @JsonProperty("allowed_attempts") Integer allowedAttempts,
        @JsonProperty("shuffle_answers") Boolean shuffleAnswers,
        @JsonProperty("points_possible") Double pointsPossible,
        Boolean published
) {
}
