package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasQuizQuestion(
        Long id,
        @JsonProperty("question_name") String questionName,
        @JsonProperty("question_text") String questionText,
        @JsonProperty("question_type") String questionType,
        @JsonProperty("points_possible") Double pointsPossible,
        List<CanvasAnswer> answers
) {
}
