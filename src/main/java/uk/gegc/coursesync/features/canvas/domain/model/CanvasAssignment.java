package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasAssignment(
        Long id,
        String name,
        String description,
        @JsonProperty("points_possible") Double pointsPossible,
        @JsonProperty("submission_types") List<String> submissionTypes,
        @JsonProperty("due_at") String dueAt,
        @JsonProperty("unlock_at") String unlockAt,
        @JsonProperty("lock_at") String lockAt,
        @JsonProperty("grading_type") String gradingType,
        @JsonProperty("allowed_extensions") List<String> allowedExtensions,
        Boolean published,
        List<CanvasRubricCriterion> rubric,
        @JsonProperty("rubric_settings") Map<String, Object> rubricSettings
) {
}
