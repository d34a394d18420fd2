package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasRubricCriterion(String id, String description,
                                    @JsonProperty("long_description") String longDescription,
                                    Double points, List<CanvasRubricRating> ratings) {
}
