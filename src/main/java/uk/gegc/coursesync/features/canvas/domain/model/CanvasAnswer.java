package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Answer as returned by the API; a weight of 100 marks a correct answer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasAnswer(Long id, String text, Double weight) {

    public boolean correct() {
        return weight != null && weight > 0;
    }
}
