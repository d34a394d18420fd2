package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasModule(Long id, String name, Integer position, Boolean published) {
}
