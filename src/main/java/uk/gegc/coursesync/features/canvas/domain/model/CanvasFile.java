package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasFile(Long id, @JsonProperty("display_name") String displayName, String filename, String url, Long size) {
}
