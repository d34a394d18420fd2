package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wiki page. {@code url} is the page slug the API addresses it by; list responses omit {@code body}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasPage(@JsonProperty("page_id") Long pageId, String url, String title, String body, Boolean published) {
}
