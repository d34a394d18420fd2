package uk.gegc.coursesync.features.canvas.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Module entry. Pages are addressed by {@code pageUrl}, links by {@code externalUrl}, everything else by
 * {@code contentId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CanvasModuleItem(
        Long id,
        String title,
        String type,
        @JsonProperty("content_id") Long contentId,
        @JsonProperty("page_url") String pageUrl,
        @JsonProperty("external_url") String externalUrl,
        Integer position,
        Integer indent,
        @JsonProperty("new_tab") Boolean newTab
) {
}
