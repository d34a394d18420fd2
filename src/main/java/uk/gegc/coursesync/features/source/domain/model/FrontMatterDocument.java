package uk.gegc.coursesync.features.source.domain.model;

import java.util.Map;

/**
 * A Markdown file split into its YAML header and body.
 */
public record FrontMatterDocument(Map<String, Object> metadata, String body) {

    public FrontMatterDocument {
        metadata = metadata == null ? Map.of() : metadata;
        body = body == null ? "" : body;
    }
}
