package uk.gegc.coursesync.features.source.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.source.domain.model.FrontMatterDocument;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes {@code ---} delimited YAML front matter.
 */
@Component
@RequiredArgsConstructor
public class FrontMatterCodec {

    private static final String DELIMITER = "---";

    private final YAMLMapper yamlMapper;

    public FrontMatterDocument parse(String text, String location) {
        String normalized = text.replace("\r\n", "\n");
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        if (!normalized.startsWith(DELIMITER + "\n")) {
            return new FrontMatterDocument(Map.of(), normalized);
        }
        int end = normalized.indexOf("\n" + DELIMITER, DELIMITER.length());
        if (end < 0) {
            throw new ValidationException(location, "front matter is not closed with '---'");
        }
        String yaml = normalized.substring(DELIMITER.length() + 1, end + 1);
        int bodyStart = normalized.indexOf('\n', end + 1);
        String body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);
        if (body.startsWith("\n")) {
            body = body.substring(1);
        }
        return new FrontMatterDocument(readYaml(yaml, location), body);
    }

    public String format(Map<String, Object> metadata, String body) {
        StringBuilder out = new StringBuilder(DELIMITER).append('\n');
        try {
            if (!metadata.isEmpty()) {
                out.append(yamlMapper.writeValueAsString(metadata));
            }
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to write front matter", ex);
        }
        out.append(DELIMITER).append("\n\n");
        String trimmed = body == null ? "" : body.strip();
        if (!trimmed.isEmpty()) {
            out.append(trimmed).append('\n');
        }
        return out.toString();
    }

    private Map<String, Object> readYaml(String yaml, String location) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> values = yamlMapper.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return values == null ? Map.of() : values;
        } catch (JsonProcessingException ex) {
            throw new ValidationException(location, "invalid front matter: " + ex.getOriginalMessage());
        }
    }
}
