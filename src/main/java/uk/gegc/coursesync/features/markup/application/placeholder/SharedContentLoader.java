package uk.gegc.coursesync.features.markup.application.placeholder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads {@code shared/variables.yaml} and the {@code shared/*.md} include fragments of a course.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SharedContentLoader {

    public static final String SHARED_DIR = "shared";
    public static final String VARIABLES_FILE = "variables.yaml";

    private final YAMLMapper yamlMapper;

    public SharedContent load(Path courseRoot) {
        Path dir = courseRoot.resolve(SHARED_DIR);
        if (!Files.isDirectory(dir)) {
            return SharedContent.empty();
        }
        Map<String, String> variables = loadVariables(dir.resolve(VARIABLES_FILE));
        Map<String, String> includes = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(f -> f.toString().endsWith(".md")).sorted().toList()) {
                includes.put(FilenameUtils.getBaseName(file.getFileName().toString()),
                        Files.readString(file, StandardCharsets.UTF_8));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read shared includes from " + dir, ex);
        }
        log.debug("Loaded {} variables and {} includes from {}", variables.size(), includes.size(), dir);
        return new SharedContent(includes, variables);
    }

    private Map<String, String> loadVariables(Path file) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!Files.isRegularFile(file)) {
            return result;
        }
        try {
            Map<String, Object> raw = yamlMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
            if (raw != null) {
                raw.forEach((k, v) -> result.put(k, v == null ? "" : v.toString()));
            }
            return result;
        } catch (IOException ex) {
            throw new ValidationException(file.toString(), "invalid variables file: " + ex.getMessage());
        }
    }
}
