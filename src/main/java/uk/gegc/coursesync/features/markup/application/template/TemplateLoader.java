package uk.gegc.coursesync.features.markup.application.template;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code templates/<set>/header.md|footer.md|header.html|footer.html} from a course. Missing files
 * are empty fragments; a missing set is {@link TemplateSet#EMPTY}.
 */
@Slf4j
@Component
public class TemplateLoader {

    public static final String DEFAULT_SET = "default";
    private static final String TEMPLATES_DIR = "templates";

    public TemplateSet load(Path courseRoot, String setName) {
        String name = setName == null || setName.isBlank() ? DEFAULT_SET : setName.trim();
        Path dir = courseRoot.resolve(TEMPLATES_DIR).resolve(name);
        if (!Files.isDirectory(dir)) {
            if (!DEFAULT_SET.equals(name)) {
                log.warn("Template set '{}' not found under {}", name, dir.getParent());
            }
            return TemplateSet.EMPTY;
        }
        TemplateSet set = new TemplateSet(name,
                read(dir.resolve("header.md")),
                read(dir.resolve("footer.md")),
                read(dir.resolve("header.html")),
                read(dir.resolve("footer.html")));
        log.debug("Loaded template set '{}' from {}", name, dir);
        return set;
    }

    private static String read(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read template " + file, ex);
        }
    }
}
