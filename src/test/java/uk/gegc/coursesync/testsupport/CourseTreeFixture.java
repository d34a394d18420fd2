package uk.gegc.coursesync.testsupport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes small author course trees under a temp directory.
 */
public class CourseTreeFixture {

    private final Path root;

    public CourseTreeFixture(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public CourseTreeFixture courseFile(String yaml) {
        return file("course.yaml", yaml);
    }

    /**
     * Writes {@code content/<module>/<folder>/index.md} with the given front matter and body and returns the item folder.
     */
    public Path item(String moduleFolder, String itemFolder, Map<String, Object> frontMatter, String body) {
        String relative = "content/" + (moduleFolder == null ? "" : moduleFolder + "/") + itemFolder;
        String yaml = frontMatter.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        file(relative + "/index.md", "---\n" + yaml + "\n---\n" + body);
        return root.resolve(relative);
    }

    public CourseTreeFixture file(String relativePath, String content) {
        return bytes(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    public CourseTreeFixture bytes(String relativePath, byte[] content) {
        Path target = root.resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return this;
    }
}
