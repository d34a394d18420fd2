package uk.gegc.coursesync.features.cartridge.infra;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zip output that remembers every member written, so the manifest can be checked against it.
 * Writing the same member twice is ignored.
 */
public class ArchiveWriter implements AutoCloseable {

    private final ZipOutputStream zip;
    private final Set<String> entries = new LinkedHashSet<>();

    public ArchiveWriter(Path archive) throws IOException {
        Files.createDirectories(archive.toAbsolutePath().getParent());
        OutputStream out = Files.newOutputStream(archive);
        this.zip = new ZipOutputStream(out, StandardCharsets.UTF_8);
    }

    public void write(String name, byte[] content) {
        if (!entries.add(name)) {
            return;
        }
        try {
            zip.putNextEntry(new ZipEntry(name));
            zip.write(content);
            zip.closeEntry();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write archive member " + name, ex);
        }
    }

    public void write(String name, String content) {
        write(name, content.getBytes(StandardCharsets.UTF_8));
    }

    public void copy(String name, Path file) {
        if (entries.contains(name)) {
            return;
        }
        try {
            write(name, Files.readAllBytes(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }

    public boolean contains(String name) {
        return entries.contains(name);
    }

    public List<String> entries() {
        return new ArrayList<>(entries);
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
