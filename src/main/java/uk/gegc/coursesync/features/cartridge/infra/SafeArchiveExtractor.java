package uk.gegc.coursesync.features.cartridge.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.config.CartridgeProperties;
import uk.gegc.coursesync.shared.exception.ArchiveFormatException;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.shared.util.PathSafety;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Extracts an archive under size, count and compression-ratio limits. Archive-wide violations abort
 * with {@link ArchiveFormatException}; a single oversized, suspicious or unsafe member is skipped and
 * reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SafeArchiveExtractor {

    private static final int BUFFER_SIZE = 8192;

    private final CartridgeProperties properties;

    /**
     * @return number of files written
     */
    public int extract(Path archive, Path target, RunReport report) {
        if (!Files.isRegularFile(archive)) {
            throw new ArchiveFormatException("Archive not found: " + archive);
        }
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            List<? extends ZipEntry> entries = Collections.list(zip.entries());
            if (entries.size() > properties.getMaxEntries()) {
                throw new ArchiveFormatException("Archive contains too many files: " + entries.size()
                        + " (max " + properties.getMaxEntries() + ")");
            }
            long declared = entries.stream().mapToLong(e -> Math.max(e.getSize(), 0)).sum();
            if (declared > properties.getMaxTotalBytes()) {
                throw new ArchiveFormatException(String.format("Archive too large: %.1f MB (max %.0f MB)",
                        declared / 1048576.0, properties.getMaxTotalBytes() / 1048576.0));
            }

            Path root = target.toAbsolutePath().normalize();
            long extracted = 0;
            int files = 0;
            for (ZipEntry entry : entries) {
                String name = entry.getName();
                if (!PathSafety.isSafeMemberName(name)) {
                    report.warn("Skipping unsafe archive member name: " + name);
                    continue;
                }
                Path destination = root.resolve(name.replace('\\', '/')).normalize();
                if (!PathSafety.isWithin(root, destination)) {
                    report.warn("Skipping archive member escaping the target directory: " + name);
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                if (entry.getSize() > properties.getMaxEntryBytes()) {
                    report.warn(String.format("Skipping large archive member: %s (%.1f MB)", name, entry.getSize() / 1048576.0));
                    continue;
                }
                if (entry.getSize() > 0 && entry.getCompressedSize() > 0
                        && entry.getSize() / (double) entry.getCompressedSize() > properties.getMaxCompressionRatio()) {
                    report.warn(String.format("Skipping suspiciously compressed archive member: %s (%.0fx)",
                            name, entry.getSize() / (double) entry.getCompressedSize()));
                    continue;
                }
                Files.createDirectories(destination.getParent());
                try (InputStream in = zip.getInputStream(entry); OutputStream out = Files.newOutputStream(destination)) {
                    extracted += copyBounded(in, out, name, properties.getMaxTotalBytes() - extracted);
                }
                files++;
            }
            log.info("Extracted {} files ({} bytes) from {}", files, extracted, archive.getFileName());
            return files;
        } catch (ZipException ex) {
            throw new ArchiveFormatException("Not a readable zip archive: " + archive.getFileName(), ex);
        } catch (IOException ex) {
            throw new ArchiveFormatException("Failed to extract " + archive.getFileName() + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Copies while enforcing the per-entry and remaining total limits against the bytes actually
     * inflated, since declared sizes can lie.
     */
    private long copyBounded(InputStream in, OutputStream out, String name, long remainingTotal) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long copied = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            copied += read;
            if (copied > properties.getMaxEntryBytes()) {
                throw new ArchiveFormatException("Archive member " + name + " inflates beyond its size limit");
            }
            if (copied > remainingTotal) {
                throw new ArchiveFormatException("Extracted size exceeds the archive limit at " + name);
            }
            out.write(buffer, 0, read);
        }
        return copied;
    }
}
