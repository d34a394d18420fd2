package uk.gegc.coursesync.features.asset.domain.model;

import java.nio.file.Path;

/**
 * A reference that resolved to exactly one file.
 *
 * @param reference    spelling used by the author
 * @param file         absolute path of the file
 * @param relativePath path relative to the course root with forward slashes, the registry path key
 */
public record ResolvedAsset(String reference, Path file, String relativePath) {

    public String filename() {
        return file.getFileName().toString();
    }
}
