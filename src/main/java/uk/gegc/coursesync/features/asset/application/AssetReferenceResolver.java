package uk.gegc.coursesync.features.asset.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;
import uk.gegc.coursesync.shared.exception.AmbiguousReferenceException;
import uk.gegc.coursesync.shared.exception.UnresolvedReferenceException;
import uk.gegc.coursesync.shared.util.PathSafety;
import uk.gegc.coursesync.shared.util.UrlPaths;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns an author's asset reference into exactly one file.
 * <ol>
 *     <li>relative to the referencing item's own folder</li>
 *     <li>an explicit relative path, tried from the item folder and then from the course root</li>
 *     <li>a bare filename, searched across the shared-assets tree</li>
 * </ol>
 * A bare filename with more than one match fails listing every candidate.
 */
@Slf4j
public class AssetReferenceResolver {

    private final Path courseRoot;
    private final Path sharedAssetsDir;
    private volatile Map<String, List<Path>> sharedIndex;

    public AssetReferenceResolver(Path courseRoot, String sharedAssetsDir) {
        this.courseRoot = courseRoot.toAbsolutePath().normalize();
        this.sharedAssetsDir = this.courseRoot.resolve(sharedAssetsDir);
    }

    public ResolvedAsset resolve(String reference, Path itemDir) {
        String cleaned = clean(reference);
        if (cleaned.isEmpty() || cleaned.contains("://") || cleaned.startsWith("data:")) {
            throw new UnresolvedReferenceException(reference, describe(itemDir));
        }

        boolean explicitPath = cleaned.contains("/");
        Path base = itemDir == null ? courseRoot : itemDir.toAbsolutePath().normalize();

        if (!explicitPath) {
            Optional<Path> local = existingFile(base.resolve(cleaned));
            if (local.isPresent()) {
                return toResolved(reference, local.get());
            }
            return searchSharedAssets(reference, cleaned, itemDir);
        }

        String relative = cleaned.startsWith("/") ? cleaned.substring(1) : cleaned;
        if (!cleaned.startsWith("/")) {
            Optional<Path> fromItem = existingFile(base.resolve(relative));
            if (fromItem.isPresent()) {
                return toResolved(reference, fromItem.get());
            }
        }
        Optional<Path> fromRoot = existingFile(courseRoot.resolve(relative));
        if (fromRoot.isPresent()) {
            return toResolved(reference, fromRoot.get());
        }
        throw new UnresolvedReferenceException(reference, describe(itemDir));
    }

    /**
     * Drops the cached shared-assets index so that files created after the first lookup are seen.
     */
    public void refreshIndex() {
        sharedIndex = null;
    }

    public String relativize(Path file) {
        return FilenameUtils.separatorsToUnix(courseRoot.relativize(file.toAbsolutePath().normalize()).toString());
    }

    public Path getCourseRoot() {
        return courseRoot;
    }

    private ResolvedAsset searchSharedAssets(String reference, String filename, Path itemDir) {
        List<Path> matches = index().getOrDefault(filename, List.of());
        if (matches.isEmpty()) {
            throw new UnresolvedReferenceException(reference, describe(itemDir));
        }
        if (matches.size() > 1) {
            List<String> candidates = matches.stream().map(this::relativize).sorted().toList();
            throw new AmbiguousReferenceException(reference, candidates);
        }
        return toResolved(reference, matches.get(0));
    }

    private Map<String, List<Path>> index() {
        Map<String, List<Path>> current = sharedIndex;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (sharedIndex == null) {
                sharedIndex = buildIndex();
            }
            return sharedIndex;
        }
    }

    private Map<String, List<Path>> buildIndex() {
        Map<String, List<Path>> index = new HashMap<>();
        if (!Files.isDirectory(sharedAssetsDir)) {
            return index;
        }
        try (Stream<Path> files = Files.walk(sharedAssetsDir)) {
            files.filter(Files::isRegularFile)
                    .forEach(f -> index.computeIfAbsent(f.getFileName().toString(), k -> new ArrayList<>()).add(f));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to index " + sharedAssetsDir, ex);
        }
        log.debug("Indexed {} distinct asset names under {}", index.size(), sharedAssetsDir);
        return index;
    }

    private Optional<Path> existingFile(Path candidate) {
        Path normalized = candidate.toAbsolutePath().normalize();
        if (!PathSafety.isWithin(courseRoot, normalized)) {
            return Optional.empty();
        }
        return Files.isRegularFile(normalized) ? Optional.of(normalized) : Optional.empty();
    }

    private ResolvedAsset toResolved(String reference, Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        return new ResolvedAsset(reference, normalized, relativize(normalized));
    }

    private String describe(Path itemDir) {
        return itemDir == null ? relativize(courseRoot) : relativize(itemDir);
    }

    private static String clean(String reference) {
        if (reference == null) {
            return "";
        }
        String value = reference.trim();
        int cut = indexOfAny(value, '?', '#');
        if (cut >= 0) {
            value = value.substring(0, cut);
        }
        if (value.startsWith("./")) {
            value = value.substring(2);
        }
        value = UrlPaths.decodePath(value);
        return value.replace('\\', '/');
    }

    private static int indexOfAny(String value, char... chars) {
        int result = -1;
        for (char c : chars) {
            int index = value.indexOf(c);
            if (index >= 0 && (result < 0 || index < result)) {
                result = index;
            }
        }
        return result;
    }
}
