package uk.gegc.coursesync.features.markup.application;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps an author asset reference to the URL written into rendered output. Implementations may throw the
 * asset resolution exceptions; the normalizer turns them into warnings and keeps the reference.
 */
@FunctionalInterface
public interface AssetLinker {

    AssetLinker NONE = (reference, itemDir) -> Optional.empty();

    Optional<String> link(String reference, Path itemDir);
}
