package uk.gegc.coursesync.features.markup.application;

import java.util.Optional;

/**
 * Maps a platform or package URL back to a local, course-root relative asset path.
 */
@FunctionalInterface
public interface AssetPathMapper {

    AssetPathMapper NONE = url -> Optional.empty();

    Optional<String> localPath(String url);
}
