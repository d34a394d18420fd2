package uk.gegc.coursesync.features.markup.application.placeholder;

import java.util.Optional;

/**
 * Source of {@code {{include:name}}} fragments.
 */
@FunctionalInterface
public interface IncludeResolver {

    IncludeResolver NONE = name -> Optional.empty();

    Optional<String> include(String name);
}
