package uk.gegc.coursesync.features.markup.application.placeholder;

import java.util.Optional;

/**
 * Source of {@code {{var:name}}} values.
 */
@FunctionalInterface
public interface VariableResolver {

    VariableResolver NONE = name -> Optional.empty();

    Optional<String> variable(String name);
}
