package uk.gegc.coursesync.features.cartridge.application.matcher;

import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;

import java.nio.file.Path;

/**
 * One typed test of what a manifest resource holds. Matchers look at the declared type string and at
 * companion files, since producers do not agree on the type vocabulary.
 */
public interface ResourceMatcher {

    /**
     * Lower runs first and wins ties on confidence.
     */
    int priority();

    /**
     * @param root extracted archive root, for companion file checks
     */
    MatchResult match(ManifestResource resource, Path root);
}
