package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSESSMENT_META_FILE;

/**
 * The settings companion of a quiz. It also lists the flat index file, so it must outrank
 * {@link AssessmentMatcher}'s file signal.
 */
@Component
public class AssessmentMetaMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        return resource.hasFileEndingWith(ASSESSMENT_META_FILE)
                ? MatchResult.of(ResourceKind.ASSESSMENT_META, 0.95, "file " + ASSESSMENT_META_FILE)
                : MatchResult.none();
    }
}
