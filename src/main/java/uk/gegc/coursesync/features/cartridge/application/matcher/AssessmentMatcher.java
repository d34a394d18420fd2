package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSESSMENT_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.FLAT_INDEX_SUFFIX;

/**
 * Quizzes and question banks. Both decode the same way; placement is decided afterwards.
 */
@Component
public class AssessmentMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        if (resource.typeContains("imsqti")) {
            return MatchResult.of(ResourceKind.ASSESSMENT, 1.0, "type " + resource.type());
        }
        if (resource.hasFileEndingWith(ASSESSMENT_FILE)) {
            return MatchResult.of(ResourceKind.ASSESSMENT, 0.9, "file " + ASSESSMENT_FILE);
        }
        if (resource.hasFileEndingWith(FLAT_INDEX_SUFFIX)) {
            return MatchResult.of(ResourceKind.ASSESSMENT, 0.7, "file *" + FLAT_INDEX_SUFFIX);
        }
        return MatchResult.none();
    }
}
