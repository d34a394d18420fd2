package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Files;
import java.nio.file.Path;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSIGNMENT_SETTINGS_FILE;

@Component
public class AssignmentMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        if (resource.hasFileEndingWith(ASSIGNMENT_SETTINGS_FILE)) {
            return MatchResult.of(ResourceKind.ASSIGNMENT, 0.9, "file " + ASSIGNMENT_SETTINGS_FILE);
        }
        if (root != null && Files.isRegularFile(root.resolve(resource.identifier()).resolve(ASSIGNMENT_SETTINGS_FILE))) {
            return MatchResult.of(ResourceKind.ASSIGNMENT, 0.85, "companion " + ASSIGNMENT_SETTINGS_FILE);
        }
        if (resource.typeContains("learning-application")) {
            return MatchResult.of(ResourceKind.ASSIGNMENT, 0.5, "type " + resource.type());
        }
        return MatchResult.none();
    }
}
