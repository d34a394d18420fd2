package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;

@Component
public class LinkMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        if (resource.typeContains("imswl")) {
            return MatchResult.of(ResourceKind.LINK, 1.0, "type " + resource.type());
        }
        if (resource.typeContains("weblink")) {
            return MatchResult.of(ResourceKind.LINK, 0.8, "type " + resource.type());
        }
        return MatchResult.none();
    }
}
