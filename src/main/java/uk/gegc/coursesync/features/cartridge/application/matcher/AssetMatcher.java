package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WEB_RESOURCES_DIR;

@Component
public class AssetMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        String file = resource.primaryFile().orElse("");
        if (file.startsWith(WEB_RESOURCES_DIR + "/")) {
            return MatchResult.of(ResourceKind.ASSET, 0.9, "file under " + WEB_RESOURCES_DIR);
        }
        if (resource.typeContains("webcontent") && !file.isEmpty()) {
            return MatchResult.of(ResourceKind.ASSET, 0.5, "webcontent file " + file);
        }
        return MatchResult.none();
    }
}
