package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;
import java.util.Locale;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WIKI_DIR;

@Component
public class PageMatcher implements ResourceMatcher {

    @Override
    public int priority() {
        return 60;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        String file = resource.primaryFile().orElse("");
        String lower = file.toLowerCase(Locale.ROOT);
        boolean html = lower.endsWith(".html") || lower.endsWith(".htm");
        if (!html) {
            return MatchResult.none();
        }
        if (file.startsWith(WIKI_DIR + "/")) {
            return MatchResult.of(ResourceKind.PAGE, 1.0, "html under " + WIKI_DIR);
        }
        if (resource.typeContains("webcontent")) {
            return MatchResult.of(ResourceKind.PAGE, 0.7, "webcontent html " + file);
        }
        return MatchResult.of(ResourceKind.PAGE, 0.3, "html " + file);
    }
}
