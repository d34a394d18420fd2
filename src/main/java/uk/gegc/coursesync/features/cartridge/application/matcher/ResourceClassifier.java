package uk.gegc.coursesync.features.cartridge.application.matcher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every matcher in priority order and keeps the most confident result. Equal confidence goes to
 * the earlier matcher. No match yields {@code UNKNOWN}, which the importer skips and reports.
 */
@Slf4j
@Component
public class ResourceClassifier {

    private final List<ResourceMatcher> matchers;

    public ResourceClassifier(List<ResourceMatcher> matchers) {
        this.matchers = matchers.stream().sorted(Comparator.comparingInt(ResourceMatcher::priority)).toList();
    }

    public MatchResult classify(ManifestResource resource, Path root) {
        MatchResult best = MatchResult.none();
        for (ResourceMatcher matcher : matchers) {
            MatchResult result = matcher.match(resource, root);
            if (result.confidence() > best.confidence()) {
                best = result;
            }
        }
        log.debug("Classified {} as {} ({}, {})", resource.identifier(), best.kind(), best.confidence(), best.signal());
        return best;
    }

    public static ResourceClassifier withDefaultMatchers() {
        return new ResourceClassifier(List.of(new CourseSettingsMatcher(), new LinkMatcher(), new AssessmentMatcher(),
                new AssessmentMetaMatcher(), new AssignmentMatcher(), new PageMatcher(), new AssetMatcher()));
    }
}
