package uk.gegc.coursesync.features.cartridge.application.matcher;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ResourceKind;

import java.nio.file.Path;

@Component
public class CourseSettingsMatcher implements ResourceMatcher {

    private static final String DIR = "course_settings/";

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public MatchResult match(ManifestResource resource, Path root) {
        boolean settings = resource.primaryFile().map(f -> f.startsWith(DIR)).orElse(false)
                || resource.files().stream().anyMatch(f -> f.startsWith(DIR));
        return settings ? MatchResult.of(ResourceKind.COURSE_SETTINGS, 1.0, "file under " + DIR) : MatchResult.none();
    }
}
