package uk.gegc.coursesync.features.cartridge.domain.model;

import uk.gegc.coursesync.features.course.domain.model.CourseModel;

import java.nio.file.Path;
import java.util.Map;

/**
 * @param assets course-root-relative target path to the extracted file holding its bytes
 */
public record ImportedCourse(CourseModel model, Map<String, Path> assets, ArchiveMode mode) {

    public ImportedCourse {
        assets = Map.copyOf(assets);
    }
}
