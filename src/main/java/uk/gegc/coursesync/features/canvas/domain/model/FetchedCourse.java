package uk.gegc.coursesync.features.canvas.domain.model;

import uk.gegc.coursesync.features.course.domain.model.CourseModel;

import java.nio.file.Path;
import java.util.Map;

/**
 * A remote course read into the canonical model.
 *
 * @param assets course-root relative target path to the downloaded file
 */
public record FetchedCourse(CourseModel model, Map<String, Path> assets) {

    public FetchedCourse {
        assets = Map.copyOf(assets);
    }
}
