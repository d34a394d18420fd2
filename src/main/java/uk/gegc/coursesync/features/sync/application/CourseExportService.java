package uk.gegc.coursesync.features.sync.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.cartridge.application.CartridgeExporter;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.source.application.CourseSourceReader;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;

import java.nio.file.Path;

/**
 * Packages a local course as a Common Cartridge archive without touching the platform.
 */
@Service
@RequiredArgsConstructor
public class CourseExportService {

    private final CourseSourceReader sourceReader;
    private final CartridgeExporter exporter;

    public ExportResult export(Path courseRoot, Path archive) {
        Path root = courseRoot.toAbsolutePath().normalize();
        RunReport report = new RunReport("export");
        RunCache cache = new RunCache();
        try {
            CourseModel model = sourceReader.read(root, report, cache);
            return exporter.export(model, root, archive.toAbsolutePath(), report);
        } finally {
            cache.clear();
            report.logSummary();
        }
    }
}
