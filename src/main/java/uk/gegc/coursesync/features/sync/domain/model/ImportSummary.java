package uk.gegc.coursesync.features.sync.domain.model;

import uk.gegc.coursesync.shared.run.RunReport;

import java.nio.file.Path;

public record ImportSummary(Path targetRoot, int items, int modules, int assets, int extractedRubrics,
                            RunReport report) {
}
