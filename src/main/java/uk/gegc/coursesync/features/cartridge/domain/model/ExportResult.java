package uk.gegc.coursesync.features.cartridge.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * @param entries archive member names in write order
 */
public record ExportResult(Path archive, List<String> entries, int items, int assets) {

    public ExportResult {
        entries = List.copyOf(entries);
    }
}
