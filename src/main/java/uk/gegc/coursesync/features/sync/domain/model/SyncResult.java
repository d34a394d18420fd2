package uk.gegc.coursesync.features.sync.domain.model;

import uk.gegc.coursesync.features.canvas.domain.model.PublishResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.shared.run.RunReport;

/**
 * @param exportResult archive written at the end of the run, null when packaging is off
 * @param prunedAssets registry records removed, 0 when pruning is off
 */
public record SyncResult(PublishResult publishResult, ExportResult exportResult, int renderedItems,
                         int prunedAssets, RunReport report) {
}
