package uk.gegc.coursesync.features.cartridge.domain.model;

/**
 * How an archive is read. A platform export carries the root sentinel file; its quizzes are decoded
 * from the flat assessment index only. Any other archive is decoded from the structured QTI files.
 */
public enum ArchiveMode {
    PLATFORM_EXPORT,
    THIRD_PARTY
}
