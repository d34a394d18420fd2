package uk.gegc.coursesync.shared.exception;

/**
 * The archive as a whole cannot be read: corrupt zip, unsafe member, missing or unparsable manifest.
 * Raised before anything is written locally.
 */
public class ArchiveFormatException extends CourseSyncException {

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
