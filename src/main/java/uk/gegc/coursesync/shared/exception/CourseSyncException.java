package uk.gegc.coursesync.shared.exception;

/**
 * Root of the unchecked exception hierarchy raised by the sync, export and import pipelines.
 */
public abstract class CourseSyncException extends RuntimeException {

    protected CourseSyncException(String message) {
        super(message);
    }

    protected CourseSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
