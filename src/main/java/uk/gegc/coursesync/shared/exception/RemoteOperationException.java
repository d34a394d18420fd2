package uk.gegc.coursesync.shared.exception;

/**
 * Network or remote API failure. Aborts the current pipeline stage; completed stages stay in place.
 */
public class RemoteOperationException extends CourseSyncException {

    private final String operation;

    public RemoteOperationException(String operation, String message) {
        super(String.format("Remote operation '%s' failed: %s", operation, message));
        this.operation = operation;
    }

    public RemoteOperationException(String operation, String message, Throwable cause) {
        super(String.format("Remote operation '%s' failed: %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
