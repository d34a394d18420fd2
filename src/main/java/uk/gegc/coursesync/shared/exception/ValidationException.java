package uk.gegc.coursesync.shared.exception;

/**
 * Malformed or missing required source fields. The offending item is skipped, the run continues.
 */
public class ValidationException extends CourseSyncException {

    private final String location;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String location, String message) {
        super(location == null ? message : location + ": " + message);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
