package uk.gegc.coursesync.shared.exception;

public class ResourceDecodeException extends CourseSyncException {

    private final String resourceId;

    public ResourceDecodeException(String resourceId, String message) {
        super(String.format("Resource %s could not be decoded: %s", resourceId, message));
        this.resourceId = resourceId;
    }

    public ResourceDecodeException(String resourceId, String message, Throwable cause) {
        super(String.format("Resource %s could not be decoded: %s", resourceId, message), cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
