package uk.gegc.coursesync.shared.exception;

public class UnresolvedReferenceException extends CourseSyncException {

    private final String reference;

    public UnresolvedReferenceException(String reference, String searchedFrom) {
        super(String.format("Asset reference '%s' not found (searched from %s)", reference, searchedFrom));
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
