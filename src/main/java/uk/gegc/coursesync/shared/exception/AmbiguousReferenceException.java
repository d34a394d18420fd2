package uk.gegc.coursesync.shared.exception;

import java.util.List;

public class AmbiguousReferenceException extends CourseSyncException {

    private final String reference;
    private final List<String> candidates;

    public AmbiguousReferenceException(String reference, List<String> candidates) {
        super(String.format("Asset reference '%s' is ambiguous, %d candidates: %s",
                reference, candidates.size(), String.join(", ", candidates)));
        this.reference = reference;
        this.candidates = List.copyOf(candidates);
    }

    public String getReference() {
        return reference;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
