package uk.gegc.coursesync.features.cartridge.domain.model;

/**
 * Outcome of one resource matcher.
 *
 * @param confidence 0 for no match, up to 1 for a certain match
 * @param signal     what the matcher saw, for logging and skip reports
 */
public record MatchResult(ResourceKind kind, double confidence, String signal) {

    public MatchResult {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1");
        }
    }

    public static MatchResult of(ResourceKind kind, double confidence, String signal) {
        return new MatchResult(kind, confidence, signal);
    }

    public static MatchResult none() {
        return new MatchResult(ResourceKind.UNKNOWN, 0, "no signal");
    }

    public boolean matched() {
        return confidence > 0;
    }
}
