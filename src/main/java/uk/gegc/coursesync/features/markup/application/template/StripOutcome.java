package uk.gegc.coursesync.features.markup.application.template;

public record StripOutcome(boolean matched, String strategy, Edge edge, String detail) {

    public static StripOutcome matched(String strategy, Edge edge, String detail) {
        return new StripOutcome(true, strategy, edge, detail);
    }

    public static StripOutcome noMatch(String strategy, Edge edge, String detail) {
        return new StripOutcome(false, strategy, edge, detail);
    }
}
