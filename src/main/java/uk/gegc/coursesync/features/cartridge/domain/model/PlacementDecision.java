package uk.gegc.coursesync.features.cartridge.domain.model;

/**
 * @param rule name of the rule that decided
 */
public record PlacementDecision(QuizPlacement placement, String rule, String reason) {
}
