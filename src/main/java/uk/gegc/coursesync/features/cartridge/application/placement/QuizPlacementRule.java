package uk.gegc.coursesync.features.cartridge.application.placement;

import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.PlacementDecision;

import java.util.Optional;

/**
 * One step of the inline-or-bank decision. Empty means the rule has no opinion.
 */
public interface QuizPlacementRule {

    String name();

    Optional<PlacementDecision> decide(ManifestResource resource, DecodedAssessment assessment);
}
