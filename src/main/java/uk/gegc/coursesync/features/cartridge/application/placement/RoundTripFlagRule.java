package uk.gegc.coursesync.features.cartridge.application.placement;

import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.PlacementDecision;
import uk.gegc.coursesync.features.cartridge.domain.model.QuizPlacement;

import java.util.Optional;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.INLINE_QUESTIONS_FLAG;

/**
 * Trusts the flag our own exporter writes on every quiz.
 */
public class RoundTripFlagRule implements QuizPlacementRule {

    @Override
    public String name() {
        return "round-trip-flag";
    }

    @Override
    public Optional<PlacementDecision> decide(ManifestResource resource, DecodedAssessment assessment) {
        String flag = assessment.metadata().get(INLINE_QUESTIONS_FLAG);
        if (flag == null || flag.isBlank()) {
            return Optional.empty();
        }
        boolean inline = Boolean.parseBoolean(flag.trim());
        return Optional.of(new PlacementDecision(inline ? QuizPlacement.INLINE : QuizPlacement.BANK, name(),
                INLINE_QUESTIONS_FLAG + "=" + flag.trim()));
    }
}
