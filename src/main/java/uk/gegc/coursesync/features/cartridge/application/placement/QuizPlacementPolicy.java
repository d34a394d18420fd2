package uk.gegc.coursesync.features.cartridge.application.placement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.PlacementDecision;
import uk.gegc.coursesync.features.cartridge.domain.model.QuizPlacement;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a decoded assessment becomes a quiz item or a question bank. Rules run in order;
 * the first opinion wins. Without any opinion the assessment is an inline quiz.
 */
@Slf4j
@Component
public class QuizPlacementPolicy {

    static final String DEFAULT_RULE = "default";

    private final List<QuizPlacementRule> rules;

    public QuizPlacementPolicy() {
        this(List.of(new RoundTripFlagRule(), new BankMarkerRule()));
    }

    QuizPlacementPolicy(List<QuizPlacementRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public PlacementDecision decide(ManifestResource resource, DecodedAssessment assessment) {
        for (QuizPlacementRule rule : rules) {
            Optional<PlacementDecision> decision = rule.decide(resource, assessment);
            if (decision.isPresent()) {
                log.debug("Placed {} as {} by {} ({})", assessment.identifier(), decision.get().placement(),
                        decision.get().rule(), decision.get().reason());
                return decision.get();
            }
        }
        return new PlacementDecision(QuizPlacement.INLINE, DEFAULT_RULE, "no bank marker");
    }
}
