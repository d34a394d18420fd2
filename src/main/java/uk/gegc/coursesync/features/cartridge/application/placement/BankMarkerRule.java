package uk.gegc.coursesync.features.cartridge.application.placement;

import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.PlacementDecision;
import uk.gegc.coursesync.features.cartridge.domain.model.QuizPlacement;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structural hints that an assessment is a question pool: an {@code objectbank} root, a question-bank
 * resource type, or bank keywords in the identifier or title.
 */
public class BankMarkerRule implements QuizPlacementRule {

    private static final Pattern BANK_WORD = Pattern.compile("(^|[^a-z])(bank|pool|question_bank|questionbank)([^a-z]|$)");

    @Override
    public String name() {
        return "bank-marker";
    }

    @Override
    public Optional<PlacementDecision> decide(ManifestResource resource, DecodedAssessment assessment) {
        if (assessment.objectBank()) {
            return bank("objectbank element");
        }
        if (resource != null && resource.typeContains("question-bank")) {
            return bank("resource type " + resource.type());
        }
        if (hasBankWord(assessment.identifier())) {
            return bank("identifier " + assessment.identifier());
        }
        if (hasBankWord(assessment.title())) {
            return bank("title '" + assessment.title() + "'");
        }
        return Optional.empty();
    }

    private Optional<PlacementDecision> bank(String reason) {
        return Optional.of(new PlacementDecision(QuizPlacement.BANK, name(), reason));
    }

    private static boolean hasBankWord(String value) {
        return value != null && BANK_WORD.matcher(value.toLowerCase(Locale.ROOT)).find();
    }
}
