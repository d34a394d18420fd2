package uk.gegc.coursesync.features.cartridge.domain.model;

import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;

import java.util.List;
import java.util.Map;

/**
 * One QTI document read back: either an {@code <assessment>} or an {@code <objectbank>}.
 *
 * @param descriptionHtml content of the objectives field, empty when absent
 * @param metadata        qtimetadata fields of the assessment or bank
 */
public record DecodedAssessment(String identifier, String title, String descriptionHtml, List<Question> questions,
                                List<QuestionGroup> groups, Map<String, String> metadata, boolean objectBank) {

    public DecodedAssessment {
        descriptionHtml = descriptionHtml == null ? "" : descriptionHtml;
        questions = questions == null ? List.of() : List.copyOf(questions);
        groups = groups == null ? List.of() : List.copyOf(groups);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
