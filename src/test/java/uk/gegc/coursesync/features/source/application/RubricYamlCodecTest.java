package uk.gegc.coursesync.features.source.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RubricYamlCodec Tests")
class RubricYamlCodecTest extends BaseUnitTest {

    private static final RubricCriterion CITATIONS = new RubricCriterion("Citations", null, 5,
            List.of(new RubricRating("Complete", 5, null), new RubricRating("None", 0, null)));

    private final RubricYamlCodec codec = new RubricYamlCodec(TestComponents.yamlMapper());

    @Test
    @DisplayName("toRubric: inline criteria and row references combined in order")
    void toRubric_inlineAndRows_combined() {
        // Given
        Map<String, Object> values = codec.readMap(String.join("\n",
                "title: Essay rubric",
                "free_form_criterion_comments: true",
                "criteria:",
                "  - description: Thesis",
                "    ratings:",
                "      - {description: Clear, points: 10}",
                "      - {description: Missing, points: 0}",
                "  - \"{{rubric_row:citations}}\"",
                ""), "rubric.yaml");

        // When
        Rubric rubric = codec.toRubric(values, slug -> "citations".equals(slug) ? Optional.of(CITATIONS)
                : Optional.empty(), "rubric.yaml");

        // Then
        assertThat(rubric.title()).isEqualTo("Essay rubric");
        assertThat(rubric.freeFormComments()).isTrue();
        assertThat(rubric.criteria()).extracting(RubricCriterion::description).containsExactly("Thesis", "Citations");
        assertThat(rubric.criteria().get(0).points()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("toRubric: unknown row reference rejected")
    void toRubric_unknownRow_throws() {
        // Given
        Map<String, Object> values = Map.of("title", "R", "criteria", List.of("{{rubric_row:ghost}}"));

        // When & Then
        assertThatThrownBy(() -> codec.toRubric(values, slug -> Optional.empty(), "rubric.yaml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown rubric row 'ghost'");
    }

    @Test
    @DisplayName("toRubric: rubric without criteria rejected")
    void toRubric_noCriteria_throws() {
        // When & Then
        assertThatThrownBy(() -> codec.toRubric(Map.of("title", "R"), slug -> Optional.empty(), "rubric.yaml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no criteria");
    }

    @Test
    @DisplayName("sharedReference: use_rubric names a shared rubric")
    void sharedReference_useRubric_returned() {
        assertThat(codec.sharedReference(Map.of("use_rubric", " essay-rubric "))).hasValue("essay-rubric");
        assertThat(codec.sharedReference(Map.of("title", "R"))).isEmpty();
    }

    @Test
    @DisplayName("toMap: criterion written back reads as the same criterion")
    void toMap_criterion_readsBack() {
        // When
        RubricCriterion back = codec.toCriterion(codec.toMap(CITATIONS), "row.yaml");

        // Then
        assertThat(back).isEqualTo(CITATIONS);
    }
}
