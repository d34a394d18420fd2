package uk.gegc.coursesync.features.source.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.coursesync.testsupport.TestComponents.sourceReader;
import static uk.gegc.coursesync.testsupport.TestComponents.sourceWriter;

@DisplayName("CourseSourceWriter Tests")
class CourseSourceWriterTest extends BaseUnitTest {

    @TempDir
    Path target;

    private final CourseSourceWriter writer = sourceWriter();

    private static CourseModel sampleModel() {
        CourseModel model = new CourseModel("Biology 101");
        model.setRemoteCourseId(42L);

        Page welcome = new Page("welcome", "Welcome");
        welcome.setBody("Hello **all**");
        model.addItem(welcome);

        Assignment essay = new Assignment("essay", "Essay");
        essay.setBody("Write it.");
        essay.setPointsPossible(10.0);
        essay.addMembership(new ModuleMembership("Week 1", null, 1));
        essay.setRubric(new Rubric("Essay rubric", false, List.of(new RubricCriterion("Thesis", null, 10,
                List.of(new RubricRating("Clear", 10, null), new RubricRating("Missing", 0, null))))));
        model.addItem(essay);

        Quiz check = new Quiz("check", "Check");
        check.setDescription("Read ch.1");
        check.setQuestions(List.of(new Question(QuestionType.MULTIPLE_CHOICE, "Capital of France?",
                List.of(new AnswerChoice("Paris", true), new AnswerChoice("Lyon", false)))));
        model.addItem(check);

        Page loose = new Page("loose", "Loose Notes");
        loose.setBody("Not in a module");
        model.addItem(loose);

        model.addBank(new QuestionBank("b1", "Cells", List.of(new Question(QuestionType.MULTIPLE_CHOICE,
                "Powerhouse?", List.of(new AnswerChoice("Mitochondria", true), new AnswerChoice("Nucleus", false))))));

        CourseModule later = new CourseModule("Week 2: Cells");
        later.setPosition(1);
        later.addItem("check", 0);
        CourseModule first = new CourseModule("Week 1");
        first.setPosition(2);
        first.addItem("welcome", 0);
        first.addItem("essay", 1);
        model.getModules().add(later);
        model.getModules().add(first);
        return model;
    }

    @Test
    @DisplayName("write: written tree reads back into an equivalent model")
    void write_thenRead_equivalentModel() {
        // When
        writer.write(sampleModel(), target, Map.of());
        CourseModel back = sourceReader().read(target, new RunReport("back"), new RunCache());

        // Then
        assertThat(back.getTitle()).isEqualTo("Biology 101");
        assertThat(back.getRemoteCourseId()).isEqualTo(42L);
        assertThat(back.getItems()).containsOnlyKeys("welcome", "essay", "check", "loose");
        assertThat(back.getModules()).extracting(CourseModule::getTitle).containsExactly("Week 2 Cells", "Week 1");
        assertThat(back.getModules().get(1).getItems())
                .containsExactly(new ModuleItemRef("welcome", 1, 0), new ModuleItemRef("essay", 2, 1));

        Quiz quiz = (Quiz) back.findItem("check").orElseThrow();
        assertThat(quiz.getDescription()).isEqualTo("Read ch.1");
        assertThat(quiz.getQuestions()).singleElement()
                .satisfies(q -> assertThat(q.correctAnswers()).extracting(AnswerChoice::text).containsExactly("Paris"));

        Assignment essay = (Assignment) back.findItem("essay").orElseThrow();
        assertThat(essay.getRubric().criteria()).extracting(RubricCriterion::description).containsExactly("Thesis");
        assertThat(back.findBank("b1")).get().satisfies(b -> assertThat(b.questions()).hasSize(1));
    }

    @Test
    @DisplayName("write: folder layout uses numeric prefixes and item suffixes")
    void write_layout_prefixedFolders() {
        // When
        writer.write(sampleModel(), target, Map.of());

        // Then
        assertThat(target.resolve("content/01-Week 2 Cells.module/01-check.quiz/index.md")).isRegularFile();
        assertThat(target.resolve("content/02-Week 1.module/02-essay.assignment/rubric.yaml")).isRegularFile();
        assertThat(target.resolve("content/loose-notes.page/index.md")).isRegularFile();
        assertThat(target.resolve("question-banks/cells.bank.md")).isRegularFile();
        assertThat(target.resolve("modules/module_order.yaml")).isRegularFile();
    }

    @Test
    @DisplayName("write: course file starts with the linked course id")
    void write_courseFile_courseIdFirst() throws IOException {
        // When
        writer.write(sampleModel(), target, Map.of());

        // Then
        String courseFile = Files.readString(target.resolve("course.yaml"));
        assertThat(courseFile).startsWith("course_id: 42").contains("course_name: Biology 101");
    }

    @Test
    @DisplayName("write: shared rubric rows referenced instead of repeated")
    void write_sharedRows_referenced() throws IOException {
        // Given
        CourseModel model = sampleModel();
        Assignment essay = (Assignment) model.findItem("essay").orElseThrow();
        RubricCriterion thesis = essay.getRubric().criteria().get(0);

        // When
        writer.write(model, target, Map.of("thesis", thesis));

        // Then
        assertThat(target.resolve("rubrics/rows/thesis.yaml")).isRegularFile();
        String rubric = Files.readString(target.resolve("content/02-Week 1.module/02-essay.assignment/rubric.yaml"));
        assertThat(rubric).contains("{{rubric_row:thesis}}").doesNotContain("Missing");
    }

    @Test
    @DisplayName("write: target with existing content refused")
    void write_nonEmptyContent_throws() throws IOException {
        // Given
        Files.createDirectories(target.resolve("content/old.page"));

        // When & Then
        assertThatThrownBy(() -> writer.write(sampleModel(), target, Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already contains course content");
    }

    @Test
    @DisplayName("copyAsset: asset copied under the course root")
    void copyAsset_safePath_copied() {
        // When
        writer.copyAsset(target, "assets/img/cell.png",
                new ByteArrayInputStream("png".getBytes(StandardCharsets.UTF_8)));

        // Then
        assertThat(target.resolve("assets/img/cell.png")).hasContent("png");
    }

    @Test
    @DisplayName("copyAsset: path escaping the root rejected")
    void copyAsset_traversal_throws() {
        // When & Then
        assertThatThrownBy(() -> writer.copyAsset(target, "../outside.png", new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(ValidationException.class);
        assertThat(target.getParent().resolve("outside.png")).doesNotExist();
    }
}
