package uk.gegc.coursesync.features.source.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.testsupport.CourseTreeFixture;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CourseSourceReader Tests")
class CourseSourceReaderTest extends BaseUnitTest {

    @TempDir
    Path root;

    private CourseTreeFixture tree;
    private CourseSourceReader reader;
    private RunReport report;

    @BeforeEach
    void setUp() {
        tree = new CourseTreeFixture(root);
        reader = TestComponents.sourceReader();
        report = new RunReport("test");
    }

    private void writeSampleCourse() {
        tree.courseFile("course_name: Biology 101\ncourse_id: 42\ncourse_code: BIO101\n");
        tree.item("01-Week 1.module", "01-welcome.page", Map.of("id", "welcome", "name", "Welcome"), "Hello **all**\n");
        Path essay = tree.item("01-Week 1.module", "02-essay.assignment",
                Map.of("id", "essay", "name", "Essay", "points_possible", 10), "Write it.\n");
        tree.file(root.relativize(essay.resolve("rubric.yaml")).toString(), String.join("\n",
                "title: Essay rubric",
                "criteria:",
                "  - description: Thesis",
                "    points: 10",
                "    ratings:",
                "      - {description: Clear, points: 10}",
                "      - {description: Missing, points: 0}",
                ""));
        tree.item("01-Week 1.module", "03-check.quiz", Map.of("id", "check", "name", "Check"),
                "Read ch.1\n\n1. Capital of France?\n*a) Paris\nb) Lyon\n");
        tree.item("02-Week 2.module", "01-broken.page", Map.of("id", "broken"), "No name here\n");
        tree.item("02-Week 2.module", "02-site.link",
                Map.of("id", "site", "name", "Site", "external_url", "https://example.com"), "");
        tree.item("02-Week 2.module", "03-late.page", Map.of("id", "late", "name", "Late", "position", 1), "Late\n");
        tree.file("modules/module_order.yaml", "modules:\n  - Week 2\n  - Week 1\n");
    }

    @Test
    @DisplayName("read: course settings and every valid item parsed")
    void read_sampleCourse_itemsParsed() {
        // Given
        writeSampleCourse();

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.getTitle()).isEqualTo("Biology 101");
        assertThat(model.getRemoteCourseId()).isEqualTo(42L);
        assertThat(model.getCourseCode()).isEqualTo("BIO101");
        assertThat(model.getItems()).containsOnlyKeys("welcome", "essay", "check", "site", "late");
        assertThat(model.findItem("welcome")).get().extracting(i -> i.getBody()).isEqualTo("Hello **all**");
        assertThat(model.findItem("site")).get().isInstanceOfSatisfying(Link.class,
                link -> assertThat(link.getExternalUrl()).isEqualTo("https://example.com"));
    }

    @Test
    @DisplayName("read: quiz description kept apart from its questions")
    void read_quiz_descriptionAndQuestions() {
        // Given
        writeSampleCourse();

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        Quiz quiz = (Quiz) model.findItem("check").orElseThrow();
        assertThat(quiz.getDescription()).isEqualTo("Read ch.1");
        assertThat(quiz.getQuestions()).singleElement().satisfies(q -> {
            assertThat(q.answers()).hasSize(2);
            assertThat(q.correctAnswers()).singleElement().satisfies(a -> assertThat(a.text()).isEqualTo("Paris"));
        });
    }

    @Test
    @DisplayName("read: inline rubric attached to its assignment")
    void read_assignmentRubric_attached() {
        // Given
        writeSampleCourse();

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        Assignment essay = (Assignment) model.findItem("essay").orElseThrow();
        assertThat(essay.getPointsPossible()).isEqualTo(10.0);
        assertThat(essay.getRubric()).isNotNull();
        assertThat(essay.getRubric().title()).isEqualTo("Essay rubric");
        assertThat(essay.getRubric().criteria()).singleElement().satisfies(c -> {
            assertThat(c.description()).isEqualTo("Thesis");
            assertThat(c.ratings()).hasSize(2);
        });
    }

    @Test
    @DisplayName("read: item without a name skipped and reported")
    void read_missingName_skipped() {
        // Given
        writeSampleCourse();

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.findItem("broken")).isEmpty();
        assertThat(report.getSkippedItems()).singleElement().satisfies(entry -> {
            assertThat(entry.subject()).isEqualTo("content/02-Week 2.module/01-broken.page");
            assertThat(entry.message()).contains("name");
        });
    }

    @Test
    @DisplayName("read: module order file wins and position tags beat folder prefixes")
    void read_moduleOrdering_applied() {
        // Given
        writeSampleCourse();

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.getModules()).extracting(CourseModule::getTitle).containsExactly("Week 2", "Week 1");
        assertThat(model.getModules().get(0).getItems()).extracting(ModuleItemRef::itemId)
                .containsExactly("late", "site");
        assertThat(model.getModules().get(1).getItems()).extracting(ModuleItemRef::itemId)
                .containsExactly("welcome", "essay", "check");
    }

    @Test
    @DisplayName("read: folder prefixes order modules without an order file")
    void read_noOrderFile_prefixOrder() {
        // Given
        tree.item("02-Later.module", "01-b.page", Map.of("id", "b", "name", "B"), "");
        tree.item("01-Sooner.module", "01-a.page", Map.of("id", "a", "name", "A"), "");

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.getModules()).extracting(CourseModule::getTitle).containsExactly("Sooner", "Later");
        assertThat(model.getTitle()).isEqualTo(root.getFileName().toString());
    }

    @Test
    @DisplayName("read: items without an id get a stable derived id")
    void read_noExplicitId_derivedIdStable() {
        // Given
        tree.item(null, "intro.page", Map.of("name", "Intro"), "Hi");

        // When
        CourseModel first = reader.read(root, report, new RunCache());
        CourseModel second = reader.read(root, new RunReport("again"), new RunCache());

        // Then
        assertThat(first.getItems().keySet()).singleElement().asString().startsWith("g");
        assertThat(second.getItems().keySet()).isEqualTo(first.getItems().keySet());
    }

    @Test
    @DisplayName("read: quiz without questions or groups skipped")
    void read_emptyQuiz_skipped() {
        // Given
        tree.item(null, "empty.quiz", Map.of("id", "empty", "name", "Empty"), "Just words.\n");

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.getItems()).isEmpty();
        assertThat(report.getSkippedItems()).singleElement()
                .satisfies(entry -> assertThat(entry.message()).contains("neither questions nor question groups"));
    }

    @Test
    @DisplayName("read: front matter cached per item location")
    void read_frontMatter_cached() {
        // Given
        tree.item(null, "intro.page", Map.of("id", "intro", "name", "Intro"), "Hi");
        RunCache cache = new RunCache();

        // When
        reader.read(root, report, cache);

        // Then
        assertThat(cache.size(CourseSourceReader.FRONT_MATTER_CACHE)).isEqualTo(1);
    }

    @Test
    @DisplayName("read: index file that is not UTF-8 skipped, other items still read")
    void read_latin1IndexFile_itemSkipped() {
        // Given
        writeSampleCourse();
        tree.bytes("content/01-Week 1.module/04-cafe.page/index.md",
                "---\nid: cafe\nname: Caf\u00e9\n---\nCaf\u00e9 au lait\n".getBytes(StandardCharsets.ISO_8859_1));

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.getItems()).containsOnlyKeys("welcome", "essay", "check", "site", "late");
        assertThat(report.getSkippedItems()).anySatisfy(entry -> {
            assertThat(entry.subject()).contains("04-cafe.page");
            assertThat(entry.message()).contains("not valid UTF-8");
        });
    }

    @Test
    @DisplayName("read: second bank file reusing an id skipped")
    void read_duplicateBankId_secondSkipped() {
        // Given
        writeSampleCourse();
        tree.file("question-banks/a-cells.bank.md", "---\nid: cells\nbank_name: Cells\n---\n1. Powerhouse?\n*a) Mitochondria\nb) Nucleus\n");
        tree.file("question-banks/b-cells.bank.md", "---\nid: cells\nbank_name: Cells copy\n---\n1. Membrane?\n*a) Lipid\nb) Sugar\n");

        // When
        CourseModel model = reader.read(root, report, new RunCache());

        // Then
        assertThat(model.findBank("cells")).isPresent();
        assertThat(report.getSkippedItems()).anySatisfy(entry -> {
            assertThat(entry.subject()).isEqualTo("question-banks/b-cells.bank.md");
            assertThat(entry.message()).contains("Duplicate question bank id cells");
        });
    }

    @Test
    @DisplayName("read: non-numeric course id rejected")
    void read_nonNumericCourseId_throws() {
        // Given
        tree.courseFile("course_name: X\ncourse_id: abc\n");
        tree.item(null, "intro.page", Map.of("name", "Intro"), "Hi");

        // When & Then
        assertThatThrownBy(() -> reader.read(root, report, new RunCache()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("course_id must be numeric");
    }

    @Test
    @DisplayName("read: tree without content directory rejected")
    void read_noContentDir_throws() {
        // Given
        tree.courseFile("course_name: X\n");

        // When & Then
        assertThatThrownBy(() -> reader.read(root, report, new RunCache()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("content");
    }
}
