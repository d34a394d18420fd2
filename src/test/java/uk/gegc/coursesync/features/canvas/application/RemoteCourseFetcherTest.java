package uk.gegc.coursesync.features.canvas.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.asset.application.AssetReferenceResolver;
import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasAnswer;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasCourse;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasFile;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModule;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModuleItem;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuiz;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuizQuestion;
import uk.gegc.coursesync.features.canvas.domain.model.FetchedCourse;
import uk.gegc.coursesync.features.canvas.infra.CanvasApiClient;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.markup.application.MediaReferenceExtractor;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RemoteCourseFetcher Tests")
class RemoteCourseFetcherTest extends BaseUnitTest {

    private static final long COURSE_ID = 42L;
    private static final String IMAGE_URL = "https://canvas.example/courses/42/files/77/preview";
    private static final byte[] IMAGE = {1, 2, 3, 4};

    @TempDir
    Path downloadDir;

    @Mock
    private CanvasApiClient client;

    private RemoteCourseFetcher fetcher;
    private AssetRegistry registry;
    private RunReport report;

    @BeforeEach
    void setUp() {
        fetcher = new RemoteCourseFetcher(client, TestComponents.markupNormalizer(), new MediaReferenceExtractor());
        registry = new AssetRegistry(new AssetReferenceResolver(downloadDir, "assets"), 12, TestComponents.FIXED_CLOCK);
        report = new RunReport("fetch");
    }

    private void stubCourseWithPage() {
        when(client.getCourse(COURSE_ID)).thenReturn(new CanvasCourse(COURSE_ID, "Biology 101", "BIO101"));
        when(client.listPages(COURSE_ID)).thenReturn(List.of(new CanvasPage(1L, "welcome", "Welcome", null, true)));
        when(client.getPage(COURSE_ID, "welcome")).thenReturn(new CanvasPage(1L, "welcome", "Welcome",
                "<p>Hello <strong>all</strong></p><p><img src=\"" + IMAGE_URL + "\" alt=\"cell\"></p>", true));
        when(client.listAssignments(COURSE_ID)).thenReturn(List.of());
    }

    @Test
    @DisplayName("fetch: pages, quizzes, links and modules read into the model")
    void fetch_fullCourse_modelBuilt() {
        // Given
        stubCourseWithPage();
        when(client.getFile(COURSE_ID, 77L)).thenReturn(
                new CanvasFile(77L, "cell.png", "cell.png", "https://canvas.example/files/77/download", 4L));
        when(client.download("https://canvas.example/files/77/download")).thenReturn(IMAGE);
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of(
                new CanvasQuiz(7L, "Check", "<p>Read ch.1</p>", "assignment", null, 1, false, 1.0, true),
                new CanvasQuiz(8L, "Matching only", null, "assignment", null, 1, false, 1.0, true)));
        when(client.listQuizQuestions(COURSE_ID, 7L)).thenReturn(List.of(
                new CanvasQuizQuestion(1L, "Q1", "<p>Capital?</p>", "multiple_choice_question", 1.0,
                        List.of(new CanvasAnswer(1L, "Paris", 100.0), new CanvasAnswer(2L, "Lyon", 0.0))),
                new CanvasQuizQuestion(2L, "Q2", "<p>Match</p>", "matching_question", 1.0, List.of())));
        when(client.listQuizQuestions(COURSE_ID, 8L)).thenReturn(List.of(
                new CanvasQuizQuestion(3L, "Q1", "<p>Match</p>", "matching_question", 1.0, List.of())));
        when(client.listModules(COURSE_ID)).thenReturn(List.of(new CanvasModule(3L, "Week 1", 1, true)));
        when(client.listModuleItems(COURSE_ID, 3L)).thenReturn(List.of(
                new CanvasModuleItem(50L, "Welcome", "Page", null, "welcome", null, 1, 0, null),
                new CanvasModuleItem(51L, "Check", "Quiz", 7L, null, null, 2, 1, null),
                new CanvasModuleItem(52L, "Site", "ExternalUrl", null, null, "https://example.com", 3, 0, false),
                new CanvasModuleItem(53L, "Part two", "SubHeader", null, null, null, 4, 0, null)));

        // When
        FetchedCourse fetched = fetcher.fetch(COURSE_ID, downloadDir, registry, TemplateSet.EMPTY, report);

        // Then
        CourseModel model = fetched.model();
        assertThat(model.getTitle()).isEqualTo("Biology 101");
        assertThat(model.getRemoteCourseId()).isEqualTo(COURSE_ID);
        assertThat(model.getItems()).containsOnlyKeys("page-welcome", "quiz-7", "link-52");

        Quiz quiz = (Quiz) model.findItem("quiz-7").orElseThrow();
        assertThat(quiz.getDescription()).isEqualTo("Read ch.1");
        assertThat(quiz.getQuestions()).singleElement()
                .satisfies(q -> assertThat(q.correctAnswers()).extracting(AnswerChoice::text).containsExactly("Paris"));
        assertThat(report.getSkippedItems()).singleElement()
                .satisfies(e -> assertThat(e.subject()).isEqualTo("Matching only"));

        assertThat(model.findItem("link-52")).get().isInstanceOfSatisfying(Link.class, link -> {
            assertThat(link.getExternalUrl()).isEqualTo("https://example.com");
            assertThat(link.isNewTab()).isFalse();
        });
        assertThat(model.getModules()).singleElement().satisfies(m -> assertThat(m.getItems())
                .containsExactly(new ModuleItemRef("page-welcome", 1, 0), new ModuleItemRef("quiz-7", 2, 1),
                        new ModuleItemRef("link-52", 3, 0)));
        assertThat(report.getWarnings()).anyMatch(w -> w.contains("matching_question"))
                .anyMatch(w -> w.contains("SubHeader"));
    }

    @Test
    @DisplayName("fetch: referenced course file downloaded once and registered with its remote id")
    void fetch_courseFile_downloadedAndRegistered() {
        // Given
        stubCourseWithPage();
        when(client.getFile(COURSE_ID, 77L)).thenReturn(
                new CanvasFile(77L, "cell.png", "cell.png", "https://canvas.example/files/77/download", 4L));
        when(client.download("https://canvas.example/files/77/download")).thenReturn(IMAGE);
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of());
        when(client.listModules(COURSE_ID)).thenReturn(List.of());

        // When
        FetchedCourse fetched = fetcher.fetch(COURSE_ID, downloadDir, registry, TemplateSet.EMPTY, report);

        // Then
        assertThat(fetched.assets()).containsOnlyKeys("assets/cell.png");
        assertThat(downloadDir.resolve("assets/cell.png")).hasBinaryContent(IMAGE);
        assertThat(registry.localPathFor("77")).hasValue("assets/cell.png");
        assertThat(fetched.model().findItem("page-welcome").orElseThrow().getBody())
                .contains("**all**")
                .contains("assets/cell.png")
                .doesNotContain("canvas.example");
        verify(client, times(1)).download(anyString());
    }

    @Test
    @DisplayName("fetch: file already known to the registry keeps its local path and is not downloaded")
    void fetch_knownRemoteFile_notDownloaded() {
        // Given
        stubCourseWithPage();
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of());
        when(client.listModules(COURSE_ID)).thenReturn(List.of());
        registry.register("assets/img/cell.png", IMAGE, new RemoteFileDescriptor("77", IMAGE_URL), "cell.png");

        // When
        FetchedCourse fetched = fetcher.fetch(COURSE_ID, downloadDir, registry, TemplateSet.EMPTY, report);

        // Then
        assertThat(fetched.assets()).isEmpty();
        assertThat(fetched.model().findItem("page-welcome").orElseThrow().getBody()).contains("assets/img/cell.png");
        verify(client, never()).getFile(anyLong(), anyLong());
        verify(client, never()).download(anyString());
    }
}
