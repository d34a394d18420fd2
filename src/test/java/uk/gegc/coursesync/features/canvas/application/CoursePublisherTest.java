package uk.gegc.coursesync.features.canvas.application;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasAssignment;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModule;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModuleItem;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuiz;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuizQuestion;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasRubric;
import uk.gegc.coursesync.features.canvas.domain.model.PublishResult;
import uk.gegc.coursesync.features.canvas.domain.model.RemoteRef;
import uk.gegc.coursesync.features.canvas.domain.model.RenderedItem;
import uk.gegc.coursesync.features.canvas.infra.CanvasApiClient;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentType;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.run.RunReport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CoursePublisher Tests")
class CoursePublisherTest extends BaseUnitTest {

    private static final long COURSE_ID = 42L;

    @Mock
    private CanvasApiClient client;

    @InjectMocks
    private CoursePublisher publisher;

    private CourseModel model;
    private Map<String, RenderedItem> rendered;
    private RunReport report;

    @BeforeEach
    void setUp() {
        model = new CourseModel("Biology 101");
        rendered = new HashMap<>();
        report = new RunReport("publish");
    }

    private Page page(String id, String title) {
        Page page = new Page(id, title);
        model.addItem(page);
        rendered.put(id, RenderedItem.body(id, "<p>" + title + "</p>"));
        return page;
    }

    private Quiz quiz(String id, String title) {
        Quiz quiz = new Quiz(id, title);
        Question question = new Question(QuestionType.MULTIPLE_CHOICE, "Capital?",
                List.of(new AnswerChoice("Paris", true), new AnswerChoice("Lyon", false)));
        quiz.setQuestions(List.of(question));
        model.addItem(quiz);
        rendered.put(id, new RenderedItem(id, "", "<p>Read ch.1</p>", List.of(question.withId(null)), null));
        return quiz;
    }

    private static CanvasPage remotePage(long id, String url, String title) {
        return new CanvasPage(id, url, title, null, true);
    }

    private static CanvasQuiz remoteQuiz(long id, String title) {
        return new CanvasQuiz(id, title, null, "assignment", null, 1, false, 1.0, true);
    }

    private static CanvasAssignment remoteAssignment(long id, String name) {
        return new CanvasAssignment(id, name, null, 10.0, List.of("online_upload"), null, null, null, "points",
                null, true, null, null);
    }

    @Test
    @DisplayName("publish: new page, quiz and module created with their entries")
    void publish_newCourse_everythingCreated() {
        // Given
        page("welcome", "Welcome");
        quiz("check", "Check");
        CourseModule module = new CourseModule("Week 1");
        module.setPosition(1);
        module.addItem("welcome", 0);
        module.addItem("check", 1);
        model.getModules().add(module);

        when(client.listPages(COURSE_ID)).thenReturn(List.of());
        when(client.createPage(eq(COURSE_ID), anyMap())).thenReturn(remotePage(11L, "welcome", "Welcome"));
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of());
        when(client.createQuiz(eq(COURSE_ID), anyMap())).thenReturn(remoteQuiz(7L, "Check"));
        when(client.listModules(COURSE_ID)).thenReturn(List.of());
        when(client.createModule(eq(COURSE_ID), anyMap())).thenReturn(new CanvasModule(3L, "Week 1", 1, true));

        // When
        PublishResult result = publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        assertThat(result.created()).isEqualTo(5);
        assertThat(result.updated()).isZero();
        assertThat(result.items()).containsEntry("welcome", new RemoteRef(ContentType.PAGE, 11L, "welcome"))
                .containsEntry("check", new RemoteRef(ContentType.QUIZ, 7L, null));
        verify(client, never()).listQuizQuestions(anyLong(), anyLong());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> items = ArgumentCaptor.forClass(Map.class);
        verify(client, times(2)).createModuleItem(eq(COURSE_ID), eq(3L), items.capture());
        assertThat(items.getAllValues().get(0)).containsEntry("type", "Page").containsEntry("page_url", "welcome");
        assertThat(items.getAllValues().get(1)).containsEntry("type", "Quiz").containsEntry("content_id", 7L)
                .containsEntry("indent", 1);
    }

    @Test
    @DisplayName("publish: quiz questions sent with correct answers weighted 100")
    void publish_quizQuestions_weighted() {
        // Given
        quiz("check", "Check");
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of());
        when(client.createQuiz(eq(COURSE_ID), anyMap())).thenReturn(remoteQuiz(7L, "Check"));

        // When
        publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> quizPayload = ArgumentCaptor.forClass(Map.class);
        verify(client).createQuiz(eq(COURSE_ID), quizPayload.capture());
        assertThat(quizPayload.getValue()).containsEntry("description", "<p>Read ch.1</p>")
                .containsEntry("points_possible", 1.0);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> question = ArgumentCaptor.forClass(Map.class);
        verify(client).createQuizQuestion(eq(COURSE_ID), eq(7L), question.capture());
        assertThat(question.getValue()).containsEntry("question_type", "multiple_choice_question")
                .containsEntry("position", 1);
        assertThat(question.getValue().get("answers")).asList().containsExactly(
                Map.of("answer_text", "Paris", "answer_weight", 100),
                Map.of("answer_text", "Lyon", "answer_weight", 0));
    }

    @Test
    @DisplayName("publish: existing objects updated and quiz questions replaced")
    void publish_existingObjects_updatedInPlace() {
        // Given
        page("welcome", "Welcome");
        quiz("check", "Check");
        when(client.listPages(COURSE_ID)).thenReturn(List.of(remotePage(11L, "welcome", "Welcome")));
        when(client.updatePage(eq(COURSE_ID), eq("welcome"), anyMap())).thenReturn(remotePage(11L, "welcome", "Welcome"));
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of(remoteQuiz(7L, "Check")));
        when(client.updateQuiz(eq(COURSE_ID), eq(7L), anyMap())).thenReturn(remoteQuiz(7L, "Check"));
        when(client.listQuizQuestions(COURSE_ID, 7L)).thenReturn(List.of(
                new CanvasQuizQuestion(101L, "Q1", "old", "essay_question", 1.0, List.of()),
                new CanvasQuizQuestion(102L, "Q2", "old", "essay_question", 1.0, List.of())));

        // When
        PublishResult result = publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        assertThat(result.created()).isZero();
        assertThat(result.updated()).isEqualTo(2);
        verify(client, never()).createPage(anyLong(), anyMap());
        verify(client, never()).createQuiz(anyLong(), anyMap());
        verify(client).deleteQuizQuestion(COURSE_ID, 7L, 101L);
        verify(client).deleteQuizQuestion(COURSE_ID, 7L, 102L);
        verify(client, times(1)).createQuizQuestion(eq(COURSE_ID), eq(7L), anyMap());
    }

    @Test
    @DisplayName("publish: existing module entry updated instead of duplicated")
    void publish_existingModuleItem_updated() {
        // Given
        page("welcome", "Welcome");
        CourseModule module = new CourseModule("Week 1");
        module.setPosition(1);
        module.addItem("welcome", 0);
        model.getModules().add(module);

        when(client.listPages(COURSE_ID)).thenReturn(List.of(remotePage(11L, "welcome", "Welcome")));
        when(client.updatePage(eq(COURSE_ID), eq("welcome"), anyMap())).thenReturn(remotePage(11L, "welcome", "Welcome"));
        when(client.listModules(COURSE_ID)).thenReturn(List.of(new CanvasModule(3L, "Week 1", 1, true)));
        when(client.updateModule(eq(COURSE_ID), eq(3L), anyMap())).thenReturn(new CanvasModule(3L, "Week 1", 1, true));
        when(client.listModuleItems(COURSE_ID, 3L)).thenReturn(List.of(
                new CanvasModuleItem(55L, "Welcome", "Page", null, "welcome", null, 1, 0, null)));

        // When
        PublishResult result = publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        assertThat(result.created()).isZero();
        verify(client).updateModuleItem(eq(COURSE_ID), eq(3L), eq(55L), anyMap());
        verify(client, never()).createModuleItem(anyLong(), anyLong(), anyMap());
    }

    @Test
    @DisplayName("publish: shared rubric created and associated with its assignment")
    void publish_assignmentRubric_associated() {
        // Given
        Rubric rubric = new Rubric("Essay rubric", false, List.of(new RubricCriterion("Thesis", null, 10,
                List.of(new RubricRating("Clear", 10, null), new RubricRating("Missing", 0, null)))));
        model.getSharedRubrics().put("essay-rubric", rubric);
        Assignment essay = new Assignment("essay", "Essay");
        essay.setRubricRef("essay-rubric");
        model.addItem(essay);
        rendered.put("essay", RenderedItem.body("essay", "<p>Write</p>"));

        when(client.listAssignments(COURSE_ID)).thenReturn(List.of());
        when(client.createAssignment(eq(COURSE_ID), anyMap())).thenReturn(remoteAssignment(5L, "Essay"));
        when(client.listRubrics(COURSE_ID)).thenReturn(List.of());
        when(client.createRubric(eq(COURSE_ID), anyMap(), anyMap())).thenReturn(new CanvasRubric(9L, "Essay rubric", 10.0));

        // When
        publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> association = ArgumentCaptor.forClass(Map.class);
        verify(client).createRubric(eq(COURSE_ID), payload.capture(), association.capture());
        assertThat(payload.getValue()).containsEntry("title", "Essay rubric");
        assertThat(payload.getValue().get("criteria")).asInstanceOf(InstanceOfAssertFactories.MAP).containsOnlyKeys("0");
        assertThat(association.getValue()).containsEntry("association_id", 5L)
                .containsEntry("association_type", "Assignment");
    }

    @Test
    @DisplayName("publish: question groups not published and reported")
    void publish_quizGroups_warned() {
        // Given
        Quiz quiz = quiz("check", "Check");
        quiz.getGroups().add(new QuestionGroup("cells", 2, null));
        when(client.listQuizzes(COURSE_ID)).thenReturn(List.of());
        when(client.createQuiz(eq(COURSE_ID), anyMap())).thenReturn(remoteQuiz(7L, "Check"));

        // When
        publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        assertThat(report.getWarnings()).singleElement().asString().contains("draws from question banks");
    }

    @Test
    @DisplayName("publish: item without a rendered form left out with its module entry")
    void publish_unrenderedItem_leftOut() {
        // Given
        page("welcome", "Welcome");
        model.addItem(new Page("draft", "Draft"));
        CourseModule module = new CourseModule("Week 1");
        module.setPosition(1);
        module.addItem("draft", 0);
        model.getModules().add(module);

        when(client.listPages(COURSE_ID)).thenReturn(List.of());
        when(client.createPage(eq(COURSE_ID), anyMap())).thenReturn(remotePage(11L, "welcome", "Welcome"));
        when(client.listModules(COURSE_ID)).thenReturn(List.of());
        when(client.createModule(eq(COURSE_ID), anyMap())).thenReturn(new CanvasModule(3L, "Week 1", 1, true));

        // When
        PublishResult result = publisher.publish(model, rendered, COURSE_ID, report);

        // Then
        assertThat(result.items()).containsOnlyKeys("welcome");
        verify(client, times(1)).createPage(anyLong(), anyMap());
        verify(client, never()).createModuleItem(anyLong(), anyLong(), any());
    }
}
