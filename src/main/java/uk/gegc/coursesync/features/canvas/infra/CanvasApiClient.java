package uk.gegc.coursesync.features.canvas.infra;

import uk.gegc.coursesync.features.canvas.domain.model.CanvasAssignment;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasCourse;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasFile;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModule;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModuleItem;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuiz;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuizQuestion;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasRubric;

import java.util.List;
import java.util.Map;

/**
 * The platform operations the pipeline needs. List calls follow pagination to the end. Every failure
 * surfaces as {@link uk.gegc.coursesync.shared.exception.RemoteOperationException}; nothing is retried.
 * <p>
 * Write payloads use the platform's field names and are wrapped in the resource envelope
 * ({@code wiki_page}, {@code assignment}...) by the implementation.
 */
public interface CanvasApiClient {

    CanvasCourse getCourse(long courseId);

    List<CanvasPage> listPages(long courseId);

    CanvasPage getPage(long courseId, String pageUrl);

    CanvasPage createPage(long courseId, Map<String, Object> page);

    CanvasPage updatePage(long courseId, String pageUrl, Map<String, Object> page);

    List<CanvasAssignment> listAssignments(long courseId);

    CanvasAssignment createAssignment(long courseId, Map<String, Object> assignment);

    CanvasAssignment updateAssignment(long courseId, long assignmentId, Map<String, Object> assignment);

    List<CanvasQuiz> listQuizzes(long courseId);

    CanvasQuiz createQuiz(long courseId, Map<String, Object> quiz);

    CanvasQuiz updateQuiz(long courseId, long quizId, Map<String, Object> quiz);

    List<CanvasQuizQuestion> listQuizQuestions(long courseId, long quizId);

    CanvasQuizQuestion createQuizQuestion(long courseId, long quizId, Map<String, Object> question);

    void deleteQuizQuestion(long courseId, long quizId, long questionId);

    List<CanvasModule> listModules(long courseId);

    CanvasModule createModule(long courseId, Map<String, Object> module);

    CanvasModule updateModule(long courseId, long moduleId, Map<String, Object> module);

    List<CanvasModuleItem> listModuleItems(long courseId, long moduleId);

    CanvasModuleItem createModuleItem(long courseId, long moduleId, Map<String, Object> item);

    CanvasModuleItem updateModuleItem(long courseId, long moduleId, long itemId, Map<String, Object> item);

    List<CanvasRubric> listRubrics(long courseId);

    /**
     * @param rubric      rubric fields including {@code criteria}
     * @param association rubric association fields, e.g. the assignment it grades
     */
    CanvasRubric createRubric(long courseId, Map<String, Object> rubric, Map<String, Object> association);

    CanvasRubric updateRubric(long courseId, long rubricId, Map<String, Object> rubric, Map<String, Object> association);

    /**
     * Three steps: announce the upload, send the bytes to the returned upload URL, confirm.
     */
    CanvasFile uploadFile(long courseId, String filename, byte[] content, String folderPath);

    CanvasFile getFile(long courseId, long fileId);

    byte[] download(String url);
}
