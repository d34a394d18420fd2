package uk.gegc.coursesync.features.canvas.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
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
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.ContentType;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.FileItem;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.run.RunReport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pushes a rendered course to the platform. Every object is matched by its natural key (page title,
 * assignment name, quiz title, module name, rubric title) and updated when found, so publishing the same
 * course twice creates nothing the second time. Quiz questions are replaced as a whole.
 * <p>
 * A {@link uk.gegc.coursesync.shared.exception.RemoteOperationException} aborts the run at the failing
 * call; objects published before it stay in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoursePublisher {

    public static final String CREATED = "remote.created";
    public static final String UPDATED = "remote.updated";

    private final CanvasApiClient client;

    /**
     * @param rendered platform form of each item by id; items without an entry were skipped earlier and
     *                 are left out, together with their module entries
     */
    public PublishResult publish(CourseModel model, Map<String, RenderedItem> rendered, long courseId, RunReport report) {
        PublishRun run = new PublishRun(model, rendered, courseId, report);
        run.publishPages();
        run.publishAssignments();
        run.publishQuizzes();
        run.collectLinksAndFiles();
        run.publishModules();
        log.info("Published course '{}' to {}: {} created, {} updated", model.getTitle(), courseId,
                run.created, run.updated);
        return new PublishResult(run.refs, run.created, run.updated);
    }

    private final class PublishRun {

        private final CourseModel model;
        private final Map<String, RenderedItem> rendered;
        private final long courseId;
        private final RunReport report;
        private final Map<String, RemoteRef> refs = new LinkedHashMap<>();
        private Map<String, CanvasRubric> rubricsByTitle;
        private int created;
        private int updated;

        PublishRun(CourseModel model, Map<String, RenderedItem> rendered, long courseId, RunReport report) {
            this.model = model;
            this.rendered = rendered;
            this.courseId = courseId;
            this.report = report;
        }

        void publishPages() {
            List<Page> pages = pendingOf(Page.class);
            if (pages.isEmpty()) {
                return;
            }
            Map<String, CanvasPage> existing = byKey(client.listPages(courseId), CanvasPage::title);
            for (Page page : pages) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("title", page.getTitle());
                payload.put("body", rendered.get(page.getId()).html());
                payload.put("published", page.isPublished());

                CanvasPage match = existing.get(page.getTitle());
                CanvasPage result;
                if (match != null) {
                    result = client.updatePage(courseId, match.url(), payload);
                    counted(false);
                } else {
                    result = client.createPage(courseId, payload);
                    counted(true);
                }
                refs.put(page.getId(), new RemoteRef(ContentType.PAGE, result.pageId(), result.url()));
            }
        }

        void publishAssignments() {
            List<Assignment> assignments = pendingOf(Assignment.class);
            if (assignments.isEmpty()) {
                return;
            }
            Map<String, CanvasAssignment> existing = byKey(client.listAssignments(courseId), CanvasAssignment::name);
            for (Assignment assignment : assignments) {
                Map<String, Object> payload = assignmentPayload(assignment, rendered.get(assignment.getId()).html());
                CanvasAssignment match = existing.get(assignment.getTitle());
                CanvasAssignment result;
                if (match != null) {
                    result = client.updateAssignment(courseId, match.id(), payload);
                    counted(false);
                } else {
                    result = client.createAssignment(courseId, payload);
                    counted(true);
                }
                refs.put(assignment.getId(), new RemoteRef(ContentType.ASSIGNMENT, result.id(), null));
                publishRubric(assignment, result.id());
            }
        }

        private void publishRubric(Assignment assignment, long assignmentId) {
            Rubric rubric = rubricOf(assignment);
            if (rubric == null) {
                return;
            }
            if (rubricsByTitle == null) {
                rubricsByTitle = new HashMap<>(byKey(client.listRubrics(courseId), CanvasRubric::title));
            }
            Map<String, Object> payload = rubricPayload(rubric);
            Map<String, Object> association = new LinkedHashMap<>();
            association.put("association_id", assignmentId);
            association.put("association_type", "Assignment");
            association.put("use_for_grading", true);
            association.put("purpose", "grading");

            CanvasRubric match = rubricsByTitle.get(rubric.title());
            CanvasRubric result;
            if (match != null) {
                result = client.updateRubric(courseId, match.id(), payload, association);
                counted(false);
            } else {
                result = client.createRubric(courseId, payload, association);
                counted(true);
            }
            if (result != null) {
                rubricsByTitle.put(rubric.title(), result);
            }
        }

        private Rubric rubricOf(Assignment assignment) {
            if (assignment.getRubricRef() != null) {
                Rubric shared = model.getSharedRubrics().get(assignment.getRubricRef());
                if (shared == null) {
                    report.warn("Assignment '" + assignment.getTitle() + "' uses unknown rubric '"
                            + assignment.getRubricRef() + "', published without one");
                }
                return shared;
            }
            return assignment.getRubric();
        }

        void publishQuizzes() {
            List<Quiz> quizzes = pendingOf(Quiz.class);
            if (quizzes.isEmpty()) {
                return;
            }
            Map<String, CanvasQuiz> existing = byKey(client.listQuizzes(courseId), CanvasQuiz::title);
            for (Quiz quiz : quizzes) {
                RenderedItem item = rendered.get(quiz.getId());
                if (!quiz.getGroups().isEmpty()) {
                    report.warn("Quiz '" + quiz.getTitle() + "' draws from question banks; "
                            + quiz.getGroups().size() + " group(s) not published");
                }
                Map<String, Object> payload = quizPayload(quiz, item.descriptionHtml());
                CanvasQuiz match = existing.get(quiz.getTitle());
                CanvasQuiz result;
                if (match != null) {
                    result = client.updateQuiz(courseId, match.id(), payload);
                    counted(false);
                } else {
                    result = client.createQuiz(courseId, payload);
                    counted(true);
                }
                replaceQuestions(quiz, result.id(), item.questions(), match != null);
                refs.put(quiz.getId(), new RemoteRef(ContentType.QUIZ, result.id(), null));
            }
        }

        private void replaceQuestions(Quiz quiz, long quizId, List<Question> questions, boolean existed) {
            if (existed) {
                for (CanvasQuizQuestion old : client.listQuizQuestions(courseId, quizId)) {
                    client.deleteQuizQuestion(courseId, quizId, old.id());
                }
            }
            int position = 1;
            for (Question question : questions) {
                client.createQuizQuestion(courseId, quizId, questionPayload(quiz, question, position++));
            }
            log.debug("Quiz '{}' now has {} questions", quiz.getTitle(), questions.size());
        }

        void collectLinksAndFiles() {
            for (Link link : pendingOf(Link.class)) {
                refs.put(link.getId(), new RemoteRef(ContentType.LINK, null, null));
            }
            for (FileItem file : pendingOf(FileItem.class)) {
                String remoteFileId = rendered.get(file.getId()).remoteFileId();
                if (remoteFileId == null) {
                    report.skipItem(file.getTitle(), "file was not uploaded");
                    continue;
                }
                refs.put(file.getId(), new RemoteRef(ContentType.FILE, Long.parseLong(remoteFileId), null));
            }
        }

        void publishModules() {
            if (model.getModules().isEmpty()) {
                return;
            }
            Map<String, CanvasModule> existing = byKey(client.listModules(courseId), CanvasModule::name);
            for (CourseModule module : model.getModules()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("name", module.getTitle());
                payload.put("position", module.getPosition());
                payload.put("published", module.isPublished());

                CanvasModule match = existing.get(module.getTitle());
                CanvasModule result;
                if (match != null) {
                    result = client.updateModule(courseId, match.id(), payload);
                    counted(false);
                } else {
                    result = client.createModule(courseId, payload);
                    counted(true);
                }
                List<CanvasModuleItem> remoteItems = match != null
                        ? new ArrayList<>(client.listModuleItems(courseId, result.id()))
                        : new ArrayList<>();
                for (ModuleItemRef ref : module.getItems()) {
                    publishModuleItem(module, result.id(), ref, remoteItems);
                }
            }
        }

        private void publishModuleItem(CourseModule module, long moduleId, ModuleItemRef ref,
                                       List<CanvasModuleItem> remoteItems) {
            ContentItem item = model.findItem(ref.itemId()).orElse(null);
            RemoteRef remote = refs.get(ref.itemId());
            if (item == null || remote == null) {
                log.debug("Module '{}' entry {} has no published item, left out", module.getTitle(), ref.itemId());
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("title", item.getTitle());
            payload.put("type", item.type().remoteModuleItemType());
            payload.put("position", ref.position());
            payload.put("indent", ref.indent());
            switch (item.type()) {
                case PAGE -> payload.put("page_url", remote.pageUrl());
                case LINK -> {
                    payload.put("external_url", ((Link) item).getExternalUrl());
                    payload.put("new_tab", ((Link) item).isNewTab());
                }
                default -> payload.put("content_id", remote.id());
            }

            CanvasModuleItem match = remoteItems.stream()
                    .filter(r -> sameTarget(r, item, remote))
                    .findFirst()
                    .orElse(null);
            if (match != null) {
                client.updateModuleItem(courseId, moduleId, match.id(), payload);
                remoteItems.remove(match);
                counted(false);
            } else {
                client.createModuleItem(courseId, moduleId, payload);
                counted(true);
            }
        }

        private <T extends ContentItem> List<T> pendingOf(Class<T> variant) {
            return model.itemsOf(variant).stream()
                    .filter(item -> rendered.containsKey(item.getId()))
                    .toList();
        }

        private void counted(boolean create) {
            if (create) {
                created++;
                report.increment(CREATED);
            } else {
                updated++;
                report.increment(UPDATED);
            }
        }
    }

    static boolean sameTarget(CanvasModuleItem remote, ContentItem item, RemoteRef ref) {
        if (!item.type().remoteModuleItemType().equals(remote.type())) {
            return false;
        }
        return switch (item.type()) {
            case PAGE -> Objects.equals(remote.pageUrl(), ref.pageUrl());
            case LINK -> Objects.equals(remote.externalUrl(), ((Link) item).getExternalUrl());
            default -> Objects.equals(remote.contentId(), ref.id());
        };
    }

    static Map<String, Object> assignmentPayload(Assignment assignment, String descriptionHtml) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", assignment.getTitle());
        payload.put("description", descriptionHtml);
        payload.put("submission_types", assignment.getSubmissionTypes());
        payload.put("grading_type", assignment.getGradingType());
        payload.put("published", assignment.isPublished());
        if (assignment.getPointsPossible() != null) {
            payload.put("points_possible", assignment.getPointsPossible());
        }
        payload.put("due_at", assignment.getDueAt());
        payload.put("unlock_at", assignment.getUnlockAt());
        payload.put("lock_at", assignment.getLockAt());
        if (assignment.getAllowedExtensions() != null) {
            payload.put("allowed_extensions", Arrays.stream(assignment.getAllowedExtensions().split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }
        return payload;
    }

    static Map<String, Object> quizPayload(Quiz quiz, String descriptionHtml) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", quiz.getTitle());
        payload.put("description", descriptionHtml);
        payload.put("quiz_type", quiz.getQuizType());
        payload.put("shuffle_answers", quiz.isShuffleAnswers());
        payload.put("published", quiz.isPublished());
        payload.put("time_limit", quiz.getTimeLimit());
        payload.put("allowed_attempts", quiz.getAllowedAttempts() == null ? 1 : quiz.getAllowedAttempts());
        payload.put("points_possible", quiz.totalPoints());
        return payload;
    }

    static Map<String, Object> questionPayload(Quiz quiz, Question question, int position) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question_name", "Question " + position);
        payload.put("question_text", question.text());
        payload.put("question_type", question.type().remoteName());
        payload.put("points_possible", question.points() != null ? question.points() : quiz.getPointsPerQuestion());
        payload.put("position", position);
        if (question.type() != QuestionType.ESSAY && question.type() != QuestionType.FILE_UPLOAD) {
            List<Map<String, Object>> answers = new ArrayList<>();
            for (AnswerChoice choice : question.answers()) {
                Map<String, Object> answer = new LinkedHashMap<>();
                answer.put("answer_text", choice.text());
                answer.put("answer_weight", choice.correct() ? 100 : 0);
                answers.add(answer);
            }
            payload.put("answers", answers);
        }
        return payload;
    }

    /**
     * Criteria and ratings go out as index-keyed maps, the form the rubric endpoint expects.
     */
    static Map<String, Object> rubricPayload(Rubric rubric) {
        Map<String, Object> criteria = new LinkedHashMap<>();
        int c = 0;
        for (RubricCriterion criterion : rubric.criteria()) {
            Map<String, Object> ratings = new LinkedHashMap<>();
            int r = 0;
            for (RubricRating rating : criterion.ratings()) {
                Map<String, Object> ratingPayload = new LinkedHashMap<>();
                ratingPayload.put("description", rating.description());
                ratingPayload.put("long_description", rating.longDescription() == null ? "" : rating.longDescription());
                ratingPayload.put("points", rating.points());
                ratings.put(String.valueOf(r++), ratingPayload);
            }
            Map<String, Object> criterionPayload = new LinkedHashMap<>();
            criterionPayload.put("description", criterion.description());
            criterionPayload.put("long_description", criterion.longDescription() == null ? "" : criterion.longDescription());
            criterionPayload.put("points", criterion.points());
            criterionPayload.put("ratings", ratings);
            criteria.put(String.valueOf(c++), criterionPayload);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", rubric.title());
        payload.put("free_form_criterion_comments", rubric.freeFormComments());
        payload.put("criteria", criteria);
        return payload;
    }

    /**
     * First remote object per key; later duplicates are never updated.
     */
    private static <T> Map<String, T> byKey(List<T> remote, Function<T, String> key) {
        return remote.stream()
                .filter(r -> key.apply(r) != null)
                .collect(Collectors.toMap(key, Function.identity(), (first, second) -> first, LinkedHashMap::new));
    }
}
