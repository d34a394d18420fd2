package uk.gegc.coursesync.features.canvas.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasAnswer;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasAssignment;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasCourse;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasFile;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModule;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModuleItem;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuiz;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuizQuestion;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasRubricCriterion;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasRubricRating;
import uk.gegc.coursesync.features.canvas.domain.model.FetchedCourse;
import uk.gegc.coursesync.features.canvas.infra.CanvasApiClient;
import uk.gegc.coursesync.features.course.domain.ModuleAssembler;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.FileItem;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.features.markup.application.AssetPathMapper;
import uk.gegc.coursesync.features.markup.application.MarkupNormalizer;
import uk.gegc.coursesync.features.markup.application.MediaReferenceExtractor;
import uk.gegc.coursesync.features.markup.application.ReverseContext;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.markup.domain.model.MediaReference;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.shared.util.Slugs;
import uk.gegc.coursesync.shared.run.RunReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a remote course into the canonical model. Media referenced from bodies is mapped to local paths:
 * bytes the registry already knows by remote id keep their existing path, anything else is downloaded
 * under {@code assets/} and registered with its remote identity so a later sync does not upload it again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteCourseFetcher {

    private final CanvasApiClient client;
    private final MarkupNormalizer markupNormalizer;
    private final MediaReferenceExtractor mediaReferenceExtractor;

    /**
     * @param downloadDir directory the downloaded assets are written to, at their course-root relative path
     */
    public FetchedCourse fetch(long courseId, Path downloadDir, AssetRegistry registry, TemplateSet templates,
                               RunReport report) {
        CanvasCourse course = client.getCourse(courseId);
        CourseModel model = new CourseModel(course.name());
        model.setCourseCode(course.courseCode());
        model.setRemoteCourseId(courseId);

        FetchRun run = new FetchRun(courseId, model, downloadDir, registry, templates, report);
        run.fetchPages();
        run.fetchAssignments();
        run.fetchQuizzes();
        run.fetchModules();
        log.info("Fetched course '{}' ({}): {} items, {} modules, {} assets", model.getTitle(), courseId,
                model.getItems().size(), model.getModules().size(), run.assets.size());
        return new FetchedCourse(model, run.assets);
    }

    private final class FetchRun {

        private final long courseId;
        private final CourseModel model;
        private final Path downloadDir;
        private final AssetRegistry registry;
        private final TemplateSet templates;
        private final RunReport report;
        private final Map<String, Path> assets = new LinkedHashMap<>();
        private final Map<String, String> urlToPath = new HashMap<>();
        private final Map<String, String> fileIdToPath = new HashMap<>();
        private final Set<String> takenPaths = new HashSet<>();
        private final Map<String, String> pageIdsByUrl = new HashMap<>();
        private final Map<Long, String> assignmentIds = new HashMap<>();
        private final Map<Long, String> quizIds = new HashMap<>();

        FetchRun(long courseId, CourseModel model, Path downloadDir, AssetRegistry registry,
                 TemplateSet templates, RunReport report) {
            this.courseId = courseId;
            this.model = model;
            this.downloadDir = downloadDir;
            this.registry = registry;
            this.templates = templates;
            this.report = report;
        }

        void fetchPages() {
            for (CanvasPage summary : client.listPages(courseId)) {
                CanvasPage page = client.getPage(courseId, summary.url());
                String id = "page-" + page.url();
                Page item = new Page(id, page.title());
                item.setPublished(page.published() == null || page.published());
                item.setBody(toMarkdown(page.body(), templates));
                model.addItem(item);
                pageIdsByUrl.put(page.url(), id);
            }
        }

        void fetchAssignments() {
            for (CanvasAssignment remote : client.listAssignments(courseId)) {
                String id = "assignment-" + remote.id();
                Assignment assignment = new Assignment(id, remote.name());
                assignment.setPublished(remote.published() == null || remote.published());
                assignment.setBody(toMarkdown(remote.description(), templates));
                assignment.setPointsPossible(remote.pointsPossible());
                if (remote.submissionTypes() != null && !remote.submissionTypes().isEmpty()) {
                    assignment.setSubmissionTypes(new ArrayList<>(remote.submissionTypes()));
                }
                assignment.setDueAt(remote.dueAt());
                assignment.setUnlockAt(remote.unlockAt());
                assignment.setLockAt(remote.lockAt());
                if (remote.gradingType() != null) {
                    assignment.setGradingType(remote.gradingType());
                }
                if (remote.allowedExtensions() != null && !remote.allowedExtensions().isEmpty()) {
                    assignment.setAllowedExtensions(String.join(",", remote.allowedExtensions()));
                }
                assignment.setRubric(rubricOf(remote));
                model.addItem(assignment);
                assignmentIds.put(remote.id(), id);
            }
        }

        private Rubric rubricOf(CanvasAssignment remote) {
            if (remote.rubric() == null || remote.rubric().isEmpty()) {
                return null;
            }
            List<RubricCriterion> criteria = new ArrayList<>();
            for (CanvasRubricCriterion criterion : remote.rubric()) {
                List<RubricRating> ratings = new ArrayList<>();
                if (criterion.ratings() != null) {
                    for (CanvasRubricRating rating : criterion.ratings()) {
                        ratings.add(new RubricRating(rating.description(), points(rating.points()),
                                blankToNull(rating.longDescription())));
                    }
                }
                try {
                    criteria.add(new RubricCriterion(criterion.description(), blankToNull(criterion.longDescription()),
                            points(criterion.points()), ratings));
                } catch (IllegalArgumentException ex) {
                    report.warn("Rubric criterion of '" + remote.name() + "' dropped: " + ex.getMessage());
                }
            }
            Map<String, Object> settings = remote.rubricSettings() == null ? Map.of() : remote.rubricSettings();
            Object title = settings.get("title");
            boolean freeForm = Boolean.TRUE.equals(settings.get("free_form_criterion_comments"));
            return new Rubric(title == null ? remote.name() + " Rubric" : title.toString(), freeForm, criteria);
        }

        void fetchQuizzes() {
            for (CanvasQuiz remote : client.listQuizzes(courseId)) {
                String id = "quiz-" + remote.id();
                List<Question> questions = new ArrayList<>();
                for (CanvasQuizQuestion question : client.listQuizQuestions(courseId, remote.id())) {
                    toQuestion(remote, question).ifPresent(questions::add);
                }
                if (questions.isEmpty()) {
                    report.skipItem(remote.title(), "quiz has no supported questions");
                    continue;
                }
                Quiz quiz = new Quiz(id, remote.title());
                quiz.setPublished(remote.published() == null || remote.published());
                quiz.setDescription(toMarkdown(remote.description(), TemplateSet.EMPTY));
                quiz.setQuestions(questions);
                quiz.setTimeLimit(remote.timeLimit());
                quiz.setAllowedAttempts(remote.allowedAttempts());
                quiz.setShuffleAnswers(Boolean.TRUE.equals(remote.shuffleAnswers()));
                quiz.setPointsPossible(remote.pointsPossible());
                if (remote.quizType() != null) {
                    quiz.setQuizType(remote.quizType());
                }
                model.addItem(quiz);
                quizIds.put(remote.id(), id);
            }
        }

        private Optional<Question> toQuestion(CanvasQuiz quiz, CanvasQuizQuestion remote) {
            Optional<QuestionType> type = QuestionType.fromRemoteName(remote.questionType());
            if (type.isEmpty()) {
                report.warn("Quiz '" + quiz.title() + "': question type " + remote.questionType() + " not supported, dropped");
                return Optional.empty();
            }
            String text = markupNormalizer.htmlToMarkdown(remote.questionText());
            if (text.isBlank()) {
                report.warn("Quiz '" + quiz.title() + "': question " + remote.id() + " has no text, dropped");
                return Optional.empty();
            }
            List<AnswerChoice> answers = new ArrayList<>();
            if (type.get().hasChoices() || type.get() == QuestionType.SHORT_ANSWER) {
                for (CanvasAnswer answer : remote.answers() == null ? List.<CanvasAnswer>of() : remote.answers()) {
                    if (answer.text() != null && !answer.text().isBlank()) {
                        answers.add(new AnswerChoice(answer.text(), type.get() == QuestionType.SHORT_ANSWER || answer.correct()));
                    }
                }
            }
            return Optional.of(new Question(remote.id() == null ? null : String.valueOf(remote.id()), type.get(), text,
                    answers, remote.pointsPossible()));
        }

        void fetchModules() {
            List<CanvasModule> modules = new ArrayList<>(client.listModules(courseId));
            modules.sort(Comparator.comparing(m -> m.position() == null ? Integer.MAX_VALUE : m.position()));
            List<String> order = new ArrayList<>();
            Set<String> titles = new LinkedHashSet<>();
            for (CanvasModule module : modules) {
                if (!titles.add(module.name())) {
                    report.warn("Duplicate module name '" + module.name() + "', entries merged");
                } else {
                    order.add(module.name());
                }
                for (CanvasModuleItem entry : client.listModuleItems(courseId, module.id())) {
                    itemFor(module, entry).ifPresent(item -> item.addMembership(new ModuleMembership(module.name(),
                            entry.position(), entry.indent() == null ? 0 : entry.indent())));
                }
            }
            ModuleAssembler.assemble(model, order, Map.of(), titles);
        }

        private Optional<ContentItem> itemFor(CanvasModule module, CanvasModuleItem entry) {
            String type = entry.type() == null ? "" : entry.type();
            String id = switch (type) {
                case "Page" -> pageIdsByUrl.get(entry.pageUrl());
                case "Assignment" -> assignmentIds.get(entry.contentId());
                case "Quiz" -> quizIds.get(entry.contentId());
                case "ExternalUrl" -> link(entry);
                case "File" -> file(entry);
                default -> {
                    report.warn("Module '" + module.name() + "': " + (type.isEmpty() ? "untyped" : type)
                            + " entry '" + entry.title() + "' is not supported, dropped");
                    yield null;
                }
            };
            if (id == null) {
                log.debug("Module '{}' entry '{}' has no fetched item", module.name(), entry.title());
            }
            return Optional.ofNullable(id).flatMap(model::findItem);
        }

        private String link(CanvasModuleItem entry) {
            String id = "link-" + entry.id();
            if (model.findItem(id).isEmpty()) {
                Link link = new Link(id, entry.title());
                link.setExternalUrl(entry.externalUrl());
                link.setNewTab(entry.newTab() == null || entry.newTab());
                model.addItem(link);
            }
            return id;
        }

        private String file(CanvasModuleItem entry) {
            String id = "file-" + entry.contentId();
            if (model.findItem(id).isEmpty()) {
                String path = localPath(String.valueOf(entry.contentId()), entry.title());
                FileItem item = new FileItem(id, entry.title());
                item.setFileReference(path);
                model.addItem(item);
            }
            return id;
        }

        private String toMarkdown(String html, TemplateSet set) {
            if (html == null || html.isBlank()) {
                return "";
            }
            for (MediaReference reference : mediaReferenceExtractor.extract(html)) {
                if (reference.remoteFileId() != null && !urlToPath.containsKey(reference.url())) {
                    urlToPath.put(reference.url(), localPath(reference.remoteFileId(), reference.filename()));
                }
            }
            AssetPathMapper mapper = url -> Optional.ofNullable(urlToPath.get(url));
            return markupNormalizer.toAuthorMarkdown(html, new ReverseContext(set, mapper, report::warn));
        }

        /**
         * Local path of a remote file, downloading it the first time it is seen in this run and the
         * registry does not know it.
         */
        private String localPath(String remoteFileId, String filenameHint) {
            String known = fileIdToPath.get(remoteFileId);
            if (known != null) {
                return known;
            }
            Optional<String> registered = registry == null ? Optional.empty() : registry.localPathFor(remoteFileId);
            if (registered.isPresent()) {
                fileIdToPath.put(remoteFileId, registered.get());
                return registered.get();
            }

            CanvasFile file = client.getFile(courseId, Long.parseLong(remoteFileId));
            byte[] content = client.download(file.url());
            String name = file.filename() != null ? file.filename()
                    : file.displayName() != null ? file.displayName() : filenameHint;
            String path = uniquePath(CourseLayout.ASSETS_DIR + "/" + Slugs.sanitizeFilename(name));
            Path target = downloadDir.resolve(path);
            try {
                Files.createDirectories(target.getParent());
                Files.write(target, content);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to store downloaded file " + path, ex);
            }
            assets.put(path, target);
            if (registry != null) {
                registry.register(path, content, new RemoteFileDescriptor(remoteFileId, file.url()), name);
            }
            fileIdToPath.put(remoteFileId, path);
            log.debug("Downloaded file {} as {} ({} bytes)", remoteFileId, path, content.length);
            return path;
        }

        private String uniquePath(String path) {
            String candidate = path;
            int dot = path.lastIndexOf('.');
            String stem = dot > path.lastIndexOf('/') ? path.substring(0, dot) : path;
            String extension = dot > path.lastIndexOf('/') ? path.substring(dot) : "";
            int counter = 2;
            while (!takenPaths.add(candidate)) {
                candidate = stem + "-" + counter++ + extension;
            }
            return candidate;
        }
    }

    private static double points(Double value) {
        return value == null ? 0.0 : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
