package uk.gegc.coursesync.features.course.domain;

import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.ContentType;
import uk.gegc.coursesync.features.course.domain.model.FileItem;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds content items from settings and turns items back into settings. Author front matter and
 * package settings share the key vocabulary below, so both directions go through this one mapping.
 */
public final class ContentItemFactory {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String PUBLISHED = "published";
    public static final String MODULES = "modules";
    public static final String POSITION = "position";
    public static final String INDENT = "indent";
    public static final String TEMPLATE = "template";
    public static final String POINTS_POSSIBLE = "points_possible";
    public static final String SUBMISSION_TYPES = "submission_types";
    public static final String DUE_AT = "due_at";
    public static final String UNLOCK_AT = "unlock_at";
    public static final String LOCK_AT = "lock_at";
    public static final String GRADING_TYPE = "grading_type";
    public static final String ALLOWED_EXTENSIONS = "allowed_extensions";
    public static final String USE_RUBRIC = "use_rubric";
    public static final String EXTERNAL_URL = "external_url";
    public static final String NEW_TAB = "new_tab";
    public static final String FILE = "file";
    public static final String TIME_LIMIT = "time_limit";
    public static final String ALLOWED_ATTEMPTS = "allowed_attempts";
    public static final String SHUFFLE_ANSWERS = "shuffle_answers";
    public static final String QUIZ_TYPE = "quiz_type";
    public static final String POINTS_PER_QUESTION = "points_per_question";
    public static final String QUESTION_GROUPS = "question_groups";

    private ContentItemFactory() {
    }

    public static ContentItem create(ContentType type, String id, ItemSettings settings, String location) {
        String title = settings.string(NAME) != null ? settings.string(NAME) : settings.string(TITLE);
        if (title == null) {
            throw new ValidationException(location, "missing required field 'name'");
        }
        try {
            ContentItem item = switch (type) {
                case PAGE -> new Page(id, title);
                case ASSIGNMENT -> assignment(id, title, settings);
                case QUIZ -> quiz(id, title, settings);
                case LINK -> link(id, title, settings, location);
                case FILE -> file(id, title, settings, location);
            };
            item.setPublished(settings.bool(PUBLISHED, true));
            item.setTemplate(settings.string(TEMPLATE));
            for (String module : settings.stringList(MODULES)) {
                item.addMembership(new ModuleMembership(module, settings.integer(POSITION),
                        indentOf(settings)));
            }
            return item;
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(location, ex.getMessage());
        }
    }

    private static int indentOf(ItemSettings settings) {
        Integer indent = settings.integer(INDENT);
        return indent == null ? 0 : indent;
    }

    private static Assignment assignment(String id, String title, ItemSettings settings) {
        Assignment assignment = new Assignment(id, title);
        List<String> types = settings.stringList(SUBMISSION_TYPES);
        if (!types.isEmpty()) {
            assignment.setSubmissionTypes(types);
        }
        assignment.setDueAt(settings.string(DUE_AT));
        assignment.setUnlockAt(settings.string(UNLOCK_AT));
        assignment.setLockAt(settings.string(LOCK_AT));
        assignment.setPointsPossible(settings.decimal(POINTS_POSSIBLE));
        if (settings.string(GRADING_TYPE) != null) {
            assignment.setGradingType(settings.string(GRADING_TYPE));
        }
        assignment.setAllowedExtensions(settings.string(ALLOWED_EXTENSIONS));
        assignment.setRubricRef(settings.string(USE_RUBRIC));
        return assignment;
    }

    private static Quiz quiz(String id, String title, ItemSettings settings) {
        Quiz quiz = new Quiz(id, title);
        quiz.setTimeLimit(settings.integer(TIME_LIMIT));
        quiz.setAllowedAttempts(settings.integer(ALLOWED_ATTEMPTS));
        quiz.setShuffleAnswers(settings.bool(SHUFFLE_ANSWERS, false));
        quiz.setPointsPossible(settings.decimal(POINTS_POSSIBLE));
        if (settings.string(QUIZ_TYPE) != null) {
            quiz.setQuizType(settings.string(QUIZ_TYPE));
        }
        if (settings.decimal(POINTS_PER_QUESTION) != null) {
            quiz.setPointsPerQuestion(settings.decimal(POINTS_PER_QUESTION));
        }
        for (Map<String, Object> group : settings.mapList(QUESTION_GROUPS)) {
            ItemSettings groupSettings = new ItemSettings(group);
            Integer pick = groupSettings.integer("pick");
            quiz.getGroups().add(new QuestionGroup(groupSettings.string("bank"),
                    pick == null ? 1 : pick,
                    groupSettings.decimal(POINTS_PER_QUESTION)));
        }
        return quiz;
    }

    private static Link link(String id, String title, ItemSettings settings, String location) {
        String url = settings.string(EXTERNAL_URL);
        if (url == null) {
            throw new ValidationException(location, "link requires 'external_url'");
        }
        Link link = new Link(id, title);
        link.setExternalUrl(url);
        link.setNewTab(settings.bool(NEW_TAB, true));
        return link;
    }

    private static FileItem file(String id, String title, ItemSettings settings, String location) {
        String reference = settings.string(FILE);
        if (reference == null) {
            throw new ValidationException(location, "file item requires 'file'");
        }
        FileItem item = new FileItem(id, title);
        item.setFileReference(reference);
        return item;
    }

    /**
     * Inverse of {@link #create}: the settings that would rebuild {@code item}, defaults omitted.
     */
    public static Map<String, Object> settingsOf(ContentItem item) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(ID, item.getId());
        settings.put(NAME, item.getTitle());
        if (!item.isPublished()) {
            settings.put(PUBLISHED, false);
        }
        if (item.getTemplate() != null) {
            settings.put(TEMPLATE, item.getTemplate());
        }
        if (item instanceof Assignment assignment) {
            putIfPresent(settings, POINTS_POSSIBLE, assignment.getPointsPossible());
            settings.put(SUBMISSION_TYPES, assignment.getSubmissionTypes());
            putIfPresent(settings, DUE_AT, assignment.getDueAt());
            putIfPresent(settings, UNLOCK_AT, assignment.getUnlockAt());
            putIfPresent(settings, LOCK_AT, assignment.getLockAt());
            if (!"points".equals(assignment.getGradingType())) {
                putIfPresent(settings, GRADING_TYPE, assignment.getGradingType());
            }
            putIfPresent(settings, ALLOWED_EXTENSIONS, assignment.getAllowedExtensions());
            putIfPresent(settings, USE_RUBRIC, assignment.getRubricRef());
        } else if (item instanceof Quiz quiz) {
            putIfPresent(settings, TIME_LIMIT, quiz.getTimeLimit());
            putIfPresent(settings, ALLOWED_ATTEMPTS, quiz.getAllowedAttempts());
            if (quiz.isShuffleAnswers()) {
                settings.put(SHUFFLE_ANSWERS, true);
            }
            putIfPresent(settings, POINTS_POSSIBLE, quiz.getPointsPossible());
            if (!"assignment".equals(quiz.getQuizType())) {
                settings.put(QUIZ_TYPE, quiz.getQuizType());
            }
            if (quiz.getPointsPerQuestion() != 1.0) {
                settings.put(POINTS_PER_QUESTION, quiz.getPointsPerQuestion());
            }
            if (!quiz.getGroups().isEmpty()) {
                settings.put(QUESTION_GROUPS, quiz.getGroups().stream().map(g -> {
                    Map<String, Object> group = new LinkedHashMap<>();
                    group.put("bank", g.bank());
                    group.put("pick", g.pick());
                    putIfPresent(group, POINTS_PER_QUESTION, g.pointsPerQuestion());
                    return group;
                }).toList());
            }
        } else if (item instanceof Link link) {
            settings.put(EXTERNAL_URL, link.getExternalUrl());
            if (!link.isNewTab()) {
                settings.put(NEW_TAB, false);
            }
        } else if (item instanceof FileItem file) {
            settings.put(FILE, file.getFileReference());
        }
        return settings;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
