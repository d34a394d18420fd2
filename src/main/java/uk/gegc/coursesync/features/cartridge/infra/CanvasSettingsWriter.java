package uk.gegc.coursesync.features.cartridge.infra;

import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;

import java.util.Map;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.CANVAS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WEBLINK_1_1;

/**
 * Platform-specific settings documents in the {@code cccv1p0} namespace.
 */
@Component
public class CanvasSettingsWriter {

    public static final String ASSIGNMENT_GROUP_ID = "assignment_group_default";

    public Document courseSettings(CourseModel model, String identifier) {
        Document document = DocumentHelper.createDocument();
        Element course = document.addElement("course", CANVAS).addAttribute("identifier", identifier);
        XmlSupport.addText(course, "title", model.getTitle());
        XmlSupport.addText(course, "course_code", model.getCourseCode() != null ? model.getCourseCode() : model.getTitle());
        XmlSupport.addText(course, "default_view", "modules");
        return document;
    }

    /**
     * @param moduleIds     module title to archive identifier
     * @param moduleItemIds {@code moduleId/itemId} to archive identifier of the module entry; items
     *                      without one were not exported and are left out
     */
    public Document moduleMeta(CourseModel model, Map<String, String> moduleIds, Map<String, String> moduleItemIds) {
        Document document = DocumentHelper.createDocument();
        Element modules = document.addElement("modules", CANVAS);
        for (CourseModule module : model.getModules()) {
            String moduleId = moduleIds.get(module.getTitle());
            Element element = modules.addElement("module", CANVAS).addAttribute("identifier", moduleId);
            XmlSupport.addText(element, "title", module.getTitle());
            XmlSupport.addText(element, "workflow_state", module.isPublished() ? "active" : "unpublished");
            XmlSupport.addText(element, "position", module.getPosition());
            XmlSupport.addText(element, "require_sequential_progress", false);
            Element items = element.addElement("items", CANVAS);
            for (ModuleItemRef ref : module.getItems()) {
                ContentItem item = model.findItem(ref.itemId()).orElse(null);
                String entryId = moduleItemIds.get(moduleId + "/" + ref.itemId());
                if (item == null || entryId == null) {
                    continue;
                }
                Element entry = items.addElement("item", CANVAS).addAttribute("identifier", entryId);
                XmlSupport.addText(entry, "content_type", item.type().packageContentType());
                XmlSupport.addText(entry, "workflow_state", item.isPublished() ? "active" : "unpublished");
                XmlSupport.addText(entry, "title", item.getTitle());
                XmlSupport.addText(entry, "identifierref", item.getId());
                XmlSupport.addText(entry, "position", ref.position());
                XmlSupport.addText(entry, "indent", ref.indent());
                if (item instanceof Link link) {
                    XmlSupport.addText(entry, "url", link.getExternalUrl());
                    XmlSupport.addText(entry, "new_tab", link.isNewTab());
                }
            }
        }
        return document;
    }

    public Document assignmentGroups() {
        Document document = DocumentHelper.createDocument();
        Element group = document.addElement("assignmentGroups", CANVAS)
                .addElement("assignmentGroup", CANVAS)
                .addAttribute("identifier", ASSIGNMENT_GROUP_ID);
        XmlSupport.addText(group, "title", "Assignments");
        XmlSupport.addText(group, "position", 1);
        XmlSupport.addText(group, "group_weight", "0.0");
        return document;
    }

    /**
     * @param rubricId archive identifier of the assignment's rubric, null when it has none
     */
    public Document assignmentSettings(Assignment assignment, String rubricId) {
        Document document = DocumentHelper.createDocument();
        Element element = document.addElement("assignment", CANVAS).addAttribute("identifier", assignment.getId());
        XmlSupport.addText(element, "title", assignment.getTitle());
        XmlSupport.addText(element, "workflow_state", assignment.isPublished() ? "published" : "unpublished");
        XmlSupport.addText(element, "points_possible", assignment.getPointsPossible());
        XmlSupport.addText(element, "grading_type", assignment.getGradingType());
        XmlSupport.addText(element, "submission_types", String.join(",", assignment.getSubmissionTypes()));
        XmlSupport.addText(element, "due_at", assignment.getDueAt());
        XmlSupport.addText(element, "unlock_at", assignment.getUnlockAt());
        XmlSupport.addText(element, "lock_at", assignment.getLockAt());
        XmlSupport.addText(element, "allowed_extensions", assignment.getAllowedExtensions());
        XmlSupport.addText(element, "assignment_group_identifierref", ASSIGNMENT_GROUP_ID);
        if (rubricId != null) {
            XmlSupport.addText(element, "rubric_identifierref", rubricId);
            XmlSupport.addText(element, "rubric_use_for_grading", false);
        }
        return document;
    }

    public Document quizMeta(Quiz quiz, String descriptionHtml) {
        Document document = DocumentHelper.createDocument();
        Element element = document.addElement("quiz", CANVAS).addAttribute("identifier", quiz.getId());
        XmlSupport.addText(element, "title", quiz.getTitle());
        XmlSupport.addText(element, "description", descriptionHtml);
        XmlSupport.addText(element, "quiz_type", quiz.getQuizType());
        XmlSupport.addText(element, "points_possible", quiz.totalPoints());
        XmlSupport.addText(element, "shuffle_answers", quiz.isShuffleAnswers());
        XmlSupport.addText(element, "time_limit", quiz.getTimeLimit());
        XmlSupport.addText(element, "allowed_attempts", quiz.getAllowedAttempts() == null ? -1 : quiz.getAllowedAttempts());
        XmlSupport.addText(element, "available", quiz.isPublished());
        XmlSupport.addText(element, "assignment_group_identifierref", ASSIGNMENT_GROUP_ID);
        return document;
    }

    /**
     * @param rubrics archive identifier to rubric
     */
    public Document rubrics(Map<String, Rubric> rubrics) {
        Document document = DocumentHelper.createDocument();
        Element root = document.addElement("rubrics", CANVAS);
        rubrics.forEach((identifier, rubric) -> {
            Element element = root.addElement("rubric", CANVAS).addAttribute("identifier", identifier);
            XmlSupport.addText(element, "title", rubric.title());
            XmlSupport.addText(element, "points_possible", rubric.pointsPossible());
            XmlSupport.addText(element, "free_form_criterion_comments", rubric.freeFormComments());
            Element criteria = element.addElement("criteria", CANVAS);
            int criterionNumber = 1;
            for (RubricCriterion criterion : rubric.criteria()) {
                String criterionId = identifier + "_c" + criterionNumber++;
                Element c = criteria.addElement("criterion", CANVAS);
                XmlSupport.addText(c, "criterion_id", criterionId);
                XmlSupport.addText(c, "description", criterion.description());
                XmlSupport.addText(c, "long_description", criterion.longDescription());
                XmlSupport.addText(c, "points", criterion.points());
                Element ratings = c.addElement("ratings", CANVAS);
                int ratingNumber = 1;
                for (RubricRating rating : criterion.ratings()) {
                    Element r = ratings.addElement("rating", CANVAS);
                    XmlSupport.addText(r, "description", rating.description());
                    XmlSupport.addText(r, "long_description", rating.longDescription());
                    XmlSupport.addText(r, "points", rating.points());
                    XmlSupport.addText(r, "criterion_id", criterionId);
                    XmlSupport.addText(r, "id", criterionId + "_r" + ratingNumber++);
                }
            }
        });
        return document;
    }

    /**
     * @param files archive identifier to display name
     */
    public Document filesMeta(Map<String, String> files) {
        Document document = DocumentHelper.createDocument();
        Element list = document.addElement("fileMeta", CANVAS).addElement("files", CANVAS);
        files.forEach((identifier, name) -> {
            Element file = list.addElement("file", CANVAS).addAttribute("identifier", identifier);
            XmlSupport.addText(file, "display_name", name);
        });
        return document;
    }

    public Document webLink(Link link) {
        Document document = DocumentHelper.createDocument();
        Element root = document.addElement("webLink", WEBLINK_1_1);
        XmlSupport.addText(root, "title", link.getTitle());
        root.addElement("url", WEBLINK_1_1)
                .addAttribute("href", link.getExternalUrl())
                .addAttribute("target", link.isNewTab() ? "_blank" : "_self");
        return document;
    }
}
