package uk.gegc.coursesync.features.cartridge.infra;

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ModuleMetaEntry;
import uk.gegc.coursesync.features.course.domain.ContentItemFactory;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.course.domain.model.RubricRating;
import uk.gegc.coursesync.shared.exception.ResourceDecodeException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.CANVAS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WEBLINK;

/**
 * Reads the platform settings documents back into the settings vocabulary of
 * {@link ContentItemFactory}, so archive items are built by the same code as author items.
 */
@Component
public class CanvasSettingsReader {

    private static final String[] WL = WEBLINK.toArray(String[]::new);

    public Map<String, Object> courseSettings(Path file) {
        Element root = root(file, "course_settings");
        Map<String, Object> settings = new LinkedHashMap<>();
        XmlSupport.childText(root, "title", CANVAS).ifPresent(v -> settings.put("title", v));
        XmlSupport.childText(root, "course_code", CANVAS).ifPresent(v -> settings.put("course_code", v));
        return settings;
    }

    public Map<String, Object> assignmentSettings(Path file, String resourceId) {
        Element root = root(file, resourceId);
        Map<String, Object> settings = new LinkedHashMap<>();
        text(root, "title").ifPresent(v -> settings.put(ContentItemFactory.NAME, v));
        text(root, "workflow_state").ifPresent(v -> settings.put(ContentItemFactory.PUBLISHED, "published".equals(v)));
        text(root, "points_possible").ifPresent(v -> settings.put(ContentItemFactory.POINTS_POSSIBLE, v));
        text(root, "grading_type").ifPresent(v -> settings.put(ContentItemFactory.GRADING_TYPE, v));
        text(root, "submission_types").ifPresent(v -> settings.put(ContentItemFactory.SUBMISSION_TYPES, v));
        text(root, "due_at").ifPresent(v -> settings.put(ContentItemFactory.DUE_AT, v));
        text(root, "unlock_at").ifPresent(v -> settings.put(ContentItemFactory.UNLOCK_AT, v));
        text(root, "lock_at").ifPresent(v -> settings.put(ContentItemFactory.LOCK_AT, v));
        text(root, "allowed_extensions").ifPresent(v -> settings.put(ContentItemFactory.ALLOWED_EXTENSIONS, v));
        text(root, "rubric_identifierref").ifPresent(v -> settings.put("rubric_identifierref", v));
        return settings;
    }

    public Map<String, Object> quizMeta(Path file, String resourceId) {
        Element root = root(file, resourceId);
        Map<String, Object> settings = new LinkedHashMap<>();
        text(root, "title").ifPresent(v -> settings.put(ContentItemFactory.NAME, v));
        text(root, "description").ifPresent(v -> settings.put("description", v));
        text(root, "quiz_type").ifPresent(v -> settings.put(ContentItemFactory.QUIZ_TYPE, v));
        text(root, "shuffle_answers").ifPresent(v -> settings.put(ContentItemFactory.SHUFFLE_ANSWERS, v));
        text(root, "time_limit").ifPresent(v -> settings.put(ContentItemFactory.TIME_LIMIT, v));
        text(root, "allowed_attempts")
                .filter(v -> !v.startsWith("-"))
                .ifPresent(v -> settings.put(ContentItemFactory.ALLOWED_ATTEMPTS, v));
        text(root, "available").ifPresent(v -> settings.put(ContentItemFactory.PUBLISHED, v));
        return settings;
    }

    public List<ModuleMetaEntry> moduleMeta(Path file) {
        Element root = root(file, "module_meta");
        List<ModuleMetaEntry> entries = new ArrayList<>();
        for (Element module : XmlSupport.children(root, "module", CANVAS)) {
            String moduleId = module.attributeValue("identifier");
            for (Element item : XmlSupport.child(module, "items", CANVAS)
                    .map(i -> XmlSupport.children(i, "item", CANVAS)).orElse(List.of())) {
                Optional<String> ref = text(item, "identifierref");
                if (ref.isEmpty()) {
                    continue;
                }
                int indent = text(item, "indent").map(CanvasSettingsReader::parseInt).orElse(0);
                boolean published = text(item, "workflow_state").map(v -> !"unpublished".equals(v)).orElse(true);
                Boolean newTab = text(item, "new_tab").map(Boolean::valueOf).orElse(null);
                entries.add(new ModuleMetaEntry(moduleId, ref.get(), text(item, "content_type").orElse(null),
                        indent, published, text(item, "url").orElse(null), newTab));
            }
        }
        return entries;
    }

    /**
     * Rubrics by archive identifier. Criteria without a description are dropped.
     */
    public Map<String, Rubric> rubrics(Path file) {
        Element root = root(file, "rubrics");
        Map<String, Rubric> rubrics = new LinkedHashMap<>();
        for (Element element : XmlSupport.children(root, "rubric", CANVAS)) {
            List<RubricCriterion> criteria = new ArrayList<>();
            for (Element criterion : XmlSupport.descendants(element, "criterion", CANVAS)) {
                Optional<String> description = text(criterion, "description");
                if (description.isEmpty()) {
                    continue;
                }
                List<RubricRating> ratings = new ArrayList<>();
                for (Element rating : XmlSupport.descendants(criterion, "rating", CANVAS)) {
                    ratings.add(new RubricRating(text(rating, "description").orElse(""),
                            text(rating, "points").map(CanvasSettingsReader::parseDouble).orElse(0.0),
                            text(rating, "long_description").orElse(null)));
                }
                double points = text(criterion, "points").map(CanvasSettingsReader::parseDouble)
                        .orElseGet(() -> ratings.stream().mapToDouble(RubricRating::points).max().orElse(0));
                criteria.add(new RubricCriterion(description.get(), text(criterion, "long_description").orElse(null),
                        points, ratings));
            }
            boolean freeForm = text(element, "free_form_criterion_comments").map(Boolean::valueOf).orElse(false);
            rubrics.put(element.attributeValue("identifier"),
                    new Rubric(text(element, "title").orElse(null), freeForm, criteria));
        }
        return rubrics;
    }

    public Map<String, Object> webLink(Path file, String resourceId) {
        Element root = root(file, resourceId);
        Map<String, Object> settings = new LinkedHashMap<>();
        XmlSupport.childText(root, "title", WL).ifPresent(v -> settings.put(ContentItemFactory.NAME, v));
        XmlSupport.child(root, "url", WL).ifPresent(url -> {
            settings.put(ContentItemFactory.EXTERNAL_URL, url.attributeValue("href"));
            settings.put(ContentItemFactory.NEW_TAB, !"_self".equals(url.attributeValue("target")));
        });
        return settings;
    }

    private static Optional<String> text(Element parent, String name) {
        return XmlSupport.childText(parent, name, CANVAS);
    }

    private static Element root(Path file, String resourceId) {
        if (!Files.isRegularFile(file)) {
            throw new ResourceDecodeException(resourceId, "missing " + file.getFileName());
        }
        try {
            Document document = XmlSupport.read(file);
            return document.getRootElement();
        } catch (DocumentException | IOException ex) {
            throw new ResourceDecodeException(resourceId, "unparsable " + file.getFileName() + ": " + ex.getMessage(), ex);
        }
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
