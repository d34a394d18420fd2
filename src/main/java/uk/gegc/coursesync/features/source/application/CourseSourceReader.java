package uk.gegc.coursesync.features.source.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.course.domain.ContentItemFactory;
import uk.gegc.coursesync.features.course.domain.ItemSettings;
import uk.gegc.coursesync.features.course.domain.ModuleAssembler;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.ContentType;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.features.source.domain.model.FrontMatterDocument;
import uk.gegc.coursesync.features.source.domain.model.QuizText;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.hash.Digests;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Parses an author course tree into the canonical model. Reads only; never writes into the tree.
 * Items failing validation are skipped and recorded in the run report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseSourceReader {

    public static final String FRONT_MATTER_CACHE = "front-matter";

    private final FrontMatterCodec frontMatterCodec;
    private final QuizTextCodec quizTextCodec;
    private final RubricYamlCodec rubricYamlCodec;
    private final YAMLMapper yamlMapper;

    public CourseModel read(Path courseRoot, RunReport report, RunCache cache) {
        CourseLayout layout = new CourseLayout(courseRoot);
        if (!Files.isDirectory(layout.contentDir())) {
            throw new ValidationException(layout.root().toString(), "no '" + CourseLayout.CONTENT_DIR + "' directory");
        }

        Map<String, Object> courseSettings = readYamlMap(layout.courseFile());
        ItemSettings course = new ItemSettings(courseSettings);
        String title = course.string("course_name") != null ? course.string("course_name") : course.string("title");
        CourseModel model = new CourseModel(title != null ? title : layout.root().getFileName().toString());
        model.setCourseCode(course.string("course_code"));
        model.setDefaultTemplate(course.string("template"));
        model.setRemoteCourseId(remoteCourseId(course.string("course_id"), layout));

        Map<String, RubricCriterion> rows = readRubricRows(layout, report);
        readSharedRubrics(layout, model, rows, report);
        readBanks(layout, model, report);

        Map<String, String> folderNames = new LinkedHashMap<>();
        Set<String> moduleTitles = new LinkedHashSet<>();
        for (Path child : list(layout.contentDir())) {
            String name = child.getFileName().toString();
            if (Files.isDirectory(child) && CourseLayout.isModuleFolder(name)) {
                String moduleTitle = CourseLayout.moduleFolderTitle(name);
                folderNames.put(moduleTitle, name);
                moduleTitles.add(moduleTitle);
                for (Path itemDir : list(child)) {
                    readItem(layout, itemDir, moduleTitle, model, rows, report, cache);
                }
            } else if (Files.isDirectory(child)) {
                readItem(layout, child, null, model, rows, report, cache);
            }
        }

        checkGroups(model, report);
        ModuleAssembler.assemble(model, readModuleOrder(layout), folderNames, moduleTitles);
        log.info("Read course '{}': {} items, {} modules, {} banks, {} shared rubrics", model.getTitle(),
                model.getItems().size(), model.getModules().size(), model.getBanks().size(),
                model.getSharedRubrics().size());
        return model;
    }

    private static Long remoteCourseId(String value, CourseLayout layout) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException ex) {
            throw new ValidationException(layout.courseFile().toString(), "course_id must be numeric, got '" + value + "'");
        }
    }

    /**
     * Identifier of an item without an explicit {@code id}: derived from its folder path so that it is
     * stable across runs.
     */
    public static String derivedId(CourseLayout layout, Path itemDir) {
        String relative = FilenameUtils.separatorsToUnix(layout.contentDir().relativize(itemDir.toAbsolutePath().normalize()).toString());
        return "g" + Digests.md5Hex(relative.getBytes(StandardCharsets.UTF_8));
    }

    private void readItem(CourseLayout layout, Path itemDir, String moduleTitle, CourseModel model,
                          Map<String, RubricCriterion> rows, RunReport report, RunCache cache) {
        String folderName = itemDir.getFileName().toString();
        Optional<ContentType> type = ContentType.fromFolderName(folderName);
        if (!Files.isDirectory(itemDir) || type.isEmpty()) {
            return;
        }
        String location = FilenameUtils.separatorsToUnix(layout.root().relativize(itemDir).toString());
        try {
            Path index = itemDir.resolve(CourseLayout.INDEX_FILE);
            if (!Files.isRegularFile(index)) {
                throw new ValidationException(location, "missing " + CourseLayout.INDEX_FILE);
            }
            FrontMatterDocument document = frontMatterCodec.parse(readString(index), location);
            cache.put(FRONT_MATTER_CACHE, location, document.metadata());
            ItemSettings settings = new ItemSettings(document.metadata());
            String id = settings.string(ContentItemFactory.ID) != null
                    ? settings.string(ContentItemFactory.ID)
                    : derivedId(layout, itemDir);

            ContentItem item = ContentItemFactory.create(type.get(), id, settings, location);
            item.setSourceName(folderName);
            item.setSourcePath(location);
            if (moduleTitle != null) {
                List<ModuleMembership> memberships = new ArrayList<>();
                memberships.add(new ModuleMembership(moduleTitle, settings.integer(ContentItemFactory.POSITION),
                        indentOf(settings)));
                item.getMemberships().stream()
                        .filter(m -> !m.module().equals(moduleTitle))
                        .forEach(memberships::add);
                item.setMemberships(memberships);
            }

            if (item instanceof Quiz quiz) {
                QuizText text = quizTextCodec.parse(document.body(), location);
                quiz.setDescription(text.description());
                quiz.setQuestions(new ArrayList<>(text.questions()));
                if (quiz.getQuestions().isEmpty() && quiz.getGroups().isEmpty()) {
                    throw new ValidationException(location, "quiz has neither questions nor question groups");
                }
            } else {
                item.setBody(document.body().strip());
            }
            if (item instanceof Assignment assignment) {
                attachRubric(assignment, itemDir, model, rows, location);
            }
            model.addItem(item);
        } catch (ValidationException ex) {
            report.skipItem(location, ex.getMessage());
        } catch (IllegalArgumentException ex) {
            report.skipItem(location, ex.getMessage());
        }
    }

    private static int indentOf(ItemSettings settings) {
        Integer indent = settings.integer(ContentItemFactory.INDENT);
        return indent == null ? 0 : indent;
    }

    private void attachRubric(Assignment assignment, Path itemDir, CourseModel model,
                              Map<String, RubricCriterion> rows, String location) {
        Path file = itemDir.resolve(CourseLayout.RUBRIC_FILE);
        if (Files.isRegularFile(file)) {
            Map<String, Object> values = rubricYamlCodec.readMap(readString(file), location + "/" + CourseLayout.RUBRIC_FILE);
            Optional<String> shared = rubricYamlCodec.sharedReference(values);
            if (shared.isPresent()) {
                assignment.setRubricRef(shared.get());
            } else {
                assignment.setRubric(rubricYamlCodec.toRubric(values, slug -> Optional.ofNullable(rows.get(slug)),
                        location + "/" + CourseLayout.RUBRIC_FILE));
            }
        }
        if (assignment.getRubricRef() != null && !model.getSharedRubrics().containsKey(assignment.getRubricRef())) {
            throw new ValidationException(location, "unknown shared rubric '" + assignment.getRubricRef() + "'");
        }
    }

    private Map<String, RubricCriterion> readRubricRows(CourseLayout layout, RunReport report) {
        Map<String, RubricCriterion> rows = new LinkedHashMap<>();
        for (Path file : yamlFiles(layout.rubricRowsDir())) {
            String slug = FilenameUtils.getBaseName(file.getFileName().toString());
            String location = CourseLayout.RUBRIC_ROWS_DIR + "/" + file.getFileName();
            try {
                rows.put(slug, rubricYamlCodec.toCriterion(rubricYamlCodec.readMap(readString(file), location), location));
            } catch (ValidationException ex) {
                report.skipItem(location, ex.getMessage());
            }
        }
        return rows;
    }

    private void readSharedRubrics(CourseLayout layout, CourseModel model, Map<String, RubricCriterion> rows,
                                   RunReport report) {
        for (Path file : yamlFiles(layout.rubricsDir())) {
            String slug = FilenameUtils.getBaseName(file.getFileName().toString());
            String location = CourseLayout.RUBRICS_DIR + "/" + file.getFileName();
            try {
                Rubric rubric = rubricYamlCodec.toRubric(rubricYamlCodec.readMap(readString(file), location),
                        s -> Optional.ofNullable(rows.get(s)), location);
                model.getSharedRubrics().put(slug, rubric);
            } catch (ValidationException ex) {
                report.skipItem(location, ex.getMessage());
            }
        }
    }

    private void readBanks(CourseLayout layout, CourseModel model, RunReport report) {
        if (!Files.isDirectory(layout.banksDir())) {
            return;
        }
        for (Path file : list(layout.banksDir())) {
            String name = file.getFileName().toString();
            if (!name.endsWith(CourseLayout.BANK_SUFFIX)) {
                continue;
            }
            String location = CourseLayout.BANKS_DIR + "/" + name;
            try {
                FrontMatterDocument document = frontMatterCodec.parse(readString(file), location);
                ItemSettings settings = new ItemSettings(document.metadata());
                String slug = name.substring(0, name.length() - CourseLayout.BANK_SUFFIX.length());
                String title = settings.string("bank_name") != null ? settings.string("bank_name")
                        : settings.string("name") != null ? settings.string("name") : slug;
                String id = settings.string("id") != null ? settings.string("id") : slug;
                QuizText text = quizTextCodec.parse(document.body(), location);
                if (text.questions().isEmpty()) {
                    throw new ValidationException(location, "question bank has no questions");
                }
                model.addBank(new QuestionBank(id, title, text.questions()));
            } catch (ValidationException | IllegalArgumentException ex) {
                report.skipItem(location, ex.getMessage());
            }
        }
    }

    private void checkGroups(CourseModel model, RunReport report) {
        for (Quiz quiz : model.itemsOf(Quiz.class)) {
            for (QuestionGroup group : quiz.getGroups()) {
                if (model.findBank(group.bank()).isEmpty()) {
                    report.warn("Quiz '" + quiz.getTitle() + "' draws from unknown bank '" + group.bank() + "'");
                }
            }
        }
    }

    private List<String> readModuleOrder(CourseLayout layout) {
        Path file = layout.moduleOrderFile();
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            Object raw = yamlMapper.readValue(file.toFile(), Object.class);
            Object list = raw instanceof Map<?, ?> map ? map.get("modules") : raw;
            List<String> order = new ArrayList<>();
            if (list instanceof List<?> entries) {
                entries.stream().filter(e -> e != null).forEach(e -> order.add(e.toString().trim()));
            }
            return order;
        } catch (IOException ex) {
            throw new ValidationException(CourseLayout.MODULE_ORDER_FILE, "invalid module order: " + ex.getMessage());
        }
    }

    private Map<String, Object> readYamlMap(Path file) {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        try {
            Map<String, Object> values = yamlMapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return values == null ? Map.of() : values;
        } catch (IOException ex) {
            throw new ValidationException(file.getFileName().toString(), "invalid YAML: " + ex.getMessage());
        }
    }

    private static List<Path> yamlFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        return list(dir).stream()
                .filter(Files::isRegularFile)
                .filter(f -> f.toString().endsWith(".yaml") || f.toString().endsWith(".yml"))
                .toList();
    }

    private static List<Path> list(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted().toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + dir, ex);
        }
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            throw new ValidationException(file.toString(), "not valid UTF-8");
        } catch (IOException ex) {
            throw new ValidationException(file.toString(), "unreadable: " + ex.getMessage());
        }
    }
}
