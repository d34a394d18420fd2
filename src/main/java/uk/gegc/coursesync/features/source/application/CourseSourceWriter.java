package uk.gegc.coursesync.features.source.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.course.domain.ContentItemFactory;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.course.domain.model.RubricCriterion;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.util.PathSafety;
import uk.gegc.coursesync.shared.util.Slugs;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Writes a canonical model back out as an author course tree (import mode). Item bodies must already
 * be author Markdown. The written tree reads back into an equivalent model through
 * {@link CourseSourceReader}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseSourceWriter {

    private final FrontMatterCodec frontMatterCodec;
    private final QuizTextCodec quizTextCodec;
    private final RubricYamlCodec rubricYamlCodec;

    /**
     * @param rows shared rubric rows by slug; criteria equal to a row are written as row references
     */
    public void write(CourseModel model, Path targetRoot, Map<String, RubricCriterion> rows) {
        CourseLayout layout = new CourseLayout(targetRoot);
        ensureEmptyContent(layout);
        createDirectories(layout.contentDir());

        writeCourseFile(model, layout);
        Map<RubricCriterion, String> rowSlugs = new HashMap<>();
        rows.forEach((slug, criterion) -> {
            rowSlugs.putIfAbsent(criterion, slug);
            writeString(layout.rubricRowsDir().resolve(slug + ".yaml"), rubricYamlCodec.write(rubricYamlCodec.toMap(criterion)));
        });
        model.getSharedRubrics().forEach((slug, rubric) ->
                writeString(layout.rubricsDir().resolve(slug + ".yaml"), rubricYamlCodec.write(rubricMap(rubric, rowSlugs))));
        writeBanks(model, layout);

        Map<String, String> primaryModule = new HashMap<>();
        Map<String, Integer> primaryPosition = new HashMap<>();
        Set<String> takenModuleFolders = new HashSet<>();
        Map<String, Path> moduleDirs = new LinkedHashMap<>();
        for (CourseModule module : model.getModules()) {
            String folder = Slugs.unique(String.format("%02d-%s", module.getPosition(),
                    Slugs.sanitizeFilename(module.getTitle())), takenModuleFolders);
            takenModuleFolders.add(folder);
            Path dir = layout.contentDir().resolve(folder + CourseLayout.MODULE_SUFFIX);
            createDirectories(dir);
            moduleDirs.put(module.getTitle(), dir);
            for (ModuleItemRef ref : module.getItems()) {
                if (primaryModule.putIfAbsent(ref.itemId(), module.getTitle()) == null) {
                    primaryPosition.put(ref.itemId(), ref.position());
                }
            }
        }
        writeModuleOrder(layout, moduleDirs);

        Map<Path, Set<String>> takenNames = new HashMap<>();
        for (ContentItem item : model.items()) {
            String module = primaryModule.get(item.getId());
            Path parent = module == null ? layout.contentDir() : moduleDirs.get(module);
            String slug = Slugs.slugify(item.getTitle(), item.type().name().toLowerCase());
            String base = module == null ? slug : String.format("%02d-%s", primaryPosition.get(item.getId()), slug);
            Set<String> taken = takenNames.computeIfAbsent(parent, p -> new HashSet<>());
            String name = Slugs.unique(base, taken);
            taken.add(name);
            writeItem(item, parent.resolve(name + "." + item.type().folderSuffix()), module, moduleDirs, rowSlugs);
        }
        log.info("Wrote course '{}' to {}: {} items, {} modules, {} banks", model.getTitle(), layout.root(),
                model.getItems().size(), model.getModules().size(), model.getBanks().size());
    }

    /**
     * Copies an asset into the tree at a course-root-relative path.
     */
    public void copyAsset(Path targetRoot, String relativePath, InputStream content) {
        if (!PathSafety.isSafeMemberName(relativePath)) {
            throw new ValidationException(relativePath, "unsafe asset path");
        }
        Path target = targetRoot.toAbsolutePath().normalize().resolve(relativePath).normalize();
        if (!PathSafety.isWithin(targetRoot.toAbsolutePath().normalize(), target)) {
            throw new ValidationException(relativePath, "asset path escapes the course root");
        }
        try {
            createDirectories(target.getParent());
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write asset " + relativePath, ex);
        }
    }

    private void writeItem(ContentItem item, Path dir, String primaryModule, Map<String, Path> moduleDirs,
                           Map<RubricCriterion, String> rowSlugs) {
        createDirectories(dir);
        Map<String, Object> metadata = ContentItemFactory.settingsOf(item);
        List<String> extraModules = item.getMemberships().stream()
                .map(ModuleMembership::module)
                .filter(m -> !m.equals(primaryModule))
                .filter(moduleDirs::containsKey)
                .map(m -> CourseLayout.moduleFolderTitle(moduleDirs.get(m).getFileName().toString()))
                .distinct()
                .toList();
        if (!extraModules.isEmpty()) {
            metadata.put(ContentItemFactory.MODULES, extraModules);
        }
        item.getMemberships().stream()
                .filter(m -> m.module().equals(primaryModule) && m.indent() > 0)
                .findFirst()
                .ifPresent(m -> metadata.put(ContentItemFactory.INDENT, m.indent()));

        String body = item instanceof Quiz quiz
                ? quizTextCodec.format(quiz.getDescription(), quiz.getQuestions())
                : item.getBody();
        writeString(dir.resolve(CourseLayout.INDEX_FILE), frontMatterCodec.format(metadata, body));

        if (item instanceof Assignment assignment && assignment.getRubricRef() == null && assignment.getRubric() != null) {
            writeString(dir.resolve(CourseLayout.RUBRIC_FILE),
                    rubricYamlCodec.write(rubricMap(assignment.getRubric(), rowSlugs)));
        }
    }

    private Map<String, Object> rubricMap(Rubric rubric, Map<RubricCriterion, String> rowSlugs) {
        Map<String, Object> values = rubricYamlCodec.toMap(rubric);
        values.put("criteria", rubric.criteria().stream()
                .map(c -> rowSlugs.containsKey(c) ? (Object) RubricYamlCodec.rowReference(rowSlugs.get(c)) : rubricYamlCodec.toMap(c))
                .toList());
        return values;
    }

    private void writeCourseFile(CourseModel model, CourseLayout layout) {
        Map<String, Object> course = new LinkedHashMap<>();
        if (model.getRemoteCourseId() != null) {
            course.put("course_id", model.getRemoteCourseId());
        }
        course.put("course_name", model.getTitle());
        if (model.getCourseCode() != null) {
            course.put("course_code", model.getCourseCode());
        }
        if (model.getDefaultTemplate() != null) {
            course.put("template", model.getDefaultTemplate());
        }
        writeString(layout.courseFile(), rubricYamlCodec.write(course));
    }

    private void writeBanks(CourseModel model, CourseLayout layout) {
        Set<String> taken = new HashSet<>();
        for (QuestionBank bank : model.getBanks().values()) {
            String slug = Slugs.unique(Slugs.slugify(bank.title(), "bank"), taken);
            taken.add(slug);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("id", bank.id());
            metadata.put("bank_name", bank.title());
            writeString(layout.banksDir().resolve(slug + CourseLayout.BANK_SUFFIX),
                    frontMatterCodec.format(metadata, quizTextCodec.format("", bank.questions())));
        }
    }

    private void writeModuleOrder(CourseLayout layout, Map<String, Path> moduleDirs) {
        if (moduleDirs.isEmpty()) {
            return;
        }
        List<String> titles = moduleDirs.values().stream()
                .map(dir -> CourseLayout.moduleFolderTitle(dir.getFileName().toString()))
                .toList();
        writeString(layout.moduleOrderFile(), rubricYamlCodec.write(Map.of("modules", titles)));
    }

    private static void ensureEmptyContent(CourseLayout layout) {
        if (!Files.isDirectory(layout.contentDir())) {
            return;
        }
        try (Stream<Path> children = Files.list(layout.contentDir())) {
            if (children.findAny().isPresent()) {
                throw new ValidationException(layout.contentDir().toString(),
                        "target already contains course content; import into an empty directory");
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to inspect " + layout.contentDir(), ex);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create " + dir, ex);
        }
    }

    private static void writeString(Path file, String content) {
        createDirectories(file.getParent());
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + file, ex);
        }
    }
}
