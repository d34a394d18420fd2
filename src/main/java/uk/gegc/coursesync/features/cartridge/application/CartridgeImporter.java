package uk.gegc.coursesync.features.cartridge.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.cartridge.application.matcher.ResourceClassifier;
import uk.gegc.coursesync.features.cartridge.application.placement.QuizPlacementPolicy;
import uk.gegc.coursesync.features.cartridge.domain.model.ArchiveMode;
import uk.gegc.coursesync.features.cartridge.domain.model.CartridgeManifest;
import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.cartridge.domain.model.ImportedCourse;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestModule;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestModuleItem;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.features.cartridge.domain.model.MatchResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ModuleMetaEntry;
import uk.gegc.coursesync.features.cartridge.domain.model.PlacementDecision;
import uk.gegc.coursesync.features.cartridge.domain.model.QuizPlacement;
import uk.gegc.coursesync.features.cartridge.infra.CanvasSettingsReader;
import uk.gegc.coursesync.features.cartridge.infra.ManifestParser;
import uk.gegc.coursesync.features.cartridge.infra.QtiReader;
import uk.gegc.coursesync.features.cartridge.infra.SafeArchiveExtractor;
import uk.gegc.coursesync.features.course.domain.ContentItemFactory;
import uk.gegc.coursesync.features.course.domain.ItemSettings;
import uk.gegc.coursesync.features.course.domain.ModuleAssembler;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.ContentType;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.ModuleMembership;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.markup.application.AssetPathMapper;
import uk.gegc.coursesync.features.markup.application.MarkupNormalizer;
import uk.gegc.coursesync.features.markup.application.ReverseContext;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.shared.exception.ResourceDecodeException;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.shared.util.Slugs;
import uk.gegc.coursesync.shared.util.UrlPaths;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSESSMENT_META_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSIGNMENT_SETTINGS_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.COURSE_SETTINGS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.EXPORT_SENTINEL;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.FILEBASE_TOKEN;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.MANIFEST_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.MODULE_META;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.POINTS_POSSIBLE_FIELD;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.RUBRICS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WEB_RESOURCES_DIR;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.flatIndexPath;

/**
 * Reads a Common Cartridge archive back into a course model.
 * <p>
 * One run moves through {@link Stage}: extract, parse the manifest, classify decode and attach every
 * resource, resolve modules, resolve rubrics. A corrupt archive aborts during extraction or manifest
 * parsing, before anything is written. A single bad resource is skipped and reported.
 * <p>
 * Archives carrying the platform export sentinel are read like the platform reads them: quizzes come
 * only from the flat assessment index. Other archives are read from the structured QTI files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartridgeImporter {

    public enum Stage {
        EXTRACT, PARSE_MANIFEST, RESOURCES, RESOLVE_MODULES, RESOLVE_RUBRICS, DONE
    }

    private static final String RUBRIC_REF = "rubric_identifierref";
    private static final String DESCRIPTION = "description";

    private final SafeArchiveExtractor extractor;
    private final ManifestParser manifestParser;
    private final ResourceClassifier classifier;
    private final QuizPlacementPolicy placementPolicy;
    private final QtiReader qtiReader;
    private final CanvasSettingsReader settingsReader;
    private final MarkupNormalizer markupNormalizer;

    /**
     * @param workDir   scratch directory the archive is extracted into; the caller removes it
     * @param templates template set stripped from page and assignment bodies
     */
    public ImportedCourse importArchive(Path archive, Path workDir, TemplateSet templates, RunReport report) {
        ImportRun run = new ImportRun(workDir.resolve("extracted"), templates, report);
        run.enter(Stage.EXTRACT);
        extractor.extract(archive, run.root, report);

        run.enter(Stage.PARSE_MANIFEST);
        CartridgeManifest manifest = manifestParser.parse(run.root.resolve(MANIFEST_FILE));
        return run.decode(manifest);
    }

    /**
     * Import of an already extracted archive.
     */
    public ImportedCourse importExtracted(Path root, TemplateSet templates, RunReport report) {
        ImportRun run = new ImportRun(root, templates, report);
        run.enter(Stage.PARSE_MANIFEST);
        return run.decode(manifestParser.parse(root.resolve(MANIFEST_FILE)));
    }

    /**
     * Course-root relative path an archive file is written to: {@code web_resources/} is dropped and the
     * result placed under the shared assets directory.
     */
    public static String assetTargetPath(String archivePath) {
        String path = FilenameUtils.separatorsToUnix(archivePath);
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.startsWith(WEB_RESOURCES_DIR + "/")) {
            path = path.substring(WEB_RESOURCES_DIR.length() + 1);
        }
        return path.startsWith(CourseLayout.ASSETS_DIR + "/") ? path : CourseLayout.ASSETS_DIR + "/" + path;
    }

    private final class ImportRun {

        private final Path root;
        private final TemplateSet templates;
        private final RunReport report;
        private final Map<String, Path> assets = new LinkedHashMap<>();
        private final Map<String, String> pendingRubrics = new LinkedHashMap<>();
        private CartridgeManifest manifest;
        private ArchiveMode mode;
        private CourseModel model;
        private Stage stage;

        ImportRun(Path root, TemplateSet templates, RunReport report) {
            this.root = root.toAbsolutePath().normalize();
            this.templates = templates == null ? TemplateSet.EMPTY : templates;
            this.report = report;
        }

        void enter(Stage next) {
            stage = next;
            log.debug("Import stage {}", next);
        }

        ImportedCourse decode(CartridgeManifest parsed) {
            manifest = parsed;
            mode = Files.isRegularFile(root.resolve(EXPORT_SENTINEL)) ? ArchiveMode.PLATFORM_EXPORT : ArchiveMode.THIRD_PARTY;
            log.info("Importing {} archive '{}'", mode, manifest.title());
            model = new CourseModel(manifest.title());
            readCourseSettings();
            collectAssets();

            enter(Stage.RESOURCES);
            for (ManifestResource resource : manifest.resources().values()) {
                try {
                    decodeResource(resource);
                } catch (ResourceDecodeException ex) {
                    report.skipResource(resource.identifier(), ex.getMessage());
                } catch (ValidationException | IllegalArgumentException ex) {
                    report.skipResource(resource.identifier(), ex.getMessage());
                }
            }

            enter(Stage.RESOLVE_MODULES);
            resolveModules();
            enter(Stage.RESOLVE_RUBRICS);
            resolveRubrics();
            enter(Stage.DONE);
            log.info("Imported '{}': {} items, {} modules, {} banks, {} assets", model.getTitle(), model.getItems().size(),
                    model.getModules().size(), model.getBanks().size(), assets.size());
            return new ImportedCourse(model, assets, mode);
        }

        private void readCourseSettings() {
            Path file = root.resolve(COURSE_SETTINGS);
            if (!Files.isRegularFile(file)) {
                return;
            }
            try {
                ItemSettings settings = new ItemSettings(settingsReader.courseSettings(file));
                if (settings.string("title") != null) {
                    model.setTitle(settings.string("title"));
                }
                model.setCourseCode(settings.string("course_code"));
            } catch (ResourceDecodeException ex) {
                report.warn("Course settings ignored: " + ex.getMessage());
            }
        }

        private void collectAssets() {
            Path webResources = root.resolve(WEB_RESOURCES_DIR);
            if (!Files.isDirectory(webResources)) {
                return;
            }
            try (Stream<Path> files = Files.walk(webResources)) {
                files.filter(Files::isRegularFile).forEach(file ->
                        assets.put(assetTargetPath(root.relativize(file).toString()), file));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to list " + webResources, ex);
            }
        }

        private void decodeResource(ManifestResource resource) {
            MatchResult match = classifier.classify(resource, root);
            report.increment("resource." + match.kind().name().toLowerCase());
            switch (match.kind()) {
                case PAGE -> attach(decodePage(resource));
                case ASSIGNMENT -> attach(decodeAssignment(resource));
                case ASSESSMENT -> decodeAssessment(resource);
                case LINK -> attach(decodeLink(resource));
                case ASSET -> decodeAsset(resource);
                case COURSE_SETTINGS, ASSESSMENT_META -> {
                    // read together with their owners
                }
                case UNKNOWN -> report.skipResource(resource.identifier(),
                        "unrecognised resource type '" + resource.type() + "' (" + match.signal() + ")");
            }
        }

        private void attach(ContentItem item) {
            model.addItem(item);
        }

        private ContentItem decodePage(ManifestResource resource) {
            Path file = file(resource, resource.primaryFile().orElse(null));
            Document document = parseHtml(file, resource.identifier());
            Map<String, Object> settings = new LinkedHashMap<>();
            settings.put(ContentItemFactory.NAME, title(resource, document.title()));
            String state = document.select("meta[name=workflow_state]").attr("content");
            settings.put(ContentItemFactory.PUBLISHED, !"unpublished".equals(state));
            ContentItem page = ContentItemFactory.create(ContentType.PAGE, resource.identifier(),
                    new ItemSettings(settings), resource.identifier());
            page.setBody(markupNormalizer.toAuthorMarkdown(document.outerHtml(), reverseContext(templates)));
            return page;
        }

        private ContentItem decodeAssignment(ManifestResource resource) {
            Map<String, Object> settings = new LinkedHashMap<>();
            Optional<Path> settingsFile = resource.fileEndingWith(ASSIGNMENT_SETTINGS_FILE)
                    .map(root::resolve)
                    .or(() -> Optional.of(root.resolve(resource.identifier()).resolve(ASSIGNMENT_SETTINGS_FILE)))
                    .filter(Files::isRegularFile);
            settingsFile.ifPresent(f -> settings.putAll(settingsReader.assignmentSettings(f, resource.identifier())));

            Optional<String> htmlFile = resource.fileEndingWith(".html").or(() -> resource.fileEndingWith(".htm"));
            String body = "";
            if (htmlFile.isPresent()) {
                Document document = parseHtml(file(resource, htmlFile.get()), resource.identifier());
                settings.putIfAbsent(ContentItemFactory.NAME, blankToNull(document.title()));
                body = markupNormalizer.toAuthorMarkdown(document.outerHtml(), reverseContext(templates));
            }
            settings.put(ContentItemFactory.NAME, title(resource, (String) settings.get(ContentItemFactory.NAME)));
            Object rubricRef = settings.remove(RUBRIC_REF);

            ContentItem assignment = ContentItemFactory.create(ContentType.ASSIGNMENT, resource.identifier(),
                    new ItemSettings(settings), resource.identifier());
            assignment.setBody(body);
            if (rubricRef != null) {
                pendingRubrics.put(assignment.getId(), rubricRef.toString());
            }
            return assignment;
        }

        private void decodeAssessment(ManifestResource resource) {
            Path file = assessmentFile(resource);
            DecodedAssessment assessment = qtiReader.read(file, resource.identifier());
            PlacementDecision decision = placementPolicy.decide(resource, assessment);
            if (decision.placement() == QuizPlacement.BANK) {
                model.addBank(new QuestionBank(resource.identifier(), assessment.title(), assessment.questions()));
                report.increment("imported.bank");
                return;
            }
            attach(toQuiz(resource, assessment));
        }

        /**
         * Platform archives: the flat index only, as the platform itself does. Others: the declared file.
         */
        private Path assessmentFile(ManifestResource resource) {
            if (mode == ArchiveMode.PLATFORM_EXPORT) {
                Path flat = root.resolve(flatIndexPath(resource.identifier()));
                if (!Files.isRegularFile(flat)) {
                    throw new ResourceDecodeException(resource.identifier(),
                            "flat assessment index " + flatIndexPath(resource.identifier()) + " is missing");
                }
                return flat;
            }
            return file(resource, resource.primaryFile().orElse(null));
        }

        private Quiz toQuiz(ManifestResource resource, DecodedAssessment assessment) {
            Map<String, Object> settings = new LinkedHashMap<>(quizMeta(resource));
            Object metaDescription = settings.remove(DESCRIPTION);
            settings.putIfAbsent(ContentItemFactory.NAME, blankToNull(assessment.title()));
            settings.put(ContentItemFactory.NAME, title(resource, (String) settings.get(ContentItemFactory.NAME)));
            Map<String, String> metadata = assessment.metadata();
            if (metadata.containsKey(POINTS_POSSIBLE_FIELD)) {
                settings.put(ContentItemFactory.POINTS_POSSIBLE, metadata.get(POINTS_POSSIBLE_FIELD));
            }
            if (!settings.containsKey(ContentItemFactory.TIME_LIMIT) && metadata.containsKey("qmd_timelimit")) {
                settings.put(ContentItemFactory.TIME_LIMIT, metadata.get("qmd_timelimit"));
            }
            String attempts = metadata.get("cc_maxattempts");
            if (!settings.containsKey(ContentItemFactory.ALLOWED_ATTEMPTS) && attempts != null && attempts.matches("\\d+")) {
                settings.put(ContentItemFactory.ALLOWED_ATTEMPTS, attempts);
            }

            Quiz quiz = (Quiz) ContentItemFactory.create(ContentType.QUIZ, resource.identifier(),
                    new ItemSettings(settings), resource.identifier());
            String descriptionHtml = !assessment.descriptionHtml().isBlank()
                    ? assessment.descriptionHtml()
                    : metaDescription == null ? "" : metaDescription.toString();
            quiz.setDescription(markupNormalizer.toAuthorMarkdown(descriptionHtml, reverseContext(TemplateSet.EMPTY)));
            quiz.setQuestions(new ArrayList<>(assessment.questions()));
            quiz.setGroups(new ArrayList<>(assessment.groups()));
            if (quiz.getQuestions().isEmpty() && quiz.getGroups().isEmpty()) {
                throw new ResourceDecodeException(resource.identifier(), "assessment has no questions");
            }
            return quiz;
        }

        private Map<String, Object> quizMeta(ManifestResource resource) {
            Optional<Path> meta = resource.dependencies().stream()
                    .map(manifest::resource)
                    .flatMap(Optional::stream)
                    .map(r -> r.fileEndingWith(ASSESSMENT_META_FILE))
                    .flatMap(Optional::stream)
                    .map(root::resolve)
                    .findFirst()
                    .or(() -> Optional.of(root.resolve(resource.identifier()).resolve(ASSESSMENT_META_FILE)))
                    .filter(Files::isRegularFile);
            return meta.map(f -> settingsReader.quizMeta(f, resource.identifier())).orElse(Map.of());
        }

        private ContentItem decodeLink(ManifestResource resource) {
            Path file = file(resource, resource.primaryFile().orElse(null));
            Map<String, Object> settings = new LinkedHashMap<>(settingsReader.webLink(file, resource.identifier()));
            settings.put(ContentItemFactory.NAME, title(resource, (String) settings.get(ContentItemFactory.NAME)));
            return ContentItemFactory.create(ContentType.LINK, resource.identifier(), new ItemSettings(settings),
                    resource.identifier());
        }

        /**
         * Assets are copied anyway; one placed in a module also becomes a file item.
         */
        private void decodeAsset(ManifestResource resource) {
            String href = resource.primaryFile().orElseThrow();
            Path file = file(resource, href);
            String target = assetTargetPath(href);
            assets.putIfAbsent(target, file);
            if (!manifest.isReferencedByModule(resource.identifier())) {
                return;
            }
            Map<String, Object> settings = new LinkedHashMap<>();
            settings.put(ContentItemFactory.NAME, title(resource, FilenameUtils.getName(href)));
            settings.put(ContentItemFactory.FILE, target);
            attach(ContentItemFactory.create(ContentType.FILE, resource.identifier(), new ItemSettings(settings),
                    resource.identifier()));
        }

        private void resolveModules() {
            Map<String, ModuleMetaEntry> meta = new HashMap<>();
            Path metaFile = root.resolve(MODULE_META);
            if (Files.isRegularFile(metaFile)) {
                try {
                    settingsReader.moduleMeta(metaFile).forEach(e -> meta.put(e.moduleIdentifier() + "/" + e.identifierRef(), e));
                } catch (ResourceDecodeException ex) {
                    report.warn("Module settings ignored: " + ex.getMessage());
                }
            }

            List<String> order = new ArrayList<>();
            Set<String> titles = new LinkedHashSet<>();
            Set<String> placedIds = new HashSet<>();
            int number = 1;
            for (ManifestModule module : manifest.modules()) {
                String title = module.title() == null || module.title().isBlank() ? "Module " + number : module.title().strip();
                number++;
                if (!titles.add(title)) {
                    report.warn("Module title '" + title + "' appears more than once; items are merged");
                } else {
                    order.add(title);
                }
                int position = 1;
                for (ManifestModuleItem entry : module.items()) {
                    if (entry.identifierRef() == null) {
                        report.warn("Module '" + title + "' entry '" + entry.title() + "' has no content and was dropped");
                        continue;
                    }
                    Optional<ContentItem> item = model.findItem(entry.identifierRef());
                    if (item.isEmpty()) {
                        if (!placedIds.contains(entry.identifierRef())) {
                            report.warn("Module '" + title + "' refers to " + entry.identifierRef() + ", which was not imported");
                        }
                        continue;
                    }
                    ModuleMetaEntry annotation = meta.get(module.identifier() + "/" + entry.identifierRef());
                    int indent = annotation == null ? 0 : annotation.indent();
                    item.get().addMembership(new ModuleMembership(title, position++, indent));
                    placedIds.add(entry.identifierRef());
                }
            }
            ModuleAssembler.assemble(model, order, Map.of(), titles);
        }

        private void resolveRubrics() {
            Path file = root.resolve(RUBRICS);
            Map<String, Rubric> rubrics = Map.of();
            if (Files.isRegularFile(file)) {
                try {
                    rubrics = settingsReader.rubrics(file);
                } catch (ResourceDecodeException ex) {
                    report.warn("Rubrics ignored: " + ex.getMessage());
                }
            }
            Set<String> used = new HashSet<>();
            for (Map.Entry<String, String> pending : pendingRubrics.entrySet()) {
                Rubric rubric = rubrics.get(pending.getValue());
                if (rubric == null) {
                    report.warn("Assignment " + pending.getKey() + " refers to missing rubric " + pending.getValue());
                    continue;
                }
                ((Assignment) model.findItem(pending.getKey()).orElseThrow()).setRubric(rubric);
                used.add(pending.getValue());
            }
            Set<String> slugs = new HashSet<>(model.getSharedRubrics().keySet());
            rubrics.forEach((id, rubric) -> {
                if (!used.contains(id)) {
                    String slug = Slugs.unique(Slugs.slugify(rubric.title(), "rubric"), slugs);
                    slugs.add(slug);
                    model.getSharedRubrics().put(slug, rubric);
                }
            });
        }

        private ReverseContext reverseContext(TemplateSet set) {
            return new ReverseContext(set, assetPathMapper(), report::warn);
        }

        private AssetPathMapper assetPathMapper() {
            return url -> {
                String path = null;
                if (url.startsWith(FILEBASE_TOKEN + "/")) {
                    path = url.substring(FILEBASE_TOKEN.length() + 1);
                } else if (!url.contains("://")) {
                    int index = url.indexOf(WEB_RESOURCES_DIR + "/");
                    path = index < 0 ? null : url.substring(index);
                }
                if (path == null) {
                    return Optional.empty();
                }
                path = path.replaceAll("[?#].*$", "");
                return Optional.of(assetTargetPath(UrlPaths.decodePath(path)));
            };
        }

        private String title(ManifestResource resource, String candidate) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.strip();
            }
            return manifest.moduleItemTitle(resource.identifier()).orElse(resource.identifier());
        }

        private Path file(ManifestResource resource, String href) {
            if (href == null || href.isBlank()) {
                throw new ResourceDecodeException(resource.identifier(), "resource declares no file");
            }
            Path file = root.resolve(href).normalize();
            if (!file.startsWith(root) || !Files.isRegularFile(file)) {
                throw new ResourceDecodeException(resource.identifier(), "file " + href + " is missing from the archive");
            }
            return file;
        }

        private Document parseHtml(Path file, String resourceId) {
            try {
                return Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
            } catch (IOException ex) {
                throw new ResourceDecodeException(resourceId, "unreadable html " + file.getFileName(), ex);
            }
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
