package uk.gegc.coursesync.features.cartridge.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.asset.application.AssetReferenceResolver;
import uk.gegc.coursesync.features.asset.config.AssetRegistryProperties;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.features.cartridge.infra.ArchiveWriter;
import uk.gegc.coursesync.features.cartridge.infra.CanvasSettingsWriter;
import uk.gegc.coursesync.features.cartridge.infra.ManifestWriter;
import uk.gegc.coursesync.features.cartridge.infra.QtiWriter;
import uk.gegc.coursesync.features.cartridge.infra.XmlSupport;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.CourseModule;
import uk.gegc.coursesync.features.course.domain.model.FileItem;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.ModuleItemRef;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.course.domain.model.Rubric;
import uk.gegc.coursesync.features.markup.application.AssetLinker;
import uk.gegc.coursesync.features.markup.application.MarkupNormalizer;
import uk.gegc.coursesync.features.markup.application.RenderContext;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContent;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContentLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.source.application.QuizTextCodec;
import uk.gegc.coursesync.shared.exception.AmbiguousReferenceException;
import uk.gegc.coursesync.shared.exception.UnresolvedReferenceException;
import uk.gegc.coursesync.shared.hash.Digests;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.shared.util.Slugs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSESSMENT_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSESSMENT_META_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSIGNMENT_GROUPS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.ASSIGNMENT_SETTINGS_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.COURSE_SETTINGS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.EXPORT_SENTINEL;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.FILEBASE_TOKEN;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.FILES_META;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.MANIFEST_FILE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.MODULE_META;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.RUBRICS;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.TYPE_ASSESSMENT;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.TYPE_LEARNING_APPLICATION;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.TYPE_QUESTION_BANK;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.TYPE_WEBCONTENT;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.TYPE_WEBLINK;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WEB_RESOURCES_DIR;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.WIKI_DIR;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.flatIndexPath;

/**
 * Builds a Common Cartridge archive from a course model. Every quiz is written both as structured QTI
 * and into the flat assessment index, and the settings files that switch on page and quiz import are
 * always written and listed in the manifest. Asset references point into {@code web_resources} through
 * the file base token, never at remote URLs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartridgeExporter {

    static final String SENTINEL_TEXT = "Exported by coursesync. This file marks a platform export archive.\n";
    private static final String SETTINGS_RESOURCE = "course_settings";

    private final MarkupNormalizer markupNormalizer;
    private final TemplateLoader templateLoader;
    private final SharedContentLoader sharedContentLoader;
    private final QtiWriter qtiWriter;
    private final CanvasSettingsWriter settingsWriter;
    private final AssetRegistryProperties assetProperties;

    public ExportResult export(CourseModel model, Path courseRoot, Path archive, RunReport report) {
        log.info("Exporting course '{}' to {}", model.getTitle(), archive);
        ExportRun run = new ExportRun(model, courseRoot, report);
        try (ArchiveWriter writer = new ArchiveWriter(archive)) {
            run.writer = writer;
            run.writeItems();
            run.writeBanks();
            run.writeAssets();
            run.writeModules();
            run.writeCourseSettings();
            writer.write(MANIFEST_FILE, run.manifest.toBytes());
            ExportResult result = new ExportResult(archive, writer.entries(), run.exportedItems.size(), run.assets.size());
            log.info("Exported {} items and {} assets ({} archive entries)", result.items(), result.assets(),
                    result.entries().size());
            return result;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write archive " + archive, ex);
        }
    }

    /**
     * State of one export: the manifest under construction and everything collected on the way.
     */
    private final class ExportRun {

        private final CourseModel model;
        private final Path courseRoot;
        private final RunReport report;
        private final ManifestWriter manifest;
        private final AssetReferenceResolver resolver;
        private final SharedContent shared;
        private final Map<String, TemplateSet> templateSets = new HashMap<>();
        private final Map<String, Path> assets = new LinkedHashMap<>();
        private final Set<String> exportedItems = new HashSet<>();
        private final Set<String> declaredFiles = new HashSet<>();
        private final Set<String> wikiNames = new HashSet<>();
        private final Map<String, Rubric> rubrics = new LinkedHashMap<>();
        private final Map<String, String> fileNames = new LinkedHashMap<>();
        private ArchiveWriter writer;

        ExportRun(CourseModel model, Path courseRoot, RunReport report) {
            this.model = model;
            this.courseRoot = courseRoot;
            this.report = report;
            this.manifest = new ManifestWriter(archiveId("manifest", model.getTitle()), model.getTitle());
            this.resolver = new AssetReferenceResolver(courseRoot, assetProperties.getSharedDir());
            this.shared = sharedContentLoader.load(courseRoot);
        }

        void writeItems() {
            for (ContentItem item : model.items()) {
                try {
                    if (item instanceof Page page) {
                        writePage(page);
                    } else if (item instanceof Assignment assignment) {
                        writeAssignment(assignment);
                    } else if (item instanceof Quiz quiz) {
                        writeQuiz(quiz);
                    } else if (item instanceof Link link) {
                        writeLink(link);
                    } else if (item instanceof FileItem file) {
                        writeFile(file);
                    }
                    exportedItems.add(item.getId());
                    report.increment("exported." + item.type().folderSuffix());
                } catch (AmbiguousReferenceException | UnresolvedReferenceException ex) {
                    report.skipItem(describe(item), ex.getMessage());
                }
            }
        }

        private void writePage(Page page) {
            String html = markupNormalizer.toPlatformHtml(page.getBody(), context(page));
            String slug = Slugs.unique(Slugs.slugify(page.getTitle(), page.getId()), wikiNames);
            wikiNames.add(slug);
            String path = WIKI_DIR + "/" + slug + ".html";
            writer.write(path, htmlDocument(page, html));
            manifest.addResource(page.getId(), TYPE_WEBCONTENT, path, List.of(path), List.of());
        }

        private void writeAssignment(Assignment assignment) {
            String html = markupNormalizer.toPlatformHtml(assignment.getBody(), context(assignment));
            String htmlPath = assignment.getId() + "/" + Slugs.slugify(assignment.getTitle(), "assignment") + ".html";
            String settingsPath = assignment.getId() + "/" + ASSIGNMENT_SETTINGS_FILE;
            writer.write(htmlPath, htmlDocument(assignment, html));
            writer.write(settingsPath, XmlSupport.toBytes(settingsWriter.assignmentSettings(assignment, rubricId(assignment))));
            manifest.addResource(assignment.getId(), TYPE_LEARNING_APPLICATION, htmlPath,
                    List.of(htmlPath, settingsPath), List.of());
        }

        private String rubricId(Assignment assignment) {
            if (assignment.getRubricRef() != null) {
                Rubric shared = model.getSharedRubrics().get(assignment.getRubricRef());
                if (shared == null) {
                    report.warn("Assignment '" + assignment.getTitle() + "' uses unknown rubric '"
                            + assignment.getRubricRef() + "', exported without it");
                    return null;
                }
                String id = archiveId("rubric", assignment.getRubricRef());
                rubrics.putIfAbsent(id, shared);
                return id;
            }
            if (assignment.getRubric() != null) {
                String id = assignment.getId() + "_rubric";
                rubrics.put(id, assignment.getRubric());
                return id;
            }
            return null;
        }

        private void writeQuiz(Quiz quiz) {
            RenderContext fragmentContext = context(quiz).withoutTemplates();
            String description = quiz.getDescription() != null && !quiz.getDescription().isBlank()
                    ? quiz.getDescription()
                    : QuizTextCodec.extractDescription(quiz.getBody());
            String descriptionHtml = description.isBlank() ? "" : markupNormalizer.renderFragment(description, fragmentContext);

            String structured = quiz.getId() + "/" + ASSESSMENT_FILE;
            String flat = flatIndexPath(quiz.getId());
            String meta = quiz.getId() + "/" + ASSESSMENT_META_FILE;
            writer.write(structured, XmlSupport.toBytes(qtiWriter.assessment(quiz, descriptionHtml,
                    text -> markupNormalizer.renderFragment(text, fragmentContext), this::bankIdentifier,
                    QtiWriter.Flavor.CARTRIDGE)));
            writer.write(flat, XmlSupport.toBytes(qtiWriter.assessment(quiz, descriptionHtml,
                    text -> markupNormalizer.renderFragment(text, fragmentContext), this::bankIdentifier,
                    QtiWriter.Flavor.PLATFORM)));
            writer.write(meta, XmlSupport.toBytes(settingsWriter.quizMeta(quiz, descriptionHtml)));

            String metaId = quiz.getId() + "_meta";
            manifest.addResource(quiz.getId(), TYPE_ASSESSMENT, structured, List.of(structured), List.of(metaId));
            manifest.addResource(metaId, TYPE_LEARNING_APPLICATION, meta, List.of(meta, flat), List.of());
        }

        private String bankIdentifier(String reference) {
            Optional<QuestionBank> bank = model.findBank(reference);
            if (bank.isEmpty()) {
                report.warn("Question group refers to unknown bank '" + reference + "'");
                return reference;
            }
            return bank.get().id();
        }

        private void writeLink(Link link) {
            String path = link.getId() + ".xml";
            writer.write(path, XmlSupport.toBytes(settingsWriter.webLink(link)));
            manifest.addResource(link.getId(), TYPE_WEBLINK, null, List.of(path), List.of());
        }

        private void writeFile(FileItem file) {
            ResolvedAsset asset = resolver.resolve(file.getFileReference(), itemDir(file));
            String path = collect(asset);
            manifest.addResource(file.getId(), TYPE_WEBCONTENT, path, List.of(path), List.of());
            declaredFiles.add(path);
            fileNames.put(file.getId(), asset.filename());
        }

        void writeBanks() {
            for (QuestionBank bank : model.getBanks().values()) {
                String path = flatIndexPath(bank.id());
                writer.write(path, XmlSupport.toBytes(qtiWriter.objectBank(bank,
                        text -> markupNormalizer.renderFragment(text, RenderContext.plain()), QtiWriter.Flavor.PLATFORM)));
                manifest.addResource(bank.id(), TYPE_QUESTION_BANK, path, List.of(path), List.of());
                report.increment("exported.bank");
            }
        }

        void writeAssets() {
            assets.forEach((relativePath, file) -> {
                String path = WEB_RESOURCES_DIR + "/" + relativePath;
                writer.copy(path, file);
                if (declaredFiles.add(path)) {
                    String id = archiveId("file", relativePath);
                    manifest.addResource(id, TYPE_WEBCONTENT, path, List.of(path), List.of());
                    fileNames.put(id, file.getFileName().toString());
                }
            });
        }

        void writeModules() {
            Map<String, String> moduleIds = new LinkedHashMap<>();
            Map<String, String> moduleItemIds = new HashMap<>();
            for (CourseModule module : model.getModules()) {
                String moduleId = module.getId() != null ? module.getId() : archiveId("module", module.getTitle());
                moduleIds.put(module.getTitle(), moduleId);
                org.dom4j.Element element = manifest.addModule(moduleId, module.getTitle());
                for (ModuleItemRef ref : module.getItems()) {
                    if (!exportedItems.contains(ref.itemId())) {
                        continue;
                    }
                    ContentItem item = model.findItem(ref.itemId()).orElseThrow();
                    String entryId = archiveId("item", moduleId + "/" + ref.itemId());
                    moduleItemIds.put(moduleId + "/" + ref.itemId(), entryId);
                    manifest.addModuleItem(element, entryId, ref.itemId(), item.getTitle());
                }
            }
            writer.write(MODULE_META, XmlSupport.toBytes(settingsWriter.moduleMeta(model, moduleIds, moduleItemIds)));
        }

        void writeCourseSettings() {
            writer.write(EXPORT_SENTINEL, SENTINEL_TEXT.getBytes(StandardCharsets.UTF_8));
            writer.write(COURSE_SETTINGS, XmlSupport.toBytes(settingsWriter.courseSettings(model, archiveId("course", model.getTitle()))));
            writer.write(ASSIGNMENT_GROUPS, XmlSupport.toBytes(settingsWriter.assignmentGroups()));
            writer.write(RUBRICS, XmlSupport.toBytes(settingsWriter.rubrics(rubrics)));
            writer.write(FILES_META, XmlSupport.toBytes(settingsWriter.filesMeta(fileNames)));
            manifest.addResource(SETTINGS_RESOURCE, TYPE_LEARNING_APPLICATION, EXPORT_SENTINEL,
                    List.of(EXPORT_SENTINEL, COURSE_SETTINGS, MODULE_META, ASSIGNMENT_GROUPS, RUBRICS, FILES_META),
                    List.of());
        }

        private RenderContext context(ContentItem item) {
            return new RenderContext(itemDir(item), linker(), shared, shared, templates(item), report::warn);
        }

        private AssetLinker linker() {
            return (reference, dir) -> {
                ResolvedAsset asset = resolver.resolve(reference, dir);
                return Optional.of(FILEBASE_TOKEN + "/" + collect(asset).substring(WEB_RESOURCES_DIR.length() + 1)
                        .replace(" ", "%20"));
            };
        }

        /**
         * @return archive path of the asset
         */
        private String collect(ResolvedAsset asset) {
            assets.putIfAbsent(asset.relativePath(), asset.file());
            return WEB_RESOURCES_DIR + "/" + asset.relativePath();
        }

        private TemplateSet templates(ContentItem item) {
            String name = item.getTemplate() != null ? item.getTemplate() : model.getDefaultTemplate();
            String key = name == null ? TemplateLoader.DEFAULT_SET : name;
            return templateSets.computeIfAbsent(key, k -> templateLoader.load(courseRoot, k));
        }

        private Path itemDir(ContentItem item) {
            return item.getSourcePath() == null ? null : courseRoot.resolve(item.getSourcePath());
        }

        private String describe(ContentItem item) {
            return item.getSourcePath() != null ? item.getSourcePath() : item.getId();
        }
    }

    static String htmlDocument(ContentItem item, String bodyHtml) {
        Document document = Document.createShell("");
        document.outputSettings().prettyPrint(false).charset(StandardCharsets.UTF_8);
        Element head = document.head();
        head.appendElement("meta").attr("http-equiv", "Content-Type").attr("content", "text/html; charset=utf-8");
        document.title(item.getTitle());
        head.appendElement("meta").attr("name", "identifier").attr("content", item.getId());
        head.appendElement("meta").attr("name", "editing_roles").attr("content", "teachers");
        head.appendElement("meta").attr("name", "workflow_state").attr("content", item.isPublished() ? "active" : "unpublished");
        document.body().html(bodyHtml);
        return "<!DOCTYPE html>\n" + document.outerHtml();
    }

    /**
     * Stable archive identifier for things the model does not identify itself.
     */
    static String archiveId(String kind, String key) {
        return "g" + Digests.md5Hex((kind + ":" + key).getBytes(StandardCharsets.UTF_8));
    }
}
