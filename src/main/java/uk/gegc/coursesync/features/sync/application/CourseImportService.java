package uk.gegc.coursesync.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.asset.infra.AssetRegistryRepository;
import uk.gegc.coursesync.features.canvas.application.RemoteCourseFetcher;
import uk.gegc.coursesync.features.canvas.domain.model.FetchedCourse;
import uk.gegc.coursesync.features.cartridge.application.CartridgeImporter;
import uk.gegc.coursesync.features.cartridge.domain.model.ImportedCourse;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.markup.application.template.TemplateLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.rubric.application.RubricDeduplicator;
import uk.gegc.coursesync.features.rubric.domain.model.RubricDedupResult;
import uk.gegc.coursesync.features.source.application.CourseSourceWriter;
import uk.gegc.coursesync.features.sync.config.SyncProperties;
import uk.gegc.coursesync.features.sync.domain.model.ImportSummary;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunReport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reconstitutes an author tree from a Common Cartridge archive or from a remote course, given by its
 * numeric id. Templates for stripping come from the target tree. Nothing is written to the target
 * before the source has been read completely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseImportService {

    private static final Pattern REMOTE_ID = Pattern.compile("\\d+");

    private final CartridgeImporter cartridgeImporter;
    private final RemoteCourseFetcher remoteCourseFetcher;
    private final RubricDeduplicator rubricDeduplicator;
    private final CourseSourceWriter sourceWriter;
    private final TemplateLoader templateLoader;
    private final AssetRegistryRepository registryRepository;
    private final SyncProperties properties;

    /**
     * @param source      archive path, or a platform course id
     * @param templateSet set to strip from bodies, null for the configured default
     */
    public ImportSummary importCourse(String source, Path targetRoot, String templateSet) {
        if (source == null || source.isBlank()) {
            throw new ValidationException("import source must be an archive path or a course id");
        }
        Path root = targetRoot.toAbsolutePath().normalize();
        RunReport report = new RunReport("import");
        TemplateSet templates = templateLoader.load(root, templateSet != null ? templateSet
                : properties.getTemplateSet() != null ? properties.getTemplateSet() : TemplateLoader.DEFAULT_SET);

        Path workDir = createWorkDir();
        try {
            if (REMOTE_ID.matcher(source.strip()).matches()) {
                AssetRegistry registry = registryRepository.load(root);
                FetchedCourse fetched = remoteCourseFetcher.fetch(Long.parseLong(source.strip()), workDir, registry,
                        templates, report);
                ImportSummary summary = write(fetched.model(), fetched.assets(), root, report);
                registryRepository.save(registry, root);
                return summary;
            }
            Path archive = Path.of(source);
            if (!Files.isRegularFile(archive)) {
                throw new ValidationException(source, "archive not found");
            }
            ImportedCourse imported = cartridgeImporter.importArchive(archive, workDir, templates, report);
            log.info("Archive {} read in {} mode", archive.getFileName(), imported.mode());
            return write(imported.model(), imported.assets(), root, report);
        } finally {
            deleteWorkDir(workDir);
            report.logSummary();
        }
    }

    private ImportSummary write(CourseModel model, Map<String, Path> assets, Path root, RunReport report) {
        RubricDedupResult dedup = rubricDeduplicator.deduplicate(model);
        sourceWriter.write(model, root, dedup.rows());
        int copied = 0;
        for (Map.Entry<String, Path> asset : assets.entrySet()) {
            try (InputStream in = Files.newInputStream(asset.getValue())) {
                sourceWriter.copyAsset(root, asset.getKey(), in);
                copied++;
            } catch (ValidationException ex) {
                report.warn("Asset " + asset.getKey() + " not written: " + ex.getMessage());
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read imported asset " + asset.getValue(), ex);
            }
        }
        log.info("Imported course '{}' into {}: {} items, {} modules, {} assets, {} rubrics extracted",
                model.getTitle(), root, model.getItems().size(), model.getModules().size(), copied,
                dedup.extractedRubrics());
        return new ImportSummary(root, model.getItems().size(), model.getModules().size(), copied,
                dedup.extractedRubrics(), report);
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("coursesync-import-");
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create import work directory", ex);
        }
    }

    private static void deleteWorkDir(Path workDir) {
        try {
            FileUtils.deleteDirectory(workDir.toFile());
        } catch (IOException ex) {
            log.warn("Could not delete import work directory {}: {}", workDir, ex.getMessage());
        }
    }
}
