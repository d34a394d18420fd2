package uk.gegc.coursesync.features.sync.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.asset.domain.model.AssetRecord;
import uk.gegc.coursesync.features.asset.infra.AssetRegistryRepository;
import uk.gegc.coursesync.features.canvas.application.CoursePublisher;
import uk.gegc.coursesync.features.canvas.domain.model.PublishResult;
import uk.gegc.coursesync.features.canvas.domain.model.RenderedItem;
import uk.gegc.coursesync.features.cartridge.application.CartridgeExporter;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContentLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateSet;
import uk.gegc.coursesync.features.source.application.CourseSourceReader;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.features.sync.config.SyncProperties;
import uk.gegc.coursesync.features.sync.domain.model.RenderSession;
import uk.gegc.coursesync.features.sync.domain.model.SyncResult;
import uk.gegc.coursesync.shared.exception.AmbiguousReferenceException;
import uk.gegc.coursesync.shared.exception.UnresolvedReferenceException;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.shared.util.Slugs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * One sync run of a local course: load registry, parse source, render and upload in parallel, publish,
 * then optionally prune and package. The registry is saved exactly once, also when a later stage fails,
 * so uploads that already happened are never repeated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncPipeline {

    enum Stage {LOAD_REGISTRY, PARSE, RENDER, PUBLISH, PRUNE, PACKAGE, SAVE_REGISTRY}

    private final AssetRegistryRepository registryRepository;
    private final CourseSourceReader sourceReader;
    private final TemplateLoader templateLoader;
    private final SharedContentLoader sharedContentLoader;
    private final ItemRenderer itemRenderer;
    private final CoursePublisher publisher;
    private final CartridgeExporter exporter;
    private final SyncProperties properties;
    private final ObjectMapper objectMapper;
    @Qualifier("syncTaskExecutor")
    private final ThreadPoolTaskExecutor syncTaskExecutor;

    /**
     * @param courseIdOverride platform course to publish to; null uses {@code course_id} from {@code course.yaml}
     */
    public SyncResult sync(Path courseRoot, Long courseIdOverride) {
        Path root = courseRoot.toAbsolutePath().normalize();
        RunReport report = new RunReport("sync");
        RunCache cache = new RunCache();

        log.info("[{}] stage {}", report.getRunName(), Stage.LOAD_REGISTRY);
        AssetRegistry registry = registryRepository.load(root);
        try {
            log.info("[{}] stage {}", report.getRunName(), Stage.PARSE);
            CourseModel model = sourceReader.read(root, report, cache);
            long courseId = courseId(model, courseIdOverride, root);

            log.info("[{}] stage {}", report.getRunName(), Stage.RENDER);
            RenderSession session = new RenderSession(root, courseId, registry, sharedContentLoader.load(root),
                    loadTemplates(model, root), defaultSet(model), report);
            Map<String, RenderedItem> rendered = render(model, session);

            log.info("[{}] stage {}", report.getRunName(), Stage.PUBLISH);
            PublishResult published = publisher.publish(model, rendered, courseId, report);

            int pruned = 0;
            if (properties.isPrune()) {
                log.info("[{}] stage {}", report.getRunName(), Stage.PRUNE);
                pruned = registry.prune(existingPaths(registry, root));
            }

            ExportResult exported = null;
            if (properties.isPackageOnSync()) {
                log.info("[{}] stage {}", report.getRunName(), Stage.PACKAGE);
                Path archive = root.resolve(properties.getPackageDir())
                        .resolve(Slugs.slugify(model.getTitle(), "course") + ".imscc");
                exported = exporter.export(model, root, archive, report);
            }
            return new SyncResult(published, exported, rendered.size(), pruned, report);
        } finally {
            log.info("[{}] stage {}", report.getRunName(), Stage.SAVE_REGISTRY);
            registryRepository.save(registry, root);
            if (properties.isDumpRunCache()) {
                cache.dump(root.resolve(properties.getRunCachePath()), objectMapper);
            }
            cache.clear();
            report.logSummary();
        }
    }

    /**
     * Renders every item on the sync executor. Items that fail validation or asset resolution are skipped
     * and reported; any other failure aborts the stage.
     */
    Map<String, RenderedItem> render(CourseModel model, RenderSession session) {
        Map<String, CompletableFuture<RenderedItem>> tasks = new LinkedHashMap<>();
        for (ContentItem item : model.items()) {
            tasks.put(item.getId(), CompletableFuture.supplyAsync(() -> itemRenderer.render(item, session), syncTaskExecutor));
        }

        Map<String, RenderedItem> rendered = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<RenderedItem>> task : tasks.entrySet()) {
            ContentItem item = model.getItems().get(task.getKey());
            try {
                rendered.put(task.getKey(), task.getValue().join());
                session.report().increment("rendered." + item.type().folderSuffix());
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                if (cause instanceof ValidationException || cause instanceof AmbiguousReferenceException
                        || cause instanceof UnresolvedReferenceException) {
                    session.report().skipItem(item.getSourcePath() != null ? item.getSourcePath() : item.getId(),
                            cause.getMessage());
                } else if (cause instanceof RuntimeException runtime) {
                    tasks.values().forEach(f -> f.cancel(false));
                    throw runtime;
                } else {
                    throw ex;
                }
            }
        }
        log.info("Rendered {} of {} items", rendered.size(), tasks.size());
        return rendered;
    }

    private Map<String, TemplateSet> loadTemplates(CourseModel model, Path root) {
        Set<String> names = model.items().stream()
                .map(ContentItem::getTemplate)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));
        names.add(defaultSet(model));
        Map<String, TemplateSet> sets = new HashMap<>();
        names.forEach(name -> sets.put(name, templateLoader.load(root, name)));
        return sets;
    }

    private String defaultSet(CourseModel model) {
        if (model.getDefaultTemplate() != null) {
            return model.getDefaultTemplate();
        }
        return properties.getTemplateSet() != null ? properties.getTemplateSet() : TemplateLoader.DEFAULT_SET;
    }

    private static long courseId(CourseModel model, Long override, Path root) {
        if (override != null) {
            return override;
        }
        if (model.getRemoteCourseId() == null) {
            throw new ValidationException(root.resolve(CourseLayout.COURSE_FILE).toString(),
                    "no course_id configured and none given on the command line");
        }
        return model.getRemoteCourseId();
    }

    private static List<String> existingPaths(AssetRegistry registry, Path root) {
        return registry.records().values().stream()
                .map(AssetRecord::getLocalPaths)
                .flatMap(Set::stream)
                .filter(path -> Files.isRegularFile(root.resolve(path)))
                .distinct()
                .toList();
    }
}
