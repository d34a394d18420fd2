package uk.gegc.coursesync.features.asset.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.asset.application.AssetReferenceResolver;
import uk.gegc.coursesync.features.asset.application.AssetRegistry;
import uk.gegc.coursesync.features.asset.config.AssetRegistryProperties;
import uk.gegc.coursesync.features.asset.domain.model.AssetRecord;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the registry of a course once at the start of a run and saves it once at the end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetRegistryRepository {

    private final ObjectMapper objectMapper;
    private final AssetRegistryProperties properties;
    private final Clock clock;

    public AssetRegistry load(Path courseRoot) {
        AssetRegistry registry = new AssetRegistry(
                new AssetReferenceResolver(courseRoot, properties.getSharedDir()),
                properties.getKeyLength(),
                clock);
        Path file = registryFile(courseRoot);
        if (!Files.isRegularFile(file)) {
            log.debug("No asset registry at {}, starting empty", file);
            return registry;
        }

        AssetRegistryDocument document;
        try {
            document = objectMapper.readValue(file.toFile(), AssetRegistryDocument.class);
        } catch (IOException ex) {
            Path backup = file.resolveSibling(file.getFileName() + ".corrupt");
            log.warn("Asset registry {} is unreadable ({}), moving it to {} and starting empty",
                    file, ex.getMessage(), backup);
            moveQuietly(file, backup);
            return registry;
        }

        for (Map.Entry<String, AssetRegistryDocument.Entry> entry : document.assets().entrySet()) {
            AssetRegistryDocument.Entry value = entry.getValue();
            if (value.remoteId() == null) {
                log.warn("Skipping registry entry {} without remote id", entry.getKey());
                continue;
            }
            AssetRecord record = new AssetRecord(entry.getKey(), value.contentHash(),
                    new RemoteFileDescriptor(value.remoteId(), value.remoteLocator()),
                    value.uploadedAt(), value.fileSize(), value.filename());
            if (value.localPaths() != null) {
                value.localPaths().forEach(record::addPath);
            }
            Map<String, String> lookup = new LinkedHashMap<>();
            document.pathLookup().forEach((path, hash) -> {
                if (hash.equals(entry.getKey())) {
                    lookup.put(path, hash);
                }
            });
            registry.restore(record, lookup);
        }
        log.info("Loaded asset registry with {} assets from {}", registry.records().size(), file);
        return registry;
    }

    public void save(AssetRegistry registry, Path courseRoot) {
        Map<String, AssetRegistryDocument.Entry> assets = new LinkedHashMap<>();
        registry.records().forEach((hash, record) -> assets.put(hash, new AssetRegistryDocument.Entry(
                new ArrayList<>(record.getLocalPaths()),
                record.getRemoteId(),
                record.getRemoteLocator(),
                record.getContentHash(),
                record.getUploadedAt(),
                record.getFileSize(),
                record.getFilename())));
        AssetRegistryDocument document = new AssetRegistryDocument(AssetRegistry.FORMAT_VERSION, assets,
                registry.pathLookup());

        Path file = registryFile(courseRoot);
        try {
            Files.createDirectories(file.getParent());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save asset registry to " + file, ex);
        }
        log.info("Saved asset registry with {} assets to {}", assets.size(), file);
    }

    public Path registryFile(Path courseRoot) {
        return courseRoot.resolve(properties.getRegistryPath());
    }

    private static void moveQuietly(Path from, Path to) {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            log.warn("Could not move {} aside: {}", from, ex.getMessage());
        }
    }
}
