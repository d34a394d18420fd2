package uk.gegc.coursesync.features.asset.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.coursesync.features.asset.domain.model.AssetRecord;
import uk.gegc.coursesync.features.asset.domain.model.RegistryStats;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;
import uk.gegc.coursesync.shared.hash.ByteContentDigester;
import uk.gegc.coursesync.shared.hash.ContentAddressableStore;
import uk.gegc.coursesync.shared.hash.Digests;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Content-addressable registry of uploaded assets for one course. One hash maps to one record and at
 * most one upload, however many local spellings reach the same bytes. Remote identifiers live only
 * here and in rendered output, never in author files.
 * <p>
 * Held in memory for a single run; {@code AssetRegistryRepository} loads it at the start and saves it
 * at the end.
 */
@Slf4j
public class AssetRegistry {

    public static final int FORMAT_VERSION = 1;

    private final AssetReferenceResolver resolver;
    private final ContentAddressableStore<byte[], AssetRecord> store;
    private final ConcurrentMap<String, String> pathLookup = new ConcurrentHashMap<>();
    private final Clock clock;

    public AssetRegistry(AssetReferenceResolver resolver, int keyLength, Clock clock) {
        this.resolver = resolver;
        this.store = new ContentAddressableStore<>(new ByteContentDigester(keyLength));
        this.clock = clock;
    }

    public ResolvedAsset resolve(String reference, Path itemDir) {
        return resolver.resolve(reference, itemDir);
    }

    /**
     * Returns the remote descriptor for the bytes behind {@code asset}, invoking {@code uploader} only
     * when no record exists for their hash. The check and the record write are atomic per hash.
     */
    public RemoteFileDescriptor ensureUploaded(ResolvedAsset asset, AssetUploader uploader) {
        byte[] content = read(asset.file());
        String key = store.keyOf(content);
        AssetRecord record = store.computeIfAbsent(key, k -> {
            log.info("Uploading asset {} ({} bytes) as {}", asset.relativePath(), content.length, k);
            RemoteFileDescriptor descriptor = uploader.upload(asset, content);
            return new AssetRecord(k, Digests.md5Hex(content), descriptor, clock.instant(),
                    content.length, asset.filename());
        });
        record.addPath(asset.relativePath());
        pathLookup.put(asset.relativePath(), key);
        return record.descriptor();
    }

    /**
     * Remote locator of the current bytes behind {@code reference}; empty when they were never uploaded.
     * Only for building transient rendered output.
     */
    public Optional<String> remoteLocatorFor(String reference, Path itemDir) {
        ResolvedAsset asset = resolver.resolve(reference, itemDir);
        String key = store.keyOf(read(asset.file()));
        return store.find(key).map(AssetRecord::getRemoteLocator);
    }

    /**
     * Records a file whose remote identity is already known, e.g. one downloaded during a remote import.
     */
    public AssetRecord register(String relativePath, byte[] content, RemoteFileDescriptor descriptor, String filename) {
        String key = store.keyOf(content);
        AssetRecord record = store.computeIfAbsent(key, k ->
                new AssetRecord(k, Digests.md5Hex(content), descriptor, clock.instant(), content.length, filename));
        record.addPath(relativePath);
        pathLookup.put(relativePath, key);
        return record;
    }

    /**
     * Drops every path not in {@code existingPaths}, then every record left without a path.
     *
     * @return number of records removed
     */
    public int prune(Collection<String> existingPaths) {
        Set<String> existing = new HashSet<>(existingPaths);
        pathLookup.keySet().removeIf(path -> !existing.contains(path));
        int removed = 0;
        for (Map.Entry<String, AssetRecord> entry : store.snapshot().entrySet()) {
            AssetRecord record = entry.getValue();
            record.getLocalPaths().stream()
                    .filter(path -> !existing.contains(path))
                    .toList()
                    .forEach(record::removePath);
            if (record.getLocalPaths().isEmpty() && store.remove(entry.getKey())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Pruned {} asset records with no remaining local path", removed);
        }
        return removed;
    }

    public Optional<AssetRecord> findByHash(String hash) {
        return store.find(hash);
    }

    public Optional<AssetRecord> findByPath(String relativePath) {
        String key = pathLookup.get(relativePath);
        return key == null ? Optional.empty() : store.find(key);
    }

    public Optional<AssetRecord> findByRemoteId(String remoteId) {
        return store.snapshot().values().stream()
                .filter(r -> remoteId.equals(r.getRemoteId()))
                .findFirst();
    }

    /**
     * First known local path of the bytes uploaded as {@code remoteId}.
     */
    public Optional<String> localPathFor(String remoteId) {
        return findByRemoteId(remoteId).flatMap(r -> r.getLocalPaths().stream().findFirst());
    }

    public void restore(AssetRecord record, Map<String, String> lookupEntries) {
        store.restore(record.getHash(), record);
        pathLookup.putAll(lookupEntries);
    }

    public Map<String, AssetRecord> records() {
        return store.snapshot();
    }

    public Map<String, String> pathLookup() {
        return new TreeMap<>(pathLookup);
    }

    public RegistryStats stats() {
        Map<String, AssetRecord> records = store.snapshot();
        int paths = records.values().stream().mapToInt(r -> r.getLocalPaths().size()).sum();
        long bytes = records.values().stream().mapToLong(AssetRecord::getFileSize).sum();
        return new RegistryStats(records.size(), paths, bytes);
    }

    public AssetReferenceResolver getResolver() {
        return resolver;
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read asset " + file, ex);
        }
    }
}
