package uk.gegc.coursesync.features.asset.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * One uploaded asset, keyed by the hash of its bytes. The path set only grows during a run;
 * paths are dropped by explicit pruning.
 */
@Getter
public class AssetRecord {

    private final String hash;
    private final String contentHash;
    private final String remoteId;
    private final String remoteLocator;
    private final Instant uploadedAt;
    private final long fileSize;
    private final String filename;
    private final Set<String> localPaths = new ConcurrentSkipListSet<>();

    public AssetRecord(String hash, String contentHash, RemoteFileDescriptor descriptor,
                       Instant uploadedAt, long fileSize, String filename) {
        this.hash = hash;
        this.contentHash = contentHash;
        this.remoteId = descriptor.remoteId();
        this.remoteLocator = descriptor.locator();
        this.uploadedAt = uploadedAt;
        this.fileSize = fileSize;
        this.filename = filename;
    }

    public RemoteFileDescriptor descriptor() {
        return new RemoteFileDescriptor(remoteId, remoteLocator);
    }

    public void addPath(String path) {
        localPaths.add(path);
    }

    public boolean removePath(String path) {
        return localPaths.remove(path);
    }

    public Set<String> getLocalPaths() {
        return Collections.unmodifiableSet(localPaths);
    }
}
