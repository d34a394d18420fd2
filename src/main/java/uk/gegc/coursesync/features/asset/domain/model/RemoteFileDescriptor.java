package uk.gegc.coursesync.features.asset.domain.model;

/**
 * What the remote platform returned for an uploaded file.
 */
public record RemoteFileDescriptor(String remoteId, String locator) {

    public RemoteFileDescriptor {
        if (remoteId == null || remoteId.isBlank()) {
            throw new IllegalArgumentException("Remote id cannot be null or blank");
        }
    }
}
