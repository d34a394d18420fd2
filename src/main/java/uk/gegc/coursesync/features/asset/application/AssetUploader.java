package uk.gegc.coursesync.features.asset.application;

import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;

/**
 * Performs the actual upload of an asset. Failures propagate to the caller unchanged.
 */
@FunctionalInterface
public interface AssetUploader {

    RemoteFileDescriptor upload(ResolvedAsset asset, byte[] content);
}
