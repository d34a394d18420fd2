package uk.gegc.coursesync.features.asset.infra;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of the asset registry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetRegistryDocument(
        int version,
        Map<String, Entry> assets,
        @JsonProperty("path_lookup") Map<String, String> pathLookup
) {

    public AssetRegistryDocument {
        assets = assets == null ? Map.of() : assets;
        pathLookup = pathLookup == null ? Map.of() : pathLookup;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            @JsonProperty("local_paths") List<String> localPaths,
            @JsonProperty("remote_id") @JsonAlias("canvas_file_id") String remoteId,
            @JsonProperty("remote_locator") @JsonAlias("canvas_url") String remoteLocator,
            @JsonProperty("content_hash") String contentHash,
            @JsonProperty("uploaded_at") Instant uploadedAt,
            @JsonProperty("file_size") long fileSize,
            String filename
    ) {
    }
}
