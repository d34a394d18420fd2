package uk.gegc.coursesync.features.canvas.domain.model;

import java.util.Map;

/**
 * @param items content item id to its remote location
 */
public record PublishResult(Map<String, RemoteRef> items, int created, int updated) {

    public PublishResult {
        items = Map.copyOf(items);
    }
}
