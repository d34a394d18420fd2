package uk.gegc.coursesync.features.canvas.domain.model;

import uk.gegc.coursesync.features.course.domain.model.ContentType;

/**
 * Where one content item lives on the platform after publishing.
 *
 * @param pageUrl page slug for pages, null otherwise
 */
public record RemoteRef(ContentType type, Long id, String pageUrl) {
}
