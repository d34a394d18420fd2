package uk.gegc.coursesync.features.markup.domain.model;

/**
 * Media found in platform HTML.
 *
 * @param remoteFileId platform file id parsed from the URL, null when the URL is not a platform file
 */
public record MediaReference(String kind, String url, String filename, String altText, String remoteFileId) {
}
