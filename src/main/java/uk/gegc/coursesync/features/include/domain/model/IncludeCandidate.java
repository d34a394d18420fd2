package uk.gegc.coursesync.features.include.domain.model;

import java.util.List;

/**
 * A prose block repeated verbatim across item bodies.
 *
 * @param slug  suggested include name, unique within one report
 * @param files item index files containing the block, sorted
 */
public record IncludeCandidate(String slug, String text, List<String> files) {

    public static final int PREVIEW_LENGTH = 120;

    public IncludeCandidate {
        files = List.copyOf(files);
    }

    public int charCount() {
        return text.length();
    }

    public String preview() {
        String flat = text.replace('\n', ' ');
        return flat.length() > PREVIEW_LENGTH ? flat.substring(0, PREVIEW_LENGTH) + "..." : flat;
    }
}
