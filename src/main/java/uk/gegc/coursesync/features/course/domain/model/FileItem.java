package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Module entry pointing at a single asset.
 */
@Getter
@Setter
public class FileItem extends ContentItem {

    /**
     * Asset reference as the author wrote it, resolved through the asset registry.
     */
    private String fileReference;

    public FileItem(String id, String title) {
        super(id, title);
    }

    @Override
    public ContentType type() {
        return ContentType.FILE;
    }
}
