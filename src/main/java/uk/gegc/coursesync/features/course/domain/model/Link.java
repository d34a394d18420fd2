package uk.gegc.coursesync.features.course.domain.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Link extends ContentItem {

    private String externalUrl;
    private boolean newTab = true;

    public Link(String id, String title) {
        super(id, title);
    }

    @Override
    public ContentType type() {
        return ContentType.LINK;
    }
}
