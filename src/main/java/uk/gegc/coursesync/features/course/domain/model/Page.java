package uk.gegc.coursesync.features.course.domain.model;

public class Page extends ContentItem {

    public Page(String id, String title) {
        super(id, title);
    }

    @Override
    public ContentType type() {
        return ContentType.PAGE;
    }
}
