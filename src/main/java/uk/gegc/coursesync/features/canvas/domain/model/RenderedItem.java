package uk.gegc.coursesync.features.canvas.domain.model;

import uk.gegc.coursesync.features.course.domain.model.Question;

import java.util.List;

/**
 * Platform form of one content item, produced by the render stage and consumed by the publisher.
 *
 * @param html           body or assignment description, with templates and remote asset URLs
 * @param descriptionHtml quiz description, empty for other items
 * @param questions      quiz questions with HTML text
 * @param remoteFileId   uploaded file of a file item, null for other items
 */
public record RenderedItem(String itemId, String html, String descriptionHtml, List<Question> questions,
                           String remoteFileId) {

    public RenderedItem {
        html = html == null ? "" : html;
        descriptionHtml = descriptionHtml == null ? "" : descriptionHtml;
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public static RenderedItem body(String itemId, String html) {
        return new RenderedItem(itemId, html, "", List.of(), null);
    }
}
