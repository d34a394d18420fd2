package uk.gegc.coursesync.features.sync.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.asset.application.AssetUploader;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;
import uk.gegc.coursesync.features.canvas.config.CanvasProperties;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasFile;
import uk.gegc.coursesync.features.canvas.domain.model.RenderedItem;
import uk.gegc.coursesync.features.canvas.infra.CanvasApiClient;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.FileItem;
import uk.gegc.coursesync.features.course.domain.model.Link;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.Quiz;
import uk.gegc.coursesync.features.markup.application.AssetLinker;
import uk.gegc.coursesync.features.markup.application.MarkupNormalizer;
import uk.gegc.coursesync.features.markup.application.RenderContext;
import uk.gegc.coursesync.features.source.application.QuizTextCodec;
import uk.gegc.coursesync.features.sync.domain.model.RenderSession;
import uk.gegc.coursesync.shared.exception.RemoteOperationException;

import java.util.List;
import java.util.Optional;

/**
 * Turns one content item into its platform form, uploading referenced assets on the way. Safe to call
 * from several threads for the same session: uploads go through the registry, which is atomic per hash.
 */
@Component
@RequiredArgsConstructor
public class ItemRenderer {

    private final MarkupNormalizer markupNormalizer;
    private final CanvasApiClient client;
    private final CanvasProperties canvasProperties;

    public RenderedItem render(ContentItem item, RenderSession session) {
        RenderContext context = new RenderContext(session.itemDir(item), linker(session), session.shared(),
                session.shared(), session.templatesFor(item), session.report()::warn);
        if (item instanceof Page || item instanceof Assignment) {
            return RenderedItem.body(item.getId(), markupNormalizer.toPlatformHtml(item.getBody(), context));
        }
        if (item instanceof Quiz quiz) {
            return renderQuiz(quiz, context.withoutTemplates());
        }
        if (item instanceof FileItem file) {
            ResolvedAsset asset = session.registry().resolve(file.getFileReference(), session.itemDir(file));
            RemoteFileDescriptor descriptor = session.registry().ensureUploaded(asset, uploader(session));
            return new RenderedItem(file.getId(), "", "", List.of(), descriptor.remoteId());
        }
        if (item instanceof Link) {
            return RenderedItem.body(item.getId(), "");
        }
        throw new IllegalStateException("Unhandled content type " + item.type());
    }

    private RenderedItem renderQuiz(Quiz quiz, RenderContext context) {
        String description = quiz.getDescription() != null && !quiz.getDescription().isBlank()
                ? quiz.getDescription()
                : QuizTextCodec.extractDescription(quiz.getBody());
        String descriptionHtml = description.isBlank() ? "" : markupNormalizer.renderFragment(description, context);
        List<Question> questions = quiz.getQuestions().stream()
                .map(q -> new Question(q.id(), q.type(), markupNormalizer.renderFragment(q.text(), context),
                        q.answers(), q.points()))
                .toList();
        return new RenderedItem(quiz.getId(), "", descriptionHtml, questions, null);
    }

    private AssetLinker linker(RenderSession session) {
        return (reference, itemDir) -> {
            ResolvedAsset asset = session.registry().resolve(reference, itemDir);
            RemoteFileDescriptor descriptor = session.registry().ensureUploaded(asset, uploader(session));
            return Optional.of(descriptor.locator() != null ? descriptor.locator()
                    : "/courses/" + session.courseId() + "/files/" + descriptor.remoteId() + "/preview");
        };
    }

    AssetUploader uploader(RenderSession session) {
        return (asset, content) -> {
            CanvasFile file = client.uploadFile(session.courseId(), asset.filename(), content,
                    canvasProperties.getUploadFolder());
            if (file == null || file.id() == null) {
                throw new RemoteOperationException("upload file", "no file id returned for " + asset.relativePath());
            }
            session.report().increment("assets.uploaded");
            return new RemoteFileDescriptor(String.valueOf(file.id()), file.url());
        };
    }
}
