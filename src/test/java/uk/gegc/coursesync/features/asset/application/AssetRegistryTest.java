package uk.gegc.coursesync.features.asset.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.asset.domain.model.AssetRecord;
import uk.gegc.coursesync.features.asset.domain.model.RemoteFileDescriptor;
import uk.gegc.coursesync.features.asset.domain.model.ResolvedAsset;
import uk.gegc.coursesync.shared.exception.AmbiguousReferenceException;
import uk.gegc.coursesync.shared.exception.UnresolvedReferenceException;
import uk.gegc.coursesync.testsupport.CourseTreeFixture;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AssetRegistry Tests")
class AssetRegistryTest extends BaseUnitTest {

    @TempDir
    Path courseRoot;

    private CourseTreeFixture fixture;
    private AssetRegistry registry;
    private AtomicInteger uploads;
    private AssetUploader uploader;

    @BeforeEach
    void setUp() {
        fixture = new CourseTreeFixture(courseRoot);
        registry = new AssetRegistry(new AssetReferenceResolver(courseRoot, "assets"), 12, TestComponents.FIXED_CLOCK);
        uploads = new AtomicInteger();
        uploader = (asset, content) -> {
            int id = uploads.incrementAndGet();
            return new RemoteFileDescriptor(String.valueOf(id), "https://lms.example/files/" + id);
        };
    }

    @Test
    @DisplayName("ensureUploaded: same bytes reached by different spellings upload once")
    void ensureUploaded_sameBytesDifferentReferences_singleUpload() {
        // Given
        byte[] png = "png-bytes".getBytes(StandardCharsets.UTF_8);
        fixture.bytes("assets/images/diagram.png", png);
        Path itemA = fixture.item("01-Intro.module", "01-welcome.page", java.util.Map.of("name", "Welcome"), "x");
        Path itemB = fixture.item("01-Intro.module", "02-more.page", java.util.Map.of("name", "More"), "y");
        fixture.bytes("content/01-Intro.module/02-more.page/copy.png", png);

        // When
        RemoteFileDescriptor first = registry.ensureUploaded(registry.resolve("diagram.png", itemA), uploader);
        RemoteFileDescriptor second = registry.ensureUploaded(registry.resolve("/assets/images/diagram.png", itemA), uploader);
        RemoteFileDescriptor third = registry.ensureUploaded(registry.resolve("copy.png", itemB), uploader);

        // Then
        assertThat(uploads.get()).isEqualTo(1);
        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        assertThat(registry.records()).hasSize(1);
        AssetRecord record = registry.records().values().iterator().next();
        assertThat(record.getLocalPaths()).containsExactlyInAnyOrder(
                "assets/images/diagram.png", "content/01-Intro.module/02-more.page/copy.png");
        assertThat(record.getUploadedAt()).isEqualTo(TestComponents.FIXED_CLOCK.instant());
    }

    @Test
    @DisplayName("resolve: literal percent sign in a filename resolves to that file")
    void resolve_percentInName_literalFile() {
        // Given
        fixture.bytes("assets/charts/growth%.png", new byte[]{1, 2});

        // When
        ResolvedAsset bare = registry.resolve("growth%.png", courseRoot);
        ResolvedAsset encoded = registry.resolve("/assets/charts/growth%25.png", courseRoot);

        // Then
        assertThat(bare.relativePath()).isEqualTo("assets/charts/growth%.png");
        assertThat(encoded.file()).isEqualTo(bare.file());
    }

    @Test
    @DisplayName("ensureUploaded: changed bytes at the same path upload again and keep the old record")
    void ensureUploaded_contentChanged_newUploadOldRecordKept() throws Exception {
        // Given
        fixture.file("assets/notes.pdf", "version 1");
        ResolvedAsset asset = registry.resolve("notes.pdf", courseRoot);
        RemoteFileDescriptor before = registry.ensureUploaded(asset, uploader);

        // When
        Files.writeString(courseRoot.resolve("assets/notes.pdf"), "version 2");
        RemoteFileDescriptor after = registry.ensureUploaded(registry.resolve("notes.pdf", courseRoot), uploader);

        // Then
        assertThat(uploads.get()).isEqualTo(2);
        assertThat(after.remoteId()).isNotEqualTo(before.remoteId());
        assertThat(registry.records()).hasSize(2);
        assertThat(registry.findByPath("assets/notes.pdf")).map(AssetRecord::getRemoteId).contains(after.remoteId());
        assertThat(registry.findByRemoteId(before.remoteId())).isPresent();
    }

    @Test
    @DisplayName("resolve: bare filename found twice in shared assets is ambiguous")
    void resolve_bareFilenameTwoMatches_ambiguous() {
        // Given
        fixture.file("assets/week1/logo.png", "one");
        fixture.file("assets/week2/logo.png", "two");

        // When & Then
        assertThatThrownBy(() -> registry.resolve("logo.png", courseRoot))
                .isInstanceOf(AmbiguousReferenceException.class)
                .satisfies(ex -> assertThat(((AmbiguousReferenceException) ex).getCandidates())
                        .containsExactly("assets/week1/logo.png", "assets/week2/logo.png"));
        assertThat(uploads.get()).isZero();
    }

    @Test
    @DisplayName("resolve: file next to the item wins over shared assets")
    void resolve_localFile_winsOverSharedAsset() {
        // Given
        Path item = fixture.item(null, "intro.page", java.util.Map.of("name", "Intro"), "x");
        fixture.file("content/intro.page/logo.png", "local");
        fixture.file("assets/week1/logo.png", "one");
        fixture.file("assets/week2/logo.png", "two");

        // When
        ResolvedAsset asset = registry.resolve("./logo.png", item);

        // Then
        assertThat(asset.relativePath()).isEqualTo("content/intro.page/logo.png");
    }

    @Test
    @DisplayName("resolve: missing or external references are unresolved")
    void resolve_missingOrExternal_unresolved() {
        assertThatThrownBy(() -> registry.resolve("nothing.png", courseRoot))
                .isInstanceOf(UnresolvedReferenceException.class);
        assertThatThrownBy(() -> registry.resolve("https://example.com/a.png", courseRoot))
                .isInstanceOf(UnresolvedReferenceException.class);
        assertThatThrownBy(() -> registry.resolve("../../etc/passwd", courseRoot))
                .isInstanceOf(UnresolvedReferenceException.class);
    }

    @Test
    @DisplayName("ensureUploaded: failed upload leaves no record")
    void ensureUploaded_uploaderThrows_noRecord() {
        // Given
        fixture.file("assets/a.txt", "a");
        ResolvedAsset asset = registry.resolve("a.txt", courseRoot);

        // When & Then
        assertThatThrownBy(() -> registry.ensureUploaded(asset, (a, c) -> {
            throw new IllegalStateException("network down");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(registry.records()).isEmpty();
        assertThat(registry.findByPath("assets/a.txt")).isEmpty();
    }

    @Test
    @DisplayName("prune: records without an existing path are removed")
    void prune_missingPaths_recordsRemoved() {
        // Given
        fixture.file("assets/keep.txt", "keep");
        fixture.file("assets/drop.txt", "drop");
        registry.ensureUploaded(registry.resolve("keep.txt", courseRoot), uploader);
        registry.ensureUploaded(registry.resolve("drop.txt", courseRoot), uploader);

        // When
        int removed = registry.prune(List.of("assets/keep.txt"));

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(registry.records()).hasSize(1);
        assertThat(registry.findByPath("assets/drop.txt")).isEmpty();
        assertThat(registry.stats().paths()).isEqualTo(1);
    }

    @Test
    @DisplayName("register: known remote file is found by remote id and local path")
    void register_downloadedFile_lookupsWork() {
        // When
        registry.register("assets/slides.pdf", "pdf".getBytes(StandardCharsets.UTF_8),
                new RemoteFileDescriptor("77", "https://lms.example/files/77"), "slides.pdf");

        // Then
        assertThat(registry.localPathFor("77")).contains("assets/slides.pdf");
        assertThat(registry.findByPath("assets/slides.pdf")).map(AssetRecord::getFilename).contains("slides.pdf");
        assertThat(registry.localPathFor("78")).isEmpty();
    }

    @Test
    @DisplayName("remoteLocatorFor: empty until uploaded")
    void remoteLocatorFor_notUploaded_empty() {
        // Given
        fixture.file("assets/a.txt", "a");

        // When & Then
        assertThat(registry.remoteLocatorFor("a.txt", courseRoot)).isEmpty();
        registry.ensureUploaded(registry.resolve("a.txt", courseRoot), uploader);
        assertThat(registry.remoteLocatorFor("a.txt", courseRoot)).contains("https://lms.example/files/1");
    }
}
