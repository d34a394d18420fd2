package uk.gegc.coursesync.features.include.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.include.domain.model.IncludeCandidate;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;
import uk.gegc.coursesync.testsupport.CourseTreeFixture;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncludeSuggester Tests")
class IncludeSuggesterTest extends BaseUnitTest {

    private static final String LATE_POLICY = "Late work policy: assignments submitted after the deadline lose ten percent"
            + " of the available points per day, up to five days, after which they receive no credit unless an"
            + " extension was arranged in advance.";

    private static final String INTEGRITY = "Academic integrity: all submitted work must be your own. Quote and cite"
            + " every source you use, including lecture notes, textbooks and web pages. Collaboration is encouraged"
            + " during study sessions, but each answer you hand in must be written by you alone.";

    private static final String ACCESSIBILITY = "Accessibility: if you need accommodations for any part of this"
            + " course, contact the accessibility office within the first two weeks of term. Materials are provided"
            + " in accessible formats on request, and recorded lectures include captions. Please tell the instructor"
            + " early so that arrangements for quizzes, labs and the final project can be made well in advance of"
            + " each deadline. Late requests may not be accommodated.";

    private final IncludeSuggester suggester = new IncludeSuggester();

    private static <T extends ContentItem> T item(T item, String folder, String body) {
        item.setSourcePath("content/" + folder);
        item.setBody(body);
        return item;
    }

    @Test
    @DisplayName("suggest: long blocks in two items and shorter blocks in three items reported, most widespread first")
    void suggest_repeatedBlocks_thresholdsApplied() {
        // Given
        CourseModel model = new CourseModel("Biology 101");
        model.addItem(item(new Page("p1", "Week 1"), "w1.page", "# Week 1\n\n" + LATE_POLICY + "\n\n" + INTEGRITY));
        model.addItem(item(new Page("p2", "Week 2"), "w2.page", LATE_POLICY + "\n\n" + INTEGRITY + "\n\n" + ACCESSIBILITY));
        model.addItem(item(new Page("p3", "Week 3"), "w3.page", "Intro\n\n" + LATE_POLICY));
        model.addItem(item(new Assignment("a1", "Essay"), "essay.assignment", "Write it.\n\n" + ACCESSIBILITY));

        // When
        List<IncludeCandidate> candidates = suggester.suggest(model);

        // Then
        assertThat(LATE_POLICY.length()).isBetween(IncludeSuggester.MIN_CHARS_LOW, IncludeSuggester.MIN_CHARS_HIGH - 1);
        assertThat(ACCESSIBILITY.length()).isGreaterThanOrEqualTo(IncludeSuggester.MIN_CHARS_HIGH);
        assertThat(candidates).extracting(IncludeCandidate::slug)
                .containsExactly("late-work-policy-assignments-submitted-a", "accessibility-if-you-need-accommodations");
        assertThat(candidates.get(0).files()).containsExactly(
                "content/w1.page/index.md", "content/w2.page/index.md", "content/w3.page/index.md");
        assertThat(candidates.get(1).files()).containsExactly(
                "content/essay.assignment/index.md", "content/w2.page/index.md");
        assertThat(candidates.get(1).preview()).hasSize(IncludeCandidate.PREVIEW_LENGTH + 3).endsWith("...");
    }

    @Test
    @DisplayName("suggest: blocks repeated only inside one item not reported")
    void suggest_repeatedWithinOneItem_ignored() {
        // Given
        CourseModel model = new CourseModel("Biology 101");
        model.addItem(item(new Page("p1", "Week 1"), "w1.page", ACCESSIBILITY + "\n\n" + ACCESSIBILITY));

        // When & Then
        assertThat(suggester.suggest(model)).isEmpty();
    }

    @Test
    @DisplayName("blocks: headings and short include lines dropped, trailing spaces trimmed")
    void blocks_markdownBody_filtered() {
        // When
        List<String> blocks = IncludeSuggester.blocks("## Overview\n\n{{include:policy}}\n\nFirst line   \nsecond line\r\n\r\n  \n");

        // Then
        assertThat(blocks).containsExactly("First line\nsecond line");
    }

    @Test
    @DisplayName("slugOf: markdown marks stripped, fallback when nothing usable remains")
    void slugOf_markdownFirstLine_slugified() {
        assertThat(IncludeSuggester.slugOf("**Note:** read this\nmore")).isEqualTo("note-read-this");
        assertThat(IncludeSuggester.slugOf("***")).isEqualTo(IncludeSuggester.FALLBACK_SLUG);
    }

    @Test
    @DisplayName("suggest: author tree read from disk reported without changing any file")
    void suggest_authorTree_filesUntouched(@TempDir Path root) throws Exception {
        // Given
        CourseTreeFixture tree = new CourseTreeFixture(root);
        tree.courseFile("course_name: Biology 101\n");
        Path first = tree.item("01-Week 1.module", "01-intro.page", Map.of("name", "Intro"), ACCESSIBILITY + "\n");
        tree.item("01-Week 1.module", "02-essay.assignment", Map.of("name", "Essay"), "Write it.\n\n" + ACCESSIBILITY + "\n");
        String before = Files.readString(first.resolve("index.md"));
        CourseModel model = TestComponents.sourceReader().read(root, new RunReport("test"), new RunCache());

        // When
        List<IncludeCandidate> candidates = suggester.suggest(model);

        // Then
        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.text()).isEqualTo(ACCESSIBILITY);
            assertThat(c.files()).containsExactly("content/01-Week 1.module/01-intro.page/index.md",
                    "content/01-Week 1.module/02-essay.assignment/index.md");
        });
        assertThat(Files.readString(first.resolve("index.md"))).isEqualTo(before);
        assertThat(root.resolve("shared")).doesNotExist();
    }
}
