package uk.gegc.coursesync.features.sync.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.canvas.domain.model.PublishResult;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.features.include.domain.model.IncludeCandidate;
import uk.gegc.coursesync.features.sync.domain.model.ImportSummary;
import uk.gegc.coursesync.features.sync.domain.model.SyncResult;
import uk.gegc.coursesync.shared.exception.ValidationException;
import uk.gegc.coursesync.shared.run.RunReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("CourseSyncCommandRunner Tests")
class CourseSyncCommandRunnerTest extends BaseUnitTest {

    @Mock
    private CourseExportService exportService;

    @Mock
    private CourseImportService importService;

    @Mock
    private SyncPipeline syncPipeline;

    @Mock
    private IncludeSuggestionService includeSuggestionService;

    @InjectMocks
    private CourseSyncCommandRunner runner;

    @Nested
    @DisplayName("CommandLine.parse")
    class Parse {

        @Test
        @DisplayName("parse: command, positionals and options separated")
        void parse_mixedArguments_split() {
            // When
            CourseSyncCommandRunner.CommandLine command =
                    CourseSyncCommandRunner.CommandLine.parse("import", "course.imscc", "--into", "out", "--template", "plain");

            // Then
            assertThat(command.name()).isEqualTo("import");
            assertThat(command.positionals()).containsExactly("course.imscc");
            assertThat(command.options()).containsOnly(Map.entry("into", "out"), Map.entry("template", "plain"));
        }

        @Test
        @DisplayName("parse: Spring style --name=value arguments ignored")
        void parse_springArguments_ignored() {
            // When
            CourseSyncCommandRunner.CommandLine command =
                    CourseSyncCommandRunner.CommandLine.parse("--spring.profiles.active=dev", "sync", "bio");

            // Then
            assertThat(command.name()).isEqualTo("sync");
            assertThat(command.positionals()).containsExactly("bio");
            assertThat(command.options()).isEmpty();
        }

        @Test
        @DisplayName("parse: no words means no command")
        void parse_noWords_null() {
            assertThat(CourseSyncCommandRunner.CommandLine.parse("--logging.level.root=INFO")).isNull();
            assertThat(CourseSyncCommandRunner.CommandLine.parse()).isNull();
        }

        @Test
        @DisplayName("parse: trailing option without value rejected")
        void parse_optionWithoutValue_throws() {
            // When & Then
            assertThatThrownBy(() -> CourseSyncCommandRunner.CommandLine.parse("export", "bio", "--out"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("--out needs a value");
        }

        @Test
        @DisplayName("positional: missing positional named in the error")
        void positional_missing_throws() {
            // Given
            CourseSyncCommandRunner.CommandLine command = CourseSyncCommandRunner.CommandLine.parse("export");

            // When & Then
            assertThatThrownBy(() -> command.positional(0, "course directory"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("export needs a course directory");
        }
    }

    @Test
    @DisplayName("run: export dispatched with the requested archive")
    void run_export_dispatched() {
        // Given
        when(exportService.export(Path.of("bio"), Path.of("out.imscc")))
                .thenReturn(new ExportResult(Path.of("out.imscc"), List.of(), 0, 0));

        // When
        runner.run("export", "bio", "--out", "out.imscc");

        // Then
        verify(exportService).export(Path.of("bio"), Path.of("out.imscc"));
    }

    @Test
    @DisplayName("run: import dispatched with target and template set")
    void run_import_dispatched() {
        // Given
        when(importService.importCourse("42", Path.of("out"), "plain"))
                .thenReturn(new ImportSummary(Path.of("out"), 1, 0, 0, 0, new RunReport("import")));

        // When
        runner.run("import", "42", "--into", "out", "--template", "plain");

        // Then
        verify(importService).importCourse("42", Path.of("out"), "plain");
    }

    @Test
    @DisplayName("run: sync passes the course id override")
    void run_syncWithCourseId_overridePassed() {
        // Given
        when(syncPipeline.sync(Path.of("bio"), 7L)).thenReturn(new SyncResult(new PublishResult(Map.of(), 1, 0),
                null, 1, 0, new RunReport("sync")));

        // When
        runner.run("sync", "bio", "--course-id", "7");

        // Then
        verify(syncPipeline).sync(Path.of("bio"), 7L);
    }

    @Test
    @DisplayName("run: sync without override uses the course file id")
    void run_syncWithoutCourseId_nullOverride() {
        // Given
        when(syncPipeline.sync(eq(Path.of("bio")), isNull())).thenReturn(new SyncResult(
                new PublishResult(Map.of(), 0, 2), null, 2, 0, new RunReport("sync")));

        // When
        runner.run("sync", "bio");

        // Then
        verify(syncPipeline).sync(eq(Path.of("bio")), isNull());
    }

    @Test
    @DisplayName("run: suggest-includes dispatched with the course directory")
    void run_suggestIncludes_dispatched() {
        // Given
        when(includeSuggestionService.suggest(Path.of("bio"))).thenReturn(List.of(
                new IncludeCandidate("late-policy", "Late work loses ten percent per day.", List.of("a/index.md", "b/index.md"))));

        // When
        runner.run("suggest-includes", "bio");

        // Then
        verify(includeSuggestionService).suggest(Path.of("bio"));
        verifyNoInteractions(syncPipeline, exportService, importService);
    }

    @Test
    @DisplayName("run: non-numeric course id rejected")
    void run_nonNumericCourseId_throws() {
        // When & Then
        assertThatThrownBy(() -> runner.run("sync", "bio", "--course-id", "abc"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("--course-id must be numeric");
        verifyNoInteractions(syncPipeline);
    }

    @Test
    @DisplayName("run: unknown command rejected")
    void run_unknownCommand_throws() {
        // When & Then
        assertThatThrownBy(() -> runner.run("publish", "bio"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown command 'publish'");
    }

    @Test
    @DisplayName("run: no command does nothing")
    void run_noCommand_noop() {
        // When
        runner.run("--server.port=0");

        // Then
        verifyNoInteractions(exportService, importService, syncPipeline);
    }
}
