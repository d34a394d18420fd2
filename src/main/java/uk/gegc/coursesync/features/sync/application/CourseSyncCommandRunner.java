package uk.gegc.coursesync.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.ExportResult;
import uk.gegc.coursesync.features.include.domain.model.IncludeCandidate;
import uk.gegc.coursesync.features.sync.domain.model.ImportSummary;
import uk.gegc.coursesync.features.sync.domain.model.SyncResult;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches {@code export <course> [--out file]}, {@code import <archive|course-id> [--into dir]
 * [--template set]}, {@code sync <course> [--course-id id]} and {@code suggest-includes <course>}. Spring's own {@code --name=value}
 * arguments are ignored; without a command nothing runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CourseSyncCommandRunner implements CommandLineRunner {

    private static final String COMMANDS = "export, import, sync, suggest-includes";

    private final CourseExportService exportService;
    private final CourseImportService importService;
    private final SyncPipeline syncPipeline;
    private final IncludeSuggestionService includeSuggestionService;

    @Override
    public void run(String... args) {
        CommandLine command = CommandLine.parse(args);
        if (command == null) {
            log.info("No command given; expected one of: {}", COMMANDS);
            return;
        }
        switch (command.name()) {
            case "export" -> {
                Path course = Path.of(command.positional(0, "course directory"));
                Path out = Path.of(command.option("out", course.toAbsolutePath().normalize().getFileName() + ".imscc"));
                ExportResult result = exportService.export(course, out);
                log.info("Wrote {} ({} items, {} assets)", result.archive(), result.items(), result.assets());
            }
            case "import" -> {
                String source = command.positional(0, "archive or course id");
                Path into = Path.of(command.option("into", "."));
                ImportSummary summary = importService.importCourse(source, into, command.option("template", null));
                log.info("Imported {} items into {}", summary.items(), summary.targetRoot());
            }
            case "sync" -> {
                Path course = Path.of(command.positional(0, "course directory"));
                String courseId = command.option("course-id", null);
                SyncResult result = syncPipeline.sync(course, courseId == null ? null : parseId(courseId));
                log.info("Synced {} items: {} created, {} updated", result.renderedItems(),
                        result.publishResult().created(), result.publishResult().updated());
            }
            case "suggest-includes" -> {
                Path course = Path.of(command.positional(0, "course directory"));
                List<IncludeCandidate> candidates = includeSuggestionService.suggest(course);
                log.info("{} shared include candidates; no files were modified", candidates.size());
            }
            default -> throw new ValidationException("unknown command '" + command.name()
                    + "', expected one of: " + COMMANDS);
        }
    }

    private static long parseId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new ValidationException("--course-id must be numeric, got '" + value + "'");
        }
    }

    record CommandLine(String name, List<String> positionals, Map<String, String> options) {

        static CommandLine parse(String... args) {
            List<String> words = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--") && arg.contains("=")) {
                    continue;
                }
                if (arg.startsWith("--")) {
                    if (i + 1 >= args.length) {
                        throw new ValidationException("option " + arg + " needs a value");
                    }
                    options.put(arg.substring(2), args[++i]);
                } else {
                    words.add(arg);
                }
            }
            if (words.isEmpty()) {
                return null;
            }
            return new CommandLine(words.get(0), List.copyOf(words.subList(1, words.size())), options);
        }

        String positional(int index, String description) {
            if (index >= positionals.size()) {
                throw new ValidationException(name + " needs a " + description);
            }
            return positionals.get(index);
        }

        String option(String key, String defaultValue) {
            return options.getOrDefault(key, defaultValue);
        }
    }
}
