package uk.gegc.coursesync.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.include.application.IncludeSuggester;
import uk.gegc.coursesync.features.include.domain.model.IncludeCandidate;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContentLoader;
import uk.gegc.coursesync.features.source.application.CourseSourceReader;
import uk.gegc.coursesync.shared.run.RunCache;
import uk.gegc.coursesync.shared.run.RunReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Reports prose blocks worth turning into shared includes. The course tree is only read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncludeSuggestionService {

    private final CourseSourceReader sourceReader;
    private final IncludeSuggester includeSuggester;

    public List<IncludeCandidate> suggest(Path courseRoot) {
        Path root = courseRoot.toAbsolutePath().normalize();
        RunReport report = new RunReport("suggest-includes");
        RunCache cache = new RunCache();
        try {
            CourseModel model = sourceReader.read(root, report, cache);
            List<IncludeCandidate> candidates = includeSuggester.suggest(model);
            logCandidates(candidates);
            return candidates;
        } finally {
            cache.clear();
            report.logSummary();
        }
    }

    private void logCandidates(List<IncludeCandidate> candidates) {
        if (candidates.isEmpty()) {
            log.info("No repeated prose blocks found ({}+ chars in {}+ items, or {}+ chars in {}+ items)",
                    IncludeSuggester.MIN_CHARS_LOW, IncludeSuggester.MIN_FILES_LOW,
                    IncludeSuggester.MIN_CHARS_HIGH, IncludeSuggester.MIN_FILES_HIGH);
            return;
        }
        log.info("Shared include candidates: {}", candidates.size());
        for (IncludeCandidate candidate : candidates) {
            log.info("{}: {} items, {} chars, extract to {}/{}.md as {{include:{}}}", candidate.slug(),
                    candidate.files().size(), candidate.charCount(), SharedContentLoader.SHARED_DIR,
                    candidate.slug(), candidate.slug());
            candidate.files().forEach(file -> log.info("    {}", file));
            log.info("    \"{}\"", candidate.preview());
        }
    }
}
