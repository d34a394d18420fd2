package uk.gegc.coursesync.features.include.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.model.Assignment;
import uk.gegc.coursesync.features.course.domain.model.ContentItem;
import uk.gegc.coursesync.features.course.domain.model.CourseModel;
import uk.gegc.coursesync.features.course.domain.model.Page;
import uk.gegc.coursesync.features.include.domain.model.IncludeCandidate;
import uk.gegc.coursesync.features.source.domain.CourseLayout;
import uk.gegc.coursesync.shared.hash.ContentAddressableStore;
import uk.gegc.coursesync.shared.hash.Digests;
import uk.gegc.coursesync.shared.util.Slugs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds paragraphs repeated verbatim across page and assignment bodies that could become
 * {@code {{include:name}}} fragments. Read-only: nothing in the model or on disk changes.
 * <p>
 * A block qualifies with {@value #MIN_CHARS_LOW}+ characters in {@value #MIN_FILES_LOW}+ items, or
 * {@value #MIN_CHARS_HIGH}+ characters in {@value #MIN_FILES_HIGH}+ items. Blocks are keyed through a
 * {@link ContentAddressableStore} over a SHA-256 prefix of their text.
 */
@Slf4j
@Component
public class IncludeSuggester {

    public static final int MIN_CHARS_LOW = 200;
    public static final int MIN_FILES_LOW = 3;
    public static final int MIN_CHARS_HIGH = 400;
    public static final int MIN_FILES_HIGH = 2;
    public static final int KEY_LENGTH = 16;

    static final String FALLBACK_SLUG = "shared-block";
    private static final int MAX_SLUG_LENGTH = 40;
    private static final int SHORT_INCLUDE_LENGTH = 80;

    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s.*");
    private static final Pattern MARKDOWN_MARKS = Pattern.compile("[*_`#>\\[\\]()]");

    public List<IncludeCandidate> suggest(CourseModel model) {
        ContentAddressableStore<String, BlockUsage> store =
                new ContentAddressableStore<>(text -> Digests.sha256Hex(text).substring(0, KEY_LENGTH));

        Stream.concat(model.itemsOf(Page.class).stream(), model.itemsOf(Assignment.class).stream())
                .forEach(item -> {
                    String file = indexFileOf(item);
                    for (String block : blocks(item.getBody())) {
                        store.intern(block, k -> new BlockUsage(block)).files.add(file);
                    }
                });

        List<BlockUsage> qualifying = store.snapshot().values().stream()
                .filter(IncludeSuggester::qualifies)
                .sorted(Comparator.comparingInt((BlockUsage u) -> u.files.size()).reversed()
                        .thenComparing(Comparator.comparingInt((BlockUsage u) -> u.text.length()).reversed())
                        .thenComparing(u -> u.files.first()))
                .toList();

        Set<String> taken = new HashSet<>();
        List<IncludeCandidate> candidates = new ArrayList<>();
        for (BlockUsage usage : qualifying) {
            String slug = Slugs.unique(slugOf(usage.text), taken);
            taken.add(slug);
            candidates.add(new IncludeCandidate(slug, usage.text, new ArrayList<>(usage.files)));
        }
        log.debug("Scanned {} distinct blocks, {} include candidates", store.size(), candidates.size());
        return candidates;
    }

    /**
     * Paragraphs split on blank lines with trailing spaces dropped per line. Single-line headings and
     * short blocks that already use an include are not candidates.
     */
    static List<String> blocks(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        List<String> blocks = new ArrayList<>();
        for (String raw : BLANK_LINE.split(body.replace("\r\n", "\n"))) {
            String block = raw.strip();
            if (block.isEmpty()) {
                continue;
            }
            if (!block.contains("\n") && HEADING.matcher(block).matches()) {
                continue;
            }
            if (block.contains("{{include:") && block.length() < SHORT_INCLUDE_LENGTH) {
                continue;
            }
            blocks.add(String.join("\n", block.lines().map(String::stripTrailing).toList()));
        }
        return blocks;
    }

    static String slugOf(String text) {
        String firstLine = text.lines().findFirst().orElse("");
        String clean = MARKDOWN_MARKS.matcher(firstLine).replaceAll("").strip();
        String slug = Slugs.slugify(clean, FALLBACK_SLUG);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    private static boolean qualifies(BlockUsage usage) {
        int chars = usage.text.length();
        int files = usage.files.size();
        return (chars >= MIN_CHARS_LOW && files >= MIN_FILES_LOW)
                || (chars >= MIN_CHARS_HIGH && files >= MIN_FILES_HIGH);
    }

    private static String indexFileOf(ContentItem item) {
        String source = item.getSourcePath() != null ? item.getSourcePath() : item.getId();
        return source + "/" + CourseLayout.INDEX_FILE;
    }

    private static final class BlockUsage {
        private final String text;
        private final TreeSet<String> files = new TreeSet<>();

        private BlockUsage(String text) {
            this.text = text;
        }
    }
}
