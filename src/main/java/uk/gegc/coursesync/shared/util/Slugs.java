package uk.gegc.coursesync.shared.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Slug and filename helpers used wherever a title becomes a path segment.
 */
public final class Slugs {

    private static final int MAX_SLUG_LENGTH = 60;

    private Slugs() {
    }

    /**
     * Lowercase, ASCII, hyphen separated. Falls back to {@code fallback} when nothing usable remains.
     */
    public static String slugify(String title, String fallback) {
        if (title == null) {
            return fallback;
        }
        String ascii = Normalizer.normalize(title, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s-]", "")
                .trim()
                .replaceAll("[\\s_-]+", "-");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? fallback : slug;
    }

    /**
     * Keeps readable characters of a title while removing those that are invalid in file names.
     */
    public static String sanitizeFilename(String name) {
        if (name == null) {
            return "untitled";
        }
        String cleaned = name.replaceAll("[<>:\"/\\\\|?*\\x00-\\x1f]", "")
                .replaceAll("\\s+", " ")
                .trim()
                .replaceAll("^\\.+|\\.+$", "");
        if (cleaned.length() > 100) {
            cleaned = cleaned.substring(0, 100).trim();
        }
        return cleaned.isEmpty() ? "untitled" : cleaned;
    }

    /**
     * Appends {@code _2}, {@code _3}... until the slug is not in {@code taken}.
     */
    public static String unique(String slug, Set<String> taken) {
        if (!taken.contains(slug)) {
            return slug;
        }
        int counter = 2;
        while (taken.contains(slug + "_" + counter)) {
            counter++;
        }
        return slug + "_" + counter;
    }
}
