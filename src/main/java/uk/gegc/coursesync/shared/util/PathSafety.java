package uk.gegc.coursesync.shared.util;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Pure predicates over archive member names and output paths.
 */
public final class PathSafety {

    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:.*");

    private PathSafety() {
    }

    /**
     * A member name is safe when it is relative, has no parent segments and no NUL bytes.
     */
    public static boolean isSafeMemberName(String name) {
        if (name == null || name.isBlank() || name.indexOf('\0') >= 0) {
            return false;
        }
        String normalized = name.replace('\\', '/');
        if (normalized.startsWith("/") || WINDOWS_DRIVE.matcher(normalized).matches()) {
            return false;
        }
        for (String segment : normalized.split("/")) {
            if ("..".equals(segment)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isWithin(Path root, Path candidate) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        return candidate.toAbsolutePath().normalize().startsWith(normalizedRoot);
    }
}
