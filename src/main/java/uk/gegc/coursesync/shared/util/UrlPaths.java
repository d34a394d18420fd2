package uk.gegc.coursesync.shared.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

public final class UrlPaths {

    private UrlPaths() {
    }

    /**
     * Percent-decodes a path, keeping {@code +} literal. A path with a malformed escape such as
     * {@code growth%.png} is returned as written.
     */
    public static String decodePath(String path) {
        if (path == null || path.indexOf('%') < 0) {
            return path;
        }
        try {
            return URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return path;
        }
    }
}
