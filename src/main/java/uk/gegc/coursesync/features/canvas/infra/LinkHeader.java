package uk.gegc.coursesync.features.canvas.infra;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code rel="next"} target of an RFC 8288 Link header, which the platform uses for paging.
 */
final class LinkHeader {

    private static final Pattern LINK = Pattern.compile("<([^>]+)>\\s*;([^,]*)");
    private static final Pattern NEXT = Pattern.compile("rel\\s*=\\s*\"?next\"?");

    private LinkHeader() {
    }

    static Optional<String> next(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        Matcher m = LINK.matcher(header);
        while (m.find()) {
            if (NEXT.matcher(m.group(2)).find()) {
                return Optional.of(m.group(1).trim());
            }
        }
        return Optional.empty();
    }
}
