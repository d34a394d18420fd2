package uk.gegc.coursesync.features.course.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordering rules for items inside a module and for modules inside a course.
 * <ul>
 *     <li>items: explicit position tag, then numeric name prefix, then lexical</li>
 *     <li>modules: explicit ordering list, then numeric name prefix, then lexical</li>
 * </ul>
 */
public final class ItemOrdering {

    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^(\\d+)[-_ .]");

    private ItemOrdering() {
    }

    public static OptionalInt numericPrefix(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = NUMERIC_PREFIX.matcher(name);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    public static String stripNumericPrefix(String name) {
        if (name == null) {
            return null;
        }
        Matcher matcher = NUMERIC_PREFIX.matcher(name);
        return matcher.find() ? name.substring(matcher.end()).trim() : name;
    }

    /**
     * Sort key of one item in one module.
     */
    public record ItemKey(Integer position, String name) {
    }

    /**
     * The effective number is the position tag when present, else the numeric name prefix. Items without
     * either sort after all numbered items. A position tag wins a tie against a prefix.
     */
    public static Comparator<ItemKey> itemOrder() {
        return Comparator
                .comparingInt(ItemOrdering::effectiveNumber)
                .thenComparingInt((ItemKey key) -> key.position() != null ? 0 : 1)
                .thenComparing(key -> key.name() == null ? "" : key.name());
    }

    private static int effectiveNumber(ItemKey key) {
        if (key.position() != null) {
            return key.position();
        }
        return numericPrefix(key.name()).orElse(Integer.MAX_VALUE);
    }

    /**
     * @param explicitOrder module titles from the ordering file, may be empty
     * @param folderNames   module title to folder name, for the numeric prefix fallback
     */
    public static Comparator<String> moduleOrder(List<String> explicitOrder, Map<String, String> folderNames) {
        return Comparator
                .comparingInt((String title) -> {
                    int index = explicitOrder.indexOf(title);
                    return index >= 0 ? index : explicitOrder.size();
                })
                .thenComparingInt(title -> numericPrefix(folderNames.getOrDefault(title, title))
                        .orElse(Integer.MAX_VALUE))
                .thenComparing(Comparator.naturalOrder());
    }
}
