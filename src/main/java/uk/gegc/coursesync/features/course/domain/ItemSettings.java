package uk.gegc.coursesync.features.course.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed read access over loosely typed item settings: author front matter, or the key/value pairs
 * decoded from a package settings file. Both sources use the same keys.
 */
public final class ItemSettings {

    private final Map<String, Object> values;

    public ItemSettings(Map<String, ?> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ItemSettings empty() {
        return new ItemSettings(Map.of());
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public String string(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public Integer integer(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = string(key);
        if (text == null) {
            return null;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting '" + key + "' is not a number: " + text, ex);
        }
    }

    public Double decimal(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = string(key);
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting '" + key + "' is not a number: " + text, ex);
        }
    }

    public boolean bool(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = string(key);
        if (text == null) {
            return defaultValue;
        }
        return switch (text.toLowerCase()) {
            case "true", "yes", "1", "on" -> true;
            case "false", "no", "0", "off" -> false;
            default -> defaultValue;
        };
    }

    /**
     * Accepts a YAML list or a comma separated string.
     */
    public List<String> stringList(String key) {
        Object value = values.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null && !element.toString().isBlank()) {
                    result.add(element.toString().trim());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> mapList(String key) {
        Object value = values.get(key);
        List<Map<String, Object>> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?> map) {
                    result.add((Map<String, Object>) map);
                }
            }
        }
        return result;
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
