package uk.gegc.coursesync.shared.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Derived values of one run (parsed front matter, expanded bodies, loaded templates). Lives in memory
 * only and is discarded with the run; {@link #dump} writes it out for debugging.
 */
@Slf4j
public class RunCache {

    private final ConcurrentMap<String, ConcurrentMap<String, Object>> namespaces = new ConcurrentHashMap<>();

    public void put(String namespace, String key, Object value) {
        namespace(namespace).put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String namespace, String key) {
        return (T) namespace(namespace).get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(String namespace, String key, Function<String, T> loader) {
        return (T) namespace(namespace).computeIfAbsent(key, loader);
    }

    public int size(String namespace) {
        return namespace(namespace).size();
    }

    public void clear() {
        namespaces.clear();
    }

    public void dump(Path file, ObjectMapper objectMapper) {
        Map<String, Map<String, String>> view = new TreeMap<>();
        namespaces.forEach((ns, values) -> {
            Map<String, String> entries = new TreeMap<>();
            values.forEach((k, v) -> entries.put(k, String.valueOf(v)));
            view.put(ns, entries);
        });
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), view);
            log.info("Dumped run cache ({} namespaces) to {}", view.size(), file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to dump run cache to " + file, ex);
        }
    }

    private ConcurrentMap<String, Object> namespace(String name) {
        return namespaces.computeIfAbsent(name, k -> new ConcurrentHashMap<>());
    }
}
