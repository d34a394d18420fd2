package uk.gegc.coursesync.shared.run;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything a run skipped or warned about, plus simple counters. Nothing is dropped without an entry
 * here; the summary is logged when the run ends.
 */
@Slf4j
public class RunReport {

    public record Entry(String subject, String message) {
    }

    private final String runName;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private final List<Entry> skippedItems = Collections.synchronizedList(new ArrayList<>());
    private final List<Entry> skippedResources = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    public RunReport(String runName) {
        this.runName = runName;
    }

    public void warn(String message) {
        log.warn("[{}] {}", runName, message);
        warnings.add(message);
    }

    public void skipItem(String subject, String reason) {
        log.warn("[{}] Skipped item {}: {}", runName, subject, reason);
        skippedItems.add(new Entry(subject, reason));
    }

    public void skipResource(String resourceId, String reason) {
        log.warn("[{}] Skipped resource {}: {}", runName, resourceId, reason);
        skippedResources.add(new Entry(resourceId, reason));
    }

    public void increment(String counter) {
        counters.computeIfAbsent(counter, k -> new AtomicInteger()).incrementAndGet();
    }

    public int count(String counter) {
        AtomicInteger value = counters.get(counter);
        return value == null ? 0 : value.get();
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    public List<Entry> getSkippedItems() {
        synchronized (skippedItems) {
            return List.copyOf(skippedItems);
        }
    }

    public List<Entry> getSkippedResources() {
        synchronized (skippedResources) {
            return List.copyOf(skippedResources);
        }
    }

    public Map<String, Integer> getCounters() {
        Map<String, Integer> snapshot = new TreeMap<>();
        counters.forEach((k, v) -> snapshot.put(k, v.get()));
        return snapshot;
    }

    public String getRunName() {
        return runName;
    }

    public boolean isClean() {
        return warnings.isEmpty() && skippedItems.isEmpty() && skippedResources.isEmpty();
    }

    public void logSummary() {
        log.info("[{}] Finished - counters: {}, warnings: {}, skipped items: {}, skipped resources: {}",
                runName, getCounters(), warnings.size(), skippedItems.size(), skippedResources.size());
        getSkippedResources().forEach(e -> log.info("[{}]   skipped resource {} - {}", runName, e.subject(), e.message()));
        getSkippedItems().forEach(e -> log.info("[{}]   skipped item {} - {}", runName, e.subject(), e.message()));
    }
}
