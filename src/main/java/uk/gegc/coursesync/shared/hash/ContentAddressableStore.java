package uk.gegc.coursesync.shared.hash;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Records keyed by the digest of their content. The first value seen under a key creates the record,
 * every later value with the same content returns that record. Records are never merged across keys
 * and never replaced once stored.
 * <p>
 * Creation is atomic per key: concurrent callers presenting the same content see exactly one invocation
 * of the factory, callers with different keys do not block each other.
 *
 * @param <T> content type the digester understands
 * @param <R> record type stored per key
 */
public class ContentAddressableStore<T, R> {

    private final ContentDigester<T> digester;
    private final ConcurrentMap<String, R> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    public ContentAddressableStore(ContentDigester<T> digester) {
        this.digester = digester;
    }

    public String keyOf(T content) {
        return digester.digest(content);
    }

    /**
     * Returns the record for {@code key}, creating it with {@code factory} when absent.
     * A factory that throws leaves the key absent; the exception propagates unchanged.
     */
    public R computeIfAbsent(String key, Function<String, R> factory) {
        R existing = records.get(key);
        if (existing != null) {
            return existing;
        }
        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            existing = records.get(key);
            if (existing != null) {
                return existing;
            }
            R created = factory.apply(key);
            if (created == null) {
                throw new IllegalStateException("Factory returned null for key " + key);
            }
            records.put(key, created);
            return created;
        }
    }

    public R intern(T content, Function<String, R> factory) {
        return computeIfAbsent(keyOf(content), factory);
    }

    public Optional<R> find(String key) {
        return Optional.ofNullable(records.get(key));
    }

    public boolean contains(String key) {
        return records.containsKey(key);
    }

    /**
     * Puts back a record loaded from durable storage.
     */
    public void restore(String key, R record) {
        records.put(key, record);
    }

    public boolean remove(String key) {
        locks.remove(key);
        return records.remove(key) != null;
    }

    public int size() {
        return records.size();
    }

    /**
     * Stable, key-ordered view for persistence and reporting.
     */
    public Map<String, R> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }
}
