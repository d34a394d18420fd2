package uk.gegc.coursesync.shared.hash;

/**
 * Derives the content key of a value. Two values with the same normalized content must produce the same key.
 *
 * @param <T> type of value being keyed
 */
@FunctionalInterface
public interface ContentDigester<T> {

    String digest(T value);
}
