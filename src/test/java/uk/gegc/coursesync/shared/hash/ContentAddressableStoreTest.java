package uk.gegc.coursesync.shared.hash;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.coursesync.BaseUnitTest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContentAddressableStore Tests")
class ContentAddressableStoreTest extends BaseUnitTest {

    private ContentAddressableStore<byte[], String> store;

    @BeforeEach
    void setUp() {
        store = new ContentAddressableStore<>(new ByteContentDigester(12));
    }

    @Test
    @DisplayName("intern: same bytes twice invoke the factory once")
    void intern_sameContentTwice_factoryInvokedOnce() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        byte[] content = "diagram".getBytes(StandardCharsets.UTF_8);

        // When
        String first = store.intern(content, key -> "record-" + calls.incrementAndGet());
        String second = store.intern(content.clone(), key -> "record-" + calls.incrementAndGet());

        // Then
        assertThat(first).isEqualTo("record-1");
        assertThat(second).isEqualTo("record-1");
        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("intern: different bytes produce separate records")
    void intern_differentContent_separateRecords() {
        // When
        store.intern("a".getBytes(StandardCharsets.UTF_8), key -> "A");
        store.intern("b".getBytes(StandardCharsets.UTF_8), key -> "B");

        // Then
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.snapshot().values()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    @DisplayName("computeIfAbsent: factory failure leaves key absent")
    void computeIfAbsent_factoryThrows_keyAbsent() {
        // Given
        String key = store.keyOf("x".getBytes(StandardCharsets.UTF_8));

        // When & Then
        assertThatThrownBy(() -> store.computeIfAbsent(key, k -> {
            throw new IllegalStateException("upload failed");
        })).isInstanceOf(IllegalStateException.class).hasMessage("upload failed");
        assertThat(store.contains(key)).isFalse();
        assertThat(store.computeIfAbsent(key, k -> "retry")).isEqualTo("retry");
    }

    @Test
    @DisplayName("computeIfAbsent: concurrent callers with the same key see one creation")
    void computeIfAbsent_concurrentSameKey_singleCreation() throws Exception {
        // Given
        byte[] content = "shared".getBytes(StandardCharsets.UTF_8);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<String>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return store.intern(content, key -> {
                        calls.incrementAndGet();
                        return key;
                    });
                }));
            }
            start.countDown();
            for (Future<String> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("remove: removed key can be created again")
    void remove_existingKey_canBeRecreated() {
        // Given
        String key = store.keyOf("y".getBytes(StandardCharsets.UTF_8));
        store.computeIfAbsent(key, k -> "first");

        // When
        boolean removed = store.remove(key);

        // Then
        assertThat(removed).isTrue();
        assertThat(store.find(key)).isEmpty();
        assertThat(store.computeIfAbsent(key, k -> "second")).isEqualTo("second");
    }

    @Test
    @DisplayName("ByteContentDigester: rejects key lengths outside 8..32")
    void byteDigester_invalidKeyLength_throws() {
        assertThatThrownBy(() -> new ByteContentDigester(4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ByteContentDigester(40)).isInstanceOf(IllegalArgumentException.class);
    }
}
