package crosspost.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;
import crosspost.testing.MutableClock;

@DisplayName("InMemoryKeyedStore")
class InMemoryKeyedStoreTest {

    private static final Duration WAIT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryKeyedStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        store = new InMemoryKeyedStore(clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private void put(String value, String... segments) {
        store.set(KeyPath.of(segments), value).await().atMost(WAIT);
    }

    private Optional<String> read(String... segments) {
        return store.get(KeyPath.of(segments)).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("get() / set()")
    class GetSetTests {

        @Test
        @DisplayName("should return empty for absent key")
        void shouldReturnEmptyForAbsentKey() {
            assertTrue(read("token", "missing").isEmpty());
        }

        @Test
        @DisplayName("should overwrite existing value")
        void shouldOverwriteExistingValue() {
            put("first", "token", "a");
            put("second", "token", "a");

            assertEquals(Optional.of("second"), read("token", "a"));
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("should hide entries once their TTL has passed")
        void shouldHideExpiredEntries() {
            store.set(KeyPath.of("auth", "s1"), "state", Optional.of(Duration.ofMinutes(10)))
                    .await()
                    .atMost(WAIT);

            clock.advance(Duration.ofMinutes(9));
            assertEquals(Optional.of("state"), read("auth", "s1"));

            clock.advance(Duration.ofMinutes(1));
            assertTrue(read("auth", "s1").isEmpty());
        }

        @Test
        @DisplayName("should treat delete of absent key as success")
        void shouldDeleteAbsentKey() {
            store.delete(KeyPath.of("token", "none")).await().atMost(WAIT);

            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("list()")
    class ListTests {

        @BeforeEach
        void seed() {
            put("1", "audit", "0001");
            put("2", "audit", "0002");
            put("3", "audit", "0003");
            put("x", "auditor", "0001");
            put("t", "token", "twitter", "u1");
        }

        @Test
        @DisplayName("should list entries under a prefix in key order")
        void shouldListInKeyOrder() {
            final var entries = store.list(KeyPath.of("audit"), ListOptions.defaults()).await().atMost(WAIT);

            assertEquals(List.of("1", "2", "3"), entries.stream().map(StoreEntry::value).toList());
            assertEquals(KeyPath.of("audit", "0001"), entries.get(0).key());
        }

        @Test
        @DisplayName("should not match keys that only share a textual prefix")
        void shouldNotCrossSegmentBoundary() {
            final var entries = store.list(KeyPath.of("audit"), ListOptions.defaults()).await().atMost(WAIT);

            assertFalse(entries.stream().anyMatch(e -> e.key().startsWith(KeyPath.of("auditor"))));
        }

        @Test
        @DisplayName("should list newest first with a limit")
        void shouldListReverseWithLimit() {
            final var entries = store.list(KeyPath.of("audit"), ListOptions.newestFirst(2)).await().atMost(WAIT);

            assertEquals(List.of("3", "2"), entries.stream().map(StoreEntry::value).toList());
        }

        @Test
        @DisplayName("should list everything under the root key")
        void shouldListEverythingUnderRoot() {
            final var entries = store.list(KeyPath.root(), ListOptions.defaults()).await().atMost(WAIT);

            assertEquals(5, entries.size());
        }

        @Test
        @DisplayName("should skip expired entries")
        void shouldSkipExpiredEntries() {
            store.set(KeyPath.of("audit", "0004"), "4", Optional.of(Duration.ofSeconds(5)))
                    .await()
                    .atMost(WAIT);
            clock.advance(Duration.ofSeconds(5));

            final var entries = store.list(KeyPath.of("audit"), ListOptions.newestFirst(1)).await().atMost(WAIT);

            assertEquals(List.of("3"), entries.stream().map(StoreEntry::value).toList());
        }
    }

    @Nested
    @DisplayName("getAndDelete()")
    class GetAndDeleteTests {

        @Test
        @DisplayName("should return value exactly once")
        void shouldReturnValueOnce() {
            put("state", "auth", "s1");

            assertEquals(Optional.of("state"), store.getAndDelete(KeyPath.of("auth", "s1")).await().atMost(WAIT));
            assertTrue(store.getAndDelete(KeyPath.of("auth", "s1")).await().atMost(WAIT).isEmpty());
        }

        @Test
        @DisplayName("should not return expired value")
        void shouldNotReturnExpiredValue() {
            store.set(KeyPath.of("auth", "s1"), "state", Optional.of(Duration.ofSeconds(1)))
                    .await()
                    .atMost(WAIT);
            clock.advance(Duration.ofSeconds(2));

            assertTrue(store.getAndDelete(KeyPath.of("auth", "s1")).await().atMost(WAIT).isEmpty());
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should hand the value to only one of many concurrent callers")
        void shouldHandValueToOneCaller() throws InterruptedException {
            put("state", "auth", "race");
            final var executor = Executors.newFixedThreadPool(8);
            final var start = new CountDownLatch(1);
            final var winners = new AtomicInteger();
            try {
                for (int i = 0; i < 16; i++) {
                    executor.submit(() -> {
                        start.await();
                        if (store.getAndDelete(KeyPath.of("auth", "race"))
                                .await()
                                .atMost(WAIT)
                                .isPresent()) {
                            winners.incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            }

            assertEquals(1, winners.get());
        }
    }

    @Nested
    @DisplayName("compareAndSet()")
    class CompareAndSetTests {

        @Test
        @DisplayName("should create value when expected absent")
        void shouldCreateWhenAbsent() {
            assertTrue(store.compareAndSet(KeyPath.of("k"), Optional.empty(), "v1").await().atMost(WAIT));
            assertEquals(Optional.of("v1"), read("k"));
        }

        @Test
        @DisplayName("should refuse create when a value exists")
        void shouldRefuseCreateWhenPresent() {
            put("v1", "k");

            assertFalse(store.compareAndSet(KeyPath.of("k"), Optional.empty(), "v2").await().atMost(WAIT));
            assertEquals(Optional.of("v1"), read("k"));
        }

        @Test
        @DisplayName("should replace when the current value matches")
        void shouldReplaceWhenMatching() {
            put("v1", "k");

            assertTrue(store.compareAndSet(KeyPath.of("k"), Optional.of("v1"), "v2").await().atMost(WAIT));
            assertEquals(Optional.of("v2"), read("k"));
        }

        @Test
        @DisplayName("should refuse replace when the current value differs")
        void shouldRefuseReplaceWhenDifferent() {
            put("other", "k");

            assertFalse(store.compareAndSet(KeyPath.of("k"), Optional.of("v1"), "v2").await().atMost(WAIT));
            assertEquals(Optional.of("other"), read("k"));
        }

        @Test
        @DisplayName("should treat an expired value as absent")
        void shouldTreatExpiredAsAbsent() {
            store.set(KeyPath.of("k"), "old", Optional.of(Duration.ofSeconds(1))).await().atMost(WAIT);
            clock.advance(Duration.ofSeconds(1));

            assertFalse(store.compareAndSet(KeyPath.of("k"), Optional.of("old"), "v2").await().atMost(WAIT));
            assertTrue(store.compareAndSet(KeyPath.of("k"), Optional.empty(), "v2").await().atMost(WAIT));
            assertEquals(Optional.of("v2"), read("k"));
        }
    }
}
