package crosspost.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;
import crosspost.core.port.out.KeyedStore;

/**
 * In-memory implementation of the keyed store.
 *
 * <p>This implementation is intended for development and testing only.
 * Entries are lost on restart and not shared across instances.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryKeyedStore implements KeyedStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyedStore.class);

    private final ConcurrentNavigableMap<String, Entry> entries = new ConcurrentSkipListMap<>();
    private final ScheduledExecutorService cleanupExecutor;
    private final Clock clock;

    public InMemoryKeyedStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyedStore(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "keyed-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory keyed store");
    }

    @Override
    public Uni<Optional<String>> get(KeyPath key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(key.encoded());
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.<String>empty();
            }
            return Optional.of(entry.value());
        });
    }

    @Override
    public Uni<Void> set(KeyPath key, String value, Optional<Duration> ttl) {
        return Uni.createFrom().item(() -> {
            final var expiresAt = ttl.map(d -> clock.instant().plus(d));
            entries.put(key.encoded(), new Entry(value, expiresAt));
            LOG.debugf("Stored entry %s with TTL: %s", key, ttl.orElse(null));
            return null;
        });
    }

    @Override
    public Uni<Void> delete(KeyPath key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key.encoded());
            return null;
        });
    }

    @Override
    public Uni<List<StoreEntry>> list(KeyPath prefix, ListOptions options) {
        return Uni.createFrom().item(() -> {
            final var encodedPrefix = prefix.encodedPrefix();
            NavigableMap<String, Entry> range = encodedPrefix.isEmpty()
                    ? entries
                    : entries.subMap(encodedPrefix, true, upperBound(encodedPrefix), false);
            if (options.reverse()) {
                range = range.descendingMap();
            }

            final var now = clock.instant();
            final var limit = options.limit().orElse(Integer.MAX_VALUE);
            final var result = new ArrayList<StoreEntry>();
            for (Map.Entry<String, Entry> e : range.entrySet()) {
                if (result.size() >= limit) {
                    break;
                }
                if (e.getValue().isExpired(now)) {
                    continue;
                }
                result.add(new StoreEntry(KeyPath.decode(e.getKey()), e.getValue().value()));
            }
            return List.copyOf(result);
        });
    }

    @Override
    public Uni<Optional<String>> getAndDelete(KeyPath key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.remove(key.encoded());
            if (entry == null) {
                LOG.debugf("No entry found for %s", key);
                return Optional.<String>empty();
            }
            if (entry.isExpired(clock.instant())) {
                LOG.debugf("Entry expired for %s", key);
                return Optional.<String>empty();
            }
            return Optional.of(entry.value());
        });
    }

    @Override
    public Uni<Boolean> compareAndSet(KeyPath key, Optional<String> expected, String newValue) {
        return Uni.createFrom().item(() -> {
            final var encoded = key.encoded();
            final var replacement = new Entry(newValue, Optional.empty());
            while (true) {
                final var current = entries.get(encoded);
                final var live = current != null && !current.isExpired(clock.instant());

                if (expected.isEmpty()) {
                    if (live) {
                        return false;
                    }
                    final var swapped = current == null
                            ? entries.putIfAbsent(encoded, replacement) == null
                            : entries.replace(encoded, current, replacement);
                    if (swapped) {
                        return true;
                    }
                    continue;
                }

                if (!live || !current.value().equals(expected.get())) {
                    return false;
                }
                if (entries.replace(encoded, current, replacement)) {
                    return true;
                }
            }
        });
    }

    // Smallest string greater than every string starting with the prefix
    private static String upperBound(String prefix) {
        final var last = prefix.charAt(prefix.length() - 1);
        return prefix.substring(0, prefix.length() - 1) + (char) (last + 1);
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var before = entries.size();

        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));

        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    @Override
    public void close() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the current count of stored entries, including expired ones not yet cleaned up.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        entries.clear();
    }

    private record Entry(String value, Optional<Instant> expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt.map(exp -> !now.isBefore(exp)).orElse(false);
        }
    }
}
