package crosspost.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;

/**
 * Asynchronous key-value store over an ordered key namespace.
 *
 * <p>Every component of the credential subsystem persists through this port.
 * Implementations are provided by a {@link crosspost.spi.KeyedStoreProvider}.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 *   <li>Backend failures MUST surface as
 *       {@link crosspost.core.model.common.StoreUnavailableException}</li>
 *   <li>Entries with a TTL MUST NOT be returned after they expire</li>
 *   <li>{@link #getAndDelete} and {@link #compareAndSet} MUST be atomic</li>
 * </ul>
 *
 * <p>No atomicity is guaranteed across keys or across separate calls.
 */
public interface KeyedStore extends AutoCloseable {

    /**
     * Read a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(KeyPath key);

    /**
     * Write a value without expiry, replacing any existing value.
     *
     * @param key   the key
     * @param value the value
     * @return Uni completing when stored
     */
    default Uni<Void> set(KeyPath key, String value) {
        return set(key, value, Optional.empty());
    }

    /**
     * Write a value, replacing any existing value.
     *
     * @param key   the key
     * @param value the value
     * @param ttl   optional time-to-live
     * @return Uni completing when stored
     */
    Uni<Void> set(KeyPath key, String value, Optional<Duration> ttl);

    /**
     * Delete a value. Deleting an absent key is not an error.
     *
     * @param key the key
     * @return Uni completing when deleted
     */
    Uni<Void> delete(KeyPath key);

    /**
     * List entries whose key lies under {@code prefix}, ordered by key.
     *
     * @param prefix  key prefix, {@link KeyPath#root()} for all entries
     * @param options ordering and limit
     * @return ordered entries
     */
    Uni<List<StoreEntry>> list(KeyPath prefix, ListOptions options);

    /**
     * Atomically read and remove a value.
     *
     * <p>At most one concurrent caller observes the value.
     *
     * @param key the key
     * @return the removed value, or empty if absent or expired
     */
    Uni<Optional<String>> getAndDelete(KeyPath key);

    /**
     * Atomically replace a value only if the current value matches.
     *
     * @param key      the key
     * @param expected the value that must currently be stored; empty means the key must be absent
     * @param newValue the value to store
     * @return true if the value was written, false if the current value did not match
     */
    Uni<Boolean> compareAndSet(KeyPath key, Optional<String> expected, String newValue);

    /**
     * Release resources held by the store.
     */
    @Override
    default void close() {}
}
