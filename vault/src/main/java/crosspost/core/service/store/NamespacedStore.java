package crosspost.core.service.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;
import crosspost.core.port.out.KeyedStore;

/**
 * Keyed store view that prepends a fixed prefix to every key.
 *
 * <p>Owns no state. Keys returned from {@link #list} are relative to the namespace.
 * Closing a namespace does not close the underlying store.
 */
public final class NamespacedStore implements KeyedStore {

    private final KeyedStore delegate;
    private final KeyPath namespace;

    public NamespacedStore(KeyedStore delegate, KeyPath namespace) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate store must not be null");
        }
        if (namespace == null || namespace.isRoot()) {
            throw new IllegalArgumentException("namespace must have at least one segment");
        }
        this.delegate = delegate;
        this.namespace = namespace;
    }

    public KeyPath namespace() {
        return namespace;
    }

    @Override
    public Uni<Optional<String>> get(KeyPath key) {
        return delegate.get(qualify(key));
    }

    @Override
    public Uni<Void> set(KeyPath key, String value, Optional<Duration> ttl) {
        return delegate.set(qualify(key), value, ttl);
    }

    @Override
    public Uni<Void> delete(KeyPath key) {
        return delegate.delete(qualify(key));
    }

    @Override
    public Uni<List<StoreEntry>> list(KeyPath prefix, ListOptions options) {
        return delegate.list(namespace.append(prefix), options)
                .map(entries -> entries.stream()
                        .map(entry -> new StoreEntry(entry.key().relativeTo(namespace), entry.value()))
                        .toList());
    }

    @Override
    public Uni<Optional<String>> getAndDelete(KeyPath key) {
        return delegate.getAndDelete(qualify(key));
    }

    @Override
    public Uni<Boolean> compareAndSet(KeyPath key, Optional<String> expected, String newValue) {
        return delegate.compareAndSet(qualify(key), expected, newValue);
    }

    private KeyPath qualify(KeyPath key) {
        if (key.isRoot()) {
            throw new IllegalArgumentException("key must have at least one segment");
        }
        return namespace.append(key);
    }
}
