package crosspost.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import crosspost.core.port.out.KeyedStore;
import crosspost.spi.KeyedStoreProvider;

/**
 * In-memory keyed store provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis or other storage backends are unavailable.
 *
 * <p><strong>Warning:</strong> Credentials stored in memory are lost on restart
 * and not shared between instances. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryKeyedStoreProvider implements KeyedStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyedStoreProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryKeyedStore store;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized KeyedStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Credential storage is in-memory only!");
            LOG.warn("  Linked accounts and OAuth tokens are lost when the process exits.");
            LOG.warn("  Configure Redis or a custom KeyedStoreProvider for production.");
            LOG.warn("========================================================================");
        }

        if (store == null) {
            store = new InMemoryKeyedStore();
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("keyed-store-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", store != null ? store.size() : 0)
                .build());
    }
}
