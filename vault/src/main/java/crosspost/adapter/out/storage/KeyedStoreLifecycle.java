package crosspost.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import crosspost.core.port.out.KeyedStore;
import crosspost.core.service.store.KeyedStoreProviderRegistry;

/**
 * Opens the keyed store at application startup and closes it at shutdown.
 *
 * <p>The opened store is exposed as a CDI bean so services receive it through
 * their constructors.
 */
@ApplicationScoped
public class KeyedStoreLifecycle {

    private static final Logger LOG = Logger.getLogger(KeyedStoreLifecycle.class);

    private final KeyedStoreProviderRegistry registry;

    @Inject
    public KeyedStoreLifecycle(KeyedStoreProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @Singleton
    KeyedStore keyedStore() {
        return registry.getStore();
    }

    void onStart(@Observes StartupEvent event) {
        final var provider = registry.getSelectedProvider();
        registry.getStore();
        LOG.infof("Opened keyed store from provider: %s", provider.name());
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Closing keyed store...");
        registry.close();
    }
}
