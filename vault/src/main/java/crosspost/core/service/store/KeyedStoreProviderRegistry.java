package crosspost.core.service.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import crosspost.core.config.StorageConfig;
import crosspost.core.port.out.KeyedStore;
import crosspost.spi.KeyedStoreProvider;
import crosspost.spi.StorageProviderException;

/**
 * Registry for keyed store providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (crosspost.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class KeyedStoreProviderRegistry {

    private static final Logger LOG = Logger.getLogger(KeyedStoreProviderRegistry.class);

    private final Instance<KeyedStoreProvider> providers;
    private final StorageConfig config;

    private volatile KeyedStoreProvider selectedProvider;
    private volatile KeyedStore store;

    @Inject
    public KeyedStoreProviderRegistry(Instance<KeyedStoreProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Get the keyed store from the selected provider.
     *
     * @return keyed store instance
     */
    public synchronized KeyedStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore();
        }
        return store;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized KeyedStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private KeyedStoreProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var availableProviders = providers.stream()
                .filter(KeyedStoreProvider::isAvailable)
                .sorted(Comparator.comparingInt(KeyedStoreProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available keyed store providers: %s",
                availableProviders.stream().map(KeyedStoreProvider::name).toList());

        Optional<KeyedStoreProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured keyed store provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured keyed store provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using keyed store provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new StorageProviderException("No keyed store providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<KeyedStoreProvider> getAvailableProviders() {
        return providers.stream().filter(KeyedStoreProvider::isAvailable).toList();
    }

    /**
     * Close the store if one was opened. A later {@link #getStore()} opens a new one.
     */
    public synchronized void close() {
        if (store != null) {
            store.close();
            store = null;
        }
    }
}
