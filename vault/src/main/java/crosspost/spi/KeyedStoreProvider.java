package crosspost.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import crosspost.core.port.out.KeyedStore;

/**
 * SPI for keyed store implementations.
 *
 * <p>All credential data (encrypted envelopes, OAuth flow state, wallet links and
 * audit records) lives in the single store created by the selected provider.
 * Platform teams can implement this interface to back the vault with another
 * key-value system (DynamoDB, FoundationDB, etc.).
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (crosspost.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class DynamoKeyedStoreProvider implements KeyedStoreProvider {
 *
 *     @Override
 *     public String name() {
 *         return "dynamodb";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 150;
 *     }
 *
 *     @Override
 *     public boolean isAvailable() {
 *         return dynamoClient != null;
 *     }
 *
 *     @Override
 *     public KeyedStore createStore() {
 *         return new DynamoKeyedStore(dynamoClient, tableName);
 *     }
 * }
 * }</pre>
 *
 * @see KeyedStore
 */
public interface KeyedStoreProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * <p>Higher priority providers are preferred when multiple providers
     * are available.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * <p>May be called multiple times and should return quickly.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the keyed store.
     *
     * <p>The returned store must honor entry TTLs and implement
     * {@link KeyedStore#getAndDelete} and {@link KeyedStore#compareAndSet} atomically.
     *
     * @return keyed store instance
     * @throws StorageProviderException if the store cannot be created
     */
    KeyedStore createStore();

    /**
     * Report the health of this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
