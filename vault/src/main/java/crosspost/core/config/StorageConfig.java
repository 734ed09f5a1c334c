package crosspost.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the keyed store backing all credential data.
 *
 * <p>Configuration prefix: {@code crosspost.storage}
 */
@ConfigMapping(prefix = "crosspost.storage")
public interface StorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: redis, memory, or custom SPI name.
     *
     * @return Provider name (default: redis)
     */
    @WithDefault("redis")
    String provider();

    /**
     * Maximum time a single store operation may take before it fails
     * with a store-unavailable error.
     *
     * @return Operation timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration operationTimeout();

    /**
     * Redis-specific configuration.
     */
    RedisConfig redis();

    /**
     * Redis storage configuration.
     */
    interface RedisConfig {

        /**
         * Key prefix for all entries in Redis.
         *
         * @return Key prefix (default: crosspost:)
         */
        @WithDefault("crosspost:")
        String keyPrefix();
    }
}
