package crosspost.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import crosspost.core.config.StorageConfig;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.port.out.Metrics;
import crosspost.spi.KeyedStoreProvider;

/**
 * Redis-based keyed store provider.
 *
 * <p>This is the recommended provider for production deployments.
 */
@ApplicationScoped
public class RedisKeyedStoreProvider implements KeyedStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisKeyedStoreProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(5);

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final StorageConfig storageConfig;
    private final Metrics metrics;

    private volatile RedisKeyedStore store;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);
    private final CountDownLatch checkCompleted = new CountDownLatch(1);

    @Inject
    public RedisKeyedStoreProvider(
            ReactiveRedisDataSource redisDataSource, StorageConfig storageConfig, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.storageConfig = storageConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        // Check availability asynchronously at startup
        redisDataSource
                .key(String.class)
                .exists("test-connection")
                .ifNoItem()
                .after(AVAILABILITY_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            LOG.info("Redis keyed store is available");
                            checkCompleted.countDown();
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            LOG.warnf("Redis keyed store is not available: %s", error.getMessage());
                            checkCompleted.countDown();
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        // Provider selection runs once at startup; wait for the initial check rather than fall back early
        if (availabilityState.get() == AvailabilityState.CHECKING) {
            try {
                checkCompleted.await(AVAILABILITY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return availabilityState.get() == AvailabilityState.AVAILABLE;
    }

    @Override
    public synchronized KeyedStore createStore() {
        if (store == null) {
            final var keyPrefix = storageConfig.redis().keyPrefix();
            final var timeoutHelper =
                    new RedisTimeoutHelper(storageConfig.operationTimeout(), metrics, "redis-keyed-store");
            store = new RedisKeyedStore(redisDataSource, keyPrefix, timeoutHelper);
            LOG.infof("Created Redis keyed store with prefix: %s", keyPrefix);
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("keyed-store-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", storageConfig.redis().keyPrefix())
                    .build());
        }
        final var error =
                state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("keyed-store-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }
}
