package crosspost.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import crosspost.core.config.TelemetryConfig;
import crosspost.core.port.out.Metrics;

/**
 * Records credential subsystem metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code crosspost.vault.operations.total} - Vault operations by operation, platform, outcome</li>
 *   <li>{@code crosspost.oauth.refresh.total} - Credential refresh attempts by platform and outcome</li>
 *   <li>{@code crosspost.store.timeouts.total} - Store operations that timed out</li>
 *   <li>{@code crosspost.store.failures.total} - Store operations that failed</li>
 * </ul>
 */
@ApplicationScoped
public class VaultMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public VaultMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordCredentialOperation(String operation, String platform, boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("crosspost.vault.operations.total")
                .description("Credential vault operations")
                .tag("operation", nullSafe(operation))
                .tag("platform", nullSafe(platform))
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefresh(String platform, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("crosspost.oauth.refresh.total")
                .description("Credential refresh attempts")
                .tag("platform", nullSafe(platform))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("crosspost.store.timeouts.total")
                .description("Keyed store operations that timed out")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("crosspost.store.failures.total")
                .description("Keyed store operations that failed")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
