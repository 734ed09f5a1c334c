package crosspost.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import crosspost.core.service.store.KeyedStoreProviderRegistry;

/**
 * Readiness of the keyed store holding all credential data.
 *
 * <p>Reports the selected provider's own health; providers without a health
 * indicator are reported UP with their name.
 */
@Readiness
@ApplicationScoped
public class KeyedStoreHealthCheck implements HealthCheck {

    private final KeyedStoreProviderRegistry registry;

    @Inject
    public KeyedStoreHealthCheck(KeyedStoreProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.getSelectedProvider();
        return provider.healthCheck().orElseGet(() -> HealthCheckResponse.named("keyed-store")
                .up()
                .withData("provider", provider.name())
                .build());
    }
}
