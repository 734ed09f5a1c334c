package crosspost.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import crosspost.core.service.oauth.OAuthOrchestratorRegistry;
import crosspost.spi.PlatformAuthStrategy;

/**
 * Readiness of the registered platform strategies.
 *
 * <p>DOWN if any strategy reports itself DOWN. Each platform's state is listed in the data.
 */
@Readiness
@ApplicationScoped
public class PlatformStrategyHealthCheck implements HealthCheck {

    private final OAuthOrchestratorRegistry registry;

    @Inject
    public PlatformStrategyHealthCheck(OAuthOrchestratorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("platform-strategies");
        var allUp = true;
        for (PlatformAuthStrategy strategy : registry.strategies()) {
            final var status = strategy.healthCheck()
                    .map(HealthCheckResponse::getStatus)
                    .orElse(HealthCheckResponse.Status.UP);
            builder.withData(strategy.platform(), status.name());
            allUp &= status == HealthCheckResponse.Status.UP;
        }
        builder.withData("platforms", registry.platforms().size());
        return allUp ? builder.up().build() : builder.down().build();
    }
}
