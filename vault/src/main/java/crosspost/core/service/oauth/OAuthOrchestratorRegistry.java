package crosspost.core.service.oauth;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import crosspost.core.config.OAuthConfig;
import crosspost.core.model.common.PlatformNotSupportedException;
import crosspost.core.port.in.AccountLinking;
import crosspost.core.port.in.PlatformAuthFlow;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.port.out.Metrics;
import crosspost.core.service.credential.TokenVault;
import crosspost.spi.PlatformAuthStrategy;
import crosspost.spi.PlatformAuthStrategyProvider;

/**
 * Registry of OAuth orchestrators, one per supported platform.
 *
 * <p>Strategies are discovered via CDI, both as {@link PlatformAuthStrategy} beans
 * and through {@link PlatformAuthStrategyProvider} beans. When two strategies claim
 * the same platform, a strategy bean wins over a provided one.
 */
@ApplicationScoped
public class OAuthOrchestratorRegistry {

    private static final Logger LOG = Logger.getLogger(OAuthOrchestratorRegistry.class);

    private final Instance<PlatformAuthStrategy> strategyBeans;
    private final Instance<PlatformAuthStrategyProvider> strategyProviders;
    private final KeyedStore store;
    private final TokenVault vault;
    private final AccountLinking linking;
    private final OAuthConfig config;
    private final Metrics metrics;
    private final Clock clock;

    private volatile Map<String, OAuthOrchestrator> orchestrators;

    @Inject
    public OAuthOrchestratorRegistry(
            Instance<PlatformAuthStrategy> strategyBeans,
            Instance<PlatformAuthStrategyProvider> strategyProviders,
            KeyedStore store,
            TokenVault vault,
            AccountLinking linking,
            OAuthConfig config,
            Metrics metrics) {
        this.strategyBeans = strategyBeans;
        this.strategyProviders = strategyProviders;
        this.store = store;
        this.vault = vault;
        this.linking = linking;
        this.config = config;
        this.metrics = metrics;
        this.clock = Clock.systemUTC();
    }

    /**
     * Constructor for manual instantiation with a fixed set of strategies.
     */
    public OAuthOrchestratorRegistry(
            Collection<PlatformAuthStrategy> strategies,
            KeyedStore store,
            TokenVault vault,
            AccountLinking linking,
            OAuthConfig config,
            Metrics metrics,
            Clock clock) {
        this.strategyBeans = null;
        this.strategyProviders = null;
        this.store = store;
        this.vault = vault;
        this.linking = linking;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.orchestrators = build(List.copyOf(strategies), List.of());
    }

    /**
     * Get the orchestrator for a platform.
     *
     * @param platform the platform name
     * @return the platform's auth flow
     * @throws PlatformNotSupportedException if no strategy serves the platform
     */
    public PlatformAuthFlow forPlatform(String platform) {
        return find(platform).orElseThrow(() -> new PlatformNotSupportedException(platform));
    }

    /**
     * Find the orchestrator for a platform.
     *
     * @param platform the platform name
     * @return the platform's auth flow, or empty if unsupported
     */
    public Optional<PlatformAuthFlow> find(String platform) {
        return Optional.ofNullable(orchestrators().get(platform));
    }

    /**
     * Names of all supported platforms, in discovery order.
     */
    public Set<String> platforms() {
        return orchestrators().keySet();
    }

    /**
     * Strategies behind the registered orchestrators (for health checks).
     */
    public List<PlatformAuthStrategy> strategies() {
        return orchestrators().values().stream().map(OAuthOrchestrator::strategy).toList();
    }

    private Map<String, OAuthOrchestrator> orchestrators() {
        var current = orchestrators;
        if (current == null) {
            synchronized (this) {
                current = orchestrators;
                if (current == null) {
                    current = build(
                            strategyBeans.stream().toList(),
                            strategyProviders.stream()
                                    .flatMap(p -> p.strategies().stream())
                                    .toList());
                    orchestrators = current;
                }
            }
        }
        return current;
    }

    private Map<String, OAuthOrchestrator> build(
            List<PlatformAuthStrategy> beans, List<PlatformAuthStrategy> provided) {
        final var all = new ArrayList<PlatformAuthStrategy>(beans);
        all.addAll(provided);

        final var result = new LinkedHashMap<String, OAuthOrchestrator>();
        for (PlatformAuthStrategy strategy : all) {
            final var platform = strategy.platform();
            if (result.containsKey(platform)) {
                LOG.warnf(
                        "Ignoring duplicate auth strategy for platform %s: %s",
                        platform, strategy.getClass().getName());
                continue;
            }
            result.put(platform, new OAuthOrchestrator(strategy, store, vault, linking, config, metrics, clock));
        }
        LOG.infof("Registered OAuth platforms: %s", result.keySet());
        return Collections.unmodifiableMap(result);
    }
}
