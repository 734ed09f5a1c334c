package crosspost.adapter.out.platform;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import crosspost.core.config.PlatformsConfig;
import crosspost.core.service.oauth.PkceService;
import crosspost.spi.PlatformAuthStrategy;
import crosspost.spi.PlatformAuthStrategyProvider;

/**
 * Creates a {@link StandardOAuth2PlatformStrategy} for every enabled platform
 * configured under {@code crosspost.platforms}.
 */
@ApplicationScoped
public class StandardOAuth2StrategyProvider implements PlatformAuthStrategyProvider {

    private static final Logger LOG = Logger.getLogger(StandardOAuth2StrategyProvider.class);

    private final WebClient webClient;
    private final PlatformsConfig config;
    private final PkceService pkceService;

    private volatile List<PlatformAuthStrategy> strategies;

    @Inject
    public StandardOAuth2StrategyProvider(Vertx vertx, PlatformsConfig config, PkceService pkceService) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.pkceService = pkceService;
    }

    @Override
    public synchronized List<PlatformAuthStrategy> strategies() {
        if (strategies == null) {
            final var created = new ArrayList<PlatformAuthStrategy>();
            config.platforms().forEach((name, platformConfig) -> {
                if (!platformConfig.enabled()) {
                    LOG.infof("Platform %s is disabled", name);
                    return;
                }
                created.add(new StandardOAuth2PlatformStrategy(
                        name, platformConfig, webClient, pkceService, Clock.systemUTC()));
                LOG.infof("Configured OAuth 2.0 platform: %s", name);
            });
            strategies = List.copyOf(created);
        }
        return strategies;
    }

    @PreDestroy
    void close() {
        webClient.close();
    }
}
