package crosspost.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for wallet account linking.
 *
 * <p>Configuration prefix: {@code crosspost.linking}
 */
@ConfigMapping(prefix = "crosspost.linking")
public interface LinkingConfig {

    /**
     * Attempts made to apply a conditional update to a wallet's linked-account
     * index before giving up under contention.
     *
     * @return Maximum attempts (default: 5)
     */
    @WithDefault("5")
    int maxUpdateAttempts();
}
