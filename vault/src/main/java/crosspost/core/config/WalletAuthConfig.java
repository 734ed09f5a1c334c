package crosspost.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for wallet identity proofs.
 *
 * <p>Configuration prefix: {@code crosspost.wallet}
 */
@ConfigMapping(prefix = "crosspost.wallet")
public interface WalletAuthConfig {

    /**
     * Oldest nonce timestamp accepted in a signed wallet statement.
     *
     * @return Maximum nonce age (default: 3650 days)
     */
    @WithDefault("P3650D")
    Duration maxNonceAge();

    /**
     * Tolerated clock difference for nonces dated in the future.
     *
     * @return Clock skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Recipient assumed when a signed statement does not name one.
     *
     * @return Default recipient (default: crosspost.near)
     */
    @WithDefault("crosspost.near")
    String defaultRecipient();
}
