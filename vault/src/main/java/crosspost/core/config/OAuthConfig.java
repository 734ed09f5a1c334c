package crosspost.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for OAuth flow orchestration.
 *
 * <p>Configuration prefix: {@code crosspost.oauth}
 */
@ConfigMapping(prefix = "crosspost.oauth")
public interface OAuthConfig {

    /**
     * How long an initiated authorization flow waits for its callback.
     *
     * <p>Should be long enough for the user to sign in at the platform
     * but short enough to limit the window for replay.
     *
     * @return State duration (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration stateTtl();
}
