package crosspost.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the credential access audit trail.
 *
 * <p>Configuration prefix: {@code crosspost.audit}
 */
@ConfigMapping(prefix = "crosspost.audit")
public interface AuditConfig {

    /**
     * Persist audit records. Log output is produced either way.
     *
     * @return true if records are persisted (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * How long audit records are kept. Empty keeps them forever.
     *
     * @return Retention period (default: 30 days)
     */
    @WithDefault("P30D")
    Optional<Duration> retention();

    /**
     * Number of records returned by a recent-records query when no limit is given.
     *
     * @return Default limit (default: 100)
     */
    @WithDefault("100")
    int recentDefaultLimit();
}
