package crosspost.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for metrics.
 *
 * <p>Configuration prefix: {@code crosspost.telemetry}
 */
@ConfigMapping(prefix = "crosspost.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * @return true if metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
