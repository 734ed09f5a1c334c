package crosspost.core.model.common;

import java.time.Duration;
import java.util.Optional;

/**
 * The platform throttled the request. Always recoverable.
 */
public class RateLimitedException extends CredentialException {

    private final Duration retryAfter;

    public RateLimitedException(String message, String platform, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, message, true, platform);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
