package crosspost.core.model.common;

import java.util.Optional;

/**
 * Base type for all failures surfaced by the credential subsystem.
 *
 * <p>Every failure carries an {@link ErrorCode} and a {@code recoverable} flag.
 * Callers use the flag to decide between prompting the user to authenticate
 * again ({@code false}) and retrying with backoff ({@code true}).
 */
public abstract class CredentialException extends RuntimeException {

    private final ErrorCode code;
    private final boolean recoverable;
    private final String platform;

    protected CredentialException(ErrorCode code, String message, boolean recoverable, String platform) {
        super(message);
        this.code = code;
        this.recoverable = recoverable;
        this.platform = platform;
    }

    protected CredentialException(
            ErrorCode code, String message, boolean recoverable, String platform, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.recoverable = recoverable;
        this.platform = platform;
    }

    public ErrorCode code() {
        return code;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public Optional<String> platform() {
        return Optional.ofNullable(platform);
    }
}
