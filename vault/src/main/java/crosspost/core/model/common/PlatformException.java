package crosspost.core.model.common;

/**
 * The platform rejected a request for a reason not covered by a more specific error.
 */
public class PlatformException extends CredentialException {

    private final int status;

    public PlatformException(String message, String platform, int status, boolean recoverable) {
        super(ErrorCode.PLATFORM_ERROR, message, recoverable, platform);
        this.status = status;
    }

    /**
     * HTTP status reported by the platform, or 0 if none.
     */
    public int status() {
        return status;
    }
}
