package crosspost.core.model.common;

/**
 * A call to the platform failed in a way that may succeed on retry.
 */
public class TransientNetworkException extends CredentialException {

    public TransientNetworkException(String message, String platform, Throwable cause) {
        super(ErrorCode.TRANSIENT_NETWORK, message, true, platform, cause);
    }
}
