package crosspost.core.model.common;

/**
 * The OAuth state token is unknown, expired or was already used.
 */
public class InvalidStateException extends CredentialException {

    public InvalidStateException(String platform) {
        super(ErrorCode.INVALID_STATE, "Invalid or expired authorization state", false, platform);
    }
}
