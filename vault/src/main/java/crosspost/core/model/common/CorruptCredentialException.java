package crosspost.core.model.common;

/**
 * A stored credential envelope could not be authenticated, decrypted or parsed.
 */
public class CorruptCredentialException extends CredentialException {

    public CorruptCredentialException(String message) {
        super(ErrorCode.CORRUPT_CREDENTIAL, message, false, null);
    }

    public CorruptCredentialException(String message, Throwable cause) {
        super(ErrorCode.CORRUPT_CREDENTIAL, message, false, null, cause);
    }
}
