package crosspost.core.model.common;

/**
 * The backing key-value store could not complete an operation.
 */
public class StoreUnavailableException extends CredentialException {

    public StoreUnavailableException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message, true, null);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, true, null, cause);
    }
}
