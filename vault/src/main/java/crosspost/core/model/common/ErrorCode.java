package crosspost.core.model.common;

/**
 * Error codes for credential, linking and OAuth flow failures.
 */
public enum ErrorCode {
    /** No stored credential, linked account or platform for the given identifier. */
    NOT_FOUND,
    /** OAuth callback state is missing, expired or already consumed. */
    INVALID_STATE,
    /** A stored credential failed authentication or could not be parsed. */
    CORRUPT_CREDENTIAL,
    /** The credential or caller is not authorized and has no usable refresh path. */
    UNAUTHORIZED,
    /** The platform throttled the request. */
    RATE_LIMITED,
    /** A network call to the platform failed transiently. */
    TRANSIENT_NETWORK,
    /** The backing key-value store could not serve the request. */
    STORE_UNAVAILABLE,
    /** The platform rejected the request for any other reason. */
    PLATFORM_ERROR
}
