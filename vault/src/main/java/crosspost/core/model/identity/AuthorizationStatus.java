package crosspost.core.model.identity;

/**
 * Values returned by an authorization status query.
 *
 * <p>Any value of zero or more is the number of linked accounts of an authorized wallet.
 */
public final class AuthorizationStatus {

    /** The wallet has not authorized the service. */
    public static final int NOT_AUTHORIZED = -1;

    /** The wallet is authorized but has no linked accounts. */
    public static final int NO_ACCOUNTS = 0;

    private AuthorizationStatus() {}

    public static boolean isAuthorized(int status) {
        return status >= NO_ACCOUNTS;
    }
}
