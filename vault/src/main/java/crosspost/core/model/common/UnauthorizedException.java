package crosspost.core.model.common;

/**
 * The credential or caller is not authorized.
 *
 * <p>Non-recoverable unless stated otherwise: the user has to authenticate again.
 */
public class UnauthorizedException extends CredentialException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message, false, null);
    }

    public UnauthorizedException(String message, String platform) {
        super(ErrorCode.UNAUTHORIZED, message, false, platform);
    }

    public UnauthorizedException(String message, String platform, boolean recoverable, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, recoverable, platform, cause);
    }
}
