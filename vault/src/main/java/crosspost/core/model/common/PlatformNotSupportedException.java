package crosspost.core.model.common;

/**
 * No OAuth strategy is registered for the requested platform.
 */
public class PlatformNotSupportedException extends CredentialException {

    public PlatformNotSupportedException(String platform) {
        super(ErrorCode.NOT_FOUND, "Platform '" + platform + "' is not supported", false, platform);
    }
}
