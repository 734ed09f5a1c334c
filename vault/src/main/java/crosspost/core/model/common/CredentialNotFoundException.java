package crosspost.core.model.common;

/**
 * No credential is stored for the requested platform and user.
 */
public class CredentialNotFoundException extends CredentialException {

    public CredentialNotFoundException(String platform, String userId) {
        super(ErrorCode.NOT_FOUND, "No credential stored for user " + userId + " on " + platform, false, platform);
    }
}
