package crosspost.core.model.auth;

import crosspost.core.model.credential.CredentialBundle;

/**
 * Credential obtained for a platform user by exchanging an authorization code.
 *
 * @param userId the platform's id for the authenticated user
 * @param bundle the issued credentials
 */
public record CodeExchange(String userId, CredentialBundle bundle) {

    public CodeExchange {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (bundle == null) {
            throw new IllegalArgumentException("bundle cannot be null");
        }
    }
}
