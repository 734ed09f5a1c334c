package crosspost.core.model.auth;

import java.util.Optional;

/**
 * Authorization URL produced by a platform strategy.
 *
 * @param authUrl      URL the user is sent to
 * @param state        random state token bound to this flow
 * @param codeVerifier PKCE verifier, when the platform uses PKCE
 */
public record AuthorizationRequest(String authUrl, String state, Optional<String> codeVerifier) {

    public AuthorizationRequest {
        if (authUrl == null || authUrl.isBlank()) {
            throw new IllegalArgumentException("authUrl cannot be null or blank");
        }
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state cannot be null or blank");
        }
        codeVerifier = codeVerifier != null ? codeVerifier : Optional.empty();
    }
}
