package crosspost.core.model.auth;

import java.util.Optional;

/**
 * Result of starting an authorization flow.
 */
public record AuthInitialization(String authUrl, String state, Optional<String> codeVerifier) {

    public static AuthInitialization from(AuthorizationRequest request) {
        return new AuthInitialization(request.authUrl(), request.state(), request.codeVerifier());
    }
}
