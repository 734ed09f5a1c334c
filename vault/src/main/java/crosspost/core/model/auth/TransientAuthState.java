package crosspost.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * Server-side state of an authorization flow awaiting its callback.
 *
 * @param platform     platform the flow was started for
 * @param walletId     wallet that initiated the flow
 * @param redirectUri  callback URI sent to the platform
 * @param codeVerifier PKCE verifier
 * @param successUrl   redirect target after success
 * @param errorUrl     redirect target after failure
 * @param createdAt    when the flow was started
 */
public record TransientAuthState(
        String platform,
        String walletId,
        String redirectUri,
        Optional<String> codeVerifier,
        String successUrl,
        String errorUrl,
        Instant createdAt) {

    public TransientAuthState {
        codeVerifier = codeVerifier != null ? codeVerifier : Optional.empty();
    }
}
