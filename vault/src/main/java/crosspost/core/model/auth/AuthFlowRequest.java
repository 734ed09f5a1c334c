package crosspost.core.model.auth;

import java.util.List;
import java.util.Optional;

/**
 * Request to start an OAuth authorization flow on behalf of a wallet.
 *
 * @param walletId    wallet the resulting account is linked to
 * @param redirectUri callback URI registered with the platform
 * @param scopes      requested scopes; empty uses the platform defaults
 * @param successUrl  where the caller is sent after a successful callback
 * @param errorUrl    where the caller is sent after a failed callback
 */
public record AuthFlowRequest(
        String walletId,
        String redirectUri,
        List<String> scopes,
        Optional<String> successUrl,
        Optional<String> errorUrl) {

    public AuthFlowRequest {
        if (walletId == null || walletId.isBlank()) {
            throw new IllegalArgumentException("walletId cannot be null or blank");
        }
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("redirectUri cannot be null or blank");
        }
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        successUrl = successUrl != null ? successUrl : Optional.empty();
        errorUrl = errorUrl != null ? errorUrl : Optional.empty();
    }

    public static AuthFlowRequest of(String walletId, String redirectUri, List<String> scopes) {
        return new AuthFlowRequest(walletId, redirectUri, scopes, Optional.empty(), Optional.empty());
    }
}
