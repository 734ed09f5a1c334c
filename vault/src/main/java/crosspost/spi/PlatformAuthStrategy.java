package crosspost.spi;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;

import crosspost.core.model.auth.AuthorizationRequest;
import crosspost.core.model.auth.CodeExchange;
import crosspost.core.model.credential.CredentialBundle;

/**
 * SPI for platform-specific OAuth exchanges.
 *
 * <p>One strategy is implemented per social platform. Strategies talk to the
 * platform and nothing else: persistence, linking and deletion are done by the
 * orchestrator that calls them.
 *
 * <h2>Error reporting</h2>
 * Strategies signal failures with the credential exception types:
 * <ul>
 *   <li>{@link crosspost.core.model.common.UnauthorizedException} - the platform rejected
 *       the code, token or refresh token</li>
 *   <li>{@link crosspost.core.model.common.RateLimitedException} - retry later</li>
 *   <li>{@link crosspost.core.model.common.TransientNetworkException} - the platform could
 *       not be reached or failed temporarily</li>
 *   <li>{@link crosspost.core.model.common.PlatformException} - any other platform error</li>
 * </ul>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class MastodonAuthStrategy implements PlatformAuthStrategy {
 *
 *     @Override
 *     public String platform() {
 *         return "mastodon";
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p>Strategies discovered through CDI are combined with the standard OAuth 2.0
 * strategies configured under {@code crosspost.platforms}.
 */
public interface PlatformAuthStrategy {

    /**
     * Return the platform name used in storage keys and configuration.
     *
     * @return Platform name (e.g., "twitter")
     */
    String platform();

    /**
     * Build the URL the user is sent to for authorization.
     *
     * @param redirectUri the callback URI
     * @param scopes the requested scopes; empty means the platform defaults
     * @return the authorization URL with a fresh state token and PKCE verifier
     */
    Uni<AuthorizationRequest> buildAuthUrl(String redirectUri, List<String> scopes);

    /**
     * Exchange an authorization code for credentials and resolve the user they belong to.
     *
     * @param code the authorization code
     * @param redirectUri the callback URI used when the flow started
     * @param codeVerifier the PKCE verifier, if one was issued
     * @return the platform user id and issued credentials
     */
    Uni<CodeExchange> exchangeCodeForCredential(String code, String redirectUri, Optional<String> codeVerifier);

    /**
     * Obtain fresh credentials using the bundle's refresh secret.
     *
     * <p>Implementations must not persist anything.
     *
     * @param bundle the current credentials, which carry a refresh secret
     * @return the replacement bundle
     */
    Uni<CredentialBundle> refreshCredential(CredentialBundle bundle);

    /**
     * Revoke credentials at the platform.
     *
     * @param bundle the credentials to revoke
     * @return Uni completing when the platform accepted the revocation
     */
    Uni<Void> revokeCredential(CredentialBundle bundle);

    /**
     * Report the health of the platform integration.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
