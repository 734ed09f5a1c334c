package crosspost.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import crosspost.core.model.auth.AuthFlowRequest;
import crosspost.core.model.auth.AuthInitialization;
import crosspost.core.model.auth.CallbackResult;
import crosspost.core.model.auth.TransientAuthState;
import crosspost.core.model.credential.CredentialBundle;

/**
 * Use case interface for the OAuth lifecycle of one platform's credentials.
 *
 * <p>Failures are reported as {@link crosspost.core.model.common.CredentialException} subtypes.
 */
public interface PlatformAuthFlow {

    /**
     * The platform this flow serves.
     */
    String platform();

    /**
     * Start an authorization flow and persist its state until the callback arrives.
     *
     * @param request the flow request
     * @return the authorization URL and state token
     */
    Uni<AuthInitialization> initializeAuth(AuthFlowRequest request);

    /**
     * Look up pending flow state without consuming it.
     *
     * @param state the state token
     * @return the pending state, or empty if absent or expired
     */
    Uni<Optional<TransientAuthState>> findAuthState(String state);

    /**
     * Complete an authorization flow.
     *
     * <p>The state is consumed; a second callback with the same state fails with
     * {@link crosspost.core.model.common.InvalidStateException}.
     *
     * @param code the authorization code
     * @param state the state token
     * @return the linked user and stored credentials
     */
    Uni<CallbackResult> handleCallback(String code, String state);

    /**
     * Refresh a user's credentials through the platform.
     *
     * @param userId the platform user id
     * @return the refreshed bundle
     */
    Uni<CredentialBundle> refreshToken(String userId);

    /**
     * Revoke a user's credentials at the platform and delete them locally.
     *
     * @param userId the platform user id
     * @return true once no credential is stored for the user
     */
    Uni<Boolean> revokeToken(String userId);

    /**
     * Return credentials that can be used now, refreshing expired ones where possible.
     *
     * @param userId the platform user id
     * @return a non-expired bundle
     */
    Uni<CredentialBundle> getUsableCredential(String userId);
}
