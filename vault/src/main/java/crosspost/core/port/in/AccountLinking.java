package crosspost.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import crosspost.core.model.identity.LinkedAccount;

/**
 * Use case interface for binding platform accounts to wallet identities.
 */
public interface AccountLinking {

    /**
     * Link a platform account to a wallet. Linking an already linked account is a no-op.
     *
     * @param walletId the wallet identity
     * @param platform the platform name
     * @param userId the platform user id
     * @return Uni completing when the link is stored
     */
    Uni<Void> link(String walletId, String platform, String userId);

    /**
     * Remove a link and delete the account's stored credentials.
     *
     * <p>Both steps are attempted even if the other fails.
     *
     * @param walletId the wallet identity
     * @param platform the platform name
     * @param userId the platform user id
     * @return Uni completing when both steps succeeded, failing if either failed
     */
    Uni<Void> unlink(String walletId, String platform, String userId);

    /**
     * List accounts linked to a wallet.
     *
     * @param walletId the wallet identity
     * @return linked accounts in link order, empty if none
     */
    Uni<List<LinkedAccount>> listLinked(String walletId);

    /**
     * Check whether a wallet has linked the given account.
     */
    Uni<Boolean> hasAccess(String walletId, String platform, String userId);

    /**
     * Mark a wallet as authorized.
     */
    Uni<Void> authorize(String walletId);

    /**
     * Clear a wallet's authorization. Succeeds if the wallet was never authorized.
     */
    Uni<Void> unauthorize(String walletId);

    /**
     * Report the wallet's readiness.
     *
     * @param walletId the wallet identity
     * @return -1 if not authorized, otherwise the number of linked accounts
     */
    Uni<Integer> authorizationStatus(String walletId);
}
