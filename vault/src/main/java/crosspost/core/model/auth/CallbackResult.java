package crosspost.core.model.auth;

import crosspost.core.model.credential.CredentialBundle;

/**
 * Outcome of a completed authorization callback.
 *
 * @param userId          the platform user that was linked
 * @param walletId        the wallet the account was linked to
 * @param bundle          the stored credentials
 * @param successRedirect where the caller should be redirected
 */
public record CallbackResult(String userId, String walletId, CredentialBundle bundle, String successRedirect) {}
