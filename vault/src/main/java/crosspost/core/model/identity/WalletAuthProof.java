package crosspost.core.model.identity;

import java.util.Optional;

/**
 * Signed statement presented by a wallet as a bearer credential.
 *
 * @param accountId the wallet identity
 * @param publicKey key the statement was signed with
 * @param signature signature over the statement
 * @param message   signed message
 * @param nonce     epoch milliseconds at signing time
 * @param recipient intended recipient of the statement
 */
public record WalletAuthProof(
        String accountId,
        String publicKey,
        String signature,
        String message,
        String nonce,
        Optional<String> recipient) {

    public WalletAuthProof {
        recipient = recipient != null ? recipient.filter(r -> !r.isBlank()) : Optional.empty();
    }
}
