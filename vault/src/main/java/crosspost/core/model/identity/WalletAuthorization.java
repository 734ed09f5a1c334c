package crosspost.core.model.identity;

import java.time.Instant;

/**
 * Whether a wallet has authorized the service to act on its linked accounts.
 *
 * @param authorized the authorization flag
 * @param timestamp  when the flag was last set
 */
public record WalletAuthorization(boolean authorized, Instant timestamp) {}
