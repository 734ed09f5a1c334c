package crosspost.core.model.identity;

import java.time.Instant;

/**
 * Platform account linked to a wallet.
 *
 * @param platform   the platform name
 * @param userId     the platform's user id
 * @param connectedAt when the link was created
 */
public record LinkedAccount(String platform, String userId, Instant connectedAt) {

    public LinkedAccount {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (connectedAt == null) {
            throw new IllegalArgumentException("connectedAt cannot be null");
        }
    }

    /**
     * Check if this entry refers to the given account.
     */
    public boolean matches(String otherPlatform, String otherUserId) {
        return platform.equals(otherPlatform) && userId.equals(otherUserId);
    }
}
