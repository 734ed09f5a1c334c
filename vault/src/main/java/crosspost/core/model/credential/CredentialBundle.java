package crosspost.core.model.credential;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * OAuth credentials held for one platform user.
 *
 * <p>A bundle without an expiry never expires. An expired bundle without a refresh
 * secret is unusable and should be purged. Expiry is kept at millisecond precision,
 * the precision it is stored at.
 *
 * @param accessSecret  access token presented to the platform
 * @param refreshSecret refresh token, if the platform issued one
 * @param legacySecret  OAuth 1.0a token secret
 * @param expiresAt     when the access token expires
 * @param scopes        scopes granted by the platform
 * @param scheme        protocol the bundle was issued under
 */
public record CredentialBundle(
        String accessSecret,
        Optional<String> refreshSecret,
        Optional<String> legacySecret,
        Optional<Instant> expiresAt,
        List<String> scopes,
        CredentialScheme scheme) {

    public CredentialBundle {
        if (accessSecret == null || accessSecret.isEmpty()) {
            throw new IllegalArgumentException("accessSecret cannot be null or empty");
        }
        refreshSecret = refreshSecret != null ? refreshSecret.filter(s -> !s.isEmpty()) : Optional.empty();
        legacySecret = legacySecret != null ? legacySecret : Optional.empty();
        expiresAt = expiresAt != null ? expiresAt.map(t -> t.truncatedTo(ChronoUnit.MILLIS)) : Optional.empty();
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        scheme = scheme != null ? scheme : CredentialScheme.OAUTH2;
    }

    /**
     * Create an OAuth 2.0 bundle.
     */
    public static CredentialBundle oauth2(
            String accessSecret, String refreshSecret, Instant expiresAt, List<String> scopes) {
        return new CredentialBundle(
                accessSecret,
                Optional.ofNullable(refreshSecret),
                Optional.empty(),
                Optional.ofNullable(expiresAt),
                scopes,
                CredentialScheme.OAUTH2);
    }

    /**
     * Check if the access token has expired.
     *
     * @param now the current time
     * @return true if an expiry is set and is not after {@code now}
     */
    public boolean isExpired(Instant now) {
        return expiresAt.map(exp -> !exp.isAfter(now)).orElse(false);
    }

    public boolean canRefresh() {
        return refreshSecret.isPresent();
    }

    /**
     * Check if the bundle can be used now, either directly or after a refresh.
     */
    public boolean isUsable(Instant now) {
        return !isExpired(now) || canRefresh();
    }

    /**
     * Return a copy with the refresh secret replaced by {@code previous}'s when this bundle has none.
     */
    public CredentialBundle retainingRefreshSecretOf(CredentialBundle previous) {
        if (refreshSecret.isPresent() || previous.refreshSecret().isEmpty()) {
            return this;
        }
        return new CredentialBundle(accessSecret, previous.refreshSecret(), legacySecret, expiresAt, scopes, scheme);
    }

    @Override
    public String toString() {
        return "CredentialBundle[scheme=" + scheme + ", expiresAt=" + expiresAt.orElse(null) + ", scopes=" + scopes
                + ", refreshable=" + canRefresh() + "]";
    }
}
