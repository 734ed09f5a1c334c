package crosspost.core.model.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialBundle")
class CredentialBundleTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    @DisplayName("should never expire without an expiry")
    void shouldNotExpireWithoutExpiry() {
        final var bundle = CredentialBundle.oauth2("a", null, null, List.of());

        assertFalse(bundle.isExpired(NOW));
        assertTrue(bundle.isUsable(NOW));
    }

    @Test
    @DisplayName("should be expired at the expiry instant")
    void shouldBeExpiredAtExpiry() {
        assertTrue(CredentialBundle.oauth2("a", null, NOW, List.of()).isExpired(NOW));
        assertFalse(CredentialBundle.oauth2("a", null, NOW.plusSeconds(1), List.of()).isExpired(NOW));
    }

    @Test
    @DisplayName("should be unusable when expired without a refresh secret")
    void shouldBeUnusableWithoutRefresh() {
        assertFalse(CredentialBundle.oauth2("a", null, NOW.minusSeconds(1), List.of()).isUsable(NOW));
        assertTrue(CredentialBundle.oauth2("a", "r", NOW.minusSeconds(1), List.of()).isUsable(NOW));
    }

    @Test
    @DisplayName("should treat an empty refresh secret as absent")
    void shouldTreatEmptyRefreshAsAbsent() {
        assertFalse(CredentialBundle.oauth2("a", "", null, List.of()).canRefresh());
    }

    @Test
    @DisplayName("should keep the previous refresh secret only when none was issued")
    void shouldRetainRefreshSecret() {
        final var previous = CredentialBundle.oauth2("old", "r1", null, List.of());
        final var withoutRefresh = CredentialBundle.oauth2("new", null, null, List.of());
        final var withRefresh = CredentialBundle.oauth2("new", "r2", null, List.of());

        assertEquals(Optional.of("r1"), withoutRefresh.retainingRefreshSecretOf(previous).refreshSecret());
        assertSame(withRefresh, withRefresh.retainingRefreshSecretOf(previous));
    }

    @Test
    @DisplayName("should keep expiry at millisecond precision")
    void shouldTruncateExpiryToMillis() {
        final var bundle =
                CredentialBundle.oauth2("a", null, Instant.parse("2030-01-01T00:00:00.123456Z"), List.of());

        assertEquals(Optional.of(Instant.parse("2030-01-01T00:00:00.123Z")), bundle.expiresAt());
    }

    @Test
    @DisplayName("should require an access secret")
    void shouldRequireAccessSecret() {
        assertThrows(IllegalArgumentException.class, () -> CredentialBundle.oauth2("", null, null, List.of()));
    }

    @Test
    @DisplayName("should keep secrets out of toString")
    void shouldHideSecrets() {
        final var text = CredentialBundle.oauth2("access-secret", "refresh-secret", null, List.of()).toString();

        assertFalse(text.contains("access-secret"));
        assertFalse(text.contains("refresh-secret"));
    }
}
