package crosspost.core.service.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import crosspost.adapter.out.storage.memory.InMemoryKeyedStore;
import crosspost.core.config.LinkingConfig;
import crosspost.core.model.common.StoreUnavailableException;
import crosspost.core.model.identity.AuthorizationStatus;
import crosspost.core.model.identity.LinkedAccount;
import crosspost.core.model.store.KeyPath;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.service.credential.TokenVault;
import crosspost.testing.MutableClock;

@DisplayName("IdentityLinker")
@ExtendWith(MockitoExtension.class)
class IdentityLinkerTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final String WALLET = "alice.near";

    @Mock
    private TokenVault vault;

    @Mock
    private LinkingConfig config;

    private MutableClock clock;
    private InMemoryKeyedStore store;
    private IdentityLinker linker;

    @BeforeEach
    void setUp() {
        lenient().when(config.maxUpdateAttempts()).thenReturn(5);
        lenient().when(vault.delete(any(), any())).thenReturn(Uni.createFrom().voidItem());

        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        store = new InMemoryKeyedStore(clock);
        linker = new IdentityLinker(store, vault, config, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private int status(String walletId) {
        return linker.authorizationStatus(walletId).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("should report an unknown wallet as not authorized")
        void shouldReportUnknownWallet() {
            assertEquals(AuthorizationStatus.NOT_AUTHORIZED, status("bob.near"));
        }

        @Test
        @DisplayName("should report zero accounts after authorizing")
        void shouldReportZeroAfterAuthorize() {
            linker.authorize(WALLET).await().atMost(WAIT);

            assertEquals(AuthorizationStatus.NO_ACCOUNTS, status(WALLET));
            assertTrue(linker.isAuthorized(WALLET).await().atMost(WAIT));
        }

        @Test
        @DisplayName("should not authorize a wallet by linking accounts")
        void shouldNotAuthorizeByLinking() {
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            assertEquals(AuthorizationStatus.NOT_AUTHORIZED, status(WALLET));
        }

        @Test
        @DisplayName("should keep linked accounts when unauthorizing")
        void shouldKeepAccountsWhenUnauthorizing() {
            linker.authorize(WALLET).await().atMost(WAIT);
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            linker.unauthorize(WALLET).await().atMost(WAIT);

            assertEquals(AuthorizationStatus.NOT_AUTHORIZED, status(WALLET));
            assertEquals(1, linker.listLinked(WALLET).await().atMost(WAIT).size());
        }

        @Test
        @DisplayName("should treat an unreadable authorization record as not authorized")
        void shouldTreatCorruptRecordAsUnauthorized() {
            store.set(KeyPath.of("wallet-auth", WALLET), "{broken").await().atMost(WAIT);

            assertEquals(AuthorizationStatus.NOT_AUTHORIZED, status(WALLET));
        }
    }

    @Nested
    @DisplayName("link() / unlink()")
    class LinkTests {

        @Test
        @DisplayName("should link, count and unlink accounts for an authorized wallet")
        void shouldRunLinkLifecycle() {
            linker.authorize(WALLET).await().atMost(WAIT);
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            assertEquals(1, status(WALLET));
            assertTrue(linker.hasAccess(WALLET, "twitter", "u1").await().atMost(WAIT));

            linker.unlink(WALLET, "twitter", "u1").await().atMost(WAIT);

            assertEquals(AuthorizationStatus.NO_ACCOUNTS, status(WALLET));
            assertFalse(linker.hasAccess(WALLET, "twitter", "u1").await().atMost(WAIT));
            verify(vault).delete("twitter", "u1");
        }

        @Test
        @DisplayName("should ignore a repeated link")
        void shouldIgnoreRepeatedLink() {
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);
            clock.advance(Duration.ofHours(1));
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            final var accounts = linker.listLinked(WALLET).await().atMost(WAIT);

            assertEquals(1, accounts.size());
            assertEquals(Instant.parse("2024-06-01T12:00:00Z"), accounts.get(0).connectedAt());
        }

        @Test
        @DisplayName("should keep accounts of other platforms and users")
        void shouldKeepOtherAccounts() {
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);
            linker.link(WALLET, "twitter", "u2").await().atMost(WAIT);
            linker.link(WALLET, "mastodon", "u1").await().atMost(WAIT);

            linker.unlink(WALLET, "twitter", "u1").await().atMost(WAIT);

            final var remaining = linker.listLinked(WALLET).await().atMost(WAIT);
            assertEquals(2, remaining.size());
            assertTrue(remaining.stream().anyMatch(a -> a.matches("twitter", "u2")));
            assertTrue(remaining.stream().anyMatch(a -> a.matches("mastodon", "u1")));
        }

        @Test
        @DisplayName("should not grant access to other wallets")
        void shouldNotGrantAccessToOtherWallets() {
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            assertFalse(linker.hasAccess("bob.near", "twitter", "u1").await().atMost(WAIT));
        }

        @Test
        @DisplayName("should delete the credential even when the account was not linked")
        void shouldDeleteCredentialForUnknownAccount() {
            linker.unlink(WALLET, "twitter", "ghost").await().atMost(WAIT);

            verify(vault).delete("twitter", "ghost");
            assertTrue(linker.listLinked(WALLET).await().atMost(WAIT).isEmpty());
        }

        @Test
        @DisplayName("should update the index and report failure when credential deletion fails")
        void shouldReportCredentialDeletionFailure() {
            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);
            when(vault.delete("twitter", "u1"))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("down")));

            assertThrows(RuntimeException.class, () -> linker.unlink(WALLET, "twitter", "u1")
                    .await()
                    .atMost(WAIT));

            assertTrue(linker.listLinked(WALLET).await().atMost(WAIT).isEmpty());
        }

        @Test
        @DisplayName("should treat an unreadable index as empty")
        void shouldTreatCorruptIndexAsEmpty() {
            store.set(KeyPath.of("wallet-index", WALLET), "not json").await().atMost(WAIT);

            assertTrue(linker.listLinked(WALLET).await().atMost(WAIT).isEmpty());

            linker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            assertEquals(
                    List.of("u1"),
                    linker.listLinked(WALLET).await().atMost(WAIT).stream()
                            .map(LinkedAccount::userId)
                            .toList());
        }
    }

    @Nested
    @DisplayName("concurrent updates")
    class ConcurrencyTests {

        @Test
        @DisplayName("should retry after losing a compare-and-set")
        void shouldRetryAfterLostRace() {
            final var contended = mock(KeyedStore.class);
            when(contended.get(any())).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(contended.compareAndSet(any(), any(), any()))
                    .thenReturn(Uni.createFrom().item(false))
                    .thenReturn(Uni.createFrom().item(true));
            final var contendedLinker = new IdentityLinker(contended, vault, config, clock);

            contendedLinker.link(WALLET, "twitter", "u1").await().atMost(WAIT);

            verify(contended, times(2)).compareAndSet(eq(KeyPath.of("wallet-index", WALLET)), any(), any());
        }

        @Test
        @DisplayName("should give up after the configured number of attempts")
        void shouldGiveUpAfterMaxAttempts() {
            final var contended = mock(KeyedStore.class);
            when(contended.get(any())).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(contended.compareAndSet(any(), any(), any())).thenReturn(Uni.createFrom().item(false));
            final var contendedLinker = new IdentityLinker(contended, vault, config, clock);

            assertThrows(
                    StoreUnavailableException.class,
                    () -> contendedLinker.link(WALLET, "twitter", "u1").await().atMost(WAIT));

            verify(contended, times(5)).compareAndSet(any(), any(), any());
        }

        @Test
        @DisplayName("should keep every account linked concurrently")
        void shouldKeepConcurrentLinks() throws InterruptedException {
            when(config.maxUpdateAttempts()).thenReturn(100);
            final var executor = Executors.newFixedThreadPool(8);
            final var tasks = new ArrayList<Callable<Void>>();
            for (int i = 0; i < 16; i++) {
                final var userId = "user-" + i;
                tasks.add(() -> {
                    linker.link(WALLET, "twitter", userId).await().atMost(Duration.ofSeconds(5));
                    return null;
                });
            }
            try {
                executor.invokeAll(tasks);
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            }

            assertEquals(16, linker.listLinked(WALLET).await().atMost(WAIT).size());
        }
    }
}
