package crosspost.core.service.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import crosspost.adapter.out.storage.memory.InMemoryKeyedStore;
import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;

@DisplayName("NamespacedStore")
class NamespacedStoreTest {

    private static final Duration WAIT = Duration.ofSeconds(1);

    private InMemoryKeyedStore backing;

    @BeforeEach
    void setUp() {
        backing = new InMemoryKeyedStore();
    }

    @AfterEach
    void tearDown() {
        backing.close();
    }

    @Test
    @DisplayName("should write under the namespace prefix")
    void shouldWriteUnderNamespace() {
        final var tokens = StoreNamespaces.tokens(backing);

        tokens.set(KeyPath.of("twitter", "123"), "envelope").await().atMost(WAIT);

        assertEquals(
                Optional.of("envelope"),
                backing.get(KeyPath.of("token", "twitter", "123")).await().atMost(WAIT));
    }

    @Test
    @DisplayName("should isolate namespaces from each other")
    void shouldIsolateNamespaces() {
        StoreNamespaces.walletIndex(backing).set(KeyPath.of("alice.near"), "[]").await().atMost(WAIT);

        assertTrue(StoreNamespaces.walletAuthorizations(backing)
                .get(KeyPath.of("alice.near"))
                .await()
                .atMost(WAIT)
                .isEmpty());
    }

    @Test
    @DisplayName("should list keys relative to the namespace")
    void shouldListRelativeKeys() {
        final var tokens = StoreNamespaces.tokens(backing);
        tokens.set(KeyPath.of("twitter", "1"), "a").await().atMost(WAIT);
        tokens.set(KeyPath.of("twitter", "2"), "b").await().atMost(WAIT);
        StoreNamespaces.audit(backing).set(KeyPath.of("1"), "audit").await().atMost(WAIT);

        final var entries = tokens.list(KeyPath.root(), ListOptions.defaults()).await().atMost(WAIT);

        assertEquals(
                List.of(
                        new StoreEntry(KeyPath.of("twitter", "1"), "a"),
                        new StoreEntry(KeyPath.of("twitter", "2"), "b")),
                entries);
    }

    @Test
    @DisplayName("should delegate atomic operations with qualified keys")
    void shouldDelegateAtomicOperations() {
        final var states = StoreNamespaces.authStates(backing);

        assertTrue(states.compareAndSet(KeyPath.of("s1"), Optional.empty(), "v").await().atMost(WAIT));
        assertEquals(Optional.of("v"), backing.get(KeyPath.of("auth", "s1")).await().atMost(WAIT));
        assertEquals(Optional.of("v"), states.getAndDelete(KeyPath.of("s1")).await().atMost(WAIT));
        assertTrue(backing.get(KeyPath.of("auth", "s1")).await().atMost(WAIT).isEmpty());
    }

    @Test
    @DisplayName("should reject root namespaces and root keys")
    void shouldRejectRoot() {
        assertThrows(IllegalArgumentException.class, () -> new NamespacedStore(backing, KeyPath.root()));
        assertThrows(
                IllegalArgumentException.class,
                () -> StoreNamespaces.tokens(backing).get(KeyPath.root()));
    }
}
