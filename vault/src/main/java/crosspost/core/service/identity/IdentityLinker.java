package crosspost.core.service.identity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.config.LinkingConfig;
import crosspost.core.model.common.StoreUnavailableException;
import crosspost.core.model.identity.AuthorizationStatus;
import crosspost.core.model.identity.LinkedAccount;
import crosspost.core.model.identity.WalletAuthorization;
import crosspost.core.model.store.KeyPath;
import crosspost.core.port.in.AccountLinking;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.service.audit.AccessAuditor;
import crosspost.core.service.credential.TokenVault;
import crosspost.core.service.store.NamespacedStore;
import crosspost.core.service.store.StoreNamespaces;

/**
 * Binds platform accounts to wallet identities.
 *
 * <p>A wallet's linked accounts are kept as one JSON list under
 * {@code wallet-index/{walletId}}. Every change is a read-modify-write guarded by
 * {@link KeyedStore#compareAndSet}; a write that loses a race is retried against
 * the new value, up to {@code crosspost.linking.max-update-attempts} times.
 *
 * <p>Authorization is a separate record under {@code wallet-auth/{walletId}} and does
 * not depend on linked accounts.
 */
@ApplicationScoped
public class IdentityLinker implements AccountLinking {

    private static final Logger LOG = Logger.getLogger(IdentityLinker.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<LinkedAccount>> ACCOUNT_LIST_TYPE = new TypeReference<>() {};

    private final NamespacedStore walletIndex;
    private final NamespacedStore walletAuthorizations;
    private final TokenVault vault;
    private final LinkingConfig config;
    private final Clock clock;

    @Inject
    public IdentityLinker(KeyedStore store, TokenVault vault, LinkingConfig config) {
        this(store, vault, config, Clock.systemUTC());
    }

    public IdentityLinker(KeyedStore store, TokenVault vault, LinkingConfig config, Clock clock) {
        this.walletIndex = StoreNamespaces.walletIndex(store);
        this.walletAuthorizations = StoreNamespaces.walletAuthorizations(store);
        this.vault = vault;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Void> link(String walletId, String platform, String userId) {
        return updateIndex(walletId, accounts -> {
                    if (accounts.stream().anyMatch(a -> a.matches(platform, userId))) {
                        return Optional.empty();
                    }
                    final var updated = new ArrayList<>(accounts);
                    updated.add(new LinkedAccount(platform, userId, clock.instant()));
                    return Optional.of(updated);
                })
                .invoke(changed -> {
                    if (changed) {
                        LOG.infof(
                                "Linked %s account %s to wallet %s",
                                platform, AccessAuditor.redact(userId), walletId);
                    } else {
                        LOG.debugf("%s account already linked to wallet %s", platform, walletId);
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> unlink(String walletId, String platform, String userId) {
        final Uni<Void> indexRemoval = updateIndex(walletId, accounts -> {
                    final var updated = new ArrayList<>(accounts);
                    return updated.removeIf(a -> a.matches(platform, userId))
                            ? Optional.of(updated)
                            : Optional.empty();
                })
                .onFailure()
                .invoke(e -> LOG.warnf(
                        "Failed to remove %s account from wallet %s: %s", platform, walletId, e.getMessage()))
                .replaceWithVoid();

        final Uni<Void> credentialDeletion = vault.delete(platform, userId)
                .onFailure()
                .invoke(e -> LOG.warnf(
                        "Failed to delete %s credential while unlinking wallet %s: %s",
                        platform, walletId, e.getMessage()));

        return Uni.join()
                .all(indexRemoval, credentialDeletion)
                .andCollectFailures()
                .invoke(() -> LOG.infof("Unlinked %s account from wallet %s", platform, walletId))
                .replaceWithVoid();
    }

    @Override
    public Uni<List<LinkedAccount>> listLinked(String walletId) {
        return walletIndex.get(KeyPath.of(walletId)).map(json -> parseAccounts(walletId, json));
    }

    @Override
    public Uni<Boolean> hasAccess(String walletId, String platform, String userId) {
        return listLinked(walletId).map(accounts -> accounts.stream().anyMatch(a -> a.matches(platform, userId)));
    }

    @Override
    public Uni<Void> authorize(String walletId) {
        return Uni.createFrom()
                .item(() -> writeJson(new WalletAuthorization(true, clock.instant())))
                .flatMap(json -> walletAuthorizations.set(KeyPath.of(walletId), json))
                .invoke(() -> LOG.infof("Authorized wallet %s", walletId));
    }

    @Override
    public Uni<Void> unauthorize(String walletId) {
        return walletAuthorizations
                .delete(KeyPath.of(walletId))
                .invoke(() -> LOG.infof("Unauthorized wallet %s", walletId));
    }

    @Override
    public Uni<Integer> authorizationStatus(String walletId) {
        return isAuthorized(walletId).flatMap(authorized -> {
            if (!authorized) {
                return Uni.createFrom().item(AuthorizationStatus.NOT_AUTHORIZED);
            }
            return listLinked(walletId).map(List::size);
        });
    }

    /**
     * Check the wallet's authorization record.
     */
    public Uni<Boolean> isAuthorized(String walletId) {
        return walletAuthorizations.get(KeyPath.of(walletId)).map(json -> json.map(value -> {
                    try {
                        return OBJECT_MAPPER.readValue(value, WalletAuthorization.class).authorized();
                    } catch (JsonProcessingException e) {
                        LOG.warnf("Unreadable authorization record for wallet %s, treating as unauthorized", walletId);
                        return false;
                    }
                })
                .orElse(false));
    }

    /**
     * Apply {@code mutation} to the wallet's account list with compare-and-set.
     *
     * @param mutation returns the new list, or empty to leave the index unchanged
     * @return true if the index was written
     */
    private Uni<Boolean> updateIndex(
            String walletId, Function<List<LinkedAccount>, Optional<List<LinkedAccount>>> mutation) {
        return attemptUpdate(walletId, mutation, 1);
    }

    private Uni<Boolean> attemptUpdate(
            String walletId, Function<List<LinkedAccount>, Optional<List<LinkedAccount>>> mutation, int attempt) {
        final var key = KeyPath.of(walletId);
        return walletIndex.get(key).flatMap(current -> {
            final var updated = mutation.apply(parseAccounts(walletId, current));
            if (updated.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            return walletIndex
                    .compareAndSet(key, current, writeJson(updated.get()))
                    .flatMap(written -> {
                        if (written) {
                            return Uni.createFrom().item(true);
                        }
                        if (attempt >= config.maxUpdateAttempts()) {
                            LOG.warnf(
                                    "Giving up on linked account update for wallet %s after %d attempts",
                                    walletId, attempt);
                            return Uni.createFrom()
                                    .<Boolean>failure(new StoreUnavailableException(
                                            "Concurrent updates to linked accounts of wallet " + walletId));
                        }
                        LOG.debugf("Linked account update for wallet %s lost a race, retrying", walletId);
                        return attemptUpdate(walletId, mutation, attempt + 1);
                    });
        });
    }

    private List<LinkedAccount> parseAccounts(String walletId, Optional<String> json) {
        if (json.isEmpty()) {
            return List.of();
        }
        try {
            final var accounts = OBJECT_MAPPER.readValue(json.get(), ACCOUNT_LIST_TYPE);
            return accounts != null ? List.copyOf(accounts) : List.of();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Unreadable linked account index for wallet %s: %s", walletId, e.getMessage());
            return List.of();
        }
    }

    private static String writeJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
