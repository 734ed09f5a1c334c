package crosspost.core.service.credential;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.model.common.CredentialException;
import crosspost.core.model.common.CredentialNotFoundException;
import crosspost.core.model.credential.CredentialBundle;
import crosspost.core.model.credential.CredentialOperation;
import crosspost.core.model.store.KeyPath;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.port.out.Metrics;
import crosspost.core.service.audit.AccessAuditor;
import crosspost.core.service.store.NamespacedStore;
import crosspost.core.service.store.StoreNamespaces;

/**
 * Encrypted storage of OAuth credentials per platform user.
 *
 * <p>Bundles are stored under {@code token/{platform}/{userId}} as encrypted
 * envelopes. Writes overwrite unconditionally, so concurrent saves for the same
 * user resolve to the last writer.
 *
 * <p>The vault returns what is stored. It never refreshes or purges expired
 * credentials; that is decided by the OAuth orchestrator.
 */
@ApplicationScoped
public class TokenVault {

    private static final Logger LOG = Logger.getLogger(TokenVault.class);

    private final NamespacedStore tokens;
    private final CredentialEncryptionService encryption;
    private final AccessAuditor auditor;
    private final Metrics metrics;

    @Inject
    public TokenVault(
            KeyedStore store, CredentialEncryptionService encryption, AccessAuditor auditor, Metrics metrics) {
        this.tokens = StoreNamespaces.tokens(store);
        this.encryption = encryption;
        this.auditor = auditor;
        this.metrics = metrics;
    }

    /**
     * Load and decrypt a user's credentials.
     *
     * @param platform the platform
     * @param userId the platform user id
     * @return the stored bundle
     * @throws CredentialNotFoundException if nothing is stored (as a failed Uni)
     * @throws crosspost.core.model.common.CorruptCredentialException if the envelope cannot be
     *         decrypted or parsed (as a failed Uni)
     */
    public Uni<CredentialBundle> get(String platform, String userId) {
        return Uni.createFrom()
                .deferred(() -> tokens.get(key(platform, userId)))
                .map(envelope -> envelope.orElseThrow(() -> new CredentialNotFoundException(platform, userId)))
                .map(envelope -> CredentialSerializer.deserialize(encryption.decrypt(envelope)))
                .onItemOrFailure()
                .invoke((bundle, failure) -> recordAccess(CredentialOperation.GET, platform, userId, failure));
    }

    /**
     * Encrypt and store a user's credentials, replacing any existing bundle.
     *
     * @param platform the platform
     * @param userId the platform user id
     * @param bundle the credentials
     * @return Uni completing when stored
     */
    public Uni<Void> save(String platform, String userId, CredentialBundle bundle) {
        return Uni.createFrom()
                .item(() -> encryption.encrypt(CredentialSerializer.serialize(bundle)))
                .flatMap(envelope -> tokens.set(key(platform, userId), envelope))
                .invoke(() -> LOG.debugf("Stored %s credential", platform))
                .onItemOrFailure()
                .invoke((v, failure) -> recordAccess(CredentialOperation.SAVE, platform, userId, failure));
    }

    /**
     * Delete a user's credentials. Deleting absent credentials succeeds.
     *
     * @param platform the platform
     * @param userId the platform user id
     * @return Uni completing when deleted
     */
    public Uni<Void> delete(String platform, String userId) {
        return Uni.createFrom()
                .deferred(() -> tokens.delete(key(platform, userId)))
                .onItemOrFailure()
                .invoke((v, failure) -> recordAccess(CredentialOperation.DELETE, platform, userId, failure));
    }

    /**
     * Check whether credentials are stored without decrypting them.
     *
     * @param platform the platform
     * @param userId the platform user id
     * @return true if an envelope is stored
     */
    public Uni<Boolean> exists(String platform, String userId) {
        return Uni.createFrom()
                .deferred(() -> tokens.get(key(platform, userId)))
                .map(Optional::isPresent)
                .onItemOrFailure()
                .invoke((found, failure) -> recordAccess(CredentialOperation.CHECK, platform, userId, failure));
    }

    private void recordAccess(CredentialOperation operation, String platform, String userId, Throwable failure) {
        final var success = failure == null;
        auditor.record(
                operation,
                userId,
                success,
                success ? Optional.empty() : Optional.of(describe(failure)),
                Optional.ofNullable(platform));
        metrics.recordCredentialOperation(operation.label(), platform, success);
    }

    // Messages may carry the raw user id, so only the error kind is audited
    private static String describe(Throwable failure) {
        if (failure instanceof CredentialException credentialException) {
            return credentialException.code().name();
        }
        return failure.getClass().getSimpleName();
    }

    private static KeyPath key(String platform, String userId) {
        return KeyPath.of(platform, userId);
    }
}
