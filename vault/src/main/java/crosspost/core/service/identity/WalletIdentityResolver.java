package crosspost.core.service.identity;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.config.WalletAuthConfig;
import crosspost.core.model.common.UnauthorizedException;
import crosspost.core.model.identity.AuthorizationStatus;
import crosspost.core.model.identity.WalletAuthProof;
import crosspost.core.port.in.AccountLinking;
import crosspost.spi.SignatureVerifier;

/**
 * Resolves the wallet identity behind a bearer credential.
 *
 * <p>The bearer credential is a JSON signed statement:
 * <pre>{@code
 * {"account_id":"alice.near","public_key":"ed25519:...","signature":"...",
 *  "message":"...","nonce":"1718000000000","recipient":"crosspost.near"}
 * }</pre>
 *
 * <p>The nonce is the signing time in epoch milliseconds and must lie between
 * {@code crosspost.wallet.max-nonce-age} ago and the current time plus
 * {@code crosspost.wallet.clock-skew}. Signature checking is delegated to the
 * deployed {@link SignatureVerifier}; without one every proof is rejected.
 */
@ApplicationScoped
public class WalletIdentityResolver {

    private static final Logger LOG = Logger.getLogger(WalletIdentityResolver.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Optional<SignatureVerifier> verifier;
    private final AccountLinking linking;
    private final WalletAuthConfig config;
    private final Clock clock;

    @Inject
    public WalletIdentityResolver(
            Instance<SignatureVerifier> verifiers, AccountLinking linking, WalletAuthConfig config) {
        this(
                verifiers.isResolvable() ? Optional.of(verifiers.get()) : Optional.empty(),
                linking,
                config,
                Clock.systemUTC());
    }

    public WalletIdentityResolver(
            Optional<SignatureVerifier> verifier, AccountLinking linking, WalletAuthConfig config, Clock clock) {
        this.verifier = verifier;
        this.linking = linking;
        this.config = config;
        this.clock = clock;
        if (verifier.isEmpty()) {
            LOG.warn("No SignatureVerifier is deployed; all wallet proofs will be rejected");
        }
    }

    /**
     * Verify a bearer credential and return the wallet identity it proves.
     *
     * @param bearer the credential, with or without the {@code Bearer } prefix
     * @param requireAuthorization also require the wallet to have authorized the service
     * @return the wallet identity
     * @throws UnauthorizedException if the proof is malformed, stale or not verified,
     *         or authorization is required and missing (as a failed Uni)
     */
    public Uni<String> resolve(String bearer, boolean requireAuthorization) {
        return Uni.createFrom()
                .item(() -> parse(bearer))
                .invoke(this::validateNonce)
                .flatMap(proof -> verify(proof).replaceWith(proof.accountId()))
                .flatMap(walletId ->
                        requireAuthorization ? requireAuthorized(walletId) : Uni.createFrom().item(walletId));
    }

    WalletAuthProof parse(String bearer) {
        if (bearer == null || bearer.isBlank()) {
            throw new UnauthorizedException("Missing wallet credential");
        }
        final var token = bearer.startsWith(BEARER_PREFIX) ? bearer.substring(BEARER_PREFIX.length()) : bearer;

        final ProofPayload payload;
        try {
            payload = OBJECT_MAPPER.readValue(token.trim(), ProofPayload.class);
        } catch (JsonProcessingException e) {
            throw new UnauthorizedException("Wallet credential is not valid JSON");
        }
        if (payload == null
                || isBlank(payload.accountId())
                || isBlank(payload.publicKey())
                || isBlank(payload.signature())
                || isBlank(payload.message())
                || isBlank(payload.nonce())) {
            throw new UnauthorizedException("Wallet credential is missing required fields");
        }
        return new WalletAuthProof(
                payload.accountId(),
                payload.publicKey(),
                payload.signature(),
                payload.message(),
                payload.nonce(),
                Optional.of(isBlank(payload.recipient()) ? config.defaultRecipient() : payload.recipient()));
    }

    void validateNonce(WalletAuthProof proof) {
        final long nonceMillis;
        try {
            nonceMillis = Long.parseLong(proof.nonce().trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("Invalid nonce format");
        }
        final var signedAt = Instant.ofEpochMilli(nonceMillis);
        final var now = clock.instant();
        if (signedAt.isAfter(now.plus(config.clockSkew()))) {
            throw new UnauthorizedException("Nonce timestamp is in the future");
        }
        if (signedAt.isBefore(now.minus(config.maxNonceAge()))) {
            throw new UnauthorizedException("Nonce timestamp is too old");
        }
    }

    private Uni<Void> verify(WalletAuthProof proof) {
        if (verifier.isEmpty()) {
            return Uni.createFrom().failure(new UnauthorizedException("Wallet signature verification is unavailable"));
        }
        return verifier.get()
                .verify(proof)
                .onFailure(e -> !(e instanceof UnauthorizedException))
                .transform(e -> new UnauthorizedException("Wallet signature verification failed", null, false, e))
                .flatMap(valid -> {
                    if (!valid) {
                        LOG.debugf("Rejected wallet signature for %s", proof.accountId());
                        return Uni.createFrom().failure(new UnauthorizedException("Invalid wallet signature"));
                    }
                    return Uni.createFrom().voidItem();
                });
    }

    private Uni<String> requireAuthorized(String walletId) {
        return linking.authorizationStatus(walletId).map(status -> {
            if (!AuthorizationStatus.isAuthorized(status)) {
                throw new UnauthorizedException("Wallet " + walletId + " has not authorized the service");
            }
            return walletId;
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record ProofPayload(
            @JsonProperty("account_id") String accountId,
            @JsonProperty("public_key") String publicKey,
            @JsonProperty("signature") String signature,
            @JsonProperty("message") String message,
            @JsonProperty("nonce") String nonce,
            @JsonProperty("recipient") String recipient) {}
}
