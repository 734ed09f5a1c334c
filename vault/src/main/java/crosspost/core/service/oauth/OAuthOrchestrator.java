package crosspost.core.service.oauth;

import java.time.Clock;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.config.OAuthConfig;
import crosspost.core.model.auth.AuthFlowRequest;
import crosspost.core.model.auth.AuthInitialization;
import crosspost.core.model.auth.CallbackResult;
import crosspost.core.model.auth.TransientAuthState;
import crosspost.core.model.common.CorruptCredentialException;
import crosspost.core.model.common.CredentialNotFoundException;
import crosspost.core.model.common.InvalidStateException;
import crosspost.core.model.common.UnauthorizedException;
import crosspost.core.model.credential.CredentialBundle;
import crosspost.core.model.store.KeyPath;
import crosspost.core.port.in.AccountLinking;
import crosspost.core.port.in.PlatformAuthFlow;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.port.out.Metrics;
import crosspost.core.service.credential.TokenVault;
import crosspost.core.service.store.NamespacedStore;
import crosspost.core.service.store.StoreNamespaces;
import crosspost.spi.PlatformAuthStrategy;

/**
 * OAuth lifecycle of one platform's credentials.
 *
 * <pre>
 * INIT --initializeAuth--> AWAITING_CALLBACK --handleCallback--> LINKED
 * LINKED --refreshToken--> LINKED (new bundle) | UNLINKED (refresh rejected)
 * LINKED --revokeToken--> UNLINKED
 * </pre>
 *
 * <p>Platform calls are delegated to a {@link PlatformAuthStrategy}; this class
 * owns persistence of flow state and credentials and the decisions about when
 * to refresh or delete them.
 *
 * <p>Flow state lives under {@code auth/{state}} with a TTL of
 * {@code crosspost.oauth.state-ttl} and is removed atomically when the callback
 * reads it, so a replayed callback cannot exchange the code again. State belonging
 * to another platform is left in place for that platform's callback.
 */
public class OAuthOrchestrator implements PlatformAuthFlow {

    private static final Logger LOG = Logger.getLogger(OAuthOrchestrator.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final PlatformAuthStrategy strategy;
    private final String platform;
    private final NamespacedStore authStates;
    private final TokenVault vault;
    private final AccountLinking linking;
    private final OAuthConfig config;
    private final Metrics metrics;
    private final Clock clock;

    public OAuthOrchestrator(
            PlatformAuthStrategy strategy,
            KeyedStore store,
            TokenVault vault,
            AccountLinking linking,
            OAuthConfig config,
            Metrics metrics,
            Clock clock) {
        this.strategy = strategy;
        this.platform = strategy.platform();
        this.authStates = StoreNamespaces.authStates(store);
        this.vault = vault;
        this.linking = linking;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public String platform() {
        return platform;
    }

    PlatformAuthStrategy strategy() {
        return strategy;
    }

    @Override
    public Uni<AuthInitialization> initializeAuth(AuthFlowRequest request) {
        return strategy.buildAuthUrl(request.redirectUri(), request.scopes()).flatMap(authRequest -> {
            final var state = new TransientAuthState(
                    platform,
                    request.walletId(),
                    request.redirectUri(),
                    authRequest.codeVerifier(),
                    request.successUrl().orElse(request.redirectUri()),
                    request.errorUrl().orElse(request.redirectUri()),
                    clock.instant());
            return authStates
                    .set(KeyPath.of(authRequest.state()), writeState(state), Optional.of(config.stateTtl()))
                    .invoke(() -> LOG.debugf(
                            "Started %s authorization flow for wallet %s", platform, request.walletId()))
                    .replaceWith(AuthInitialization.from(authRequest));
        });
    }

    @Override
    public Uni<Optional<TransientAuthState>> findAuthState(String state) {
        if (state == null || state.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return authStates
                .get(KeyPath.of(state))
                .map(json -> json.flatMap(this::readState).filter(s -> platform.equals(s.platform())));
    }

    @Override
    public Uni<CallbackResult> handleCallback(String code, String state) {
        if (state == null || state.isBlank()) {
            return Uni.createFrom().failure(new InvalidStateException(platform));
        }
        if (code == null || code.isBlank()) {
            return Uni.createFrom().failure(new UnauthorizedException("Missing authorization code", platform));
        }

        final var key = KeyPath.of(state);
        return findAuthState(state)
                .flatMap(peeked -> peeked.isPresent()
                        ? authStates.getAndDelete(key).map(json -> json.flatMap(this::readState))
                        : Uni.createFrom().item(Optional.<TransientAuthState>empty()))
                .map(consumed -> consumed.filter(s -> platform.equals(s.platform()))
                        .orElseThrow(() -> {
                            LOG.debugf("Rejected %s callback with unknown or consumed state", platform);
                            return new InvalidStateException(platform);
                        }))
                .flatMap(authState -> strategy.exchangeCodeForCredential(
                                code, authState.redirectUri(), authState.codeVerifier())
                        .flatMap(exchange -> vault.save(platform, exchange.userId(), exchange.bundle())
                                .chain(() -> linking.link(authState.walletId(), platform, exchange.userId()))
                                .replaceWith(new CallbackResult(
                                        exchange.userId(),
                                        authState.walletId(),
                                        exchange.bundle(),
                                        authState.successUrl()))))
                .invoke(result -> LOG.infof("Completed %s authorization for wallet %s", platform, result.walletId()));
    }

    @Override
    public Uni<CredentialBundle> refreshToken(String userId) {
        return vault.get(platform, userId).flatMap(bundle -> refresh(userId, bundle));
    }

    @Override
    public Uni<Boolean> revokeToken(String userId) {
        return vault.get(platform, userId)
                .map(Optional::of)
                .onFailure(CredentialNotFoundException.class)
                .recoverWithItem(Optional.empty())
                .onFailure(CorruptCredentialException.class)
                .recoverWithItem(error -> {
                    LOG.warnf("Cannot read %s credential for remote revocation, deleting locally", platform);
                    return Optional.empty();
                })
                .flatMap(bundle -> bundle.map(this::revokeRemotely).orElse(Uni.createFrom().voidItem()))
                .chain(() -> vault.delete(platform, userId))
                .replaceWith(true);
    }

    @Override
    public Uni<CredentialBundle> getUsableCredential(String userId) {
        return vault.get(platform, userId).flatMap(bundle -> {
            if (!bundle.isExpired(clock.instant())) {
                return Uni.createFrom().item(bundle);
            }
            if (bundle.canRefresh()) {
                LOG.debugf("%s credential expired, refreshing", platform);
                return refresh(userId, bundle);
            }
            LOG.infof("%s credential expired without refresh token, purging", platform);
            return deleteQuietly(userId)
                    .chain(() -> Uni.createFrom()
                            .<CredentialBundle>failure(
                                    new UnauthorizedException("Credential expired and cannot be refreshed", platform)));
        });
    }

    private Uni<CredentialBundle> refresh(String userId, CredentialBundle current) {
        if (!current.canRefresh()) {
            metrics.recordRefresh(platform, "unavailable");
            return Uni.createFrom()
                    .failure(new UnauthorizedException(
                            "No refresh token available, re-authentication required", platform));
        }

        return strategy.refreshCredential(current)
                .onFailure(UnauthorizedException.class)
                .call(error -> {
                    LOG.infof("%s rejected refresh token, deleting stored credential", platform);
                    metrics.recordRefresh(platform, "unauthorized");
                    return deleteQuietly(userId);
                })
                .onFailure(UnauthorizedException.class)
                .transform(error -> new UnauthorizedException(
                        "Refresh token rejected, re-authentication required", platform, false, error))
                .onFailure(e -> !(e instanceof UnauthorizedException))
                .invoke(error -> metrics.recordRefresh(platform, "failed"))
                .map(refreshed -> refreshed.retainingRefreshSecretOf(current))
                .flatMap(refreshed -> vault.save(platform, userId, refreshed).replaceWith(refreshed))
                .invoke(refreshed -> {
                    metrics.recordRefresh(platform, "success");
                    LOG.debugf("Refreshed %s credential", platform);
                });
    }

    private Uni<Void> revokeRemotely(CredentialBundle bundle) {
        return strategy.revokeCredential(bundle).onFailure().recoverWithItem(error -> {
            LOG.warnf("Remote revocation of %s credential failed: %s", platform, error.getMessage());
            return null;
        });
    }

    private Uni<Void> deleteQuietly(String userId) {
        return vault.delete(platform, userId).onFailure().recoverWithItem(error -> {
            LOG.warnf("Failed to delete %s credential: %s", platform, error.getMessage());
            return null;
        });
    }

    private String writeState(TransientAuthState state) {
        try {
            return OBJECT_MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize authorization state", e);
        }
    }

    private Optional<TransientAuthState> readState(String json) {
        try {
            return Optional.of(OBJECT_MAPPER.readValue(json, TransientAuthState.class));
        } catch (JsonProcessingException e) {
            LOG.warnf("Unreadable %s authorization state: %s", platform, e.getMessage());
            return Optional.empty();
        }
    }
}
