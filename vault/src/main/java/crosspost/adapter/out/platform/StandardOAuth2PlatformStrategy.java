package crosspost.adapter.out.platform;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import crosspost.core.config.PlatformsConfig.PlatformConfig;
import crosspost.core.model.auth.AuthorizationRequest;
import crosspost.core.model.auth.CodeExchange;
import crosspost.core.model.common.CredentialException;
import crosspost.core.model.common.PlatformException;
import crosspost.core.model.common.RateLimitedException;
import crosspost.core.model.common.TransientNetworkException;
import crosspost.core.model.common.UnauthorizedException;
import crosspost.core.model.credential.CredentialBundle;
import crosspost.core.model.credential.CredentialScheme;
import crosspost.core.service.oauth.PkceService;
import crosspost.spi.PlatformAuthStrategy;

/**
 * Platform strategy for providers that follow OAuth 2.0 (RFC 6749) with PKCE (RFC 7636).
 *
 * <p>Supports:
 * <ul>
 *   <li>Authorization URL with S256 code challenge</li>
 *   <li>Authorization code and refresh token grants</li>
 *   <li>client_secret_basic and client_secret_post authentication</li>
 *   <li>User id lookup from a user-info endpoint</li>
 *   <li>Token revocation (RFC 7009)</li>
 * </ul>
 *
 * <p>Platform responses map to credential errors: {@code invalid_grant} and 401 to
 * {@link UnauthorizedException}, 429 to {@link RateLimitedException}, 5xx and
 * connection failures to {@link TransientNetworkException}, anything else to
 * {@link PlatformException}.
 */
public class StandardOAuth2PlatformStrategy implements PlatformAuthStrategy {

    private static final Logger LOG = Logger.getLogger(StandardOAuth2PlatformStrategy.class);

    private final String platform;
    private final PlatformConfig config;
    private final WebClient webClient;
    private final PkceService pkceService;
    private final Clock clock;

    public StandardOAuth2PlatformStrategy(
            String platform, PlatformConfig config, WebClient webClient, PkceService pkceService, Clock clock) {
        this.platform = platform;
        this.config = config;
        this.webClient = webClient;
        this.pkceService = pkceService;
        this.clock = clock;
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public Uni<AuthorizationRequest> buildAuthUrl(String redirectUri, List<String> scopes) {
        return Uni.createFrom().item(() -> {
            final var effectiveScopes = scopes.isEmpty() ? config.defaultScopes().orElse(List.of()) : scopes;
            final var state = pkceService.generateState();

            final Map<String, String> params = new LinkedHashMap<>();
            params.put("response_type", "code");
            params.put("client_id", config.clientId());
            params.put("redirect_uri", redirectUri);
            if (!effectiveScopes.isEmpty()) {
                params.put("scope", String.join(" ", effectiveScopes));
            }
            params.put("state", state);

            Optional<String> verifier = Optional.empty();
            if (config.pkce()) {
                verifier = Optional.of(pkceService.generateCodeVerifier());
                params.put("code_challenge", pkceService.generateChallenge(verifier.get()));
                params.put("code_challenge_method", PkceService.S256_METHOD);
            }

            final var endpoint = config.authorizationEndpoint();
            final var separator = endpoint.contains("?") ? "&" : "?";
            return new AuthorizationRequest(endpoint + separator + formEncode(params), state, verifier);
        });
    }

    @Override
    public Uni<CodeExchange> exchangeCodeForCredential(
            String code, String redirectUri, Optional<String> codeVerifier) {
        LOG.debugf("Exchanging %s authorization code", platform);

        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", redirectUri);
        codeVerifier.ifPresent(verifier -> params.put("code_verifier", verifier));

        return postForm(config.tokenEndpoint(), params, "token exchange")
                .map(response -> parseTokenResponse(response, Optional.empty()))
                .flatMap(bundle -> fetchUserId(bundle).map(userId -> new CodeExchange(userId, bundle)));
    }

    @Override
    public Uni<CredentialBundle> refreshCredential(CredentialBundle bundle) {
        if (bundle.refreshSecret().isEmpty()) {
            return Uni.createFrom().failure(new UnauthorizedException("No refresh token available", platform));
        }
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "refresh_token");
        params.put("refresh_token", bundle.refreshSecret().get());

        return postForm(config.tokenEndpoint(), params, "token refresh")
                .map(response -> parseTokenResponse(response, Optional.of(bundle)));
    }

    @Override
    public Uni<Void> revokeCredential(CredentialBundle bundle) {
        if (config.revocationEndpoint().isEmpty()) {
            LOG.debugf("No revocation endpoint configured for %s, skipping remote revocation", platform);
            return Uni.createFrom().voidItem();
        }
        final Map<String, String> params = new LinkedHashMap<>();
        if (bundle.refreshSecret().isPresent()) {
            params.put("token", bundle.refreshSecret().get());
            params.put("token_type_hint", "refresh_token");
        } else {
            params.put("token", bundle.accessSecret());
            params.put("token_type_hint", "access_token");
        }
        return postForm(config.revocationEndpoint().get(), params, "token revocation")
                .invoke(() -> LOG.debugf("Revoked %s credential", platform))
                .replaceWithVoid();
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("platform-" + platform)
                .up()
                .withData("strategy", "oauth2")
                .withData("tokenEndpoint", config.tokenEndpoint())
                .withData("pkce", config.pkce())
                .build());
    }

    private Uni<HttpResponse<Buffer>> postForm(String endpoint, Map<String, String> params, String action) {
        final Map<String, String> form = new LinkedHashMap<>(params);
        HttpRequest<Buffer> request = webClient
                .postAbs(endpoint)
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json");

        if (config.basicAuth() && config.clientSecret().isPresent()) {
            final var credentials = config.clientId() + ":" + config.clientSecret().get();
            final var encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
            request = request.putHeader("Authorization", "Basic " + encoded);
            form.put("client_id", config.clientId());
        } else {
            form.put("client_id", config.clientId());
            config.clientSecret().ifPresent(secret -> form.put("client_secret", secret));
        }

        return send(request.sendBuffer(Buffer.buffer(formEncode(form))), action);
    }

    private Uni<String> fetchUserId(CredentialBundle bundle) {
        final var request = webClient
                .getAbs(config.userInfoEndpoint())
                .timeout(config.timeout().toMillis())
                .putHeader("Accept", "application/json")
                .putHeader("Authorization", "Bearer " + bundle.accessSecret());

        return send(request.send(), "user lookup").map(response -> {
            final var userId = extractField(parseJson(response, "user lookup"), config.userIdField());
            if (userId.isEmpty()) {
                throw new PlatformException(
                        "User info response has no " + config.userIdField(), platform, response.statusCode(), false);
            }
            return userId.get();
        });
    }

    /**
     * Send a request and map non-2xx responses and connection failures to credential errors.
     */
    private Uni<HttpResponse<Buffer>> send(Uni<HttpResponse<Buffer>> exchange, String action) {
        return exchange.onFailure(e -> !(e instanceof CredentialException))
                .transform(error -> {
                    LOG.warnf("%s %s failed: %s", platform, action, error.getMessage());
                    return new TransientNetworkException(
                            platform + " " + action + " failed: " + error.getMessage(), platform, error);
                })
                .map(response -> {
                    final var status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        return response;
                    }
                    throw mapErrorResponse(response, action);
                });
    }

    private CredentialException mapErrorResponse(HttpResponse<Buffer> response, String action) {
        final var status = response.statusCode();
        final var errorCode = errorCode(response);
        LOG.warnf("%s %s returned status %d (%s)", platform, action, status, errorCode.orElse("no error code"));

        if (status == 401 || errorCode.filter("invalid_grant"::equals).isPresent()) {
            return new UnauthorizedException(platform + " rejected the credential during " + action, platform);
        }
        if (status == 429) {
            return new RateLimitedException(
                    platform + " rate limited " + action, platform, retryAfter(response).orElse(null));
        }
        if (status >= 500) {
            return new TransientNetworkException(
                    platform + " " + action + " failed with status " + status, platform, null);
        }
        return new PlatformException(
                platform + " " + action + " failed with status " + status + errorCode.map(c -> ": " + c).orElse(""),
                platform,
                status,
                false);
    }

    private CredentialBundle parseTokenResponse(HttpResponse<Buffer> response, Optional<CredentialBundle> previous) {
        final var json = parseJson(response, "token response");
        final var accessToken = stringField(json, "access_token", response);
        if (accessToken.isEmpty() || accessToken.get().isBlank()) {
            throw new PlatformException("Token response missing access_token", platform, response.statusCode(), false);
        }

        final var expiresIn = json.getValue("expires_in");
        final Optional<Instant> expiresAt = expiresIn instanceof Number seconds
                ? Optional.of(clock.instant().plusSeconds(seconds.longValue()))
                : Optional.empty();

        final List<String> scopes = parseScopes(json.getValue("scope"), response)
                .orElseGet(() -> previous.map(CredentialBundle::scopes).orElse(List.of()));

        final var bundle = new CredentialBundle(
                accessToken.get(),
                stringField(json, "refresh_token", response),
                Optional.empty(),
                expiresAt,
                scopes,
                CredentialScheme.OAUTH2);
        return previous.map(bundle::retainingRefreshSecretOf).orElse(bundle);
    }

    private Optional<String> stringField(JsonObject json, String field, HttpResponse<Buffer> response) {
        final var value = json.getValue(field);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return Optional.of(text);
        }
        throw new PlatformException(
                "Token response field " + field + " is not a string", platform, response.statusCode(), false);
    }

    // Providers send scope as a space or comma separated string, some as an array
    private Optional<List<String>> parseScopes(Object value, HttpResponse<Buffer> response) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return Optional.of(Arrays.stream(text.split("[\\s,]+")).filter(s -> !s.isEmpty()).toList());
        }
        if (value instanceof JsonArray array && array.stream().allMatch(String.class::isInstance)) {
            return Optional.of(array.stream().map(String.class::cast).toList());
        }
        throw new PlatformException(
                "Token response scope has unexpected shape", platform, response.statusCode(), false);
    }

    private JsonObject parseJson(HttpResponse<Buffer> response, String what) {
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new PlatformException(
                        "Empty " + what + " from " + platform, platform, response.statusCode(), false);
            }
            return json;
        } catch (DecodeException e) {
            throw new PlatformException(
                    "Malformed " + what + " from " + platform, platform, response.statusCode(), false);
        }
    }

    private static Optional<String> errorCode(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            return json == null ? Optional.empty() : Optional.ofNullable(json.getString("error"));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Duration> retryAfter(HttpResponse<Buffer> response) {
        final var header = response.getHeader("Retry-After");
        if (header == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(header.trim())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Read a dot-separated field path such as {@code data.id}. Numbers are returned as text.
     */
    static Optional<String> extractField(JsonObject json, String path) {
        Object current = json;
        for (String part : path.split("\\.")) {
            if (!(current instanceof JsonObject object)) {
                return Optional.empty();
            }
            current = object.getValue(part);
        }
        if (current == null || current instanceof JsonObject) {
            return Optional.empty();
        }
        final var value = current.toString();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
