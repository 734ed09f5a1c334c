package crosspost.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithParentName;

/**
 * Configuration mapping for platforms served by the standard OAuth 2.0 strategy.
 *
 * <p>Configuration prefix: {@code crosspost.platforms}
 *
 * <pre>
 * crosspost.platforms.twitter.client-id=${TWITTER_CLIENT_ID}
 * crosspost.platforms.twitter.client-secret=${TWITTER_CLIENT_SECRET}
 * crosspost.platforms.twitter.authorization-endpoint=https://twitter.com/i/oauth2/authorize
 * crosspost.platforms.twitter.token-endpoint=https://api.twitter.com/2/oauth2/token
 * crosspost.platforms.twitter.revocation-endpoint=https://api.twitter.com/2/oauth2/revoke
 * crosspost.platforms.twitter.user-info-endpoint=https://api.twitter.com/2/users/me
 * crosspost.platforms.twitter.user-id-field=data.id
 * crosspost.platforms.twitter.default-scopes=tweet.read,tweet.write,users.read,offline.access
 * </pre>
 */
@ConfigMapping(prefix = "crosspost.platforms")
public interface PlatformsConfig {

    @WithParentName
    Map<String, PlatformConfig> platforms();

    interface PlatformConfig {

        /**
         * @return true if the platform is offered (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        String clientId();

        /**
         * Client secret; absent for public clients.
         */
        Optional<String> clientSecret();

        String authorizationEndpoint();

        String tokenEndpoint();

        /**
         * RFC 7009 revocation endpoint; revocation is skipped when absent.
         */
        Optional<String> revocationEndpoint();

        /**
         * Endpoint returning the authenticated user, called with the new access token.
         */
        String userInfoEndpoint();

        /**
         * Dot-separated path of the user id inside the user-info response.
         *
         * @return Field path (default: id)
         */
        @WithDefault("id")
        String userIdField();

        /**
         * Scopes requested when the caller does not name any.
         */
        Optional<List<String>> defaultScopes();

        /**
         * @return true if PKCE (S256) is used (default: true)
         */
        @WithDefault("true")
        boolean pkce();

        /**
         * @return Send client credentials with HTTP Basic instead of in the form body (default: true)
         */
        @WithDefault("true")
        boolean basicAuth();

        /**
         * @return Timeout for platform calls (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
