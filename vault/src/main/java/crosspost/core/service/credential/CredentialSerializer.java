package crosspost.core.service.credential;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import crosspost.core.model.common.CorruptCredentialException;
import crosspost.core.model.credential.CredentialBundle;
import crosspost.core.model.credential.CredentialScheme;

/**
 * JSON form of a credential bundle as it appears inside an envelope.
 *
 * <pre>{@code
 * {"accessToken":"...","refreshToken":"...","expiresAt":1718000000000,
 *  "scope":["tweet.read"],"tokenType":"oauth2"}
 * }</pre>
 *
 * <p>{@code scope} is read either as an array or as a space or comma separated string.
 */
final class CredentialSerializer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CredentialSerializer() {}

    static String serialize(CredentialBundle bundle) {
        final var stored = new StoredCredential(
                bundle.accessSecret(),
                bundle.refreshSecret().orElse(null),
                bundle.legacySecret().orElse(null),
                bundle.expiresAt().map(Instant::toEpochMilli).orElse(null),
                OBJECT_MAPPER.valueToTree(bundle.scopes()),
                bundle.scheme().wireName());
        try {
            return OBJECT_MAPPER.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize credential", e);
        }
    }

    static CredentialBundle deserialize(String json) {
        final StoredCredential stored;
        try {
            stored = OBJECT_MAPPER.readValue(json, StoredCredential.class);
        } catch (JsonProcessingException e) {
            throw new CorruptCredentialException("Credential payload is not valid JSON", e);
        }
        if (stored == null || stored.accessToken() == null || stored.accessToken().isEmpty()) {
            throw new CorruptCredentialException("Credential payload has no access token");
        }
        return new CredentialBundle(
                stored.accessToken(),
                Optional.ofNullable(stored.refreshToken()),
                Optional.ofNullable(stored.tokenSecret()),
                Optional.ofNullable(stored.expiresAt()).map(Instant::ofEpochMilli),
                parseScopes(stored.scope()),
                parseScheme(stored.tokenType()));
    }

    private static CredentialScheme parseScheme(String tokenType) {
        try {
            return CredentialScheme.fromWireName(tokenType);
        } catch (IllegalArgumentException e) {
            throw new CorruptCredentialException("Credential has unknown token type", e);
        }
    }

    private static List<String> parseScopes(JsonNode scope) {
        final var scopes = new ArrayList<String>();
        if (scope == null || scope.isNull()) {
            return scopes;
        }
        if (scope.isArray()) {
            scope.forEach(node -> scopes.add(node.asText()));
        } else if (scope.isTextual()) {
            for (String part : scope.asText().split("[\\s,]+")) {
                if (!part.isEmpty()) {
                    scopes.add(part);
                }
            }
        } else {
            throw new CorruptCredentialException("Credential scope has unexpected type: " + scope.getNodeType());
        }
        return scopes;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StoredCredential(
            String accessToken,
            String refreshToken,
            String tokenSecret,
            Long expiresAt,
            JsonNode scope,
            String tokenType) {}
}
