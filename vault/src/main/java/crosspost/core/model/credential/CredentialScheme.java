package crosspost.core.model.credential;

/**
 * Protocol a credential bundle was issued under.
 */
public enum CredentialScheme {
    /** OAuth 1.0a: access token plus token secret, no expiry or refresh. */
    OAUTH1("oauth1"),
    /** OAuth 2.0 bearer token, optionally expiring and refreshable. */
    OAUTH2("oauth2");

    private final String wireName;

    CredentialScheme(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a scheme from its serialized name. A missing name defaults to OAuth 2.0.
     *
     * @throws IllegalArgumentException if the name is not a known scheme
     */
    public static CredentialScheme fromWireName(String name) {
        if (name == null) {
            return OAUTH2;
        }
        for (CredentialScheme scheme : values()) {
            if (scheme.wireName.equalsIgnoreCase(name)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("Unknown credential scheme: " + name);
    }
}
