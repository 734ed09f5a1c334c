package crosspost.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential encryption at rest.
 *
 * <p>Configuration prefix: {@code crosspost.vault}
 *
 * <pre>
 * crosspost.vault.encryption.key=${TOKEN_ENCRYPTION_KEY}
 * crosspost.vault.encryption.legacy-read-enabled=false
 * </pre>
 */
@ConfigMapping(prefix = "crosspost.vault")
public interface VaultConfig {

    EncryptionConfig encryption();

    interface EncryptionConfig {

        /**
         * Secret the AES key is derived from.
         *
         * <p>Used directly when its UTF-8 encoding is 16, 24 or 32 bytes long,
         * otherwise hashed with SHA-256. Required.
         */
        String key();

        /**
         * Accept envelopes written before the version byte was introduced.
         *
         * <p>Only affects reads; envelopes are always written in the current format.
         *
         * @return true to accept unversioned envelopes (default: false)
         */
        @WithDefault("false")
        boolean legacyReadEnabled();
    }
}
