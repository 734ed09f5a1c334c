package crosspost.core.service.credential;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import crosspost.core.config.VaultConfig;
import crosspost.core.model.common.CorruptCredentialException;

/**
 * Envelope encryption for credentials at rest.
 *
 * <p>Uses AES-GCM with a unique IV per envelope, providing both confidentiality
 * and integrity.
 *
 * <h2>Envelope format</h2>
 * <pre>
 * base64( version (1 byte, 0x01) || IV (12 bytes) || ciphertext || tag (16 bytes) )
 * </pre>
 *
 * <p>Envelopes written before the version byte existed ({@code IV || ciphertext || tag})
 * are read only when {@code crosspost.vault.encryption.legacy-read-enabled=true}.
 * Only the current format is ever written.
 *
 * <h2>Configuration</h2>
 * <pre>
 * crosspost.vault.encryption.key=${TOKEN_ENCRYPTION_KEY}
 * </pre>
 * A key whose UTF-8 encoding is 16, 24 or 32 bytes long is used directly;
 * any other secret is hashed to 32 bytes with SHA-256.
 */
@ApplicationScoped
public class CredentialEncryptionService {

    private static final Logger LOG = Logger.getLogger(CredentialEncryptionService.class);

    static final byte VERSION_1 = 0x01;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH = TAG_LENGTH_BITS / 8;

    private final SecretKey secretKey;
    private final boolean legacyReadEnabled;
    private final SecureRandom secureRandom;

    @Inject
    public CredentialEncryptionService(VaultConfig config) {
        this(config.encryption().key(), config.encryption().legacyReadEnabled());
    }

    /**
     * Constructor for manual instantiation.
     *
     * @param secret            the configured secret
     * @param legacyReadEnabled accept unversioned envelopes on read
     */
    public CredentialEncryptionService(String secret, boolean legacyReadEnabled) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException(
                    "Credential encryption key is not configured. Set crosspost.vault.encryption.key.");
        }
        this.secretKey = new SecretKeySpec(deriveKey(secret), "AES");
        this.legacyReadEnabled = legacyReadEnabled;
        this.secureRandom = new SecureRandom();

        if (legacyReadEnabled) {
            LOG.warn("Legacy unversioned credential envelopes will be accepted on read");
        }
    }

    /**
     * Encrypt a serialized credential into the current envelope format.
     *
     * @param plaintext the serialized credential
     * @return base64-encoded envelope
     */
    public String encrypt(String plaintext) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            final ByteBuffer buffer = ByteBuffer.allocate(1 + IV_LENGTH + ciphertext.length);
            buffer.put(VERSION_1);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    /**
     * Decrypt an envelope.
     *
     * @param envelope base64-encoded envelope
     * @return the serialized credential
     * @throws CorruptCredentialException if the envelope is malformed, has an unknown
     *         version or fails authentication
     */
    public String decrypt(String envelope) {
        final byte[] data;
        try {
            data = Base64.getDecoder().decode(envelope);
        } catch (IllegalArgumentException e) {
            throw new CorruptCredentialException("Credential envelope is not valid base64", e);
        }

        if (data.length >= 1 + IV_LENGTH + TAG_LENGTH && data[0] == VERSION_1) {
            try {
                return open(data, 1);
            } catch (GeneralSecurityException e) {
                // A legacy IV may begin with the version byte by chance
                if (!legacyReadEnabled) {
                    throw new CorruptCredentialException("Credential envelope failed authentication", e);
                }
            }
        } else if (!legacyReadEnabled) {
            throw new CorruptCredentialException("Unsupported credential envelope version");
        }

        if (data.length < IV_LENGTH + TAG_LENGTH) {
            throw new CorruptCredentialException("Credential envelope is truncated");
        }
        try {
            final var plaintext = open(data, 0);
            LOG.debug("Read credential from legacy envelope");
            return plaintext;
        } catch (GeneralSecurityException e) {
            throw new CorruptCredentialException("Credential envelope failed authentication", e);
        }
    }

    private String open(byte[] data, int offset) throws GeneralSecurityException {
        final byte[] iv = Arrays.copyOfRange(data, offset, offset + IV_LENGTH);
        final Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
        final byte[] plaintext = cipher.doFinal(data, offset + IV_LENGTH, data.length - offset - IV_LENGTH);
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    private static byte[] deriveKey(String secret) {
        final byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length == 16 || raw.length == 24 || raw.length == 32) {
            return raw;
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(raw);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
