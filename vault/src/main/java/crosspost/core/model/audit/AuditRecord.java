package crosspost.core.model.audit;

import java.time.Instant;
import java.util.Optional;

import crosspost.core.model.credential.CredentialOperation;

/**
 * Append-only record of a credential access.
 *
 * @param timestamp      when the operation completed
 * @param operation      the vault operation
 * @param redactedUserId platform user id with its middle masked
 * @param success        whether the operation succeeded
 * @param error          failure description, if any
 * @param platform       platform the credential belongs to
 */
public record AuditRecord(
        Instant timestamp,
        CredentialOperation operation,
        String redactedUserId,
        boolean success,
        Optional<String> error,
        Optional<String> platform) {

    public AuditRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        error = error != null ? error : Optional.empty();
        platform = platform != null ? platform : Optional.empty();
    }
}
