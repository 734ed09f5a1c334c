package crosspost.core.service.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import crosspost.core.config.AuditConfig;
import crosspost.core.model.audit.AuditRecord;
import crosspost.core.model.credential.CredentialOperation;
import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.port.out.KeyedStore;
import crosspost.core.service.store.NamespacedStore;
import crosspost.core.service.store.StoreNamespaces;

/**
 * Append-only audit trail of credential accesses.
 *
 * <p>User ids are redacted before they are logged or stored. Recording never
 * fails the audited operation: persistence runs in the background and its
 * failures are only logged.
 *
 * <p>Records are stored under {@code audit/{epochMillis}-{sequence}-{node}}. Millis
 * and sequence are zero-padded so that key order is chronological; the node id is
 * random per auditor instance so that processes sharing a store never overwrite
 * each other's records.
 */
@ApplicationScoped
public class AccessAuditor {

    private static final Logger LOG = Logger.getLogger(AccessAuditor.class);
    private static final Logger AUDIT_LOG = Logger.getLogger("crosspost.audit");

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final String MASK = "***";
    private static final int VISIBLE_CHARS = 4;
    private static final long SEQUENCE_MODULUS = 1_000_000L;

    private final NamespacedStore auditStore;
    private final AuditConfig config;
    private final Clock clock;
    private final String nodeId;
    private final AtomicLong sequence = new AtomicLong();

    @Inject
    public AccessAuditor(KeyedStore store, AuditConfig config) {
        this(store, config, Clock.systemUTC());
    }

    public AccessAuditor(KeyedStore store, AuditConfig config, Clock clock) {
        this(store, config, clock, String.format("%08x", ThreadLocalRandom.current().nextInt()));
    }

    AccessAuditor(KeyedStore store, AuditConfig config, Clock clock, String nodeId) {
        this.auditStore = StoreNamespaces.audit(store);
        this.config = config;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    /**
     * Record a credential access. Never throws.
     *
     * @param operation the vault operation
     * @param userId the platform user id, redacted before use
     * @param success whether the operation succeeded
     * @param error failure description
     * @param platform the platform the credential belongs to
     */
    public void record(
            CredentialOperation operation,
            String userId,
            boolean success,
            Optional<String> error,
            Optional<String> platform) {
        try {
            final var record = new AuditRecord(clock.instant(), operation, redact(userId), success, error, platform);
            log(record);
            if (config.enabled()) {
                persist(record);
            }
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warnf(e, "Failed to record credential %s audit event", operation);
        }
    }

    /**
     * Return the most recent audit records, newest first.
     *
     * <p>Yields an empty list if the records cannot be read.
     *
     * @param limit maximum number of records
     * @return the records
     */
    public Uni<List<AuditRecord>> recent(int limit) {
        return auditStore
                .list(KeyPath.root(), ListOptions.newestFirst(Math.max(limit, 0)))
                .map(entries -> {
                    final var records = new ArrayList<AuditRecord>(entries.size());
                    for (var entry : entries) {
                        parse(entry.value()).ifPresent(records::add);
                    }
                    return List.copyOf(records);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to read audit records: %s", error.getMessage());
                    return List.of();
                });
    }

    /**
     * Return the most recent audit records using the configured default limit.
     */
    public Uni<List<AuditRecord>> recent() {
        return recent(config.recentDefaultLimit());
    }

    /**
     * Mask the middle of an identifier, keeping the first and last four characters.
     * Identifiers of eight characters or fewer are masked entirely.
     *
     * @param id the identifier
     * @return the redacted identifier
     */
    public static String redact(String id) {
        if (id == null || id.length() <= VISIBLE_CHARS * 2) {
            return MASK;
        }
        return id.substring(0, VISIBLE_CHARS) + MASK + id.substring(id.length() - VISIBLE_CHARS);
    }

    private void log(AuditRecord record) {
        if (record.success()) {
            AUDIT_LOG.infof(
                    "credential %s user=%s platform=%s success=true",
                    record.operation().label(), record.redactedUserId(), record.platform().orElse("-"));
        } else {
            AUDIT_LOG.warnf(
                    "credential %s user=%s platform=%s success=false error=%s",
                    record.operation().label(),
                    record.redactedUserId(),
                    record.platform().orElse("-"),
                    record.error().orElse("-"));
        }
    }

    private void persist(AuditRecord record) throws JsonProcessingException {
        final var key = KeyPath.of(String.format(
                "%013d-%06d-%s",
                record.timestamp().toEpochMilli(),
                sequence.getAndIncrement() % SEQUENCE_MODULUS,
                nodeId));
        final var json = OBJECT_MAPPER.writeValueAsString(StoredAuditRecord.from(record));

        auditStore
                .set(key, json, config.retention())
                .subscribe()
                .with(
                        v -> LOG.debugf("Stored audit record %s", key),
                        e -> LOG.warnf("Failed to store audit record %s: %s", key, e.getMessage()));
    }

    private Optional<AuditRecord> parse(String json) {
        try {
            return Optional.of(OBJECT_MAPPER.readValue(json, StoredAuditRecord.class).toRecord());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.debugf("Skipping unreadable audit record: %s", e.getMessage());
            return Optional.empty();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StoredAuditRecord(
            long timestamp, String operation, String userId, boolean success, String error, String platform) {

        static StoredAuditRecord from(AuditRecord record) {
            return new StoredAuditRecord(
                    record.timestamp().toEpochMilli(),
                    record.operation().label(),
                    record.redactedUserId(),
                    record.success(),
                    record.error().orElse(null),
                    record.platform().orElse(null));
        }

        AuditRecord toRecord() {
            return new AuditRecord(
                    Instant.ofEpochMilli(timestamp),
                    CredentialOperation.fromLabel(operation),
                    userId,
                    success,
                    Optional.ofNullable(error),
                    Optional.ofNullable(platform));
        }
    }
}
