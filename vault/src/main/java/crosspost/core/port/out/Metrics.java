package crosspost.core.port.out;

/**
 * Port interface for recording credential subsystem metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer, OpenTelemetry).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a vault operation.
     *
     * @param operation the operation name (get, save, delete, check)
     * @param platform the platform the credential belongs to
     * @param success whether the operation succeeded
     */
    void recordCredentialOperation(String operation, String platform, boolean success);

    /**
     * Record a credential refresh attempt.
     *
     * @param platform the platform
     * @param outcome the outcome (success, unauthorized, failed)
     */
    void recordRefresh(String platform, String outcome);

    /**
     * Record a store operation that timed out.
     *
     * @param store the store name
     * @param operation the operation name
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a store operation that failed for a reason other than a timeout.
     *
     * @param store the store name
     * @param operation the operation name
     */
    void recordStoreFailure(String store, String operation);

    /**
     * Metrics implementation that records nothing.
     */
    static Metrics noop() {
        return NoopMetrics.INSTANCE;
    }

    /**
     * No-op metrics, used when no registry is available.
     */
    final class NoopMetrics implements Metrics {

        static final NoopMetrics INSTANCE = new NoopMetrics();

        private NoopMetrics() {}

        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void recordCredentialOperation(String operation, String platform, boolean success) {}

        @Override
        public void recordRefresh(String platform, String outcome) {}

        @Override
        public void recordStoreTimeout(String store, String operation) {}

        @Override
        public void recordStoreFailure(String store, String operation) {}
    }
}
