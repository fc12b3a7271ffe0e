package sentinel.core.port.out;

import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.RateLimitKey;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    boolean isEnabled();

    /**
     * Record the outcome of one admitted or rejected request.
     *
     * @param serviceName the requested service (may be unknown)
     * @param outcome     the outcome
     * @param latencyMs   time spent in the pipeline
     */
    void recordOutcome(String serviceName, ProxyOutcome outcome, long latencyMs);

    /**
     * Record a rejected rate limit check.
     *
     * @param serviceName the requested service
     * @param scope       which bucket rejected the request
     */
    void recordRateLimitExceeded(String serviceName, RateLimitKey.Scope scope);
}
