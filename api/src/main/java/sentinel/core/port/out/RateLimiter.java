package sentinel.core.port.out;

import sentinel.core.model.RateLimitDecision;
import sentinel.core.model.RateLimitKey;

/**
 * Port interface for rate limiting.
 *
 * <p>Implementations keep per-key counters. A check is atomic per key: concurrent
 * callers never admit more than {@code limitPerMinute} requests in one window.
 */
public interface RateLimiter {

    /**
     * Check if a request is allowed and count it if so.
     *
     * <p>A limit of zero or less means unlimited; no state is created for it.
     *
     * @param key            the bucket key
     * @param limitPerMinute requests allowed per window
     * @return the decision
     */
    RateLimitDecision checkAndConsume(RateLimitKey key, long limitPerMinute);

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
