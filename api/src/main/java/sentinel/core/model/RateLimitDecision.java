package sentinel.core.model;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed           whether the request is allowed
 * @param count             requests counted in the current window, including this one when allowed
 * @param limit             the configured limit per window
 * @param resetAt           when the current window ends
 * @param retryAfterSeconds seconds until the window resets (only meaningful when not allowed)
 */
public record RateLimitDecision(boolean allowed, int count, long limit, Instant resetAt, long retryAfterSeconds) {

    /**
     * Decision used when no limit applies.
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, 0, Long.MAX_VALUE, Instant.MAX, 0);
    }

    public static RateLimitDecision allow(int count, long limit, Instant resetAt) {
        return new RateLimitDecision(true, count, limit, resetAt, 0);
    }

    public static RateLimitDecision rejected(int count, long limit, Instant resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, count, limit, resetAt, retryAfterSeconds);
    }
}
