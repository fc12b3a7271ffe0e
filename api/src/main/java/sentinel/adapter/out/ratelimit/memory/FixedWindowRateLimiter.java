package sentinel.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import sentinel.core.model.RateLimitDecision;
import sentinel.core.model.RateLimitKey;
import sentinel.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>Each key owns one window of {@value #WINDOW_MILLIS} ms that starts with the first
 * request after the previous window expired. Within a window the first {@code limit}
 * requests are allowed and later ones are rejected without being counted. A burst that
 * straddles a window boundary can admit up to {@code 2 * limit} requests in a short
 * span; there is no sliding-window smoothing.
 *
 * <p>Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * <li>No cleanup of stale entries; the key space is bounded by the number of configured
 * services and agents</li>
 * </ul>
 */
public final class FixedWindowRateLimiter implements RateLimiter {

    public static final long WINDOW_MILLIS = 60_000L;

    private final ConcurrentMap<String, Window> windows;
    private final Clock clock;
    private final boolean enabled;

    /**
     * @param clock   time source for window boundaries
     * @param enabled whether rate limiting is enabled
     */
    public FixedWindowRateLimiter(Clock clock, boolean enabled) {
        this.windows = new ConcurrentHashMap<>();
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public RateLimitDecision checkAndConsume(RateLimitKey key, long limitPerMinute) {
        if (!enabled || limitPerMinute <= 0) {
            return RateLimitDecision.unlimited();
        }

        final var nowMillis = clock.millis();
        final var result = new RateLimitDecision[1];

        // compute() runs atomically per key
        windows.compute(key.toCacheKey(), (k, current) -> {
            if (current == null || nowMillis - current.startMillis() >= WINDOW_MILLIS) {
                final var fresh = new Window(1, nowMillis);
                result[0] = RateLimitDecision.allow(1, limitPerMinute, fresh.resetAt());
                return fresh;
            }
            if (current.count() < limitPerMinute) {
                final var next = new Window(current.count() + 1, current.startMillis());
                result[0] = RateLimitDecision.allow(next.count(), limitPerMinute, next.resetAt());
                return next;
            }
            result[0] = RateLimitDecision.rejected(
                    current.count(), limitPerMinute, current.resetAt(), retryAfterSeconds(current, nowMillis));
            return current;
        });

        return result[0];
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the current number of tracked buckets.
     *
     * @return the number of buckets
     */
    public int getBucketCount() {
        return windows.size();
    }

    private static long retryAfterSeconds(Window window, long nowMillis) {
        final var remainingMillis = window.startMillis() + WINDOW_MILLIS - nowMillis;
        return Math.max(1, (remainingMillis + 999) / 1000);
    }

    private record Window(int count, long startMillis) {
        Instant resetAt() {
            return Instant.ofEpochMilli(startMillis + WINDOW_MILLIS);
        }
    }
}
