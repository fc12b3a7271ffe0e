package sentinel.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import sentinel.adapter.out.ratelimit.memory.FixedWindowRateLimiter;
import sentinel.core.config.RateLimitingConfig;
import sentinel.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter and the clock it reads window boundaries from.
 *
 * <p>One limiter instance exists per process; its bucket table is the only mutable
 * state shared between concurrent requests.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config) {
        this.config = config;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter(Clock clock) {
        if (config.enabled()) {
            LOG.infov("Rate limiting enabled with fixed {0}ms windows", FixedWindowRateLimiter.WINDOW_MILLIS);
        } else {
            LOG.info("Rate limiting is disabled");
        }
        return new FixedWindowRateLimiter(clock, config.enabled());
    }

    /**
     * System UTC clock; tests replace it with an adjustable one.
     */
    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
