package sentinel.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import sentinel.config.TelemetryConfigMapping;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.RateLimitKey;
import sentinel.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, so callers need not check the
 * configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code sentinel.requests.total} - requests by service, outcome and status</li>
 *   <li>{@code sentinel.proxy.latency} - pipeline latency of forwarded requests</li>
 *   <li>{@code sentinel.ratelimit.exceeded.total} - rate limit rejections by service and scope</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordOutcome(String serviceName, ProxyOutcome outcome, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("sentinel.requests.total")
                .description("Total number of proxy requests processed")
                .tag("service", nullSafe(serviceName))
                .tag("outcome", outcomeName(outcome))
                .tag("status", String.valueOf(outcome.statusCode()))
                .register(registry)
                .increment();

        if (outcome instanceof ProxyOutcome.Forwarded
                || outcome instanceof ProxyOutcome.UpstreamTimeout
                || outcome instanceof ProxyOutcome.UpstreamUnavailable) {
            Timer.builder("sentinel.proxy.latency")
                    .description("Time from admission to upstream response")
                    .tag("service", nullSafe(serviceName))
                    .tag("status_class", statusClass(outcome.statusCode()))
                    .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                    .register(registry)
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void recordRateLimitExceeded(String serviceName, RateLimitKey.Scope scope) {
        if (!enabled) {
            return;
        }

        Counter.builder("sentinel.ratelimit.exceeded.total")
                .description("Requests rejected by a rate limit")
                .tag("service", nullSafe(serviceName))
                .tag("scope", scope.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    static String outcomeName(ProxyOutcome outcome) {
        if (outcome instanceof ProxyOutcome.Forwarded) {
            return "forwarded";
        }
        if (outcome instanceof ProxyOutcome.ServiceNotFound) {
            return "service_not_found";
        }
        if (outcome instanceof ProxyOutcome.Denied denied) {
            return denied.reason().name().toLowerCase(Locale.ROOT);
        }
        if (outcome instanceof ProxyOutcome.RateLimited) {
            return "rate_limited";
        }
        if (outcome instanceof ProxyOutcome.UpstreamTimeout) {
            return "upstream_timeout";
        }
        return "upstream_unavailable";
    }

    private static String statusClass(int statusCode) {
        return (statusCode / 100) + "xx";
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
