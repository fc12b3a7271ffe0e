package sentinel.support;

import java.util.ArrayList;
import java.util.List;

import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.RateLimitKey;
import sentinel.core.port.out.Metrics;

public class RecordingMetrics implements Metrics {

    public final List<ProxyOutcome> outcomes = new ArrayList<>();
    public final List<RateLimitKey.Scope> rateLimitRejections = new ArrayList<>();

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void recordOutcome(String serviceName, ProxyOutcome outcome, long latencyMs) {
        outcomes.add(outcome);
    }

    @Override
    public void recordRateLimitExceeded(String serviceName, RateLimitKey.Scope scope) {
        rateLimitRejections.add(scope);
    }
}
