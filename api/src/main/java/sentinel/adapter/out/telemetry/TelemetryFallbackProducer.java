package sentinel.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.quarkus.arc.DefaultBean;

/**
 * Fallback telemetry beans, used only when the Quarkus OpenTelemetry and Micrometer
 * extensions provide none (telemetry disabled, tests).
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * @return a no-op tracer for upstream spans
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public Tracer tracer() {
        return OpenTelemetry.noop().getTracer("sentinel-noop");
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public TextMapPropagator textMapPropagator() {
        return OpenTelemetry.noop().getPropagators().getTextMapPropagator();
    }
}
