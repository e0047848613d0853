package fr.lapetina.streamflow.infrastructure.metrics;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.infrastructure.resilience.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    @Test
    @DisplayName("should reuse meters for the same tags")
    void shouldReuseMeters() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        try (MetricsRegistry metrics = new MetricsRegistry("flow", meterRegistry)) {
            metrics.incrementRequestCount("parse", "success");
            metrics.incrementRequestCount("parse", "success");
            metrics.incrementErrorCount("parse", ErrorType.TIMEOUT);
            metrics.recordStageLatency("parse", Duration.ofMillis(5));

            assertThat(meterRegistry.get("flow_requests_total").counters()).hasSize(1);
            assertThat(meterRegistry.get("flow_requests_total").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("flow_errors_total").tag("type", "TIMEOUT").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("flow_stage_latency").timer().count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should expose circuit breaker state as a gauge")
    void shouldTrackBreakerState() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry metrics = new MetricsRegistry("flow", meterRegistry);
        CircuitBreaker breaker = new CircuitBreaker("handler-0", 1, Duration.ofMinutes(1));

        metrics.registerCircuitBreaker("fallback-0", breaker);

        assertThat(gauge(meterRegistry)).isEqualTo(2.0);
        breaker.recordFailure();
        assertThat(gauge(meterRegistry)).isEqualTo(0.0);
        breaker.forceState(CircuitBreaker.State.HALF_OPEN);
        assertThat(gauge(meterRegistry)).isEqualTo(1.0);
    }

    private static double gauge(SimpleMeterRegistry meterRegistry) {
        return meterRegistry.get("flow_circuit_breaker_state")
                .tag("group", "fallback-0").tag("breaker", "handler-0")
                .gauge().value();
    }

    @Test
    @DisplayName("should track in-flight stages")
    void shouldTrackInFlight() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry metrics = new MetricsRegistry("flow", meterRegistry);

        metrics.stageStarted();
        metrics.stageStarted();
        metrics.stageFinished();

        assertThat(meterRegistry.get("flow_inflight_stages").gauge().value()).isEqualTo(1.0);
        assertThat(metrics.scrape()).isEmpty();
    }

    @Test
    @DisplayName("should scrape in Prometheus format by default")
    void shouldScrapePrometheus() {
        MetricsRegistry metrics = new MetricsRegistry();
        metrics.incrementRequestCount("emit", "success");

        assertThat(metrics.scrape()).contains("stream_flow_requests_total");
        assertThat(metrics.getPrefix()).isEqualTo(MetricsRegistry.DEFAULT_PREFIX);
        metrics.close();
    }
}
