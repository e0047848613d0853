package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.Flow;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.exception.FlowException;
import fr.lapetina.streamflow.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsHandlerTest {

    private MeterRegistry meterRegistry;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MetricsRegistry("test", meterRegistry);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count successful requests and record latency")
    void shouldRecordSuccess() {
        AtomicReference<String> stageInMdc = new AtomicReference<>();
        MetricsHandler handler = new MetricsHandler("upper", (request, response) -> {
            stageInMdc.set(MDC.get("stage"));
            response.write(request.readString().toUpperCase());
        }, metrics);

        String result = new Flow().use(handler).run(FlowContext.background(), "abc");

        assertThat(result).isEqualTo("ABC");
        assertThat(stageInMdc.get()).isEqualTo("upper");
        assertThat(meterRegistry.get("test_requests_total")
                .tag("stage", "upper").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("test_stage_latency").tag("stage", "upper").timer().count()).isEqualTo(1);
        assertThat(metrics.getInFlight()).isZero();
    }

    @Test
    @DisplayName("should count failures by error type and rethrow them")
    void shouldRecordFailures() {
        MetricsHandler io = new MetricsHandler("io", (request, response) -> {
            throw new IOException("disk gone");
        }, metrics);
        MetricsHandler exhausted = new MetricsHandler("retry", (request, response) -> {
            throw new FlowException(ErrorType.RETRY_EXHAUSTED, "gave up");
        }, metrics);

        assertThatThrownBy(() -> new Flow().use(io).run(FlowContext.background(), "x"))
                .isInstanceOf(FlowException.class);
        assertThatThrownBy(() -> new Flow().use(exhausted).run(FlowContext.background(), "x"))
                .isInstanceOf(FlowException.class)
                .hasMessage("gave up");

        assertThat(meterRegistry.get("test_errors_total")
                .tag("stage", "io").tag("type", "IO_ERROR").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("test_errors_total")
                .tag("stage", "retry").tag("type", "RETRY_EXHAUSTED").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("test_requests_total")
                .tag("stage", "io").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getInFlight()).isZero();
    }
}
