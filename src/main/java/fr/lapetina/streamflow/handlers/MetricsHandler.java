package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.exception.FlowException;
import fr.lapetina.streamflow.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Objects;

/**
 * Records metrics around a wrapped handler.
 *
 * Records:
 * - Request count by stage and outcome
 * - Stage latency
 * - Error count by stage and {@link ErrorType}
 * - Sets the stage name in the MDC while the handler runs
 */
public final class MetricsHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final String stage;
    private final Handler handler;
    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(String stage, Handler handler, MetricsRegistry metricsRegistry) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry");
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        String previousStage = MDC.get("stage");
        MDC.put("stage", stage);
        metricsRegistry.stageStarted();
        long started = System.nanoTime();
        try {
            handler.serveFlow(request, response);
            metricsRegistry.incrementRequestCount(stage, "success");
        } catch (Exception e) {
            ErrorType type = FlowException.wrap(e).getErrorType();
            metricsRegistry.incrementRequestCount(stage, "failure");
            metricsRegistry.incrementErrorCount(stage, type);
            log.debug("Instrumented stage failed: requestId={}, stage={}, errorType={}",
                    request.context().requestId(), stage, type);
            throw e;
        } finally {
            metricsRegistry.recordStageLatency(stage, Duration.ofNanos(System.nanoTime() - started));
            metricsRegistry.stageFinished();
            if (previousStage != null) {
                MDC.put("stage", previousStage);
            } else {
                MDC.remove("stage");
            }
        }
    }

    public String getStage() {
        return stage;
    }
}
