package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.exception.FlowException;
import fr.lapetina.streamflow.infrastructure.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tries handlers in order until one succeeds.
 *
 * Each handler sits behind its own {@link CircuitBreaker}; a handler whose circuit is open
 * is skipped without being called. The input is buffered so every candidate sees the same
 * bytes, and only the winning handler's output is written downstream.
 *
 * A failure caused by the caller's context ending stops the fallback and is not counted
 * against the handler's circuit.
 */
public final class FallbackHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(FallbackHandler.class);

    private final List<Handler> handlers;
    private final List<CircuitBreaker> breakers;

    public FallbackHandler(Handler... handlers) {
        this(CircuitBreaker.DEFAULT_FAILURE_THRESHOLD, CircuitBreaker.DEFAULT_OPEN_TIMEOUT, handlers);
    }

    public FallbackHandler(int failureThreshold, Duration openTimeout, Handler... handlers) {
        this.handlers = List.of(handlers);
        List<CircuitBreaker> created = new ArrayList<>(handlers.length);
        for (int i = 0; i < handlers.length; i++) {
            created.add(new CircuitBreaker("handler-" + i, failureThreshold, openTimeout));
        }
        this.breakers = Collections.unmodifiableList(created);
        log.info("FallbackHandler created: handlers={}, failureThreshold={}, openTimeout={}",
                handlers.length, failureThreshold, openTimeout);
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        if (handlers.isEmpty()) {
            throw FlowException.invalidConfiguration("no handlers provided to fallback");
        }
        FlowContext ctx = request.context();
        byte[] input = request.readAllBytes();

        Exception lastError = null;
        for (int i = 0; i < handlers.size(); i++) {
            ctx.throwIfDone();
            CircuitBreaker breaker = breakers.get(i);
            if (!breaker.allowRequest()) {
                log.debug("Handler skipped, circuit open: requestId={}, handler={}", ctx.requestId(), i);
                if (lastError == null) {
                    lastError = new FlowException(ErrorType.CIRCUIT_OPEN, "circuit open for handler " + i);
                }
                continue;
            }

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            try {
                handlers.get(i).serveFlow(request.withData(input), new Response(output));
            } catch (Exception e) {
                // The caller gave up: not the handler's fault, and no other handler should run
                if (ctx.isDone() || e instanceof FlowException flowError && flowError.isContextError()) {
                    FlowException contextError = ctx.error();
                    log.debug("Fallback stopped, context ended: requestId={}, handler={}", ctx.requestId(), i);
                    throw contextError != null ? contextError : e;
                }
                breaker.recordFailure();
                lastError = e;
                log.debug("Handler failed, falling back: requestId={}, handler={}, error={}",
                        ctx.requestId(), i, e.toString());
                continue;
            }
            breaker.recordSuccess();
            if (i > 0) {
                log.info("Fallback handler succeeded: requestId={}, handler={}", ctx.requestId(), i);
            }
            response.write(output.toByteArray());
            return;
        }

        throw new FlowException(ErrorType.ALL_HANDLERS_FAILED,
                "all handlers failed, last error: " + lastError.getMessage(), lastError);
    }

    /**
     * Breakers in handler order, for inspection and metrics.
     */
    public List<CircuitBreaker> getCircuitBreakers() {
        return breakers;
    }
}
