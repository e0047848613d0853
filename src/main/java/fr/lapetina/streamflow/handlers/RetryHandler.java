package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.exception.FlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * Replays the buffered input into a handler until one attempt succeeds.
 *
 * The whole input is read once. Each attempt gets a fresh reader over it and writes into
 * a private buffer, so output of a failed attempt never reaches the downstream stage.
 * Between attempts the handler sleeps {@code initialBackoff * multiplier^attempt}, capped at
 * {@code maxBackoff}. Sleeps end early when the request context ends.
 *
 * The wrapped handler may run up to {@code maxAttempts} times and must tolerate repetition.
 */
public final class RetryHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);

    private final Handler handler;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryHandler(Handler handler, int maxAttempts) {
        this(handler, maxAttempts, DEFAULT_INITIAL_BACKOFF, DEFAULT_MULTIPLIER, DEFAULT_MAX_BACKOFF);
    }

    public RetryHandler(Handler handler, int maxAttempts, Duration initialBackoff,
                        double multiplier, Duration maxBackoff) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.multiplier = multiplier;
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        if (maxAttempts < 1) {
            throw FlowException.invalidConfiguration("maxAttempts must be at least 1, got " + maxAttempts);
        }
        FlowContext ctx = request.context();
        byte[] input = request.readAllBytes();

        Exception lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            ctx.throwIfDone();
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            try {
                handler.serveFlow(request.withData(input), new Response(output));
                if (attempt > 0) {
                    log.info("Retry succeeded: requestId={}, attempt={}/{}", ctx.requestId(), attempt + 1, maxAttempts);
                }
                response.write(output.toByteArray());
                return;
            } catch (Exception e) {
                lastError = e;
                log.debug("Attempt failed: requestId={}, attempt={}/{}, error={}",
                        ctx.requestId(), attempt + 1, maxAttempts, e.toString());
            }

            if (attempt < maxAttempts - 1) {
                ctx.sleep(backoff(attempt));
            }
        }

        log.warn("Retries exhausted: requestId={}, attempts={}, lastError={}",
                ctx.requestId(), maxAttempts, lastError.toString());
        throw new FlowException(ErrorType.RETRY_EXHAUSTED,
                "retry exhausted after " + maxAttempts + " attempts: " + lastError.getMessage(), lastError);
    }

    /**
     * Returns the pause after the given zero-based attempt.
     */
    Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt);
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
