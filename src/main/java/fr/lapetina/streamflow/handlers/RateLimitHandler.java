package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.exception.FlowException;
import fr.lapetina.streamflow.infrastructure.resilience.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Admits at most {@code rate} requests per {@code per}, token-bucket style.
 *
 * The bucket is shared by every request through this instance. A request waits for a token,
 * then streams its input through unchanged, or into the wrapped handler when one is given.
 * An invalid rate does not fail construction: every call fails with
 * {@link fr.lapetina.streamflow.domain.model.ErrorType#INVALID_CONFIGURATION} instead.
 */
public final class RateLimitHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    private final Handler handler;
    private final TokenBucketRateLimiter limiter;
    private final FlowException configurationError;

    public RateLimitHandler(int rate, Duration per) {
        this(rate, per, null);
    }

    public RateLimitHandler(int rate, Duration per, Handler handler) {
        this.handler = handler;
        TokenBucketRateLimiter created = null;
        FlowException error = null;
        try {
            created = new TokenBucketRateLimiter(rate, per);
        } catch (FlowException e) {
            error = e;
            log.warn("RateLimitHandler misconfigured, every call will fail: rate={}, per={}, error={}",
                    rate, per, e.getMessage());
        }
        this.limiter = created;
        this.configurationError = error;
        if (created != null) {
            log.info("RateLimitHandler initialized: rate={}, per={}", rate, per);
        }
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        if (configurationError != null) {
            throw FlowException.invalidConfiguration("invalid rate limit: " + configurationError.getMessage());
        }
        FlowContext ctx = request.context();
        long started = System.nanoTime();
        limiter.acquire(ctx);
        if (log.isDebugEnabled()) {
            log.debug("Request admitted: requestId={}, waitedMs={}",
                    ctx.requestId(), (System.nanoTime() - started) / 1_000_000);
        }

        if (handler != null) {
            handler.serveFlow(request, response);
        } else {
            request.data().transferTo(response.data());
        }
    }

    public long availableTokens() {
        return limiter != null ? limiter.availableTokens() : 0;
    }
}
