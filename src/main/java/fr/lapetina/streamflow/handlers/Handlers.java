package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.Handler;

import java.io.OutputStream;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Static factories for the built-in handlers.
 *
 * <pre>{@code
 * Flow flow = new Flow()
 *         .use(Handlers.timeout(Handlers.retry(callUpstream, 3), Duration.ofSeconds(10)))
 *         .use(Handlers.rateLimit(5, Duration.ofSeconds(1)));
 * }</pre>
 */
public final class Handlers {

    private Handlers() {
    }

    public static Handler passThrough() {
        return (request, response) -> request.data().transferTo(response.data());
    }

    public static Handler branch(Predicate<byte[]> condition, Handler ifHandler, Handler elseHandler) {
        return new BranchHandler(condition, ifHandler, elseHandler);
    }

    public static Handler tee(OutputStream... destinations) {
        return new TeeHandler(destinations);
    }

    public static Handler parallel(Handler... handlers) {
        return new ParallelHandler(handlers);
    }

    public static Handler chain(Handler... handlers) {
        return new ChainHandler(handlers);
    }

    public static Handler timeout(Handler handler, Duration timeout) {
        return new TimeoutHandler(handler, timeout);
    }

    public static Handler retry(Handler handler, int maxAttempts) {
        return new RetryHandler(handler, maxAttempts);
    }

    public static Handler fallback(Handler... handlers) {
        return new FallbackHandler(handlers);
    }

    public static Handler rateLimit(int rate, Duration per) {
        return new RateLimitHandler(rate, per);
    }

    /**
     * Starts a batcher. Close it once it is no longer used to stop its background thread.
     */
    public static BatchHandler batch(Handler handler, int maxSize, Duration maxWait) {
        return new BatchHandler(handler, maxSize, maxWait);
    }
}
