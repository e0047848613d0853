package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.StageExecutor;
import fr.lapetina.streamflow.flow.exception.FlowException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Fails with {@link ErrorType#TIMEOUT} when the wrapped handler runs longer than the timeout.
 *
 * The handler runs on a stage thread under a derived context that ends at the timeout,
 * so a handler honouring its context stops on its own. A cancellation of the caller's
 * context is reported as such, not as a timeout.
 */
public final class TimeoutHandler implements Handler {

    private final Handler handler;
    private final Duration timeout;

    public TimeoutHandler(Handler handler, Duration timeout) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void serveFlow(Request request, Response response) {
        FlowContext parent = request.context();
        FlowContext timed = parent.withTimeout(timeout);
        Request scoped = request.withContext(timed);

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> {
            try {
                handler.serveFlow(scoped, response);
            } catch (Exception e) {
                throw FlowException.propagate(e);
            }
        }, StageExecutor.get());

        try {
            timed.await(task);
        } catch (FlowException e) {
            if (e.isContextError() && parent.error() == null && timed.isDone()) {
                throw new FlowException(ErrorType.TIMEOUT, "handler timeout after " + timeout, e);
            }
            throw e;
        } finally {
            timed.cancel();
        }
    }
}
