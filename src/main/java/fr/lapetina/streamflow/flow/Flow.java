package fr.lapetina.streamflow.flow;

import fr.lapetina.streamflow.flow.convert.Converters;
import fr.lapetina.streamflow.flow.convert.OutputConverter;
import fr.lapetina.streamflow.flow.exception.FlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Streaming pipeline of handlers.
 *
 * Every handler of a run executes on its own thread. Handler {@code i} writes into a
 * {@link Pipe} read by handler {@code i+1}, so data moves through the chain as soon
 * as it is produced and a slow stage throttles the stages before it.
 *
 * A flow is built once and run any number of times, concurrently if needed: each
 * {@link #run} call creates its own pipes and tasks. A flow is itself a
 * {@link Handler} and can be nested inside another flow or wrapped by middleware.
 *
 * <pre>{@code
 * String out = new Flow()
 *         .use(Handlers.passThrough())
 *         .use(new RetryHandler(upstream, 3))
 *         .run(FlowContext.background(), "input");
 * }</pre>
 */
public class Flow implements Handler {

    private static final Logger log = LoggerFactory.getLogger(Flow.class);

    // How often a stage waiting for a concurrency slot re-checks its context
    private static final long PERMIT_POLL_MS = 10;

    private final List<Handler> handlers = new CopyOnWriteArrayList<>();
    private final FlowConfig config;
    private final Semaphore permits;
    private final ExecutorService executor;

    public Flow() {
        this(FlowConfig.unlimited());
    }

    public Flow(FlowConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        int limit = config.permits();
        this.permits = limit > 0 ? new Semaphore(limit) : null;
        this.executor = StageExecutor.get();
        log.debug("Flow created: maxConcurrent={}, permits={}", config.maxConcurrent(), limit);
    }

    /**
     * Appends a handler to the chain.
     *
     * @return this flow, for chaining
     */
    public Flow use(Handler handler) {
        handlers.add(Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public int size() {
        return handlers.size();
    }

    public FlowConfig getConfig() {
        return config;
    }

    /**
     * Runs the chain once and returns the output as a UTF-8 string.
     */
    public String run(FlowContext ctx, Object input) {
        return run(ctx, input, Converters.string());
    }

    /**
     * Runs the chain once.
     *
     * @param ctx    context of this run; cancelling it aborts the run
     * @param input  value converted with {@link Converters#toStream(Object)}
     * @param output converter consuming the last stage's output
     * @return the converted output
     * @throws FlowException    context errors and wrapped checked failures
     * @throws RuntimeException the first unchecked failure of any stage, verbatim
     */
    public <T> T run(FlowContext ctx, Object input, OutputConverter<T> output) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(output, "output");
        ctx.throwIfDone();

        List<Handler> stages = new ArrayList<>(handlers);
        InputStream source;
        try {
            source = Converters.toStream(input);
        } catch (IOException e) {
            throw FlowException.wrap(e);
        }

        if (stages.isEmpty()) {
            try (InputStream in = source) {
                return output.fromStream(in);
            } catch (IOException e) {
                throw FlowException.wrap(e);
            }
        }

        return new Run<>(ctx, stages, source, output).execute();
    }

    /**
     * Runs the chain as one stage of an enclosing flow.
     */
    @Override
    public void serveFlow(Request request, Response response) {
        run(request.context(), request.data(), Converters.to(response.data()));
    }

    /**
     * State of one {@link #run} call.
     */
    private final class Run<T> {

        private final FlowContext ctx;
        private final List<Handler> stages;
        private final InputStream source;
        private final OutputConverter<T> output;

        // pipes[i] feeds stage i, pipes[i + 1] receives its output
        private final Pipe[] pipes;
        private final CompletableFuture<Throwable> firstError = new CompletableFuture<>();

        Run(FlowContext ctx, List<Handler> stages, InputStream source, OutputConverter<T> output) {
            this.ctx = ctx;
            this.stages = stages;
            this.source = source;
            this.output = output;
            this.pipes = new Pipe[stages.size() + 1];
            for (int i = 0; i < pipes.length; i++) {
                pipes[i] = new Pipe();
            }
        }

        T execute() {
            String requestId = ctx.requestId();
            log.debug("Flow run started: requestId={}, stages={}", requestId, stages.size());

            CompletableFuture<?>[] stageTasks = new CompletableFuture<?>[stages.size()];
            for (int i = 0; i < stages.size(); i++) {
                int index = i;
                stageTasks[i] = CompletableFuture.runAsync(() -> runStage(index), executor);
            }
            CompletableFuture.runAsync(this::feed, executor);
            CompletableFuture<T> collected = CompletableFuture.supplyAsync(this::collect, executor);

            CompletableFuture<T> success = CompletableFuture.allOf(stageTasks).thenCompose(ignored -> collected);

            CompletableFuture<Void> contextEnded = new CompletableFuture<>();
            CompletableFuture<Object> outcome = CompletableFuture.anyOf(success, firstError, contextEnded);
            try (FlowContext.Registration ignored = ctx.onDone(() -> contextEnded.complete(null))) {
                outcome.join();
            } catch (RuntimeException e) {
                // The collector failed, handled below
            }

            FlowException contextError = ctx.error();
            if (contextError != null) {
                abort(contextError);
                log.debug("Flow run cancelled: requestId={}, reason={}", requestId, contextError.getErrorType());
                throw contextError;
            }
            Throwable stageError = firstError.getNow(null);
            if (stageError != null) {
                abort(stageError);
                throw FlowException.propagate(stageError);
            }
            try {
                T result = success.join();
                log.debug("Flow run completed: requestId={}", requestId);
                return result;
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                abort(cause);
                throw FlowException.propagate(cause);
            }
        }

        private void runStage(int index) {
            Pipe.Writer out = pipes[index + 1].writer();
            String previousStage = MDC.get("stage");
            String previousRequestId = MDC.get(FlowContext.REQUEST_ID);
            MDC.put(FlowContext.REQUEST_ID, ctx.requestId());
            MDC.put("stage", String.valueOf(index));
            boolean acquired = false;
            try {
                acquired = acquirePermit();
                Request request = new Request(ctx, pipes[index].reader());
                stages.get(index).serveFlow(request, new Response(out));
                out.close();
                drainInput(index);
            } catch (Throwable t) {
                // Recorded before closing so downstream failures never win the race
                if (firstError.complete(t)) {
                    log.error("Stage failed: requestId={}, stage={}, error={}",
                            ctx.requestId(), index, t.toString());
                }
                out.closeWithError(t);
            } finally {
                if (acquired) {
                    permits.release();
                }
                restore("stage", previousStage);
                restore(FlowContext.REQUEST_ID, previousRequestId);
            }
        }

        // Lets the previous stage finish when this one returned without reading everything
        private void drainInput(int index) {
            try {
                pipes[index].reader().transferTo(OutputStream.nullOutputStream());
            } catch (IOException e) {
                log.debug("Stage input drain stopped: requestId={}, stage={}, error={}",
                        ctx.requestId(), index, e.toString());
            }
        }

        private boolean acquirePermit() throws InterruptedException {
            if (permits == null) {
                return false;
            }
            while (!permits.tryAcquire(PERMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
                ctx.throwIfDone();
            }
            return true;
        }

        private void feed() {
            Pipe.Writer in = pipes[0].writer();
            try (InputStream src = source) {
                src.transferTo(in);
                in.close();
            } catch (IOException e) {
                // Stage 0 sees the failure when it reads
                in.closeWithError(e);
                log.debug("Flow input feed stopped: requestId={}, error={}", ctx.requestId(), e.toString());
            }
        }

        private T collect() {
            Pipe.Reader last = pipes[pipes.length - 1].reader();
            try {
                T value = output.fromStream(last);
                // Drain whatever the converter left so the last stage can finish
                last.transferTo(OutputStream.nullOutputStream());
                return value;
            } catch (IOException e) {
                last.closeWithError(e);
                throw FlowException.wrap(e);
            }
        }

        private void abort(Throwable error) {
            for (Pipe pipe : pipes) {
                pipe.abort(error);
            }
        }
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
