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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coalesces concurrent calls into fewer calls to a handler that accepts a combined payload.
 *
 * A background thread collects requests into a window. The window is flushed when it holds
 * {@code maxSize} requests or {@code maxWait} after its first request, whichever comes first.
 * A flush joins the inputs with the separator, calls the handler once and splits its output
 * on the same separator, giving each caller the part at its own index.
 *
 * If the handler fails, every caller of the window gets that failure. If the output does not
 * split into exactly one part per caller, the first caller gets the raw output and the others
 * fail with {@link ErrorType#BATCH_SPLIT_FAILED}.
 *
 * The combined call runs under the background context: one caller cancelling must not fail
 * its neighbours. Callers already cancelled at flush time are left out of the window.
 */
public final class BatchHandler implements Handler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchHandler.class);

    public static final String DEFAULT_SEPARATOR = "\n---BATCH_SEPARATOR---\n";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
    private static final long OFFER_POLL_MS = 10;

    private final Handler handler;
    private final int maxSize;
    private final Duration maxWait;
    private final byte[] separator;

    private final BlockingQueue<BatchRequest> requests;
    private final Thread worker;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public BatchHandler(Handler handler, int maxSize, Duration maxWait) {
        this(handler, maxSize, maxWait, DEFAULT_SEPARATOR);
    }

    public BatchHandler(Handler handler, int maxSize, Duration maxWait, String separator) {
        if (maxSize < 1) {
            throw FlowException.invalidConfiguration("maxSize must be at least 1, got " + maxSize);
        }
        if (separator == null || separator.isEmpty()) {
            throw FlowException.invalidConfiguration("separator must not be empty");
        }
        this.handler = Objects.requireNonNull(handler, "handler");
        this.maxSize = maxSize;
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
        this.separator = separator.getBytes(StandardCharsets.UTF_8);
        this.requests = new LinkedBlockingQueue<>((int) Math.min(Integer.MAX_VALUE, 2L * maxSize));

        this.worker = new Thread(this::processBatches, "flow-batcher-" + THREAD_COUNTER.getAndIncrement());
        this.worker.setDaemon(true);
        this.worker.start();

        log.info("BatchHandler started: maxSize={}, maxWait={}", maxSize, maxWait);
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        FlowContext ctx = request.context();
        BatchRequest batchRequest = new BatchRequest(request.readAllBytes(), ctx);

        while (!requests.offer(batchRequest, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
            ctx.throwIfDone();
            ensureRunning();
        }
        ensureRunning();

        byte[] output = ctx.await(batchRequest.response);
        response.write(output);
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new FlowException(ErrorType.SHUTDOWN, "batcher is closed");
        }
    }

    private void processBatches() {
        List<BatchRequest> window = new ArrayList<>();
        long deadline = 0;

        while (running.get()) {
            BatchRequest next;
            try {
                if (window.isEmpty()) {
                    next = requests.take();
                } else {
                    long remaining = deadline - System.nanoTime();
                    next = remaining > 0 ? requests.poll(remaining, TimeUnit.NANOSECONDS) : null;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (next != null) {
                window.add(next);
                if (window.size() == 1) {
                    deadline = System.nanoTime() + maxWait.toNanos();
                }
                if (window.size() < maxSize) {
                    continue;
                }
            }

            // Full window or maxWait elapsed
            flush(window);
            window = new ArrayList<>();
        }

        FlowException shutdown = new FlowException(ErrorType.SHUTDOWN, "batcher is closed");
        window.forEach(pending -> pending.response.completeExceptionally(shutdown));
        BatchRequest pending;
        while ((pending = requests.poll()) != null) {
            pending.response.completeExceptionally(shutdown);
        }
        log.info("BatchHandler stopped");
    }

    private void flush(List<BatchRequest> window) {
        List<BatchRequest> live = new ArrayList<>(window.size());
        for (BatchRequest request : window) {
            if (request.ctx.isDone()) {
                log.debug("Batch request dropped, context done: requestId={}", request.ctx.requestId());
            } else {
                live.add(request);
            }
        }
        if (live.isEmpty()) {
            return;
        }

        ByteArrayOutputStream combined = new ByteArrayOutputStream();
        for (int i = 0; i < live.size(); i++) {
            if (i > 0) {
                combined.writeBytes(separator);
            }
            combined.writeBytes(live.get(i).input);
        }

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            handler.serveFlow(Request.of(FlowContext.background(), combined.toByteArray()), new Response(output));
        } catch (Throwable t) {
            log.warn("Batch handler failed: size={}, error={}", live.size(), t.toString());
            live.forEach(request -> request.response.completeExceptionally(t));
            return;
        }

        byte[] raw = output.toByteArray();
        List<byte[]> parts = split(raw, separator);
        if (parts.size() != live.size()) {
            log.warn("Batch response splitting failed: expected={}, actual={}", live.size(), parts.size());
            live.get(0).response.complete(raw);
            for (int i = 1; i < live.size(); i++) {
                live.get(i).response.completeExceptionally(
                        new FlowException(ErrorType.BATCH_SPLIT_FAILED, "batch response splitting failed"));
            }
            return;
        }

        for (int i = 0; i < live.size(); i++) {
            live.get(i).response.complete(parts.get(i));
        }
        log.debug("Batch flushed: size={}, inputBytes={}, outputBytes={}", live.size(), combined.size(), raw.length);
    }

    /**
     * Splits on every occurrence of the separator. n separators always yield n + 1 parts.
     */
    static List<byte[]> split(byte[] data, byte[] separator) {
        List<byte[]> parts = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i <= data.length - separator.length) {
            if (matches(data, i, separator)) {
                parts.add(Arrays.copyOfRange(data, start, i));
                i += separator.length;
                start = i;
            } else {
                i++;
            }
        }
        parts.add(Arrays.copyOfRange(data, start, data.length));
        return parts;
    }

    private static boolean matches(byte[] data, int offset, byte[] separator) {
        for (int j = 0; j < separator.length; j++) {
            if (data[offset + j] != separator[j]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Stops the background thread. Pending and later calls fail with {@link ErrorType#SHUTDOWN}.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down BatchHandler...");
            worker.interrupt();
            try {
                worker.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private static final class BatchRequest {
        final byte[] input;
        final FlowContext ctx;
        final CompletableFuture<byte[]> response = new CompletableFuture<>();

        BatchRequest(byte[] input, FlowContext ctx) {
            this.input = input;
            this.ctx = ctx;
        }
    }
}
