package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Pipe;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.StageExecutor;
import fr.lapetina.streamflow.flow.exception.FlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Feeds the same input to several handlers at once and joins their outputs.
 *
 * Input is streamed to every branch through its own pipe. Outputs are buffered and joined
 * with {@code "\n---\n"} in completion order. The first failing branch fails the whole call.
 */
public final class ParallelHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(ParallelHandler.class);

    static final byte[] SEPARATOR = "\n---\n".getBytes(StandardCharsets.UTF_8);

    private final List<Handler> handlers;

    public ParallelHandler(Handler... handlers) {
        this.handlers = List.of(handlers);
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        if (handlers.isEmpty()) {
            request.data().transferTo(response.data());
            return;
        }
        FlowContext ctx = request.context();

        List<Pipe> pipes = new ArrayList<>(handlers.size());
        for (int i = 0; i < handlers.size(); i++) {
            pipes.add(new Pipe());
        }

        List<byte[]> outputs = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Object> firstFailure = new CompletableFuture<>();
        CompletableFuture<?>[] branches = new CompletableFuture<?>[handlers.size()];
        for (int i = 0; i < handlers.size(); i++) {
            Handler branch = handlers.get(i);
            Pipe pipe = pipes.get(i);
            branches[i] = CompletableFuture.supplyAsync(() -> {
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                try {
                    branch.serveFlow(request.withData(pipe.reader()), new Response(output));
                    return output.toByteArray();
                } catch (Exception e) {
                    throw FlowException.propagate(e);
                } finally {
                    // Branches that stop reading early must not stall the fan-out
                    pipe.reader().close();
                }
            }, StageExecutor.get()).whenComplete((bytes, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(
                            error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
                } else {
                    outputs.add(bytes);
                }
            });
        }

        CompletableFuture.runAsync(() -> fanOut(request.data(), pipes), StageExecutor.get());

        try {
            ctx.await(CompletableFuture.anyOf(CompletableFuture.allOf(branches), firstFailure));
        } catch (RuntimeException e) {
            for (Pipe pipe : pipes) {
                pipe.abort(e);
            }
            throw e;
        }

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        synchronized (outputs) {
            for (int i = 0; i < outputs.size(); i++) {
                if (i > 0) {
                    joined.write(SEPARATOR);
                }
                joined.write(outputs.get(i));
            }
        }
        log.debug("Parallel branches completed: requestId={}, branches={}", ctx.requestId(), handlers.size());
        response.write(joined.toByteArray());
    }

    private static void fanOut(InputStream source, List<Pipe> pipes) {
        List<Pipe> open = new ArrayList<>(pipes);
        byte[] buffer = new byte[8192];
        try {
            int n;
            while (!open.isEmpty() && (n = source.read(buffer)) != -1) {
                for (Pipe pipe : new ArrayList<>(open)) {
                    try {
                        pipe.writer().write(buffer, 0, n);
                    } catch (IOException closed) {
                        // Branch finished or failed; keep feeding the others
                        open.remove(pipe);
                    }
                }
            }
            for (Pipe pipe : pipes) {
                pipe.writer().close();
            }
        } catch (IOException e) {
            for (Pipe pipe : pipes) {
                pipe.writer().closeWithError(e);
            }
        }
    }
}
