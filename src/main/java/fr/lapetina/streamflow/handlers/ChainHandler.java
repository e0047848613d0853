package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Runs handlers one after the other on the calling thread.
 *
 * Unlike a {@link fr.lapetina.streamflow.flow.Flow}, each intermediate output is buffered
 * completely before the next handler starts. The last handler writes straight downstream.
 */
public final class ChainHandler implements Handler {

    private final List<Handler> handlers;

    public ChainHandler(Handler... handlers) {
        this.handlers = List.of(handlers);
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        if (handlers.isEmpty()) {
            request.data().transferTo(response.data());
            return;
        }
        byte[] current = request.readAllBytes();
        int last = handlers.size() - 1;
        for (int i = 0; i < last; i++) {
            request.context().throwIfDone();
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            handlers.get(i).serveFlow(request.withData(current), new Response(buffer));
            current = buffer.toByteArray();
        }
        handlers.get(last).serveFlow(request.withData(current), response);
    }
}
