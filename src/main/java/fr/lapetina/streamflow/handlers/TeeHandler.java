package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * Passes the input through while copying every chunk to extra destinations.
 *
 * Destinations are written before the downstream stage, in order, and are not closed.
 */
public final class TeeHandler implements Handler {

    private final List<OutputStream> destinations;

    public TeeHandler(OutputStream... destinations) {
        this.destinations = List.of(destinations);
    }

    @Override
    public void serveFlow(Request request, Response response) throws IOException {
        InputStream in = request.data();
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) != -1) {
            for (OutputStream destination : destinations) {
                destination.write(buffer, 0, n);
            }
            response.data().write(buffer, 0, n);
        }
        for (OutputStream destination : destinations) {
            destination.flush();
        }
    }
}
