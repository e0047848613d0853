package fr.lapetina.streamflow.flow;

/**
 * A single stream-processing stage.
 *
 * A handler reads its input from {@link Request#data()} and writes its output to
 * {@link Response#data()}. It does not close either stream; the flow engine owns them.
 * Any exception thrown fails the stage.
 *
 * <pre>{@code
 * Handler upper = (req, res) -> res.write(req.readString().toUpperCase());
 * }</pre>
 */
@FunctionalInterface
public interface Handler {

    void serveFlow(Request request, Response response) throws Exception;
}
