package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Routes the whole input to one of two handlers depending on its content.
 *
 * The input is buffered so the predicate can inspect it; the chosen handler then receives
 * the same bytes.
 */
public final class BranchHandler implements Handler {

    private final Predicate<byte[]> condition;
    private final Handler ifHandler;
    private final Handler elseHandler;

    public BranchHandler(Predicate<byte[]> condition, Handler ifHandler, Handler elseHandler) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.ifHandler = Objects.requireNonNull(ifHandler, "ifHandler");
        this.elseHandler = Objects.requireNonNull(elseHandler, "elseHandler");
    }

    @Override
    public void serveFlow(Request request, Response response) throws Exception {
        byte[] input = request.readAllBytes();
        Handler target = condition.test(input) ? ifHandler : elseHandler;
        target.serveFlow(request.withData(input), response);
    }
}
