package fr.lapetina.streamflow.flow;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Output side of a handler invocation.
 */
public record Response(OutputStream data) {

    public Response {
        Objects.requireNonNull(data, "data is required");
    }

    public void write(byte[] bytes) throws IOException {
        data.write(bytes);
    }

    public void write(String text) throws IOException {
        data.write(text.getBytes(StandardCharsets.UTF_8));
    }
}
