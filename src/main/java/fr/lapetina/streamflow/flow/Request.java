package fr.lapetina.streamflow.flow;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Input side of a handler invocation: the flow context plus the input stream.
 * Immutable; use the {@code with*} methods to derive variants.
 */
public record Request(FlowContext context, InputStream data) {

    public Request {
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(data, "data is required");
    }

    public static Request of(FlowContext context, byte[] data) {
        return new Request(context, new ByteArrayInputStream(data));
    }

    public static Request of(FlowContext context, String data) {
        return of(context, data.getBytes(StandardCharsets.UTF_8));
    }

    public Request withContext(FlowContext newContext) {
        return new Request(newContext, data);
    }

    public Request withData(InputStream newData) {
        return new Request(context, newData);
    }

    public Request withData(byte[] newData) {
        return new Request(context, new ByteArrayInputStream(newData));
    }

    /**
     * Buffers the whole remaining input.
     */
    public byte[] readAllBytes() throws IOException {
        return data.readAllBytes();
    }

    /**
     * Buffers the whole remaining input as UTF-8 text.
     */
    public String readString() throws IOException {
        return new String(data.readAllBytes(), StandardCharsets.UTF_8);
    }
}
