package fr.lapetina.streamflow.flow.convert;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.exception.FlowException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Built-in converters for plain values.
 *
 * Inputs: {@link String} (UTF-8), {@code byte[]}, {@link InputStream} and any {@link InputConverter}.
 * Outputs: {@link #string()}, {@link #bytes()} and {@link #to(OutputStream)}.
 */
public final class Converters {

    private Converters() {
    }

    /**
     * Converts a flow input value into a stream.
     *
     * @throws FlowException with {@link ErrorType#UNSUPPORTED_TYPE} for other types
     */
    public static InputStream toStream(Object input) throws IOException {
        if (input instanceof InputConverter converter) {
            return converter.toStream();
        }
        if (input instanceof String text) {
            return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        }
        if (input instanceof byte[] bytes) {
            return new ByteArrayInputStream(bytes);
        }
        if (input instanceof InputStream stream) {
            return stream;
        }
        String type = input == null ? "null" : input.getClass().getName();
        throw new FlowException(ErrorType.UNSUPPORTED_TYPE, "unsupported input type: " + type);
    }

    public static OutputConverter<String> string() {
        return stream -> new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }

    public static OutputConverter<byte[]> bytes() {
        return InputStream::readAllBytes;
    }

    /**
     * Copies the final stream into the given destination as it arrives.
     *
     * @return converter yielding the number of bytes copied
     */
    public static OutputConverter<Long> to(OutputStream destination) {
        return stream -> {
            long copied = stream.transferTo(destination);
            destination.flush();
            return copied;
        };
    }
}
