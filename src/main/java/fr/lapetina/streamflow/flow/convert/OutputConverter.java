package fr.lapetina.streamflow.flow.convert;

import java.io.IOException;
import java.io.InputStream;

/**
 * Turns the final stream of a flow run into a typed value.
 *
 * @param <T> the destination type
 */
@FunctionalInterface
public interface OutputConverter<T> {

    /**
     * Consumes the stream. Implementations should read it to the end so upstream stages can finish.
     */
    T fromStream(InputStream stream) throws IOException;
}
