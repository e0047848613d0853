package fr.lapetina.streamflow.flow.convert;

import java.io.IOException;
import java.io.InputStream;

/**
 * Turns a typed value into the input stream of a flow run.
 */
@FunctionalInterface
public interface InputConverter {

    InputStream toStream() throws IOException;
}
