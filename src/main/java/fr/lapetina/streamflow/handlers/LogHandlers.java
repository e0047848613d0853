package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Pass-through stages that log what flows through them.
 *
 * All output goes to the {@code fr.lapetina.streamflow.handlers.LogHandlers} logger at INFO.
 */
public final class LogHandlers {

    private static final Logger log = LoggerFactory.getLogger(LogHandlers.class);

    private static final int BINARY_PREVIEW_BYTES = 20;

    private LogHandlers() {
    }

    /**
     * Logs the first {@code n} bytes, then streams the whole input through.
     */
    public static Handler head(String prefix, int n) {
        return (request, response) -> {
            InputStream in = request.data();
            byte[] head = in.readNBytes(n);
            log.info("[{}]: {}", prefix, preview(head, n));
            response.write(head);
            in.transferTo(response.data());
        };
    }

    /**
     * Buffers the whole input, logs it and passes it on.
     */
    public static Handler print(String prefix) {
        return (request, response) -> {
            byte[] all = request.readAllBytes();
            log.info("[{}]: {}", prefix, preview(all, Integer.MAX_VALUE));
            response.write(all);
        };
    }

    /**
     * Logs duration and output throughput of the wrapped handler.
     */
    public static Handler timing(String prefix, Handler handler) {
        Objects.requireNonNull(handler, "handler");
        return (request, response) -> {
            CountingOutputStream counting = new CountingOutputStream(response.data());
            long started = System.nanoTime();
            try {
                handler.serveFlow(request, new Response(counting));
            } finally {
                long elapsedNanos = System.nanoTime() - started;
                double seconds = elapsedNanos / 1_000_000_000.0;
                long bytesPerSecond = seconds > 0 ? (long) (counting.count / seconds) : counting.count;
                log.info("[{}]: requestId={}, durationMs={}, bytes={}, bytesPerSecond={}",
                        prefix, request.context().requestId(), elapsedNanos / 1_000_000, counting.count, bytesPerSecond);
            }
        };
    }

    static String preview(byte[] data, int limit) {
        if (data.length == 0) {
            return "<empty>";
        }
        if (isPrintable(data)) {
            String text = new String(data, StandardCharsets.UTF_8);
            return data.length == limit ? text + "..." : text;
        }
        if (data.length > BINARY_PREVIEW_BYTES) {
            return "binary data (" + data.length + " bytes): "
                    + HexFormat.of().formatHex(Arrays.copyOf(data, BINARY_PREVIEW_BYTES)) + "...";
        }
        return "binary data: " + HexFormat.of().formatHex(data);
    }

    private static boolean isPrintable(byte[] data) {
        for (byte b : data) {
            int c = b & 0xFF;
            if ((c < 32 || c > 126) && c != '\t' && c != '\n' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    private static final class CountingOutputStream extends FilterOutputStream {
        private long count;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }
    }
}
