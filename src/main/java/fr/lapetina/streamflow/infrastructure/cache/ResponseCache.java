package fr.lapetina.streamflow.infrastructure.cache;

import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Memoizes handler output in a {@link CacheStore}.
 *
 * {@link #cache} keys entries on the SHA-256 of the whole input. On a hit the stored bytes
 * are written downstream and the handler is not called. On a miss the handler runs into a
 * buffer; only a successful output is stored, then written downstream.
 *
 * Caching is best-effort: a failing read counts as a miss and a failing write only reaches
 * the {@link #onError} callback.
 */
public final class ResponseCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final CacheStore store;
    private final boolean ownsStore;
    private volatile Consumer<RuntimeException> errorListener = e -> { };

    /**
     * Creates a cache over a new {@link InMemoryCacheStore}, closed with this cache.
     */
    public ResponseCache() {
        this(new InMemoryCacheStore(), true);
    }

    public ResponseCache(CacheStore store) {
        this(store, false);
    }

    private ResponseCache(CacheStore store, boolean ownsStore) {
        this.store = Objects.requireNonNull(store, "store");
        this.ownsStore = ownsStore;
    }

    /**
     * Sets the callback receiving store failures that did not fail a request.
     */
    public ResponseCache onError(Consumer<RuntimeException> listener) {
        this.errorListener = Objects.requireNonNull(listener, "listener");
        return this;
    }

    /**
     * Wraps a handler with content-addressed caching.
     */
    public Handler cache(Handler handler, Duration ttl) {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(ttl, "ttl");
        return (request, response) -> {
            byte[] input = request.readAllBytes();
            String key = key(input);

            Optional<byte[]> cached = lookup(key, request.context());
            if (cached.isPresent()) {
                response.write(cached.get());
                return;
            }

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            handler.serveFlow(request.withData(input), new Response(output));
            byte[] result = output.toByteArray();
            store(key, result, ttl, request.context());
            response.write(result);
        };
    }

    /**
     * Wraps a handler with caching keyed on request metadata.
     * On a hit the input is not read at all.
     */
    public Handler cacheWithKey(Handler handler, Duration ttl, Function<Request, String> keyFunction) {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(keyFunction, "keyFunction");
        return (request, response) -> {
            String key = keyFunction.apply(request);

            Optional<byte[]> cached = lookup(key, request.context());
            if (cached.isPresent()) {
                response.write(cached.get());
                return;
            }

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            handler.serveFlow(request, new Response(output));
            byte[] result = output.toByteArray();
            store(key, result, ttl, request.context());
            response.write(result);
        };
    }

    private Optional<byte[]> lookup(String key, FlowContext ctx) {
        try {
            Optional<byte[]> cached = store.get(key);
            log.debug("Cache {}: requestId={}, key={}", cached.isPresent() ? "hit" : "miss", ctx.requestId(), key);
            return cached;
        } catch (RuntimeException e) {
            log.warn("Cache read failed, treating as miss: requestId={}, key={}, error={}",
                    ctx.requestId(), key, e.toString());
            errorListener.accept(e);
            return Optional.empty();
        }
    }

    private void store(String key, byte[] value, Duration ttl, FlowContext ctx) {
        try {
            store.set(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("Cache write failed, response not cached: requestId={}, key={}, error={}",
                    ctx.requestId(), key, e.toString());
            errorListener.accept(e);
        }
    }

    /**
     * Returns the cache key of an input: its SHA-256 as lowercase hex.
     */
    public static String key(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String key(String input) {
        return key(input.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<byte[]> get(String key) {
        return store.get(key);
    }

    /**
     * Stores an entry directly, e.g. to warm the cache.
     */
    public void set(String key, byte[] value, Duration ttl) {
        store.set(key, value, ttl);
    }

    public void clear() {
        store.clear();
    }

    public void delete(String key) {
        store.delete(key);
    }

    public boolean exists(String key) {
        return store.exists(key);
    }

    public List<String> listKeys() {
        return store.list();
    }

    public CacheStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsStore && store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing cache store", e);
            }
        }
    }
}
