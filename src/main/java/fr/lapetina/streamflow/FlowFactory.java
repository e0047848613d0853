package fr.lapetina.streamflow;

import fr.lapetina.streamflow.flow.Flow;
import fr.lapetina.streamflow.flow.FlowConfig;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.handlers.BatchHandler;
import fr.lapetina.streamflow.handlers.FallbackHandler;
import fr.lapetina.streamflow.handlers.MetricsHandler;
import fr.lapetina.streamflow.handlers.RateLimitHandler;
import fr.lapetina.streamflow.handlers.RetryHandler;
import fr.lapetina.streamflow.infrastructure.cache.InMemoryCacheStore;
import fr.lapetina.streamflow.infrastructure.cache.ResponseCache;
import fr.lapetina.streamflow.infrastructure.config.ConfigLoader;
import fr.lapetina.streamflow.infrastructure.config.FlowSettings;
import fr.lapetina.streamflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.streamflow.infrastructure.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for flows and middleware configured from {@link FlowSettings}.
 * Owns the resources behind what it creates: batcher threads, the cache sweep and metrics.
 *
 * <p>Usage:
 * <pre>{@code
 * try (FlowFactory factory = FlowFactory.create("stream-flow.yaml")) {
 *     Flow flow = factory.newFlow()
 *             .use(factory.rateLimit())
 *             .use(factory.instrument("summarize", factory.retry(summarizer)));
 *     String out = flow.run(FlowContext.background(), text);
 * }
 * }</pre>
 */
public class FlowFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowFactory.class);

    private final FlowSettings config;
    private final MetricsRegistry metricsRegistry;
    private final InMemoryCacheStore cacheStore;
    private final ResponseCache responseCache;
    private final List<BatchHandler> batchers = new CopyOnWriteArrayList<>();
    private final AtomicInteger fallbackCounter = new AtomicInteger(0);

    protected FlowFactory(FlowSettings config, MetricsRegistry metricsOverride) {
        this.config = config;

        // Initialize metrics (allow override for testing)
        if (metricsOverride != null) {
            this.metricsRegistry = metricsOverride;
        } else if (config.getMetrics().isEnabled()) {
            this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        } else {
            this.metricsRegistry = null;
        }

        this.cacheStore = new InMemoryCacheStore(Duration.ofMillis(config.getCache().getSweepIntervalMs()));
        this.responseCache = new ResponseCache(cacheStore);

        log.info("FlowFactory initialized: maxConcurrent={}, metricsEnabled={}",
                config.getFlow().getMaxConcurrent(), metricsRegistry != null);
    }

    /**
     * Creates a factory from the specified configuration file (file system or classpath).
     */
    public static FlowFactory create(String configPath) {
        log.info("Initializing FlowFactory from config: {}", configPath);
        return new FlowFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from settings built in code.
     */
    public static FlowFactory create(FlowSettings settings) {
        return new FlowFactory(settings, null);
    }

    /**
     * Creates a factory recording into the given metrics registry.
     */
    public static FlowFactory create(FlowSettings settings, MetricsRegistry metricsRegistry) {
        return new FlowFactory(settings, metricsRegistry);
    }

    public Flow newFlow() {
        FlowSettings.EngineConfig engine = config.getFlow();
        return new Flow(new FlowConfig(engine.getMaxConcurrent(), engine.getCpuMultiplier()));
    }

    public RetryHandler retry(Handler handler) {
        FlowSettings.RetryConfig retry = config.getRetry();
        return new RetryHandler(
                handler,
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                retry.getBackoffMultiplier(),
                Duration.ofMillis(retry.getMaxBackoffMs())
        );
    }

    /**
     * Creates a fallback chain. Its breakers are registered as gauges when metrics are enabled.
     */
    public FallbackHandler fallback(Handler... handlers) {
        FlowSettings.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        FallbackHandler fallback = new FallbackHandler(
                breaker.getFailureThreshold(),
                Duration.ofMillis(breaker.getOpenTimeoutMs()),
                handlers
        );
        if (metricsRegistry != null) {
            String group = "fallback-" + fallbackCounter.getAndIncrement();
            for (CircuitBreaker circuitBreaker : fallback.getCircuitBreakers()) {
                metricsRegistry.registerCircuitBreaker(group, circuitBreaker);
            }
        }
        return fallback;
    }

    /**
     * Creates a pass-through rate limit stage. Each call creates its own bucket.
     */
    public RateLimitHandler rateLimit() {
        return rateLimit(null);
    }

    public RateLimitHandler rateLimit(Handler handler) {
        FlowSettings.RateLimitConfig rateLimit = config.getRateLimit();
        return new RateLimitHandler(rateLimit.getRate(), Duration.ofMillis(rateLimit.getPerMs()), handler);
    }

    /**
     * Creates a batcher, closed with this factory.
     */
    public BatchHandler batch(Handler handler) {
        FlowSettings.BatchConfig batch = config.getBatch();
        BatchHandler batcher = new BatchHandler(
                handler,
                batch.getMaxSize(),
                Duration.ofMillis(batch.getMaxWaitMs()),
                batch.getSeparator()
        );
        batchers.add(batcher);
        return batcher;
    }

    /**
     * Wraps a handler with caching in the factory's shared store.
     */
    public Handler cache(Handler handler) {
        return responseCache.cache(handler, Duration.ofMillis(config.getCache().getTtlMs()));
    }

    /**
     * Wraps a handler with metrics, or returns it unchanged when metrics are disabled.
     */
    public Handler instrument(String stage, Handler handler) {
        if (metricsRegistry == null) {
            return handler;
        }
        return new MetricsHandler(stage, handler, metricsRegistry);
    }

    public FlowSettings getConfig() {
        return config;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ResponseCache getResponseCache() {
        return responseCache;
    }

    @Override
    public void close() {
        log.info("Shutting down FlowFactory...");

        for (BatchHandler batcher : batchers) {
            try {
                batcher.close();
            } catch (Exception e) {
                log.warn("Error closing batcher", e);
            }
        }

        try {
            cacheStore.close();
        } catch (Exception e) {
            log.warn("Error closing cache store", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("FlowFactory shut down");
    }
}
