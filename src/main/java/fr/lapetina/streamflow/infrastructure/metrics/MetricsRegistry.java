package fr.lapetina.streamflow.infrastructure.metrics;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.infrastructure.resilience.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Stage latency timers
 * - Request counters by stage and outcome
 * - Error counters by stage and type
 * - Circuit breaker state gauges
 * - In-flight stage gauge
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "stream_flow";

    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this(prefix, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Creates a registry on top of an existing Micrometer registry.
     * Scraping is only available when it is a Prometheus registry.
     */
    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        this.prometheusRegistry = registry instanceof PrometheusMeterRegistry prometheus ? prometheus : null;

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_stages", inFlight, AtomicInteger::get)
                .description("Number of instrumented stages currently running")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Increments the request counter for a stage/outcome combination.
     */
    public void incrementRequestCount(String stage, String outcome) {
        String key = stage + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("stage", stage)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage latency.
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Flow stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String stage, ErrorType errorType) {
        String key = stage + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("stage", stage)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a circuit breaker state.
     *
     * @param group   owner of the breaker, e.g. one fallback chain
     * @param breaker the breaker to observe
     */
    public void registerCircuitBreaker(String group, CircuitBreaker breaker) {
        Gauge.builder(prefix + "_circuit_breaker_state", breaker, MetricsRegistry::stateValue)
                .description("Circuit breaker state (0=OPEN, 1=HALF_OPEN, 2=CLOSED)")
                .tag("group", group)
                .tag("breaker", breaker.getName())
                .register(registry);
    }

    static double stateValue(CircuitBreaker breaker) {
        return switch (breaker.getState()) {
            case OPEN -> 0;
            case HALF_OPEN -> 1;
            case CLOSED -> 2;
        };
    }

    public int stageStarted() {
        return inFlight.incrementAndGet();
    }

    public int stageFinished() {
        return inFlight.decrementAndGet();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other registries.
     */
    public String scrape() {
        return prometheusRegistry != null ? prometheusRegistry.scrape() : "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
