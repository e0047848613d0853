package fr.lapetina.streamflow.infrastructure.config;

/**
 * Root configuration object for flows and their middleware.
 * Designed to be populated from YAML; every field has a usable default.
 */
public class FlowSettings {

    private EngineConfig flow = new EngineConfig();
    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private BatchConfig batch = new BatchConfig();
    private CacheConfig cache = new CacheConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public EngineConfig getFlow() { return flow; }
    public void setFlow(EngineConfig flow) { this.flow = flow; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Pipeline engine configuration.
     * maxConcurrent: 0 = unlimited, -1 = available processors x cpuMultiplier, n > 0 = fixed.
     */
    public static class EngineConfig {
        private int maxConcurrent = 0;
        private int cpuMultiplier = 50;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public int getCpuMultiplier() { return cpuMultiplier; }
        public void setCpuMultiplier(int cpuMultiplier) { this.cpuMultiplier = cpuMultiplier; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialBackoffMs = 100;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 60000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }

    /**
     * Circuit breaker configuration, applied to every fallback candidate.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long openTimeoutMs = 30000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getOpenTimeoutMs() { return openTimeoutMs; }
        public void setOpenTimeoutMs(long openTimeoutMs) { this.openTimeoutMs = openTimeoutMs; }
    }

    /**
     * Token bucket configuration: rate requests per perMs milliseconds.
     */
    public static class RateLimitConfig {
        private int rate = 10;
        private long perMs = 1000;

        public int getRate() { return rate; }
        public void setRate(int rate) { this.rate = rate; }

        public long getPerMs() { return perMs; }
        public void setPerMs(long perMs) { this.perMs = perMs; }
    }

    /**
     * Request batching configuration.
     */
    public static class BatchConfig {
        private int maxSize = 10;
        private long maxWaitMs = 100;
        private String separator = "\n---BATCH_SEPARATOR---\n";

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(long maxWaitMs) { this.maxWaitMs = maxWaitMs; }

        public String getSeparator() { return separator; }
        public void setSeparator(String separator) { this.separator = separator; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private long ttlMs = 3600000;
        private long sweepIntervalMs = 300000;

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "stream_flow";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
