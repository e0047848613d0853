package fr.lapetina.streamflow.infrastructure.resilience;

import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.exception.FlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every caller of one rate-limited handler.
 *
 * The bucket holds at most {@code rate} tokens and starts full. One token is added every
 * {@code per / rate}; refills are computed lazily on each acquisition from the time
 * elapsed since the last refill.
 */
public final class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final int maxTokens;
    private final long refillIntervalNanos;

    private final ReentrantLock lock = new ReentrantLock();
    private long tokens;
    private long lastRefillNanos;

    /**
     * @throws FlowException if {@code rate} is not positive or {@code per} is not positive
     */
    public TokenBucketRateLimiter(int rate, Duration per) {
        Objects.requireNonNull(per, "per");
        if (rate <= 0) {
            throw FlowException.invalidConfiguration("rate must be positive: " + rate);
        }
        if (per.isZero() || per.isNegative()) {
            throw FlowException.invalidConfiguration("per must be positive: " + per);
        }
        this.maxTokens = rate;
        this.refillIntervalNanos = Math.max(1, per.toNanos() / rate);
        this.tokens = rate;
        this.lastRefillNanos = System.nanoTime();
        log.debug("TokenBucketRateLimiter created: rate={}, per={}, refillInterval={}ns",
                rate, per, refillIntervalNanos);
    }

    /**
     * Takes a token if one is available.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens > 0) {
                tokens--;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a token is available or the context ends.
     *
     * @throws FlowException the context error if the context ended first
     */
    public void acquire(FlowContext ctx) {
        Duration pause = Duration.ofNanos(Math.max(1, refillIntervalNanos / 10));
        while (true) {
            ctx.throwIfDone();
            if (tryAcquire()) {
                return;
            }
            ctx.sleep(pause);
        }
    }

    public long availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public Duration getRefillInterval() {
        return Duration.ofNanos(refillIntervalNanos);
    }

    // Caller holds the lock
    private void refill() {
        long now = System.nanoTime();
        long tokensToAdd = (now - lastRefillNanos) / refillIntervalNanos;
        if (tokensToAdd > 0) {
            tokens = Math.min(maxTokens, tokens + tokensToAdd);
            lastRefillNanos = now;
        }
    }
}
