package fr.lapetina.streamflow.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker guarding one handler.
 *
 * States:
 * - CLOSED: calls pass, consecutive failures are counted
 * - OPEN: threshold reached, calls are rejected until the open timeout elapses
 * - HALF_OPEN: timeout elapsed, calls pass again; the next outcome decides
 *
 * The OPEN to HALF_OPEN transition happens inside {@link #allowRequest()}, never on a read.
 * Half-open does not limit concurrency: every caller is let through until an outcome is recorded.
 *
 * Thread-safe: every operation runs under one lock and never blocks while holding it.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(30);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration openTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private State state = State.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.failureThreshold = failureThreshold;
        this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout");
    }

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_TIMEOUT);
    }

    /**
     * Checks if a call may proceed.
     *
     * @return true unless the circuit is open and its timeout has not elapsed yet
     */
    public boolean allowRequest() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                case HALF_OPEN:
                    return true;
                case OPEN:
                    if (Duration.between(lastFailureTime, Instant.now()).compareTo(openTimeout) >= 0) {
                        state = State.HALF_OPEN;
                        log.info("Circuit breaker transitioning to HALF_OPEN: name={}", name);
                        return true;
                    }
                    return false;
                default:
                    return true;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        lock.lock();
        try {
            failureCount = 0;
            if (state == State.HALF_OPEN) {
                state = State.CLOSED;
                log.info("Circuit breaker CLOSED after recovery: name={}", name);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failed call.
     */
    public void recordFailure() {
        lock.lock();
        try {
            Instant now = Instant.now();
            if (state == State.HALF_OPEN) {
                // Any failure in half-open immediately reopens the circuit
                failureCount = failureThreshold;
                lastFailureTime = now;
                state = State.OPEN;
                log.warn("Circuit breaker OPENED (half-open failure): name={}", name);
                return;
            }

            failureCount++;
            lastFailureTime = now;
            if (state == State.CLOSED && failureCount >= failureThreshold) {
                state = State.OPEN;
                log.warn("Circuit breaker OPENED: name={}, failures={}", name, failureCount);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        lock.lock();
        try {
            State old = state;
            state = newState;
            if (newState == State.CLOSED) {
                failureCount = 0;
            }
            if (newState == State.OPEN) {
                lastFailureTime = Instant.now();
            }
            log.info("Circuit breaker forced from {} to {}: name={}", old, newState, name);
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "CircuitBreaker{" +
                    "name='" + name + '\'' +
                    ", state=" + state +
                    ", failures=" + failureCount +
                    '}';
        } finally {
            lock.unlock();
        }
    }
}
