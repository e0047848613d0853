package fr.lapetina.streamflow.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link CacheStore}.
 *
 * Entries expire once their age exceeds their TTL. Reads check expiry lazily; a background
 * sweep additionally removes expired entries every {@code sweepInterval} to bound memory.
 * Close the store to stop the sweep.
 */
public final class InMemoryCacheStore implements CacheStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> data = new HashMap<>();
    private final ScheduledExecutorService sweeper;

    public InMemoryCacheStore() {
        this(DEFAULT_SWEEP_INTERVAL);
    }

    public InMemoryCacheStore(Duration sweepInterval) {
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper-" + THREAD_COUNTER.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1, sweepInterval.toMillis());
        sweeper.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("InMemoryCacheStore started: sweepInterval={}", sweepInterval);
    }

    @Override
    public Optional<byte[]> get(String key) {
        lock.readLock().lock();
        try {
            Entry entry = data.get(key);
            if (entry == null || entry.isExpired(System.nanoTime())) {
                return Optional.empty();
            }
            return Optional.of(entry.value.clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        Entry entry = new Entry(value.clone(), System.nanoTime(), ttl.toNanos());
        lock.writeLock().lock();
        try {
            data.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.writeLock().lock();
        try {
            data.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            data.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        lock.readLock().lock();
        try {
            Entry entry = data.get(key);
            return entry != null && !entry.isExpired(System.nanoTime());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> list() {
        lock.readLock().lock();
        try {
            long now = System.nanoTime();
            List<String> keys = new ArrayList<>();
            data.forEach((key, entry) -> {
                if (!entry.isExpired(now)) {
                    keys.add(key);
                }
            });
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored entries, expired ones included until the next sweep.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    public int sweep() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            long now = System.nanoTime();
            Iterator<Entry> it = data.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Cache sweep removed expired entries: removed={}", removed);
        }
        return removed;
    }

    @Override
    public void close() {
        if (!sweeper.isShutdown()) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweeper.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("InMemoryCacheStore closed");
        }
    }

    private static final class Entry {
        final byte[] value;
        final long createdNanos;
        final long ttlNanos;

        Entry(byte[] value, long createdNanos, long ttlNanos) {
            this.value = value;
            this.createdNanos = createdNanos;
            this.ttlNanos = ttlNanos;
        }

        boolean isExpired(long nowNanos) {
            return nowNanos - createdNanos > ttlNanos;
        }
    }
}
