package fr.lapetina.streamflow.flow;

import fr.lapetina.streamflow.flow.exception.FlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation, deadline and request-scoped values for one flow run.
 *
 * Contexts form a tree: a derived context is cancelled whenever its parent is,
 * and never the other way round. Values are immutable; {@link #withValue} returns
 * a new child sharing its parent's cancellation.
 *
 * A cancellable child stays linked to its parent only until it ends, so callers
 * deriving per-request contexts must end them with {@link #cancel()} once done.
 *
 * Thread-safe.
 */
public final class FlowContext {

    private static final Logger log = LoggerFactory.getLogger(FlowContext.class);

    public static final String REQUEST_ID = "requestId";

    private static final ScheduledThreadPoolExecutor DEADLINES = createDeadlineScheduler();

    private static final FlowContext BACKGROUND = new FlowContext(Scope.NEVER, Map.of(), null, false);

    private final Scope scope;
    private final Map<String, Object> values;
    private final Instant deadline;
    private final boolean cancellable;

    private FlowContext(Scope scope, Map<String, Object> values, Instant deadline, boolean cancellable) {
        this.scope = scope;
        this.values = values;
        this.deadline = deadline;
        this.cancellable = cancellable;
    }

    private static ScheduledThreadPoolExecutor createDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "flow-context-deadlines");
            t.setDaemon(true);
            return t;
        });
        // Contexts ended before their deadline must not keep a queued timer
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Returns the root context. It is never cancelled and carries no values.
     */
    public static FlowContext background() {
        return BACKGROUND;
    }

    /**
     * Derives a context that can be cancelled with {@link #cancel()}.
     */
    public FlowContext withCancel() {
        return new FlowContext(scope.child(), values, deadline, true);
    }

    /**
     * Derives a context that is cancelled once {@code timeout} has elapsed.
     * The effective deadline is the earlier of this context's deadline and the new one.
     */
    public FlowContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant candidate = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(candidate) ? deadline : candidate;

        Scope child = scope.child();
        long delayNanos = Math.max(0, Duration.between(Instant.now(), effective).toNanos());
        ScheduledFuture<?> timer = DEADLINES.schedule(
                () -> child.finish(FlowException.deadlineExceeded()),
                delayNanos,
                TimeUnit.NANOSECONDS
        );
        child.onDone(() -> timer.cancel(false));
        return new FlowContext(child, values, effective, true);
    }

    /**
     * Derives a context carrying an extra value.
     */
    public FlowContext withValue(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new FlowContext(scope, Map.copyOf(copy), deadline, false);
    }

    /**
     * Derives a context tagged with a request id, used for log correlation.
     */
    public FlowContext withRequestId(String requestId) {
        return withValue(REQUEST_ID, requestId);
    }

    public Optional<Object> value(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns the request id, or "-" when none was set.
     */
    public String requestId() {
        Object id = values.get(REQUEST_ID);
        return id != null ? id.toString() : "-";
    }

    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Cancels this context and every context derived from it.
     *
     * @throws UnsupportedOperationException on contexts not created by withCancel/withTimeout
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("Context is not cancellable, derive one with withCancel()");
        }
        scope.finish(FlowException.cancelled());
    }

    public boolean isDone() {
        return scope.error.get() != null;
    }

    /**
     * Returns the context error, or null while the context is live.
     */
    public FlowException error() {
        return scope.error.get();
    }

    /**
     * Throws the context error if the context is done.
     */
    public void throwIfDone() {
        FlowException error = error();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Runs {@code listener} once when this context ends, immediately if it already has.
     * Closing the returned registration before that detaches the listener.
     */
    public Registration onDone(Runnable listener) {
        return scope.onDone(listener);
    }

    /**
     * Sleeps for the given duration unless the context ends first.
     *
     * @throws FlowException the context error if the context ended before the duration elapsed
     */
    public void sleep(Duration duration) {
        throwIfDone();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        CompletableFuture<Void> wakeUp = new CompletableFuture<>();
        try (Registration ignored = onDone(() -> wakeUp.complete(null))) {
            wakeUp.get(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // Slept the full duration
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FlowException.cancelled();
        } catch (ExecutionException e) {
            throw FlowException.propagate(e.getCause());
        }
        throwIfDone();
    }

    /**
     * Waits for the future or for this context to end, whichever comes first.
     * When both have happened, the context error wins.
     *
     * @return the future's value
     * @throws FlowException the context error, or the future's failure
     */
    public <T> T await(CompletableFuture<T> future) {
        CompletableFuture<Void> wakeUp = new CompletableFuture<>();
        future.whenComplete((value, error) -> wakeUp.complete(null));
        try (Registration ignored = onDone(() -> wakeUp.complete(null))) {
            wakeUp.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FlowException.cancelled();
        } catch (ExecutionException e) {
            throw FlowException.propagate(e.getCause());
        }
        throwIfDone();
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            throw FlowException.propagate(cause);
        }
    }

    /**
     * Number of listeners attached to this context's cancellation, derived contexts included.
     */
    int listenerCount() {
        return scope.listeners.size();
    }

    /**
     * Number of deadline timers still queued.
     */
    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    @Override
    public String toString() {
        return "FlowContext{" +
                "requestId=" + requestId() +
                ", deadline=" + deadline +
                ", done=" + isDone() +
                '}';
    }

    /**
     * Handle on a listener registered with {@link #onDone(Runnable)}.
     */
    public interface Registration extends AutoCloseable {

        /**
         * Detaches the listener. Has no effect once it has run.
         */
        @Override
        void close();
    }

    /**
     * Cancellation state shared by a cancellable context and its value-only children.
     */
    private static final class Scope {

        // Background and its value children: nothing to listen to
        static final Scope NEVER = new Scope(false);

        private final boolean endable;
        private final AtomicReference<FlowException> error = new AtomicReference<>();
        private final Set<Listener> listeners = ConcurrentHashMap.newKeySet();
        private volatile Registration parentLink;

        private Scope(boolean endable) {
            this.endable = endable;
        }

        Scope child() {
            Scope child = new Scope(true);
            Registration link = onDone(() -> child.finish(error.get()));
            child.parentLink = link;
            if (child.error.get() != null) {
                link.close();
            }
            return child;
        }

        Registration onDone(Runnable action) {
            if (!endable) {
                return () -> { };
            }
            Listener listener = new Listener(action, this);
            listeners.add(listener);
            if (error.get() != null) {
                listener.fire();
            }
            return listener;
        }

        void finish(FlowException cause) {
            if (!error.compareAndSet(null, cause)) {
                return;
            }
            Registration link = parentLink;
            if (link != null) {
                link.close();
            }
            for (Listener listener : listeners) {
                listener.fire();
            }
        }
    }

    private static final class Listener implements Registration {

        private final Runnable action;
        private final Scope owner;
        private final AtomicBoolean done = new AtomicBoolean(false);

        Listener(Runnable action, Scope owner) {
            this.action = action;
            this.owner = owner;
        }

        void fire() {
            if (done.compareAndSet(false, true)) {
                owner.listeners.remove(this);
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.warn("Context listener failed: error={}", e.toString());
                }
            }
        }

        @Override
        public void close() {
            if (done.compareAndSet(false, true)) {
                owner.listeners.remove(this);
            }
        }
    }
}
