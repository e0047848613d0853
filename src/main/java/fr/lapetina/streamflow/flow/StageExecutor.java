package fr.lapetina.streamflow.flow;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared executor running flow stages and their bookkeeping tasks.
 *
 * Stage threads spend most of their life blocked on pipes, so the pool is unbounded
 * and threads are daemons: a stray stage left behind by a cancelled run never keeps
 * the JVM alive.
 */
public final class StageExecutor {

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(new StageThreadFactory("flow-stage"));

    private StageExecutor() {
    }

    public static ExecutorService get() {
        return EXECUTOR;
    }

    /**
     * Thread factory for stage threads.
     */
    static final class StageThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        StageThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
