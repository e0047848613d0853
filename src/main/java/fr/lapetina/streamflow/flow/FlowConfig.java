package fr.lapetina.streamflow.flow;

/**
 * Concurrency limits for a {@link Flow}.
 *
 * @param maxConcurrent {@link #UNLIMITED}, {@link #AUTO}, or a positive number of stage tasks
 *                      that may run at once across all runs of the flow
 * @param cpuMultiplier used with {@link #AUTO}: limit = available processors * multiplier
 *
 * Every stage of a run holds a permit while it runs, so a fixed limit below the number of
 * stages of one flow stalls that flow until its context ends.
 */
public record FlowConfig(int maxConcurrent, int cpuMultiplier) {

    public static final int UNLIMITED = 0;
    public static final int AUTO = -1;
    public static final int DEFAULT_CPU_MULTIPLIER = 50;

    public static FlowConfig unlimited() {
        return new FlowConfig(UNLIMITED, DEFAULT_CPU_MULTIPLIER);
    }

    public static FlowConfig auto(int cpuMultiplier) {
        return new FlowConfig(AUTO, cpuMultiplier);
    }

    public static FlowConfig fixed(int maxConcurrent) {
        return new FlowConfig(maxConcurrent, DEFAULT_CPU_MULTIPLIER);
    }

    /**
     * Resolves the effective permit count, or 0 for no limit.
     */
    public int permits() {
        if (maxConcurrent == AUTO) {
            int multiplier = cpuMultiplier > 0 ? cpuMultiplier : DEFAULT_CPU_MULTIPLIER;
            return Runtime.getRuntime().availableProcessors() * multiplier;
        }
        return Math.max(0, maxConcurrent);
    }
}
