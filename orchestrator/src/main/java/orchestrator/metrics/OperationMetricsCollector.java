package orchestrator.metrics;

import orchestrator.alert.LifecycleAlertLogger;
import orchestrator.job.BatchResult;
import orchestrator.metrics.OperationMetrics.Phase;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timing and counters for one lifecycle operation.
 *
 * <h2>Usage:</h2>
 * <pre>
 * OperationMetricsCollector collector = new OperationMetricsCollector().start(id, "stop");
 * collector.timed(Phase.DEACTIVATE_STORAGE, () -&gt; controller.deactivateAllStorageDomains(api));
 * OperationMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Phase start and completion are also reported through
 * {@link LifecycleAlertLogger}. Not thread-safe; owned by the operation.
 */
public final class OperationMetricsCollector {

    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
    private OperationMetrics.Builder builder;
    private long operationId;
    private Instant startTime;
    private int jobsRun, jobsFailed, undoStepsRun, undoStepsFailed;

    public OperationMetricsCollector start(long operationId, String operation) {
        this.operationId = operationId;
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.jobsRun = 0;
        this.jobsFailed = 0;
        this.undoStepsRun = 0;
        this.undoStepsFailed = 0;
        this.builder = OperationMetrics.builder()
                .operationId(operationId)
                .operation(operation)
                .startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        timed(phase, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        LifecycleAlertLogger.phaseStarted(operationId, phase);
        long start = System.nanoTime();
        boolean completed = false;
        try {
            T result = action.get();
            completed = true;
            return result;
        } finally {
            long ms = Duration.ofNanos(System.nanoTime() - start).toMillis();
            phaseDurations.merge(phase, ms, Long::sum);
            if (completed) {
                LifecycleAlertLogger.phaseCompleted(operationId, phase, ms);
            }
        }
    }

    /** Adds the outcomes of a joined batch to the job counters. */
    public OperationMetricsCollector batch(BatchResult result) {
        jobsRun += result.outcomes().size();
        jobsFailed += result.failures().size();
        return this;
    }

    public OperationMetricsCollector undoSteps(int run, int failed) {
        undoStepsRun += run;
        undoStepsFailed += failed;
        return this;
    }

    public OperationMetrics finish() {
        Instant endTime = Instant.now();
        return builder
                .endTime(endTime)
                .phaseDurations(phaseDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .jobsRun(jobsRun)
                .jobsFailed(jobsFailed)
                .undoStepsRun(undoStepsRun)
                .undoStepsFailed(undoStepsFailed)
                .build();
    }
}
