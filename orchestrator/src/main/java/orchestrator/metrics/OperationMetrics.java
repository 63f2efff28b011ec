package orchestrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one lifecycle operation.
 *
 * <p>Use {@link #summary()} for a human-readable line, or {@link #toMap()} for
 * JSON serialization.
 *
 * @see OperationMetricsCollector
 */
public record OperationMetrics(
        long operationId,
        String operation,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int jobsRun,
        int jobsFailed,
        int undoStepsRun,
        int undoStepsFailed
) {
    /**
     * Phases of the lifecycle operations, for timing breakdown.
     */
    public enum Phase {
        WAIT_REACHABLE,
        DEACTIVATE_STORAGE,
        DEACTIVATE_HOSTS,
        STOP_ENGINE,
        STOP_HOST_SERVICES,
        CAPTURE,
        RESTORE,
        ACTIVATE_HOSTS,
        ACTIVATE_STORAGE,
        RUN_JOBS,
        MERGE_REPOSITORIES
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * @return duration in milliseconds, or 0 if the phase was not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Operation #%d (%s) in %dms | Jobs: %d run, %d failed | Undo: %d run, %d failed",
                operationId, operation, totalDurationMs, jobsRun, jobsFailed, undoStepsRun, undoStepsFailed);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("operationId", operationId);
        map.put("operation", operation);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("jobsRun", jobsRun);
        map.put("jobsFailed", jobsFailed);
        map.put("undoStepsRun", undoStepsRun);
        map.put("undoStepsFailed", undoStepsFailed);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link OperationMetrics}.
     */
    public static class Builder {
        private long operationId;
        private String operation;
        private Instant startTime;
        private Instant endTime;
        private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
        private long totalDurationMs;
        private int jobsRun, jobsFailed, undoStepsRun, undoStepsFailed;

        public Builder operationId(long id) { this.operationId = id; return this; }
        public Builder operation(String name) { this.operation = name; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder phaseDurations(Map<Phase, Long> durations) {
            this.phaseDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder jobsRun(int v) { this.jobsRun = v; return this; }
        public Builder jobsFailed(int v) { this.jobsFailed = v; return this; }
        public Builder undoStepsRun(int v) { this.undoStepsRun = v; return this; }
        public Builder undoStepsFailed(int v) { this.undoStepsFailed = v; return this; }

        public OperationMetrics build() {
            return new OperationMetrics(operationId, operation, startTime, endTime,
                    new EnumMap<>(phaseDurations), totalDurationMs,
                    jobsRun, jobsFailed, undoStepsRun, undoStepsFailed);
        }
    }
}
