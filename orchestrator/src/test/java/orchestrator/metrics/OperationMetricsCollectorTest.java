package orchestrator.metrics;

import orchestrator.job.BatchResult;
import orchestrator.job.JobOutcome;
import orchestrator.metrics.OperationMetrics.Phase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationMetricsCollectorTest {

    @Test
    void shouldCollectBasicMetrics() {
        OperationMetricsCollector collector = new OperationMetricsCollector().start(1L, "snapshot:baseline");

        collector.timed(Phase.DEACTIVATE_STORAGE, () -> {});
        collector.timed(Phase.CAPTURE, () -> {});
        collector.batch(new BatchResult(List.of(
                JobOutcome.ok(0, "stop services on host0"),
                JobOutcome.fail(1, "stop services on host1", new IOException("ssh")))));
        collector.undoSteps(3, 1);

        OperationMetrics metrics = collector.finish();

        assertThat(metrics.operationId()).isEqualTo(1L);
        assertThat(metrics.operation()).isEqualTo("snapshot:baseline");
        assertThat(metrics.jobsRun()).isEqualTo(2);
        assertThat(metrics.jobsFailed()).isEqualTo(1);
        assertThat(metrics.undoStepsRun()).isEqualTo(3);
        assertThat(metrics.undoStepsFailed()).isEqualTo(1);
        assertThat(metrics.phaseDurations()).containsKeys(Phase.DEACTIVATE_STORAGE, Phase.CAPTURE);
        assertThat(metrics.phaseDuration(Phase.RESTORE)).isZero();
        assertThat(metrics.totalDurationMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void shouldRecordPhaseDurationWhenActionFails() {
        OperationMetricsCollector collector = new OperationMetricsCollector().start(2L, "deactivate");

        assertThatThrownBy(() -> collector.timed(Phase.DEACTIVATE_HOSTS, () -> {
            throw new IOException("API unavailable");
        })).isInstanceOf(IOException.class);

        assertThat(collector.finish().phaseDurations()).containsKey(Phase.DEACTIVATE_HOSTS);
    }

    @Test
    void shouldReturnValueOfTimedSupplier() throws Exception {
        OperationMetricsCollector collector = new OperationMetricsCollector().start(3L, "batch");

        String value = collector.timed(Phase.RUN_JOBS, () -> "done");

        assertThat(value).isEqualTo("done");
    }

    @Test
    void shouldResetCountersOnRestart() {
        OperationMetricsCollector collector = new OperationMetricsCollector().start(4L, "first");
        collector.undoSteps(5, 0);
        collector.finish();

        OperationMetrics metrics = collector.start(5L, "second").finish();

        assertThat(metrics.operationId()).isEqualTo(5L);
        assertThat(metrics.undoStepsRun()).isZero();
    }

    @Test
    void shouldSummarizeOnOneLine() {
        OperationMetrics metrics = new OperationMetricsCollector().start(6L, "stop").undoSteps(2, 0).finish();

        assertThat(metrics.summary())
                .startsWith("Operation #6 (stop) in ")
                .endsWith("| Jobs: 0 run, 0 failed | Undo: 2 run, 0 failed");
        assertThat(metrics.toMap()).containsEntry("operation", "stop").containsEntry("undoStepsRun", 2);
    }
}
