package orchestrator.exceptions;

import orchestrator.job.BatchResult;
import orchestrator.job.JobOutcome;
import orchestrator.rollback.UndoFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OrchestrationException")
class OrchestrationExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should have no stage, cause or undo failures")
        void shouldHaveNoStageCauseOrUndoFailures() {
            OrchestrationException ex = new OrchestrationException("Snapshot failed");

            assertThat(ex.getMessage()).isEqualTo("Snapshot failed");
            assertThat(ex.getStage()).isNull();
            assertThat(ex.getCause()).isNull();
            assertThat(ex.undoFailures()).isEmpty();
            assertThat(ex.isCleanupFailed()).isFalse();
        }
    }

    @Nested
    @DisplayName("constructor with full context")
    class ConstructorWithFullContext {

        @Test
        @DisplayName("should append stage and cleanup failures to the message")
        void shouldAppendStageAndCleanupFailuresToTheMessage() {
            IOException cause = new IOException("disk snapshot failed");
            List<UndoFailure> failures = List.of(
                    new UndoFailure("start ovirt-engine on engine", new IOException("unit failed")),
                    new UndoFailure("activate hosts", new IOException("API unavailable")));

            OrchestrationException ex = new OrchestrationException("Snapshot 'baseline' failed", cause, "CAPTURE", failures);

            assertThat(ex.getCause()).isSameAs(cause);
            assertThat(ex.isCleanupFailed()).isTrue();
            assertThat(ex.getMessage()).isEqualTo("Snapshot 'baseline' failed [stage=CAPTURE]"
                    + " [cleanup failed: 2 undo step(s); start ovirt-engine on engine: unit failed;"
                    + " activate hosts: API unavailable]");
        }

        @Test
        @DisplayName("should copy the undo failures")
        void shouldCopyTheUndoFailures() {
            List<UndoFailure> failures = new ArrayList<>();
            failures.add(new UndoFailure("activate hosts", null));

            OrchestrationException ex = new OrchestrationException("failed", null, null, failures);
            failures.clear();

            assertThat(ex.undoFailures()).hasSize(1);
            assertThat(ex.getMessage()).endsWith("activate hosts: null]");
        }

        @Test
        @DisplayName("should accept null undo failures")
        void shouldAcceptNullUndoFailures() {
            assertThat(new OrchestrationException("failed", null, "RESTORE", null).undoFailures()).isEmpty();
        }
    }

    @Nested
    @DisplayName("JobFailureException")
    class JobFailures {

        @Test
        @DisplayName("should list every failure and chain the first as cause")
        void shouldListEveryFailureAndChainTheFirstAsCause() {
            IOException first = new IOException("build_vdsm_rpms.sh failed with status 2, see logs");
            IllegalStateException second = new IllegalStateException("no space left");
            BatchResult result = new BatchResult(List.of(
                    JobOutcome.fail(0, "build vdsm", first),
                    JobOutcome.ok(1, "build ovirt-engine"),
                    JobOutcome.fail(2, "sync /repo", second)));

            JobFailureException ex = new JobFailureException(result);

            assertThat(ex.getMessage()).isEqualTo("2 of 3 job(s) failed;"
                    + " build vdsm: build_vdsm_rpms.sh failed with status 2, see logs; sync /repo: no space left");
            assertThat(ex.getCause()).isSameAs(first);
            assertThat(ex.getSuppressed()).containsExactly(second);
            assertThat(ex.failures()).extracting(JobOutcome::index).containsExactly(0, 2);
            assertThat(ex.result()).isSameAs(result);
        }
    }

    @Nested
    @DisplayName("ConvergenceTimeoutException")
    class ConvergenceTimeouts {

        @Test
        @DisplayName("should name the condition and the bound")
        void shouldNameTheConditionAndTheBound() {
            ConvergenceTimeoutException ex = new ConvergenceTimeoutException(
                    "host host1 in MAINTENANCE", Duration.ofMinutes(3));

            assertThat(ex.getMessage()).isEqualTo("Condition 'host host1 in MAINTENANCE' not reached within 180000 ms");
            assertThat(ex.getOperation()).isEqualTo("host host1 in MAINTENANCE");
            assertThat(ex.getTimeout()).isEqualTo(Duration.ofMinutes(3));
        }
    }
}
