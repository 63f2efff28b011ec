package orchestrator.job;

import orchestrator.exceptions.JobFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ParallelJobRunner")
class ParallelJobRunnerTest {

    private final ParallelJobRunner runner = new ParallelJobRunner("test");

    @Nested
    @DisplayName("runBatch")
    class RunBatch {

        @Test
        @DisplayName("should run every job exactly once when all succeed")
        void shouldRunEveryJobExactlyOnceWhenAllSucceed() {
            AtomicInteger[] counters = new AtomicInteger[5];
            List<Job> jobs = new ArrayList<>();
            for (int i = 0; i < counters.length; i++) {
                AtomicInteger counter = new AtomicInteger();
                counters[i] = counter;
                jobs.add(counter::incrementAndGet);
            }

            BatchResult result = runner.runBatch(jobs);

            assertThat(result.success()).isTrue();
            assertThat(result.failures()).isEmpty();
            assertThat(result.outcomes()).hasSize(5).allMatch(JobOutcome::isOk);
            for (AtomicInteger counter : counters) {
                assertThat(counter.get()).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("should still run every job when some fail")
        void shouldStillRunEveryJobWhenSomeFail() {
            AtomicInteger ran = new AtomicInteger();
            List<Job> jobs = List.of(
                    () -> ran.incrementAndGet(),
                    () -> {
                        ran.incrementAndGet();
                        throw new IOException("disk full");
                    },
                    () -> ran.incrementAndGet(),
                    () -> {
                        ran.incrementAndGet();
                        throw new IllegalStateException("bad state");
                    });

            BatchResult result = runner.runBatch(jobs);

            assertThat(ran.get()).isEqualTo(4);
            assertThat(result.success()).isFalse();
            assertThat(result.failures()).extracting(JobOutcome::index).containsExactly(1, 3);
            assertThat(result.outcomes().get(1).error()).isInstanceOf(IOException.class);
            assertThat(result.outcomes().get(3).error()).hasMessage("bad state");
        }

        @Test
        @DisplayName("should not cancel siblings of a job that fails first")
        void shouldNotCancelSiblingsOfAJobThatFailsFirst() {
            CountDownLatch failed = new CountDownLatch(1);
            AtomicInteger finished = new AtomicInteger();

            BatchResult result = runner.runBatch(List.of(
                    () -> {
                        failed.countDown();
                        throw new IOException("early failure");
                    },
                    () -> {
                        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
                        Thread.sleep(50);
                        finished.incrementAndGet();
                    }));

            assertThat(finished.get()).isEqualTo(1);
            assertThat(result.failures()).hasSize(1);
        }

        @Test
        @DisplayName("should start all workers before joining any")
        void shouldStartAllWorkersBeforeJoiningAny() {
            int size = 4;
            CountDownLatch allStarted = new CountDownLatch(size);
            List<Job> jobs = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                jobs.add(() -> {
                    allStarted.countDown();
                    if (!allStarted.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("workers did not run concurrently");
                    }
                });
            }

            assertThat(runner.runBatch(jobs).success()).isTrue();
        }

        @Test
        @DisplayName("should return success for an empty batch")
        void shouldReturnSuccessForAnEmptyBatch() {
            BatchResult result = runner.runBatch(List.of());

            assertThat(result.success()).isTrue();
            assertThat(result.outcomes()).isEmpty();
        }

        @Test
        @DisplayName("should name jobs by index unless named")
        void shouldNameJobsByIndexUnlessNamed() {
            BatchResult result = runner.runBatch(List.of(() -> {}, Job.named("sync", () -> {})));

            assertThat(result.outcomes()).extracting(JobOutcome::name).containsExactly("job#0", "sync");
        }

        @Test
        @DisplayName("should run jobs on named worker threads")
        void shouldRunJobsOnNamedWorkerThreads() {
            AtomicReference<String> threadName = new AtomicReference<>();

            runner.runBatch(List.of(() -> threadName.set(Thread.currentThread().getName())));

            assertThat(threadName.get()).startsWith("test-").endsWith("-0");
        }
    }

    @Nested
    @DisplayName("failure reporting")
    class FailureReporting {

        @Test
        @DisplayName("should report all failures in batch order")
        void shouldReportAllFailuresInBatchOrder() {
            BatchResult result = runner.runBatch(List.of(
                    Job.named("build vdsm", () -> { throw new IOException("vdsm failed"); }),
                    () -> {},
                    Job.named("build engine", () -> { throw new IOException("engine failed"); })));

            assertThatThrownBy(result::throwIfFailed)
                    .isInstanceOf(JobFailureException.class)
                    .hasMessageContaining("2 of 3 job(s) failed")
                    .hasMessageContaining("build vdsm")
                    .hasMessageContaining("build engine")
                    .satisfies(e -> {
                        JobFailureException jfe = (JobFailureException) e;
                        assertThat(jfe.failures()).extracting(JobOutcome::name)
                                .containsExactly("build vdsm", "build engine");
                        assertThat(jfe.getCause()).hasMessage("vdsm failed");
                        assertThat(jfe.getSuppressed()).hasSize(1);
                    });
        }
    }

    @Nested
    @DisplayName("batch bound")
    class BatchBound {

        @Test
        @DisplayName("should reject an oversized batch before starting any job")
        void shouldRejectAnOversizedBatchBeforeStartingAnyJob() {
            ParallelJobRunner bounded = new ParallelJobRunner("bounded", 2);
            AtomicInteger ran = new AtomicInteger();
            Job job = ran::incrementAndGet;

            assertThatThrownBy(() -> bounded.runBatch(List.of(job, job, job)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(ran.get()).isZero();
        }

        @Test
        @DisplayName("should accept a batch at the bound")
        void shouldAcceptABatchAtTheBound() {
            ParallelJobRunner bounded = new ParallelJobRunner("bounded", 2);

            assertThat(bounded.runBatch(List.of(() -> {}, () -> {})).success()).isTrue();
        }
    }

    @Nested
    @DisplayName("start and join")
    class StartAndJoin {

        @Test
        @DisplayName("should let the caller work while jobs run")
        void shouldLetTheCallerWorkWhileJobsRun() {
            CountDownLatch release = new CountDownLatch(1);
            RunningBatch batch = runner.start(List.of(() -> release.await(5, TimeUnit.SECONDS)));

            assertThat(batch.size()).isEqualTo(1);
            release.countDown();

            assertThat(batch.join().success()).isTrue();
        }

        @Test
        @DisplayName("should keep waiting and restore the interrupt flag when interrupted")
        void shouldKeepWaitingAndRestoreTheInterruptFlagWhenInterrupted() {
            AtomicInteger finished = new AtomicInteger();
            RunningBatch batch = runner.start(List.of(() -> {
                Thread.sleep(100);
                finished.incrementAndGet();
            }));

            Thread.currentThread().interrupt();
            BatchResult result = batch.join();

            assertThat(Thread.interrupted()).isTrue();
            assertThat(finished.get()).isEqualTo(1);
            assertThat(result.success()).isTrue();
        }
    }
}
