package orchestrator.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a batch of independent jobs concurrently, one new thread per job.
 *
 * <p>All workers are started before any is joined. The caller blocks until
 * every job has terminated; a failing job never cancels its siblings, and the
 * result reports every failure in submission order.
 *
 * <p>There is no pooling and no back-pressure: a batch of N jobs spawns N
 * threads. Callers are responsible for sizing batches; a {@code maxBatchSize}
 * greater than zero makes the runner refuse larger batches up front.
 *
 * <h2>Usage:</h2>
 * <pre>
 * ParallelJobRunner runner = new ParallelJobRunner("deploy");
 * runner.runBatch(jobs).throwIfFailed();
 * </pre>
 *
 * @see Job
 * @see BatchResult
 */
public final class ParallelJobRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelJobRunner.class);

    private final String name;
    private final int maxBatchSize;
    private final AtomicLong batchCounter = new AtomicLong(1L);

    public ParallelJobRunner(String name) {
        this(name, 0);
    }

    /**
     * @param name prefix for worker thread names
     * @param maxBatchSize largest accepted batch, or 0 for no bound
     */
    public ParallelJobRunner(String name, int maxBatchSize) {
        if (maxBatchSize < 0) {
            throw new IllegalArgumentException("maxBatchSize must not be negative: " + maxBatchSize);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Starts every job and waits for all of them.
     *
     * @param jobs the batch
     * @return outcomes in submission order
     * @throws IllegalArgumentException if the batch exceeds the configured bound
     */
    public BatchResult runBatch(List<? extends Job> jobs) {
        return start(jobs).join();
    }

    /**
     * Starts a worker thread for every job and returns without waiting.
     *
     * @param jobs the batch
     * @return a handle to join the batch
     * @throws IllegalArgumentException if the batch exceeds the configured bound
     */
    public RunningBatch start(List<? extends Job> jobs) {
        Objects.requireNonNull(jobs, "jobs");
        if (maxBatchSize > 0 && jobs.size() > maxBatchSize) {
            throw new IllegalArgumentException("Batch of " + jobs.size()
                    + " jobs exceeds the configured maximum of " + maxBatchSize);
        }

        long batchId = batchCounter.getAndIncrement();
        JobOutcome[] outcomes = new JobOutcome[jobs.size()];
        List<Thread> workers = new ArrayList<>(jobs.size());

        for (int i = 0; i < jobs.size(); i++) {
            Job job = Objects.requireNonNull(jobs.get(i), "job#" + i);
            int index = i;
            String jobName = job.name() != null ? job.name() : "job#" + i;
            Thread t = new Thread(() -> outcomes[index] = execute(index, jobName, job),
                    name + "-" + batchId + "-" + i);
            t.setDaemon(true);
            workers.add(t);
        }

        log.debug("Starting batch {}-{} with {} job(s)", name, batchId, workers.size());
        workers.forEach(Thread::start);

        return new RunningBatch() {
            @Override
            public int size() {
                return workers.size();
            }

            @Override
            public BatchResult join() {
                joinAll(workers);
                BatchResult result = new BatchResult(Arrays.asList(outcomes));
                if (!result.success()) {
                    log.warn("Batch {}-{}: {} of {} job(s) failed",
                            name, batchId, result.failures().size(), outcomes.length);
                }
                return result;
            }
        };
    }

    private static JobOutcome execute(int index, String jobName, Job job) {
        try {
            job.run();
            return JobOutcome.ok(index, jobName);
        } catch (Throwable t) {
            log.error("Job '{}' failed", jobName, t);
            return JobOutcome.fail(index, jobName, t);
        }
    }

    private static void joinAll(List<Thread> workers) {
        boolean interrupted = false;
        for (Thread t : workers) {
            while (true) {
                try {
                    t.join();
                    break;
                } catch (InterruptedException e) {
                    // no cancellation: keep waiting for the worker
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
