package orchestrator.job;

import java.util.Objects;

/**
 * An independent unit of work submitted to the {@link ParallelJobRunner}.
 *
 * <p>Jobs take no arguments and return nothing; they act through side effects
 * only. Each job owns its captured inputs and must not share mutable state
 * with other jobs of the same batch.
 *
 * <h2>Example:</h2>
 * <pre>
 * List&lt;Job&gt; jobs = hosts.stream()
 *     .map(h -&gt; Job.named("deploy " + h.name(), () -&gt; deploy(h)))
 *     .toList();
 * runner.runBatch(jobs).throwIfFailed();
 * </pre>
 */
@FunctionalInterface
public interface Job {

    /**
     * Executes the job.
     *
     * @throws Exception if the job fails
     */
    void run() throws Exception;

    /**
     * Display name used in outcomes and thread names, or null for the
     * positional default ({@code job#<index>}).
     */
    default String name() {
        return null;
    }

    /**
     * Wraps a job with a display name.
     *
     * @param name the display name
     * @param job the job to run
     * @return a named job
     */
    static Job named(String name, Job job) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(job, "job");
        return new Job() {
            @Override
            public void run() throws Exception {
                job.run();
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
