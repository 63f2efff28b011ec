package orchestrator.job;

/**
 * Handle on a batch whose workers have all been started.
 *
 * @see ParallelJobRunner#start(java.util.List)
 */
public interface RunningBatch {

    /** Number of jobs in the batch. */
    int size();

    /**
     * Blocks until every job has terminated and returns their outcomes.
     *
     * <p>Interrupting the calling thread does not cancel any job: the join keeps
     * waiting and the interrupt flag is restored before returning.
     *
     * @return the outcomes in submission order
     */
    BatchResult join();
}
