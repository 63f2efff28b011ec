package orchestrator.job;

import orchestrator.exceptions.JobFailureException;

import java.util.List;

/**
 * Immutable result of a joined batch: one {@link JobOutcome} per submitted
 * job, in submission order.
 *
 * <p>A batch is successful only if every outcome is. Jobs have no return
 * value, so a successful result carries no payload.
 *
 * @see ParallelJobRunner
 */
public final class BatchResult {

    private final List<JobOutcome> outcomes;

    public BatchResult(List<JobOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    /** Returns true if every job succeeded (also for an empty batch). */
    public boolean success() {
        return outcomes.stream().allMatch(JobOutcome::isOk);
    }

    /** All outcomes, aligned with submission order. */
    public List<JobOutcome> outcomes() {
        return outcomes;
    }

    /** The failed outcomes, in submission order. */
    public List<JobOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isOk()).toList();
    }

    /**
     * Raises a {@link JobFailureException} carrying every failure if any job failed.
     *
     * @throws JobFailureException if the batch did not succeed
     */
    public void throwIfFailed() throws JobFailureException {
        if (!success()) {
            throw new JobFailureException(this);
        }
    }

    @Override
    public String toString() {
        return "BatchResult{jobs=" + outcomes.size() + ", failed=" + failures().size() + '}';
    }
}
