package orchestrator.exceptions;

import orchestrator.job.BatchResult;
import orchestrator.job.JobOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Exception thrown when one or more jobs of a batch failed.
 *
 * <p>The complete {@link BatchResult} is attached so callers can inspect every
 * failure, not just the first. The first failure is used as the cause and the
 * remaining ones are added as suppressed exceptions.
 *
 * @see orchestrator.job.ParallelJobRunner
 */
public class JobFailureException extends OrchestrationException {

    private final BatchResult result;

    /**
     * Creates a new exception for a failed batch.
     *
     * @param result the batch result, containing at least one failure
     */
    public JobFailureException(BatchResult result) {
        super(formatMessage(result), firstError(result));
        this.result = result;
        List<JobOutcome> failures = result.failures();
        for (int i = 1; i < failures.size(); i++) {
            Throwable error = failures.get(i).error();
            if (error != null) addSuppressed(error);
        }
    }

    /**
     * Returns the full batch result.
     */
    public BatchResult result() {
        return result;
    }

    /**
     * Returns the failed outcomes, in submission order.
     */
    public List<JobOutcome> failures() {
        return result.failures();
    }

    private static Throwable firstError(BatchResult result) {
        List<JobOutcome> failures = Objects.requireNonNull(result, "result").failures();
        return failures.isEmpty() ? null : failures.get(0).error();
    }

    private static String formatMessage(BatchResult result) {
        List<JobOutcome> failures = Objects.requireNonNull(result, "result").failures();
        StringBuilder sb = new StringBuilder()
                .append(failures.size()).append(" of ").append(result.outcomes().size())
                .append(" job(s) failed");
        for (JobOutcome f : failures) {
            sb.append("; ").append(f.name()).append(": ").append(f.message());
        }
        return sb.toString();
    }
}
