package orchestrator.exceptions;

import orchestrator.rollback.UndoFailure;

import java.util.List;

/**
 * Exception thrown when a lifecycle operation on the environment fails.
 *
 * <p>Besides the message and the original cause, the exception carries:
 * <ul>
 *   <li>The stage of the operation where the failure occurred (optional)</li>
 *   <li>The undo steps that themselves failed while the operation was being
 *       rolled back (empty when cleanup succeeded or was not needed)</li>
 * </ul>
 *
 * <p>Use {@link #isCleanupFailed()} to tell "operation failed" apart from
 * "operation failed and cleanup also failed".
 *
 * @see JobFailureException
 * @see orchestrator.engine.EnvironmentOrchestrator
 */
public class OrchestrationException extends Exception {

    private final String stage;
    private final List<UndoFailure> undoFailures;

    /**
     * Creates a new orchestration exception with a message.
     *
     * @param message the error message
     */
    public OrchestrationException(String message) {
        this(message, null, null, List.of());
    }

    /**
     * Creates a new orchestration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public OrchestrationException(String message, Throwable cause) {
        this(message, cause, null, List.of());
    }

    /**
     * Creates a new orchestration exception with full diagnostic context.
     *
     * @param message the error message
     * @param cause the original failure (may be null)
     * @param stage the stage where the failure occurred (may be null)
     * @param undoFailures undo steps that failed during rollback (may be null)
     */
    public OrchestrationException(String message, Throwable cause, String stage, List<UndoFailure> undoFailures) {
        super(message, cause);
        this.stage = stage;
        this.undoFailures = undoFailures == null ? List.of() : List.copyOf(undoFailures);
    }

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    /**
     * Returns the undo steps that failed while rolling back.
     *
     * @return an immutable list, empty if cleanup succeeded
     */
    public List<UndoFailure> undoFailures() {
        return undoFailures;
    }

    /**
     * Returns true if rolling back the operation also failed.
     */
    public boolean isCleanupFailed() {
        return !undoFailures.isEmpty();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (!undoFailures.isEmpty()) {
            sb.append(" [cleanup failed: ").append(undoFailures.size()).append(" undo step(s)");
            for (UndoFailure f : undoFailures) {
                sb.append("; ").append(f.summary());
            }
            sb.append("]");
        }

        return sb.toString();
    }
}
