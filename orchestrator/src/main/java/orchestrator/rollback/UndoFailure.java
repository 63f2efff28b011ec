package orchestrator.rollback;

/**
 * An undo step that failed while a {@link RollbackStack} was being unwound.
 *
 * @param description the description the step was registered with
 * @param error the exception the step threw
 */
public record UndoFailure(String description, Throwable error) {

    /** Returns {@code description: message} for log lines and exception messages. */
    public String summary() {
        String msg = error != null ? error.getMessage() : null;
        return description + ": " + (msg != null ? msg : String.valueOf(error));
    }
}
