package orchestrator.rollback;

/**
 * A compensating action registered on a {@link RollbackStack}.
 */
@FunctionalInterface
public interface UndoStep {
    void run() throws Exception;
}
