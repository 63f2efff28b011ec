package orchestrator.config;

/**
 * Thrown when the orchestrator configuration cannot be found or loaded.
 */
public class OrchestratorConfigException extends RuntimeException {

    public OrchestratorConfigException(String message) {
        super(message);
    }

    public OrchestratorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
