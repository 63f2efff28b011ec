package orchestrator.exceptions;

/**
 * Thrown by the management API when it refuses a request for a single entity
 * (host or storage domain) in a way that may succeed if retried.
 *
 * <p>How a rejection is handled depends on the
 * {@link orchestrator.activation.RejectionPolicy} of the calling operation.
 */
public class TransientRejectionException extends RuntimeException {

    private final String entity;

    public TransientRejectionException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    public TransientRejectionException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    /** Name of the entity whose request was rejected. */
    public String getEntity() {
        return entity;
    }
}
