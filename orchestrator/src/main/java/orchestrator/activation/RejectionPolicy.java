package orchestrator.activation;

/**
 * What to do when the management API transiently rejects a per-entity request.
 *
 * @see RequestDispatcher
 */
public enum RejectionPolicy {
    /** Ignore the rejection and move on to the next entity. */
    SWALLOW,
    /** Put the entity back at the end of the queue and try it again later in the same pass. */
    REQUEUE,
    /** Rethrow the rejection to the caller immediately. */
    PROPAGATE
}
