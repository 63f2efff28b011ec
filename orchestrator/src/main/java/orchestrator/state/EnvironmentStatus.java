package orchestrator.state;

/**
 * Last known condition of the environment, as left by the orchestrator.
 */
public enum EnvironmentStatus {
    /** Nothing known yet. */
    UNKNOWN,
    /** VMs powered off. */
    STOPPED,
    /** Hosts up and storage domains active. */
    RUNNING,
    /** Storage domains and hosts deactivated, possibly services stopped. */
    QUIESCED,
    /** An operation failed and could not restore a known condition. */
    DEGRADED
}
