package orchestrator.api;

/**
 * Observable state of a compute host.
 */
public enum HostState {
    UP,
    MAINTENANCE,
    /** Between states (activating, preparing for maintenance, installing...) */
    TRANSITIONING
}
