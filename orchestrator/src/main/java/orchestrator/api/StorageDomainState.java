package orchestrator.api;

/**
 * Observable state of a storage domain within its data center.
 */
public enum StorageDomainState {
    ACTIVE,
    MAINTENANCE,
    /** Between states (activating, locked, preparing for maintenance...) */
    TRANSITIONING
}
