package orchestrator.api;

import orchestrator.exceptions.TransientRejectionException;

/**
 * A storage domain as seen through its data center.
 *
 * <p>Instances are views fetched from the management API: {@link #state()}
 * reflects the moment of the fetch, so pollers re-read the domain through
 * {@link DataCenter#storageDomain(String)} on every attempt.
 */
public interface StorageDomain {

    String id();

    String name();

    /** Id of the data center this domain belongs to. */
    String dataCenterId();

    /** True if this domain holds the data center's pool metadata. */
    boolean isMaster();

    StorageDomainState state();

    /**
     * Requests activation.
     *
     * @throws TransientRejectionException if the API refuses the request
     */
    void activate();

    /**
     * Requests the domain to be moved to maintenance.
     *
     * @throws TransientRejectionException if the API refuses the request
     */
    void deactivate();
}
