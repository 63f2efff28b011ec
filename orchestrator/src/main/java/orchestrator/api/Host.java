package orchestrator.api;

import orchestrator.exceptions.TransientRejectionException;

/**
 * A compute host as seen by the management API.
 */
public interface Host {

    String name();

    HostState state();

    /**
     * @throws TransientRejectionException if the API refuses the request
     */
    void activate();

    /**
     * @throws TransientRejectionException if the API refuses the request
     */
    void deactivate();
}
