package orchestrator.env;

import orchestrator.api.ManagementApi;

import java.io.IOException;

/**
 * The machine running the management engine.
 */
public interface EngineMachine extends Machine {

    /**
     * Returns a client for the engine's management API, waiting until the API
     * answers requests.
     *
     * @throws IOException if the API does not become available
     */
    ManagementApi managementApi() throws IOException;
}
