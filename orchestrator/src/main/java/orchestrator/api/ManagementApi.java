package orchestrator.api;

import java.util.List;

/**
 * Narrow view of the engine's remote management API used by the orchestrator.
 *
 * <p>Read calls may be shared between concurrent pollers. Mutating calls live on
 * {@link StorageDomain} and {@link Host} and may throw
 * {@link orchestrator.exceptions.TransientRejectionException}.
 */
public interface ManagementApi {

    List<DataCenter> dataCenters();

    /**
     * @return the data center, or null if unknown
     */
    DataCenter dataCenter(String id);

    List<Host> hosts();

    /**
     * @return the host, or null if unknown
     */
    Host host(String name);
}
