package orchestrator.env;

import java.io.IOException;

/**
 * Hypervisor-side handle of the environment: VM power and disk snapshots.
 */
public interface VirtualEnvironment {

    void start() throws IOException;

    void stop() throws IOException;

    /**
     * Captures the persistent disks of every machine under the given name.
     */
    void createSnapshot(String name) throws IOException;

    /**
     * Restores the persistent disks of every machine from the named snapshot.
     */
    void revertSnapshot(String name) throws IOException;
}
