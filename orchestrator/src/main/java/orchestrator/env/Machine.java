package orchestrator.env;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * An addressable virtual machine of the environment and its remote-control channel.
 *
 * <p>The orchestrator only uses these operations as actions inside jobs and
 * undo steps; their transport (SSH or otherwise) is up to the implementation.
 */
public interface Machine {

    String name();

    /** Distribution the machine was installed from, e.g. {@code el7}. */
    String distro();

    /**
     * Blocks until the remote channel accepts connections.
     *
     * @throws IOException if the machine does not become reachable
     */
    void waitUntilReachable() throws IOException;

    ServiceControl service(String serviceName);

    ExecResult exec(List<String> command) throws IOException;

    ExecResult runScript(Path script) throws IOException;

    void copyTo(Path localPath, String remotePath) throws IOException;

    /** Scripts to run on the machine when deploying, in order. */
    List<Path> deployScripts();

    /**
     * Copies the machine's logs and other artifacts into a local directory.
     *
     * @param destination an existing local directory
     */
    void collectArtifacts(Path destination) throws IOException;
}
