package orchestrator.env;

import java.io.IOException;

/**
 * A system service on a remote machine.
 */
public interface ServiceControl {

    String name();

    void start() throws IOException;

    void stop() throws IOException;
}
