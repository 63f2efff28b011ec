package orchestrator.env;

import java.io.Closeable;
import java.io.IOException;

/**
 * Serves the prefix's internal package repository to the machines.
 */
public interface RepositoryServer {

    /**
     * Starts serving; closing the returned handle stops the server.
     */
    Closeable start() throws IOException;

    /** Server that does nothing, for environments that reach packages otherwise. */
    RepositoryServer NONE = () -> () -> { };
}
