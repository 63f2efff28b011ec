package orchestrator.prepare;

import java.io.IOException;
import java.util.Map;

/**
 * Persistent key/value metadata of a prefix, e.g. the source revisions its
 * packages were built from.
 */
public interface MetadataStore {

    /**
     * @return the stored metadata, empty if nothing was stored yet
     */
    Map<String, String> load() throws IOException;

    void save(Map<String, String> metadata) throws IOException;
}
