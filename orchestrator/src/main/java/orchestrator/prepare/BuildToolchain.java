package orchestrator.prepare;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * External tools the preparation pipeline schedules. Every method blocks until
 * the tool finishes and throws if it failed.
 *
 * @see ProcessBuildToolchain
 */
public interface BuildToolchain {

    /**
     * Synchronizes the given repositories of a yum config into a local directory.
     */
    void syncRepository(Path repoPath, Path yumConfig, List<String> repoIds) throws IOException;

    /**
     * Runs an RPM build script as {@code script sourceDir outputDir dist...}.
     *
     * @param env extra environment variables for the script
     */
    void buildRpms(String script, Path sourceDir, Path outputDir, List<String> dists,
                   Map<String, String> env) throws IOException;

    /**
     * Merges the RPMs of the input directories into one repository.
     */
    void mergeRepositories(Path output, List<Path> inputs) throws IOException;

    /**
     * @return the commit checked out in a git working tree
     */
    String gitRevision(Path workTree) throws IOException;
}
