package orchestrator.prepare;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Layout of a prefix directory.
 *
 * <pre>
 * &lt;prefix&gt;/build/&lt;component&gt;/&lt;dist&gt;   RPMs built from local sources
 * &lt;prefix&gt;/internal_repo/&lt;dist&gt;        merged repository served to the VMs
 * &lt;prefix&gt;/metadata.yml                 prefix metadata
 * </pre>
 */
public final class PrefixPaths {

    private final Path prefix;

    public PrefixPaths(Path prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public Path prefix() {
        return prefix;
    }

    public Path buildDir(String component) {
        return prefix.resolve("build").resolve(component);
    }

    public Path internalRepo(String dist) {
        return prefix.resolve("internal_repo").resolve(dist);
    }

    public Path metadataFile() {
        return prefix.resolve("metadata.yml");
    }

    @Override
    public String toString() {
        return prefix.toString();
    }
}
