package orchestrator.prepare;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Keeps prefix metadata as a flat YAML mapping, one {@code key: value} per line.
 */
public final class YamlMetadataStore implements MetadataStore {

    private final Path file;

    public YamlMetadataStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public YamlMetadataStore(PrefixPaths paths) {
        this(paths.metadataFile());
    }

    @Override
    public Map<String, String> load() throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, Object> raw = new Yaml().load(reader);
            Map<String, String> metadata = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((k, v) -> metadata.put(k, v != null ? v.toString() : null));
            }
            return metadata;
        } catch (ClassCastException e) {
            throw new IOException("Metadata file " + file + " is not a mapping", e);
        }
    }

    @Override
    public void save(Map<String, String> metadata) throws IOException {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(new TreeMap<>(metadata), writer);
        }
    }
}
