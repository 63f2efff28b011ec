package orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads orchestrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code orchestrator.properties} on the classpath</li>
 *   <li>{@code orchestrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based values
 * (e.g. {@code -Dorchestrator.timeout.long=900}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code orchestrator.timeout.short} - host convergence bound in seconds</li>
 *   <li>{@code orchestrator.timeout.long} - storage domain convergence bound in seconds</li>
 *   <li>{@code orchestrator.poll.interval.ms} - pause between two polls</li>
 *   <li>{@code orchestrator.batch.max-size} - largest job batch, 0 for no bound</li>
 *   <li>{@code orchestrator.service.engine} - engine management service</li>
 *   <li>{@code orchestrator.service.host} - comma separated host services</li>
 *   <li>{@code orchestrator.history.size} - number of history entries</li>
 *   <li>{@code orchestrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * <p>Invalid values are logged and ignored.
 *
 * @see OrchestratorConfig
 */
public final class OrchestratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfigLoader.class);

    private OrchestratorConfigLoader() {}

    /**
     * Load from classpath (orchestrator.properties or orchestrator.yml).
     * @throws OrchestratorConfigException if no config file found
     */
    public static OrchestratorConfig load() {
        InputStream is = getResource("orchestrator.properties");
        if (is != null) {
            return loadProperties(is, "orchestrator.properties");
        }

        is = getResource("orchestrator.yml");
        if (is != null) {
            return loadYaml(is, "orchestrator.yml");
        }

        throw new OrchestratorConfigException(
                "Config file required: orchestrator.properties or orchestrator.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static OrchestratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return OrchestratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static OrchestratorConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new OrchestratorConfigException("Failed to load " + source, e);
        }
    }

    private static OrchestratorConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root = new Yaml().load(is);
        if (root == null) {
            return OrchestratorConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val instanceof List<?> list) {
                props.setProperty(key, String.join(",", list.stream().map(String::valueOf).toList()));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static OrchestratorConfig parse(Properties props) {
        OrchestratorConfig.Builder b = OrchestratorConfig.builder();

        getLong(props, "orchestrator.timeout.short").ifPresent(v -> apply(() -> b.shortTimeoutSeconds(v),
                "orchestrator.timeout.short", v));
        getLong(props, "orchestrator.timeout.long").ifPresent(v -> apply(() -> b.longTimeoutSeconds(v),
                "orchestrator.timeout.long", v));
        getLong(props, "orchestrator.poll.interval.ms").ifPresent(v -> apply(() -> b.pollIntervalMillis(v),
                "orchestrator.poll.interval.ms", v));
        getInt(props, "orchestrator.batch.max-size").ifPresent(v -> apply(() -> b.maxBatchSize(v),
                "orchestrator.batch.max-size", v));
        getInt(props, "orchestrator.history.size").ifPresent(v -> apply(() -> b.historySize(v),
                "orchestrator.history.size", v));

        getString(props, "orchestrator.service.engine").ifPresent(v -> apply(() -> b.engineService(v),
                "orchestrator.service.engine", v));
        getString(props, "orchestrator.service.host").ifPresent(v -> b.hostServices(
                Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList()));

        getString(props, "orchestrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static void apply(Runnable setter, String key, Object value) {
        try {
            setter.run();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {} ({})", key, value, e.getMessage());
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
