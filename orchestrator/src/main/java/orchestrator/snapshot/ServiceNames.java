package orchestrator.snapshot;

import orchestrator.config.OrchestratorConfig;

import java.util.List;
import java.util.Objects;

/**
 * System services stopped while quiescing.
 *
 * @param engine management service on the engine machine
 * @param hosts services on every host, in stop order; restarted in reverse
 */
public record ServiceNames(String engine, List<String> hosts) {

    public static final ServiceNames DEFAULTS = new ServiceNames(
            OrchestratorConfig.DEFAULT_ENGINE_SERVICE, OrchestratorConfig.DEFAULT_HOST_SERVICES);

    public ServiceNames {
        Objects.requireNonNull(engine, "engine");
        hosts = List.copyOf(Objects.requireNonNull(hosts, "hosts"));
    }
}
