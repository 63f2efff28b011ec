package orchestrator.env;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The live environment: one engine machine, the host machines and the
 * virtual environment that owns them.
 *
 * <p>Passed explicitly to every operation that needs it.
 *
 * @param engine the engine machine
 * @param hosts the host machines, in a stable order
 * @param virt the hypervisor-side handle
 */
public record Environment(EngineMachine engine, List<Machine> hosts, VirtualEnvironment virt) {

    public Environment {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(virt, "virt");
        hosts = List.copyOf(Objects.requireNonNull(hosts, "hosts"));
    }

    /** Every machine, engine first. */
    public List<Machine> machines() {
        List<Machine> all = new ArrayList<>(hosts.size() + 1);
        all.add(engine);
        all.addAll(hosts);
        return all;
    }
}
