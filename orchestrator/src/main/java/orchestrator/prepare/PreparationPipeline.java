package orchestrator.prepare;

import orchestrator.env.Environment;
import orchestrator.env.Machine;
import orchestrator.exceptions.OrchestrationException;
import orchestrator.job.BatchResult;
import orchestrator.job.Job;
import orchestrator.job.ParallelJobRunner;
import orchestrator.job.RunningBatch;
import orchestrator.metrics.OperationMetrics.Phase;
import orchestrator.metrics.OperationMetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the internal package repository of a prefix.
 *
 * <p>Sync and build jobs run as one batch on the {@link ParallelJobRunner};
 * their outputs are then merged per distribution into
 * {@link PrefixPaths#internalRepo(String)} and the source revisions are
 * recorded in the prefix metadata.
 */
public final class PreparationPipeline {

    private static final Logger log = LoggerFactory.getLogger(PreparationPipeline.class);

    public static final String VDSM = "vdsm";
    public static final String ENGINE = "ovirt-engine";
    public static final String VDSM_JSONRPC_JAVA = "vdsm-jsonrpc-java";

    public static final String ENGINE_REVISION_KEY = "ovirt-engine-revision";
    public static final String VDSM_REVISION_KEY = "vdsm-revision";
    public static final String UNKNOWN_REVISION = "unknown";

    private final PrefixPaths paths;
    private final BuildToolchain toolchain;
    private final MetadataStore metadataStore;
    private final ParallelJobRunner runner;

    public PreparationPipeline(PrefixPaths paths, BuildToolchain toolchain,
                               MetadataStore metadataStore, ParallelJobRunner runner) {
        this.paths = Objects.requireNonNull(paths, "paths");
        this.toolchain = Objects.requireNonNull(toolchain, "toolchain");
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Distributions of an environment: the engine's, the hosts' in host order,
     * and their union.
     */
    public record Distributions(List<String> engine, List<String> hosts, List<String> all) {

        public static Distributions of(Environment env) {
            List<String> engine = List.of(env.engine().distro());
            Set<String> hosts = new LinkedHashSet<>();
            for (Machine host : env.hosts()) {
                hosts.add(host.distro());
            }
            Set<String> all = new LinkedHashSet<>(engine);
            all.addAll(hosts);
            return new Distributions(engine, List.copyOf(hosts), List.copyOf(all));
        }
    }

    /**
     * Runs the pipeline for the given environment.
     *
     * @throws orchestrator.exceptions.JobFailureException if any sync or build job failed
     * @throws OrchestrationException if reading the yum config, merging or saving metadata failed
     */
    public void prepare(Environment env, PreparationRequest request, OperationMetricsCollector metrics)
            throws OrchestrationException {
        Distributions dists = Distributions.of(env);
        log.info("Preparing repository for {} (engine: {}, hosts: {})", paths, dists.engine(), dists.hosts());

        List<String> repoNames = List.of();
        List<Job> jobs = new ArrayList<>();

        if (request.rpmRepo() != null && request.reposyncYumConfig() != null) {
            try {
                repoNames = YumRepoConfig.read(request.reposyncYumConfig()).sectionsFor(dists.all());
            } catch (IOException e) {
                throw new OrchestrationException("Cannot read " + request.reposyncYumConfig(), e);
            }
            if (!request.skipSync()) {
                List<String> ids = repoNames;
                jobs.add(Job.named("sync " + request.rpmRepo(),
                        () -> toolchain.syncRepository(request.rpmRepo(), request.reposyncYumConfig(), ids)));
            }
        }

        if (request.vdsmDir() != null && !dists.hosts().isEmpty()) {
            jobs.add(buildJob(VDSM, "build_vdsm_rpms.sh", request.vdsmDir(), dists.hosts(), Map.of()));
        }
        if (request.engineDir() != null && !dists.engine().isEmpty()) {
            jobs.add(buildJob(ENGINE, "build_engine_rpms.sh", request.engineDir(), dists.engine(),
                    Map.of("BUILD_GWT", request.engineBuildGwt() ? "1" : "0")));
        }
        if (request.vdsmJsonrpcJavaDir() != null && !dists.engine().isEmpty()) {
            jobs.add(buildJob(VDSM_JSONRPC_JAVA, "build_vdsm-jsonrpc-java_rpms.sh",
                    request.vdsmJsonrpcJavaDir(), dists.engine(), Map.of()));
        }

        Map<String, String> metadata = new LinkedHashMap<>(loadMetadata());

        BatchResult result = metrics.timed(Phase.RUN_JOBS, () -> {
            RunningBatch batch = runner.start(jobs);
            if (request.engineDir() != null) {
                metadata.put(ENGINE_REVISION_KEY, revisionAt(request.engineDir()));
            }
            if (request.vdsmDir() != null) {
                metadata.put(VDSM_REVISION_KEY, revisionAt(request.vdsmDir()));
            }
            return batch.join();
        });
        metrics.batch(result);
        result.throwIfFailed();

        List<String> selected = repoNames;
        metrics.timed(Phase.MERGE_REPOSITORIES, () -> mergeRepositories(dists.all(), request.rpmRepo(), selected));

        try {
            metadataStore.save(metadata);
        } catch (IOException e) {
            throw new OrchestrationException("Failed to save prefix metadata", e);
        }
        log.info("Repository prepared for {}", dists.all());
    }

    private Job buildJob(String component, String script, Path sourceDir, List<String> dists,
                         Map<String, String> env) {
        Path output = paths.buildDir(component);
        return Job.named("build " + component,
                () -> toolchain.buildRpms(script, sourceDir, output, dists, env));
    }

    private void mergeRepositories(List<String> dists, Path rpmRepo, List<String> repoNames)
            throws OrchestrationException {
        for (String dist : dists) {
            List<Path> inputs = new ArrayList<>();
            for (String component : List.of(VDSM, ENGINE, VDSM_JSONRPC_JAVA)) {
                Path buildDir = paths.buildDir(component);
                if (Files.exists(buildDir)) {
                    inputs.add(buildDir.resolve(dist));
                }
            }
            if (rpmRepo != null) {
                repoNames.stream()
                        .filter(name -> name.endsWith(dist))
                        .map(rpmRepo::resolve)
                        .forEach(inputs::add);
            }

            Path output = paths.internalRepo(dist);
            try {
                toolchain.mergeRepositories(output, inputs);
            } catch (IOException e) {
                throw new OrchestrationException("Failed to merge repositories into " + output, e,
                        Phase.MERGE_REPOSITORIES.name(), List.of());
            }
        }
    }

    private Map<String, String> loadMetadata() throws OrchestrationException {
        try {
            return metadataStore.load();
        } catch (IOException e) {
            throw new OrchestrationException("Failed to load prefix metadata", e);
        }
    }

    private String revisionAt(Path workTree) {
        try {
            return toolchain.gitRevision(workTree);
        } catch (IOException e) {
            log.warn("Cannot read git revision of {}: {}", workTree, e.getMessage());
            return UNKNOWN_REVISION;
        }
    }
}
