package orchestrator.engine;

import orchestrator.activation.ActivationController;
import orchestrator.alert.LifecycleAlertLogger;
import orchestrator.api.ManagementApi;
import orchestrator.config.OrchestratorConfig;
import orchestrator.config.OrchestratorConfigLoader;
import orchestrator.env.EngineMachine;
import orchestrator.env.Environment;
import orchestrator.env.ExecResult;
import orchestrator.env.Machine;
import orchestrator.env.RepositoryServer;
import orchestrator.exceptions.JobFailureException;
import orchestrator.exceptions.OrchestrationException;
import orchestrator.job.BatchResult;
import orchestrator.job.Job;
import orchestrator.job.ParallelJobRunner;
import orchestrator.metrics.OperationMetrics;
import orchestrator.metrics.OperationMetrics.Phase;
import orchestrator.metrics.OperationMetricsCollector;
import orchestrator.prepare.BuildToolchain;
import orchestrator.prepare.MetadataStore;
import orchestrator.prepare.PrefixPaths;
import orchestrator.prepare.PreparationPipeline;
import orchestrator.prepare.PreparationRequest;
import orchestrator.prepare.ProcessBuildToolchain;
import orchestrator.prepare.YamlMetadataStore;
import orchestrator.snapshot.NoopTransactionListener;
import orchestrator.snapshot.SnapshotTransaction;
import orchestrator.snapshot.TransactionListener;
import orchestrator.state.EnvironmentStatus;
import orchestrator.state.OrchestratorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry points of the environment lifecycle: concurrent job batches,
 * activation and deactivation, snapshots, deployment and repository preparation.
 *
 * <p>Every entry point runs as a numbered operation: it is reported through
 * {@link LifecycleAlertLogger}, timed into {@link OperationMetrics} and recorded
 * in the orchestrator's {@link OrchestratorState}. Checked failures surface as
 * {@link OrchestrationException}; convergence timeouts and transient rejections
 * outside a snapshot surface unchanged.
 *
 * <h2>Example:</h2>
 * <pre>
 * EnvironmentOrchestrator orchestrator = EnvironmentOrchestrator.builder()
 *     .environment(new Environment(engine, hosts, virt))
 *     .config(OrchestratorConfigLoader.load())
 *     .prefix(Path.of("/var/lib/prefix"))
 *     .build();
 *
 * orchestrator.createSnapshot("baseline", true);
 * </pre>
 *
 * <p>Operations of one orchestrator are expected to run one at a time.
 */
public final class EnvironmentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentOrchestrator.class);

    static final String ANSWER_FILE_TARGET = "/tmp/answer-file";

    private static final AtomicLong OPERATION_COUNTER = new AtomicLong(1L);

    private final Environment env;
    private final OrchestratorConfig config;
    private final ActivationController controller;
    private final ParallelJobRunner runner;
    private final RepositoryServer repositoryServer;
    private final PreparationPipeline pipeline;
    private final TransactionListener listener;
    private final OrchestratorState state;

    private EnvironmentOrchestrator(Builder b) {
        this.env = Objects.requireNonNull(b.env, "environment");
        this.config = b.config;
        this.controller = b.controller != null ? b.controller : new ActivationController(config.polling());
        this.runner = b.runner != null ? b.runner : new ParallelJobRunner("orchestrator", config.maxBatchSize());
        this.repositoryServer = b.repositoryServer;
        this.listener = b.listener;
        this.state = b.state != null ? b.state : new OrchestratorState(config.historySize());

        if (b.paths != null) {
            BuildToolchain toolchain = b.toolchain != null ? b.toolchain : new ProcessBuildToolchain();
            MetadataStore store = b.metadataStore != null ? b.metadataStore : new YamlMetadataStore(b.paths);
            this.pipeline = new PreparationPipeline(b.paths, toolchain, store, runner);
        } else {
            this.pipeline = null;
        }

        LifecycleAlertLogger.setAlertLevel(config.alertLevel());
        log.debug("Orchestrator for {} with {}", env.engine().name(), config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OrchestratorState state() {
        return state;
    }

    public OrchestratorConfig config() {
        return config;
    }

    /**
     * Runs independent jobs concurrently and waits for all of them.
     *
     * @return one outcome per job in submission order; never throws for failed jobs
     * @throws IllegalArgumentException if the batch exceeds the configured bound
     */
    public BatchResult runBatch(List<? extends Job> jobs) {
        long id = OPERATION_COUNTER.getAndIncrement();
        String name = "batch";
        OperationMetricsCollector metrics = begin(id, name);

        BatchResult result;
        try {
            result = metrics.timed(Phase.RUN_JOBS, () -> runner.runBatch(jobs));
        } catch (RuntimeException e) {
            failed(id, name, e, metrics);
            throw e;
        }
        metrics.batch(result);

        if (result.success()) {
            completed(id, name, metrics);
        } else {
            failed(id, name, new JobFailureException(result), metrics);
        }
        return result;
    }

    /**
     * Waits for every machine, activates all hosts, then all storage domains.
     */
    public void activateEnvironment() throws OrchestrationException {
        operation("activate", EnvironmentStatus.DEGRADED, (id, metrics) -> {
            activate(metrics);
            state.setEnvironmentStatus(EnvironmentStatus.RUNNING);
        });
    }

    /**
     * Deactivates all storage domains (masters last), then all hosts.
     */
    public void deactivateEnvironment() throws OrchestrationException {
        operation("deactivate", EnvironmentStatus.DEGRADED, (id, metrics) -> {
            deactivate(metrics);
            state.setEnvironmentStatus(EnvironmentStatus.QUIESCED);
        });
    }

    /**
     * Quiesces the environment and captures a snapshot of its disks.
     *
     * @param name snapshot name
     * @param restore reactivate the environment after a successful capture
     * @throws OrchestrationException if the snapshot was not taken (the
     *         environment was restored unless {@link OrchestrationException#isCleanupFailed()}),
     *         or if it was taken but the requested restore failed
     */
    public void createSnapshot(String name, boolean restore) throws OrchestrationException {
        Objects.requireNonNull(name, "name");
        operation("snapshot:" + name, null, (id, metrics) -> {
            SnapshotTransaction tx = SnapshotTransaction.builder()
                    .environment(env)
                    .controller(controller)
                    .runner(runner)
                    .services(config.services())
                    .listener(listener)
                    .metrics(metrics, id)
                    .snapshot(name, restore)
                    .build();
            try {
                tx.execute();
            } catch (OrchestrationException e) {
                // no stage: failed before quiescing, nothing was touched
                if (e.getStage() != null) {
                    state.setEnvironmentStatus(e.isCleanupFailed() ? EnvironmentStatus.DEGRADED : EnvironmentStatus.RUNNING);
                }
                throw e;
            }
            state.setEnvironmentStatus(restore ? EnvironmentStatus.RUNNING : EnvironmentStatus.QUIESCED);
        });
    }

    /**
     * Restores the disks from a snapshot, then activates the environment.
     */
    public void revertSnapshot(String name) throws OrchestrationException {
        Objects.requireNonNull(name, "name");
        operation("revert:" + name, EnvironmentStatus.DEGRADED, (id, metrics) -> {
            metrics.timed(Phase.RESTORE, () -> env.virt().revertSnapshot(name));
            activate(metrics);
            state.setEnvironmentStatus(EnvironmentStatus.RUNNING);
        });
    }

    /**
     * Powers the VMs on, then activates the environment.
     */
    public void start() throws OrchestrationException {
        operation("start", EnvironmentStatus.DEGRADED, (id, metrics) -> {
            env.virt().start();
            activate(metrics);
            state.setEnvironmentStatus(EnvironmentStatus.RUNNING);
        });
    }

    /**
     * Deactivates the environment, then powers the VMs off.
     */
    public void stop() throws OrchestrationException {
        operation("stop", EnvironmentStatus.DEGRADED, (id, metrics) -> {
            deactivate(metrics);
            env.virt().stop();
            state.setEnvironmentStatus(EnvironmentStatus.STOPPED);
        });
    }

    /**
     * Runs every machine's deploy scripts, all machines concurrently, while the
     * internal repository is served.
     *
     * @throws JobFailureException if any machine failed; a script exiting
     *         non-zero fails its machine's job
     */
    public void deploy() throws OrchestrationException {
        operation("deploy", null, (id, metrics) -> {
            try (Closeable server = repositoryServer.start()) {
                List<Job> jobs = new ArrayList<>();
                for (Machine machine : env.machines()) {
                    jobs.add(Job.named("deploy " + machine.name(), () -> deployMachine(machine)));
                }
                runJobs(jobs, metrics);
            }
        });
    }

    /**
     * Copies an answer file to the engine and runs {@code engine-setup} with it.
     */
    public void initializeEngine(Path answerFile) throws OrchestrationException {
        Objects.requireNonNull(answerFile, "answerFile");
        operation("initialize-engine", null, (id, metrics) -> {
            EngineMachine engine = env.engine();
            engine.waitUntilReachable();
            engine.copyTo(answerFile, ANSWER_FILE_TARGET);
            ExecResult result = engine.exec(List.of("engine-setup", "--config=" + ANSWER_FILE_TARGET));
            if (!result.isSuccess()) {
                throw new OrchestrationException("engine-setup failed with status " + result.exitCode()
                        + " on " + engine.name() + ": " + result.stderr());
            }
        });
    }

    /**
     * Collects every machine's artifacts into {@code outputDir/<machine>},
     * all machines concurrently.
     */
    public void collectArtifacts(Path outputDir) throws OrchestrationException {
        Objects.requireNonNull(outputDir, "outputDir");
        operation("collect-artifacts", null, (id, metrics) -> {
            Files.createDirectories(outputDir);
            List<Job> jobs = new ArrayList<>();
            for (Machine machine : env.machines()) {
                Path destination = outputDir.resolve(machine.name());
                jobs.add(Job.named("collect " + machine.name(), () -> {
                    Files.createDirectories(destination);
                    machine.collectArtifacts(destination);
                }));
            }
            runJobs(jobs, metrics);
        });
    }

    /**
     * Builds and synchronizes packages and merges them into the internal repository.
     *
     * @throws IllegalStateException if the orchestrator was built without a prefix
     */
    public void prepareRepository(PreparationRequest request) throws OrchestrationException {
        Objects.requireNonNull(request, "request");
        if (pipeline == null) {
            throw new IllegalStateException("No prefix configured, cannot prepare a repository");
        }
        operation("prepare", null, (id, metrics) -> pipeline.prepare(env, request, metrics));
    }

    private void activate(OperationMetricsCollector metrics) throws IOException {
        metrics.timed(Phase.WAIT_REACHABLE, () -> {
            for (Machine machine : env.machines()) {
                machine.waitUntilReachable();
            }
        });
        log.info("Machines reachable");
        ManagementApi api = env.engine().managementApi();
        metrics.timed(Phase.ACTIVATE_HOSTS, () -> controller.activateAllHosts(api));
        metrics.timed(Phase.ACTIVATE_STORAGE, () -> controller.activateAllStorageDomains(api));
    }

    private void deactivate(OperationMetricsCollector metrics) throws IOException {
        ManagementApi api = env.engine().managementApi();
        metrics.timed(Phase.DEACTIVATE_STORAGE, () -> controller.deactivateAllStorageDomains(api));
        metrics.timed(Phase.DEACTIVATE_HOSTS, () -> controller.deactivateAllHosts(api));
    }

    private static void deployMachine(Machine machine) throws Exception {
        machine.waitUntilReachable();
        for (Path script : machine.deployScripts()) {
            ExecResult result = machine.runScript(script);
            if (!result.isSuccess()) {
                throw new OrchestrationException(String.format("%s failed with status %d on %s",
                        script, result.exitCode(), machine.name()));
            }
        }
    }

    private void runJobs(List<Job> jobs, OperationMetricsCollector metrics) throws JobFailureException {
        BatchResult result = metrics.timed(Phase.RUN_JOBS, () -> runner.runBatch(jobs));
        metrics.batch(result);
        result.throwIfFailed();
    }

    @FunctionalInterface
    private interface OperationBody {
        void run(long operationId, OperationMetricsCollector metrics) throws Exception;
    }

    /**
     * @param onFailure environment status recorded when the body fails, null to leave it alone
     */
    private void operation(String name, EnvironmentStatus onFailure, OperationBody body)
            throws OrchestrationException {
        long id = OPERATION_COUNTER.getAndIncrement();
        OperationMetricsCollector metrics = begin(id, name);
        try {
            body.run(id, metrics);
        } catch (OrchestrationException | RuntimeException e) {
            markEnvironment(onFailure);
            failed(id, name, e, metrics);
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            OrchestrationException wrapped = new OrchestrationException(name + " failed: " + e.getMessage(), e);
            markEnvironment(onFailure);
            failed(id, name, wrapped, metrics);
            throw wrapped;
        }
        completed(id, name, metrics);
    }

    private void markEnvironment(EnvironmentStatus status) {
        if (status != null) {
            state.setEnvironmentStatus(status);
        }
    }

    private OperationMetricsCollector begin(long id, String name) {
        state.operationStarted(id, name);
        LifecycleAlertLogger.operationStarted(id, name);
        return new OperationMetricsCollector().start(id, name);
    }

    private void completed(long id, String name, OperationMetricsCollector metrics) {
        OperationMetrics m = metrics.finish();
        state.operationCompleted(m);
        LifecycleAlertLogger.operationCompleted(id, name, m);
        log.info("{}", m.summary());
    }

    private void failed(long id, String name, Exception error, OperationMetricsCollector metrics) {
        OperationMetrics m = metrics.finish();
        boolean cleanupFailed = error instanceof OrchestrationException oe && oe.isCleanupFailed();
        state.operationFailed(error, m);
        LifecycleAlertLogger.operationFailed(id, name, error, cleanupFailed);
    }

    /**
     * Builder for {@link EnvironmentOrchestrator}.
     */
    public static final class Builder {
        private Environment env;
        private OrchestratorConfig config = OrchestratorConfig.DEFAULTS;
        private ActivationController controller;
        private ParallelJobRunner runner;
        private RepositoryServer repositoryServer = RepositoryServer.NONE;
        private PrefixPaths paths;
        private BuildToolchain toolchain;
        private MetadataStore metadataStore;
        private TransactionListener listener = NoopTransactionListener.INSTANCE;
        private OrchestratorState state;

        private Builder() {}

        public Builder environment(Environment env) {
            this.env = env;
            return this;
        }

        public Builder config(OrchestratorConfig config) {
            this.config = config != null ? config : OrchestratorConfig.DEFAULTS;
            return this;
        }

        /**
         * Uses the configuration found on the classpath.
         *
         * @see OrchestratorConfigLoader#load()
         */
        public Builder loadConfig() {
            return config(OrchestratorConfigLoader.load());
        }

        /** Overrides the controller built from the configured polling bounds. */
        public Builder controller(ActivationController controller) {
            this.controller = controller;
            return this;
        }

        public Builder runner(ParallelJobRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder repositoryServer(RepositoryServer server) {
            this.repositoryServer = server != null ? server : RepositoryServer.NONE;
            return this;
        }

        /** Prefix directory; required for {@link #prepareRepository(PreparationRequest)}. */
        public Builder prefix(Path prefix) {
            this.paths = prefix != null ? new PrefixPaths(prefix) : null;
            return this;
        }

        public Builder toolchain(BuildToolchain toolchain) {
            this.toolchain = toolchain;
            return this;
        }

        public Builder metadataStore(MetadataStore store) {
            this.metadataStore = store;
            return this;
        }

        public Builder listener(TransactionListener listener) {
            this.listener = listener != null ? listener : NoopTransactionListener.INSTANCE;
            return this;
        }

        public Builder state(OrchestratorState state) {
            this.state = state;
            return this;
        }

        public EnvironmentOrchestrator build() {
            return new EnvironmentOrchestrator(this);
        }
    }
}
