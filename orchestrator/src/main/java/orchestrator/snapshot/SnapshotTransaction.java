package orchestrator.snapshot;

import orchestrator.activation.ActivationController;
import orchestrator.alert.LifecycleAlertLogger;
import orchestrator.api.ManagementApi;
import orchestrator.env.EngineMachine;
import orchestrator.env.Environment;
import orchestrator.env.Machine;
import orchestrator.env.ServiceControl;
import orchestrator.exceptions.OrchestrationException;
import orchestrator.job.BatchResult;
import orchestrator.job.Job;
import orchestrator.job.ParallelJobRunner;
import orchestrator.metrics.OperationMetrics.Phase;
import orchestrator.metrics.OperationMetricsCollector;
import orchestrator.rollback.RollbackStack;
import orchestrator.rollback.UndoFailure;
import orchestrator.rollback.UndoStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Quiesces the environment, captures a disk snapshot and guarantees that the
 * quiesce steps are reversed if anything fails on the way.
 *
 * <p>Quiesce order, each step registering its inverse on a {@link RollbackStack}:
 * <ol>
 *   <li>deactivate all storage domains (masters last)</li>
 *   <li>deactivate all hosts</li>
 *   <li>stop the engine management service</li>
 *   <li>stop the host services on every host concurrently</li>
 * </ol>
 * Then the snapshot is captured. On success the stack is discarded and the
 * environment stays quiesced, unless a restore was requested. On failure the
 * stack is unwound in reverse order before the failure is reported.
 *
 * <p>A transaction is executed at most once.
 *
 * @see SnapshotPhase
 */
public final class SnapshotTransaction {

    private static final Logger log = LoggerFactory.getLogger(SnapshotTransaction.class);

    private final Environment env;
    private final ActivationController controller;
    private final ParallelJobRunner runner;
    private final ServiceNames services;
    private final TransactionListener listener;
    private final OperationMetricsCollector metrics;
    private final long operationId;
    private final String snapshotName;
    private final boolean restore;

    private volatile SnapshotPhase phase = SnapshotPhase.RUNNING;
    private Phase stage;
    private boolean executed;

    private SnapshotTransaction(Builder b) {
        this.env = Objects.requireNonNull(b.env, "environment");
        this.controller = Objects.requireNonNull(b.controller, "controller");
        this.runner = Objects.requireNonNull(b.runner, "runner");
        this.snapshotName = Objects.requireNonNull(b.snapshotName, "snapshotName");
        this.services = b.services;
        this.listener = b.listener;
        this.metrics = b.metrics != null ? b.metrics : new OperationMetricsCollector().start(b.operationId, "snapshot:" + snapshotName);
        this.operationId = b.operationId;
        this.restore = b.restore;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SnapshotPhase phase() {
        return phase;
    }

    public String snapshotName() {
        return snapshotName;
    }

    /**
     * Runs the transaction.
     *
     * @throws OrchestrationException if a quiesce step or the capture failed
     *         (cause is the original failure, undo failures attached), or if the
     *         snapshot was captured but the requested restore did not complete
     * @throws IllegalStateException if the transaction was already executed
     */
    public void execute() throws OrchestrationException {
        if (executed) {
            throw new IllegalStateException("Snapshot transaction '" + snapshotName + "' already executed");
        }
        executed = true;

        ManagementApi api;
        try {
            api = env.engine().managementApi();
        } catch (Exception e) {
            throw new OrchestrationException("Management API unavailable, snapshot '" + snapshotName + "' not taken", e);
        }

        try (RollbackStack rollback = new RollbackStack("snapshot " + snapshotName)) {
            try {
                transition(SnapshotPhase.QUIESCING);
                quiesce(api, rollback);

                stage = Phase.CAPTURE;
                metrics.timed(Phase.CAPTURE, () -> env.virt().createSnapshot(snapshotName));
                transition(SnapshotPhase.CAPTURED);
                log.info("Snapshot '{}' captured", snapshotName);
            } catch (Exception e) {
                Phase failedStage = stage;
                LifecycleAlertLogger.rollbackTriggered(operationId, failedStage + " failed: " + e.getMessage());
                transition(SnapshotPhase.RESTORING);
                List<UndoFailure> failures = unwind(rollback);
                if (failures.isEmpty()) {
                    transition(SnapshotPhase.RUNNING);
                }
                throw new OrchestrationException("Snapshot '" + snapshotName + "' failed", e,
                        String.valueOf(failedStage), failures);
            }

            if (!restore) {
                rollback.discard();
                return;
            }

            LifecycleAlertLogger.rollbackTriggered(operationId, "restore requested");
            List<UndoFailure> failures = unwind(rollback);
            if (!failures.isEmpty()) {
                throw new OrchestrationException("Snapshot '" + snapshotName
                        + "' captured but the environment was not restored", null, Phase.RESTORE.name(), failures);
            }
            transition(SnapshotPhase.RUNNING);
        }
    }

    private void quiesce(ManagementApi api, RollbackStack rollback) throws Exception {
        EngineMachine engine = env.engine();

        // pushed before the forward step: a group may fail with some members
        // already in maintenance, and reactivation is idempotent
        stage = Phase.DEACTIVATE_STORAGE;
        rollback.push("activate storage domains",
                () -> controller.activateAllStorageDomains(engine.managementApi()));
        metrics.timed(Phase.DEACTIVATE_STORAGE, () -> controller.deactivateAllStorageDomains(api));

        stage = Phase.DEACTIVATE_HOSTS;
        rollback.push("activate hosts", () -> controller.activateAllHosts(engine.managementApi()));
        metrics.timed(Phase.DEACTIVATE_HOSTS, () -> controller.deactivateAllHosts(api));

        stage = Phase.STOP_ENGINE;
        ServiceControl engineService = engine.service(services.engine());
        metrics.timed(Phase.STOP_ENGINE, engineService::stop);
        rollback.push("start " + services.engine() + " on " + engine.name(), () -> {
            engineService.start();
            engine.managementApi();
        });

        stage = Phase.STOP_HOST_SERVICES;
        metrics.timed(Phase.STOP_HOST_SERVICES, () -> stopHostServices(rollback));
    }

    /**
     * Stops the host services on every host in one batch. Each job records the
     * restarts of what it stopped; they are pushed here, after the join, in
     * host order.
     */
    private void stopHostServices(RollbackStack rollback) throws Exception {
        List<Machine> hosts = env.hosts();
        List<List<RecordedUndo>> recorded = new ArrayList<>(hosts.size());
        List<Job> jobs = new ArrayList<>(hosts.size());

        for (Machine host : hosts) {
            List<RecordedUndo> undos = new ArrayList<>();
            recorded.add(undos);
            jobs.add(Job.named("stop services on " + host.name(), () -> {
                for (String name : services.hosts()) {
                    ServiceControl service = host.service(name);
                    service.stop();
                    undos.add(new RecordedUndo("start " + name + " on " + host.name(), service::start));
                }
            }));
        }

        BatchResult result = runner.runBatch(jobs);
        metrics.batch(result);
        for (List<RecordedUndo> undos : recorded) {
            for (RecordedUndo undo : undos) {
                rollback.push(undo.description(), undo.step());
            }
        }
        result.throwIfFailed();
    }

    private List<UndoFailure> unwind(RollbackStack rollback) {
        int steps = rollback.size();
        List<UndoFailure> failures = metrics.timed(Phase.RESTORE, rollback::unwind);
        metrics.undoSteps(steps, failures.size());
        LifecycleAlertLogger.rollbackCompleted(operationId, failures);
        return failures;
    }

    private void transition(SnapshotPhase next) {
        SnapshotPhase previous = phase;
        phase = next;
        log.debug("Snapshot '{}': {} -> {}", snapshotName, previous, next);
        try {
            listener.onPhaseChange(snapshotName, previous, next);
        } catch (RuntimeException e) {
            log.warn("Transaction listener failed on {} -> {}", previous, next, e);
        }
    }

    private record RecordedUndo(String description, UndoStep step) {}

    /**
     * Builder for {@link SnapshotTransaction}.
     */
    public static final class Builder {
        private Environment env;
        private ActivationController controller;
        private ParallelJobRunner runner;
        private ServiceNames services = ServiceNames.DEFAULTS;
        private TransactionListener listener = NoopTransactionListener.INSTANCE;
        private OperationMetricsCollector metrics;
        private long operationId;
        private String snapshotName;
        private boolean restore;

        private Builder() {}

        public Builder environment(Environment env) {
            this.env = env;
            return this;
        }

        public Builder controller(ActivationController controller) {
            this.controller = controller;
            return this;
        }

        public Builder runner(ParallelJobRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder services(ServiceNames services) {
            this.services = services != null ? services : ServiceNames.DEFAULTS;
            return this;
        }

        public Builder listener(TransactionListener listener) {
            this.listener = listener != null ? listener : NoopTransactionListener.INSTANCE;
            return this;
        }

        /**
         * Collector the phases are timed on; a private one is started when absent.
         */
        public Builder metrics(OperationMetricsCollector metrics, long operationId) {
            this.metrics = metrics;
            this.operationId = operationId;
            return this;
        }

        public Builder snapshot(String name, boolean restore) {
            this.snapshotName = name;
            this.restore = restore;
            return this;
        }

        public SnapshotTransaction build() {
            return new SnapshotTransaction(this);
        }
    }
}
