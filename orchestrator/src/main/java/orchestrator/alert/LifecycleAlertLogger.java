package orchestrator.alert;

import orchestrator.config.AlertLevel;
import orchestrator.metrics.OperationMetrics;
import orchestrator.metrics.OperationMetrics.Phase;
import orchestrator.rollback.UndoFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Structured logging for environment lifecycle events.
 *
 * <p>Every line starts with an event marker followed by key=value pairs so that
 * log aggregators can parse and alert on them.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  orchestrator - OPERATION_STARTED id=7 operation=snapshot:baseline
 * 12:00:00.010 INFO  orchestrator - PHASE_STARTED id=7 phase=DEACTIVATE_STORAGE
 * 12:00:41.200 INFO  orchestrator - PHASE_COMPLETED id=7 phase=DEACTIVATE_STORAGE duration_ms=41190
 * 12:01:05.000 WARN  orchestrator - ROLLBACK_TRIGGERED id=7 reason="restore requested"
 * 12:02:30.000 INFO  orchestrator - OPERATION_COMPLETED id=7 operation=snapshot:baseline duration_ms=150000
 * </pre>
 */
public final class LifecycleAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("orchestrator");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private LifecycleAlertLogger() {}

    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void operationStarted(long operationId, String operation) {
        if (shouldLogInfo()) {
            log.info("OPERATION_STARTED id={} operation={}", operationId, operation);
        }
    }

    public static void phaseStarted(long operationId, Phase phase) {
        if (shouldLogInfo()) {
            log.info("PHASE_STARTED id={} phase={}", operationId, phase.name());
        }
    }

    public static void phaseCompleted(long operationId, Phase phase, long durationMs) {
        if (shouldLogInfo()) {
            log.info("PHASE_COMPLETED id={} phase={} duration_ms={}", operationId, phase.name(), durationMs);
        }
    }

    public static void operationCompleted(long operationId, String operation, OperationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("OPERATION_COMPLETED id={} operation={} duration_ms={} undo_steps_run={}",
                    operationId, operation, metrics.totalDurationMs(), metrics.undoStepsRun());
        }
    }

    /**
     * Always logged.
     */
    public static void operationFailed(long operationId, String operation, Throwable error, boolean cleanupFailed) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("OPERATION_FAILED id={} operation={} cleanup_failed={} error=\"{}\"",
                operationId, operation, cleanupFailed, errorMsg);
    }

    public static void rollbackTriggered(long operationId, String reason) {
        if (shouldLogWarn()) {
            log.warn("ROLLBACK_TRIGGERED id={} reason=\"{}\"", operationId, reason);
        }
    }

    public static void rollbackCompleted(long operationId, List<UndoFailure> failures) {
        if (failures.isEmpty()) {
            if (shouldLogWarn()) {
                log.warn("ROLLBACK_COMPLETED id={} status=SUCCESS", operationId);
            }
        } else {
            log.error("ROLLBACK_COMPLETED id={} status=FAILED failed_steps={}", operationId, failures.size());
            for (UndoFailure f : failures) {
                log.error("UNDO_FAILED id={} step=\"{}\"", operationId, f.summary());
            }
        }
    }

    /**
     * Always logged.
     */
    public static void convergenceTimeout(String condition, long timeoutMs, int attempts) {
        log.error("CONVERGENCE_TIMEOUT condition=\"{}\" timeout_ms={} attempts={}", condition, timeoutMs, attempts);
    }
}
