package orchestrator.state;

import orchestrator.metrics.OperationMetrics;

import java.time.Instant;

/**
 * Immutable record of one finished lifecycle operation.
 *
 * @param operationId unique identifier of the operation
 * @param operation operation name, e.g. {@code snapshot:baseline}
 * @param timestamp when the operation finished
 * @param status SUCCESS or FAILED
 * @param metrics metrics collected for the operation (may be null)
 * @param errorMessage error message if the operation failed (null on success)
 * @see OrchestratorState
 */
public record OperationHistoryEntry(
        long operationId,
        String operation,
        Instant timestamp,
        OrchestratorState.Status status,
        OperationMetrics metrics,
        String errorMessage
) {
    public static OperationHistoryEntry success(long operationId, String operation, OperationMetrics metrics) {
        return new OperationHistoryEntry(operationId, operation, Instant.now(),
                OrchestratorState.Status.SUCCESS, metrics, null);
    }

    public static OperationHistoryEntry failure(long operationId, String operation, String errorMessage,
                                                OperationMetrics metrics) {
        return new OperationHistoryEntry(operationId, operation, Instant.now(),
                OrchestratorState.Status.FAILED, metrics, errorMessage);
    }
}
