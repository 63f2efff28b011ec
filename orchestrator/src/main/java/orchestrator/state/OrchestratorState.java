package orchestrator.state;

import orchestrator.metrics.OperationMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe tracker of the operations run by one orchestrator.
 *
 * <p>Maintains:
 * <ul>
 *   <li>Current operation status ({@link Status}) and name</li>
 *   <li>The last known {@link EnvironmentStatus}</li>
 *   <li>A bounded history of recent operations, most recent first</li>
 *   <li>Error information if the last operation failed</li>
 * </ul>
 *
 * <p>Each orchestrator owns its own instance; there is no JVM-wide state.
 */
public final class OrchestratorState {

    /**
     * Operation execution status.
     */
    public enum Status {
        /** No operation has run yet (or since reset) */
        IDLE,
        IN_PROGRESS,
        SUCCESS,
        FAILED
    }

    private static final int DEFAULT_HISTORY_SIZE = 10;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<OperationHistoryEntry> history = new ArrayList<>();

    private volatile int maxHistorySize = DEFAULT_HISTORY_SIZE;
    private volatile Status status = Status.IDLE;
    private volatile EnvironmentStatus environmentStatus = EnvironmentStatus.UNKNOWN;
    private volatile long currentOperationId;
    private volatile String currentOperation;
    private volatile Instant startTime;
    private volatile OperationMetrics lastMetrics;
    private volatile String lastError;

    public OrchestratorState() {}

    public OrchestratorState(int maxHistorySize) {
        setMaxHistorySize(maxHistorySize);
    }

    public void operationStarted(long operationId, String operation) {
        lock.writeLock().lock();
        try {
            this.status = Status.IN_PROGRESS;
            this.currentOperationId = operationId;
            this.currentOperation = operation;
            this.startTime = Instant.now();
            this.lastError = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void operationCompleted(OperationMetrics metrics) {
        lock.writeLock().lock();
        try {
            this.status = Status.SUCCESS;
            this.lastMetrics = metrics;
            this.lastError = null;
            addToHistory(OperationHistoryEntry.success(currentOperationId, currentOperation, metrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void operationFailed(Throwable error, OperationMetrics partialMetrics) {
        lock.writeLock().lock();
        try {
            this.status = Status.FAILED;
            this.lastError = error != null ? error.getMessage() : "Unknown error";
            this.lastMetrics = partialMetrics;
            addToHistory(OperationHistoryEntry.failure(currentOperationId, currentOperation, lastError, partialMetrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setEnvironmentStatus(EnvironmentStatus environmentStatus) {
        this.environmentStatus = environmentStatus;
    }

    private void addToHistory(OperationHistoryEntry entry) {
        history.add(0, entry);
        while (history.size() > maxHistorySize) {
            history.remove(history.size() - 1);
        }
    }

    /**
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxHistorySize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxHistorySize = size;
            while (history.size() > maxHistorySize) {
                history.remove(history.size() - 1);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public Status getStatus() {
        return status;
    }

    public EnvironmentStatus getEnvironmentStatus() {
        return environmentStatus;
    }

    public long getCurrentOperationId() {
        return currentOperationId;
    }

    public String getCurrentOperation() {
        return currentOperation;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public OperationMetrics getLastMetrics() {
        return lastMetrics;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Get an unmodifiable copy of the history (most recent first).
     */
    public List<OperationHistoryEntry> getHistory() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Convert the current state to a Map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("status", status.name());
            map.put("environment", environmentStatus.name());
            map.put("currentOperationId", currentOperationId);
            map.put("currentOperation", currentOperation);
            map.put("startTime", startTime != null ? startTime.toString() : null);
            map.put("lastError", lastError);
            if (lastMetrics != null) {
                map.put("lastOperation", lastMetrics.toMap());
            }
            return map;
        } finally {
            lock.readLock().unlock();
        }
    }
}
