package orchestrator.exceptions;

import java.time.Duration;

/**
 * Exception thrown when an observed state is not reached within its polling bound.
 *
 * <p>Examples are a storage domain that never reports {@code ACTIVE} or a host
 * that never reaches {@code MAINTENANCE}. A convergence timeout is always fatal
 * for the operation that was polling.
 *
 * <p>This is an unchecked exception so that polling can be used inside
 * lambdas and undo steps without changing their signatures.
 *
 * @see orchestrator.activation.ConvergencePoller
 */
public class ConvergenceTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation description of the awaited condition
     * @param timeout the bound that was exceeded
     */
    public ConvergenceTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation description of the awaited condition
     * @param timeout the bound that was exceeded
     * @param cause the underlying cause (typically InterruptedException)
     */
    public ConvergenceTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the description of the awaited condition.
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the bound that was exceeded.
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Condition '%s' not reached within %d ms", operation, timeout.toMillis());
    }
}
