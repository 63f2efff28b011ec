package orchestrator.activation;

import orchestrator.alert.LifecycleAlertLogger;
import orchestrator.exceptions.ConvergenceTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Repeatedly evaluates a condition until it holds or a bound elapses.
 *
 * <p>The condition is evaluated at least once, even with an already elapsed
 * bound. Exceptions thrown by the condition propagate unchanged; only the
 * elapsed bound is turned into a {@link ConvergenceTimeoutException}.
 */
public final class ConvergencePoller {

    private static final Logger log = LoggerFactory.getLogger(ConvergencePoller.class);

    /**
     * Pause between two evaluations.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    public ConvergencePoller(Duration interval) {
        this(interval, System::nanoTime, d -> Thread.sleep(d.toMillis()));
    }

    public ConvergencePoller(Duration interval, LongSupplier nanoClock, Sleeper sleeper) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Waits until {@code condition} returns true.
     *
     * @param what description of the condition, used in logs and the exception
     * @param timeout the bound
     * @param condition the condition to evaluate
     * @throws ConvergenceTimeoutException if the bound elapses first, or the
     *         waiting thread is interrupted
     */
    public void await(String what, Duration timeout, BooleanSupplier condition) {
        Objects.requireNonNull(timeout, "timeout");
        long deadline = nanoClock.getAsLong() + timeout.toNanos();
        int attempts = 0;

        while (true) {
            attempts++;
            if (condition.getAsBoolean()) {
                log.debug("'{}' reached after {} attempt(s)", what, attempts);
                return;
            }

            long remaining = deadline - nanoClock.getAsLong();
            if (remaining <= 0) {
                LifecycleAlertLogger.convergenceTimeout(what, timeout.toMillis(), attempts);
                throw new ConvergenceTimeoutException(what, timeout);
            }

            try {
                sleeper.sleep(Duration.ofNanos(Math.min(interval.toNanos(), remaining)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConvergenceTimeoutException(what, timeout, e);
            }
        }
    }
}
