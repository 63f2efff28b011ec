package orchestrator.activation;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds used when polling the management API for state convergence.
 *
 * <ul>
 *   <li>short timeout: host state changes</li>
 *   <li>long timeout: storage domain state changes</li>
 *   <li>poll interval: pause between two reads</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>
 * PollingConfig config = PollingConfig.builder()
 *     .shortTimeoutSeconds(180)
 *     .longTimeoutSeconds(600)
 *     .pollInterval(Duration.ofSeconds(3))
 *     .build();
 * </pre>
 */
public final class PollingConfig {

    public static final Duration DEFAULT_SHORT_TIMEOUT = Duration.ofMinutes(3);
    public static final Duration DEFAULT_LONG_TIMEOUT = Duration.ofMinutes(10);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(3);

    public static final PollingConfig DEFAULTS = builder().build();

    private final Duration shortTimeout;
    private final Duration longTimeout;
    private final Duration pollInterval;

    private PollingConfig(Duration shortTimeout, Duration longTimeout, Duration pollInterval) {
        this.shortTimeout = shortTimeout;
        this.longTimeout = longTimeout;
        this.pollInterval = pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Bound for host convergence. */
    public Duration shortTimeout() {
        return shortTimeout;
    }

    /** Bound for storage domain convergence. */
    public Duration longTimeout() {
        return longTimeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public String toString() {
        return "PollingConfig{" +
                "short=" + shortTimeout.toMillis() + "ms" +
                ", long=" + longTimeout.toMillis() + "ms" +
                ", interval=" + pollInterval.toMillis() + "ms" +
                '}';
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
        return d;
    }

    /**
     * Builder for {@link PollingConfig}.
     */
    public static final class Builder {
        private Duration shortTimeout = DEFAULT_SHORT_TIMEOUT;
        private Duration longTimeout = DEFAULT_LONG_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        private Builder() {}

        public Builder shortTimeout(Duration timeout) {
            this.shortTimeout = requirePositive(timeout, "shortTimeout");
            return this;
        }

        public Builder shortTimeoutSeconds(long seconds) {
            return shortTimeout(Duration.ofSeconds(seconds));
        }

        public Builder longTimeout(Duration timeout) {
            this.longTimeout = requirePositive(timeout, "longTimeout");
            return this;
        }

        public Builder longTimeoutSeconds(long seconds) {
            return longTimeout(Duration.ofSeconds(seconds));
        }

        public Builder pollInterval(Duration interval) {
            this.pollInterval = requirePositive(interval, "pollInterval");
            return this;
        }

        public PollingConfig build() {
            return new PollingConfig(shortTimeout, longTimeout, pollInterval);
        }
    }
}
