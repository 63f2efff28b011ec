package orchestrator.config;

import orchestrator.activation.PollingConfig;
import orchestrator.snapshot.ServiceNames;

import java.time.Duration;
import java.util.List;

/**
 * Central configuration of the environment orchestrator.
 *
 * <p>Loaded from {@code orchestrator.properties} or {@code orchestrator.yml}
 * by {@link OrchestratorConfigLoader}, or built directly.
 *
 * @see OrchestratorConfigLoader
 */
public final class OrchestratorConfig {

    public static final String DEFAULT_ENGINE_SERVICE = "ovirt-engine";
    public static final List<String> DEFAULT_HOST_SERVICES = List.of("vdsmd", "supervdsmd");

    public static final OrchestratorConfig DEFAULTS = builder().build();

    private final Duration shortTimeout;
    private final Duration longTimeout;
    private final Duration pollInterval;
    private final int maxBatchSize;
    private final String engineService;
    private final List<String> hostServices;
    private final int historySize;
    private final AlertLevel alertLevel;

    private OrchestratorConfig(Builder b) {
        this.shortTimeout = b.shortTimeout;
        this.longTimeout = b.longTimeout;
        this.pollInterval = b.pollInterval;
        this.maxBatchSize = b.maxBatchSize;
        this.engineService = b.engineService;
        this.hostServices = List.copyOf(b.hostServices);
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Bound for host convergence. */
    public Duration shortTimeout() { return shortTimeout; }

    /** Bound for storage domain convergence. */
    public Duration longTimeout() { return longTimeout; }

    public Duration pollInterval() { return pollInterval; }

    /** Largest accepted job batch, or 0 for no bound. */
    public int maxBatchSize() { return maxBatchSize; }

    /** Management service stopped on the engine while snapshotting. */
    public String engineService() { return engineService; }

    /** Services stopped on each host while snapshotting, in stop order. */
    public List<String> hostServices() { return hostServices; }

    public int historySize() { return historySize; }

    public AlertLevel alertLevel() { return alertLevel; }

    /** The polling bounds as a {@link PollingConfig}. */
    public PollingConfig polling() {
        return PollingConfig.builder()
                .shortTimeout(shortTimeout)
                .longTimeout(longTimeout)
                .pollInterval(pollInterval)
                .build();
    }

    /** The services stopped while snapshotting. */
    public ServiceNames services() {
        return new ServiceNames(engineService, hostServices);
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "shortTimeout=" + shortTimeout.toSeconds() + "s" +
                ", longTimeout=" + longTimeout.toSeconds() + "s" +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", maxBatchSize=" + maxBatchSize +
                ", engineService=" + engineService +
                ", hostServices=" + hostServices +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for {@link OrchestratorConfig}.
     */
    public static final class Builder {
        private Duration shortTimeout = PollingConfig.DEFAULT_SHORT_TIMEOUT;
        private Duration longTimeout = PollingConfig.DEFAULT_LONG_TIMEOUT;
        private Duration pollInterval = PollingConfig.DEFAULT_POLL_INTERVAL;
        private int maxBatchSize = 0;
        private String engineService = DEFAULT_ENGINE_SERVICE;
        private List<String> hostServices = DEFAULT_HOST_SERVICES;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder shortTimeout(Duration timeout) {
            this.shortTimeout = positive(timeout, "shortTimeout");
            return this;
        }

        public Builder shortTimeoutSeconds(long seconds) {
            return shortTimeout(Duration.ofSeconds(seconds));
        }

        public Builder longTimeout(Duration timeout) {
            this.longTimeout = positive(timeout, "longTimeout");
            return this;
        }

        public Builder longTimeoutSeconds(long seconds) {
            return longTimeout(Duration.ofSeconds(seconds));
        }

        public Builder pollInterval(Duration interval) {
            this.pollInterval = positive(interval, "pollInterval");
            return this;
        }

        public Builder pollIntervalMillis(long millis) {
            return pollInterval(Duration.ofMillis(millis));
        }

        public Builder maxBatchSize(int size) {
            if (size < 0) throw new IllegalArgumentException("maxBatchSize must not be negative");
            this.maxBatchSize = size;
            return this;
        }

        public Builder engineService(String service) {
            if (service == null || service.isBlank()) throw new IllegalArgumentException("engineService must not be blank");
            this.engineService = service;
            return this;
        }

        public Builder hostServices(List<String> services) {
            this.hostServices = List.copyOf(services);
            return this;
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(this);
        }

        private static Duration positive(Duration d, String name) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + d);
            }
            return d;
        }
    }
}
