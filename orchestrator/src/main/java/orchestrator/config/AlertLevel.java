package orchestrator.config;

/**
 * Alert level for lifecycle event logging.
 *
 * <p>Controls the minimum severity of events logged by
 * {@link orchestrator.alert.LifecycleAlertLogger}. Configured through
 * {@code orchestrator.alert.level}.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: started, phases, completed, warnings, errors</li>
 *   <li>{@link #WARNING} - rollbacks and errors (default)</li>
 *   <li>{@link #ERROR} - errors only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
