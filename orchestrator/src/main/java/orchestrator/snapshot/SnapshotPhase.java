package orchestrator.snapshot;

/**
 * Phases of a {@link SnapshotTransaction}.
 *
 * <pre>
 * RUNNING -&gt; QUIESCING -&gt; CAPTURED              (captured, environment left quiesced)
 * RUNNING -&gt; QUIESCING -&gt; CAPTURED -&gt; RUNNING   (captured, restore requested)
 * RUNNING -&gt; QUIESCING -&gt; RESTORING -&gt; RUNNING  (failure, quiesce steps reversed)
 * </pre>
 *
 * A transaction whose reversal itself failed stays in {@link #RESTORING}.
 */
public enum SnapshotPhase {
    RUNNING,
    QUIESCING,
    CAPTURED,
    RESTORING
}
