package orchestrator.snapshot;

/**
 * Default listener used when the caller doesn't supply one.
 */
public enum NoopTransactionListener implements TransactionListener {
    INSTANCE;

    @Override
    public void onPhaseChange(String snapshot, SnapshotPhase from, SnapshotPhase to) { /* no-op */ }
}
