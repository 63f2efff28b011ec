package orchestrator.snapshot;

/**
 * Receives the phase changes of snapshot transactions.
 *
 * <p>Called synchronously on the thread running the transaction. A listener
 * that throws does not affect the transaction; the exception is logged.
 *
 * @see NoopTransactionListener
 */
public interface TransactionListener {

    /**
     * @param snapshot name of the snapshot being taken
     * @param from the phase being left
     * @param to the phase being entered
     */
    void onPhaseChange(String snapshot, SnapshotPhase from, SnapshotPhase to);
}
