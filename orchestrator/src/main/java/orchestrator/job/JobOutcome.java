package orchestrator.job;

/**
 * Immutable outcome of a single job of a batch.
 *
 * <p>Use the static factory methods {@link #ok(int, String)} and
 * {@link #fail(int, String, Throwable)} to create instances.
 *
 * @see BatchResult
 */
public final class JobOutcome {

    private final int index;
    private final String name;
    private final boolean ok;
    private final Throwable error;

    private JobOutcome(int index, String name, boolean ok, Throwable error) {
        this.index = index;
        this.name = name;
        this.ok = ok;
        this.error = error;
    }

    public static JobOutcome ok(int index, String name) {
        return new JobOutcome(index, name, true, null);
    }

    public static JobOutcome fail(int index, String name, Throwable error) {
        return new JobOutcome(index, name, false, error);
    }

    /** Position of the job within its batch. */
    public int index() { return index; }

    /** Display name of the job. */
    public String name() { return name; }

    /** Returns true if the job completed normally. */
    public boolean isOk() { return ok; }

    /** The exception the job threw, or null if it succeeded. */
    public Throwable error() { return error; }

    /** The failure message, or null if the job succeeded. */
    public String message() {
        if (ok) return null;
        if (error == null) return "unknown error";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    @Override
    public String toString() {
        return ok ? name + " ok" : name + " failed: " + message();
    }
}
