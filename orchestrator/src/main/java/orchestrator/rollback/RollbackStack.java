package orchestrator.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * LIFO registry of compensating actions for a multi-step operation.
 *
 * <p>A caller opens a stack at the start of the forward operation and pushes an
 * undo step right after each forward step succeeds. On failure it calls
 * {@link #unwind()}; on success {@link #discard()}. Used with
 * try-with-resources, {@link #close()} unwinds automatically when the block is
 * left without an explicit discard:
 *
 * <pre>
 * try (RollbackStack rollback = new RollbackStack("snapshot")) {
 *     stopEngine();
 *     rollback.push("start engine", this::startEngine);
 *     capture();
 *     rollback.discard();
 * }
 * </pre>
 *
 * <p>A stack is owned by a single operation and is not thread-safe. Steps are
 * run exactly once, newest first. A failing step is logged and recorded, and
 * the remaining steps still run.
 */
public final class RollbackStack implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RollbackStack.class);

    private final String owner;
    private final Deque<Entry> steps = new ArrayDeque<>();
    private boolean closed;
    private List<UndoFailure> lastFailures = List.of();

    private record Entry(String description, UndoStep action) {}

    public RollbackStack(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Registers an undo step.
     *
     * @param description short description used in logs and failure reports
     * @param undo the compensating action
     * @throws IllegalStateException if the stack was already unwound or discarded
     */
    public void push(String description, UndoStep undo) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(undo, "undo");
        if (closed) {
            throw new IllegalStateException("Rollback stack '" + owner + "' is already closed");
        }
        steps.push(new Entry(description, undo));
    }

    /**
     * Runs every registered step once, last registered first.
     *
     * <p>Calling it again after the stack is closed is a no-op returning an
     * empty list.
     *
     * @return the steps that failed, in the order they were run
     */
    public List<UndoFailure> unwind() {
        if (closed) return List.of();
        closed = true;

        if (!steps.isEmpty()) {
            log.info("Unwinding {} undo step(s) of '{}'", steps.size(), owner);
        }

        List<UndoFailure> failures = new ArrayList<>();
        while (!steps.isEmpty()) {
            Entry entry = steps.pop();
            try {
                log.debug("Undo '{}' ({})", entry.description(), owner);
                entry.action().run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(fail(entry, e));
            } catch (Throwable t) {
                // errors too: the remaining steps must still run
                failures.add(fail(entry, t));
            }
        }
        lastFailures = Collections.unmodifiableList(failures);
        return lastFailures;
    }

    /**
     * Drops every registered step without running it.
     */
    public void discard() {
        if (closed) return;
        closed = true;
        if (!steps.isEmpty()) {
            log.debug("Discarding {} undo step(s) of '{}'", steps.size(), owner);
        }
        steps.clear();
    }

    /**
     * Unwinds the stack if it was neither unwound nor discarded.
     */
    @Override
    public void close() {
        if (!closed) {
            unwind();
        }
    }

    /** Number of steps currently registered. */
    public int size() {
        return steps.size();
    }

    /** True once the stack was unwound or discarded. */
    public boolean isClosed() {
        return closed;
    }

    /** Failures reported by the last {@link #unwind()}, empty if none. */
    public List<UndoFailure> failures() {
        return lastFailures;
    }

    private UndoFailure fail(Entry entry, Throwable t) {
        log.warn("Undo step '{}' of '{}' failed, continuing", entry.description(), owner, t);
        return new UndoFailure(entry.description(), t);
    }
}
