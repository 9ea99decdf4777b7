package work.agentflow.engine.runtime;

/**
 * Cooperative cancellation flag shared by one run. Checked between steps, iterations and polls; it
 * never interrupts a running process.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
