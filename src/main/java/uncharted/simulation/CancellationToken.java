package uncharted.simulation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way stop signal owned by a {@link TickLoop}.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
