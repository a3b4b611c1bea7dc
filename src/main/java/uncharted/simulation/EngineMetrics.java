package uncharted.simulation;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Thread-safe engine counters that can be snapshotted.
 */
public final class EngineMetrics {
    private final AtomicLong passesRun = new AtomicLong();
    private final AtomicLong passesSkipped = new AtomicLong();
    private final AtomicLong slotsOverrun = new AtomicLong();
    private final AtomicLong settlementsProcessed = new AtomicLong();
    private final AtomicLong settlementsSkipped = new AtomicLong();
    private final AtomicLong settlementsFailed = new AtomicLong();
    private final AtomicLong eventsPublished = new AtomicLong();
    private final DoubleAdder wasteTotal = new DoubleAdder();
    private final AtomicBoolean faulted = new AtomicBoolean();

    /**
     * Immutable snapshot of the engine counters.
     */
    public record Snapshot(long passesRun, long passesSkipped, long slotsOverrun,
                           long settlementsProcessed, long settlementsSkipped, long settlementsFailed,
                           long eventsPublished, double wasteTotal, boolean faulted) {
    }

    public void recordPass(TickSummary summary) {
        passesRun.incrementAndGet();
        settlementsProcessed.addAndGet(summary.processed());
        settlementsSkipped.addAndGet(summary.skipped());
        settlementsFailed.addAndGet(summary.failed());
        wasteTotal.add(summary.totalWaste());
    }

    public void incrementPassesSkipped() {
        passesSkipped.incrementAndGet();
    }

    public void addSlotsOverrun(long slots) {
        slotsOverrun.addAndGet(slots);
    }

    public void addEventsPublished(long count) {
        eventsPublished.addAndGet(count);
    }

    public void markFaulted(boolean value) {
        faulted.set(value);
    }

    public Snapshot snapshot() {
        return new Snapshot(
            passesRun.get(),
            passesSkipped.get(),
            slotsOverrun.get(),
            settlementsProcessed.get(),
            settlementsSkipped.get(),
            settlementsFailed.get(),
            eventsPublished.get(),
            wasteTotal.sum(),
            faulted.get()
        );
    }

    /**
     * Resets all counters to zero. Useful for testing.
     */
    public void reset() {
        passesRun.set(0);
        passesSkipped.set(0);
        slotsOverrun.set(0);
        settlementsProcessed.set(0);
        settlementsSkipped.set(0);
        settlementsFailed.set(0);
        eventsPublished.set(0);
        wasteTotal.reset();
        faulted.set(false);
    }
}
