package uncharted.simulation;

import uncharted.clock.SystemClock;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The engine's heartbeat: polls the scheduler every interval on a single thread and hands the
 * due phases to the orchestrator.
 * <p>
 * Iterations are aligned to multiples of the interval. When a pass takes longer than the
 * interval, the missed slots are counted and skipped; the loop resumes at the next slot rather
 * than running the missed ones back to back.
 * <p>
 * Phases the scheduler hands out while the orchestrator refuses the pass (a manual trigger is in
 * flight) are held back and added to the next iteration, so a busy pass never drops a boundary.
 * <p>
 * An unexpected exception escaping a pass faults the loop: it is logged, the fault is exposed
 * through {@link #faulted()} and the metrics, and the loop stops until {@link #start()} is
 * called again.
 */
public class TickLoop {
    private static final Logger logger = Logger.getLogger(TickLoop.class.getName());

    static final long STOP_TIMEOUT_MILLIS = 30_000;

    private final WallClockScheduler scheduler;
    private final TickOrchestrator orchestrator;
    private final SystemClock clock;
    private final EngineMetrics metrics;
    private final long intervalMillis;
    // only touched by the loop thread
    private final Set<Phase> deferred = EnumSet.noneOf(Phase.class);

    private volatile CancellationToken token;
    private volatile Thread thread;
    private volatile boolean faulted = false;

    public TickLoop(WallClockScheduler scheduler, TickOrchestrator orchestrator, SystemClock clock,
                    EngineMetrics metrics, long intervalMillis) {
        if (scheduler == null) {
            throw new IllegalArgumentException("Scheduler cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("Orchestrator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("Metrics cannot be null");
        }
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.metrics = metrics;
        this.intervalMillis = intervalMillis;
    }

    /**
     * Starts the loop thread; clears a previous fault.
     *
     * @throws IllegalStateException if the loop is already running
     */
    public synchronized void start() {
        if (running()) {
            throw new IllegalStateException("Tick loop already running");
        }
        faulted = false;
        metrics.markFaulted(false);
        CancellationToken newToken = new CancellationToken();
        token = newToken;
        thread = new Thread(() -> run(newToken), "tick-loop");
        thread.start();
        logger.info("Tick loop started with " + intervalMillis + "ms interval");
    }

    /**
     * Cancels the loop and waits for the pass in progress to drain, then shuts the worker pool
     * down.
     */
    public void stop() {
        Thread current;
        synchronized (this) {
            current = thread;
            if (token != null) {
                token.cancel();
            }
        }
        if (current != null) {
            try {
                current.join(STOP_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        orchestrator.shutdown();
        logger.info("Tick loop stopped");
    }

    public boolean running() {
        Thread current = thread;
        return current != null && current.isAlive();
    }

    public boolean faulted() {
        return faulted;
    }

    /**
     * Runs a single iteration: asks the scheduler what is due at the current time and runs it.
     * Exposed for tests driving the loop with a manual clock.
     */
    TickSummary runIteration() {
        Set<Phase> due = EnumSet.copyOf(deferred);
        due.addAll(scheduler.duePhases(clock.now()));
        if (due.isEmpty()) {
            return null;
        }
        TickSummary summary = orchestrator.runPhases(due, clock.now());
        if (summary.ran()) {
            deferred.clear();
        } else {
            deferred.addAll(due);
            logger.info("Pass busy; deferring " + due + " to the next iteration");
        }
        return summary;
    }

    void run(CancellationToken token) {
        long nextSlot = alignedSlot(clock.now()) + intervalMillis;
        while (!token.isCancelled()) {
            try {
                runIteration();
            } catch (RuntimeException e) {
                faulted = true;
                metrics.markFaulted(true);
                logger.log(Level.SEVERE, "Tick loop faulted; halting until restarted", e);
                return;
            }

            long now = clock.now();
            if (now > nextSlot) {
                long missed = (now - nextSlot) / intervalMillis;
                if (missed > 0) {
                    metrics.addSlotsOverrun(missed);
                    logger.warning("Pass overran by " + (now - nextSlot) + "ms; skipping " + missed + " slot(s)");
                }
                nextSlot = alignedSlot(now) + intervalMillis;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(Math.max(0, nextSlot - clock.now()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Tick loop interrupted; stopping");
                break;
            }
            nextSlot += intervalMillis;
        }
        logger.fine("Tick loop exited");
    }

    private long alignedSlot(long epochMillis) {
        return epochMillis - Math.floorMod(epochMillis, intervalMillis);
    }
}
