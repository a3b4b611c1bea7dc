package uncharted.simulation;

import uncharted.clock.SystemClock;
import uncharted.config.EngineConfig;
import uncharted.events.EngineEvent;
import uncharted.events.EventPublisher;
import uncharted.repository.PersistenceException;
import uncharted.repository.SettlementRepository;
import uncharted.repository.ValidationException;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs due phases over every settlement.
 * <p>
 * Phases run one after another in {@link Phase} order; within a phase, settlements are processed
 * in parallel on a bounded worker pool. Each settlement goes through its own isolated
 * load, validate, process, save, publish sequence:
 * <ul>
 *   <li>a malformed settlement is skipped and logged</li>
 *   <li>a failed save leaves the stored settlement as it was and drops its events; the next due
 *       occurrence of the phase tries again</li>
 *   <li>any other failure is logged and counted; other settlements are unaffected</li>
 * </ul>
 * Only one pass runs at a time. A pass requested while another is in flight is refused, not
 * queued.
 */
public class TickOrchestrator {
    private static final Logger logger = Logger.getLogger(TickOrchestrator.class.getName());

    static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private enum Status { PROCESSED, SKIPPED, FAILED }

    private record Outcome(Status status, Map<ResourceType, Double> waste, int events) {
        static Outcome of(Status status) {
            return new Outcome(status, Map.of(), 0);
        }
    }

    private final SettlementRepository repository;
    private final Map<Phase, PhaseHandler> handlers = new EnumMap<>(Phase.class);
    private final EventPublisher publisher;
    private final EngineMetrics metrics;
    private final RandomSource randomSource;
    private final EngineConfig config;
    private final SystemClock clock;
    private final ExecutorService workers;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public TickOrchestrator(EngineConfig config,
                            SettlementRepository repository,
                            Collection<PhaseHandler> handlers,
                            EventPublisher publisher,
                            EngineMetrics metrics,
                            RandomSource randomSource,
                            SystemClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("Repository cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("Handlers cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("Publisher cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("Metrics cannot be null");
        }
        if (randomSource == null) {
            throw new IllegalArgumentException("Random source cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        for (PhaseHandler handler : handlers) {
            if (this.handlers.put(handler.phase(), handler) != null) {
                throw new IllegalArgumentException("Two handlers registered for " + handler.phase());
            }
        }
        this.config = config;
        this.repository = repository;
        this.publisher = publisher;
        this.metrics = metrics;
        this.randomSource = randomSource;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
    }

    /**
     * Runs the given phases, in phase order, at {@code now}.
     *
     * @return the pass summary, or {@link TickSummary#busy()} if a pass is already running
     */
    public TickSummary runPhases(Set<Phase> phases, long now) {
        if (phases.isEmpty()) {
            return new TickSummary(true, phases, 0, 0, 0, Map.of(), 0, Duration.ZERO);
        }
        if (!inFlight.compareAndSet(false, true)) {
            logger.warning("Pass for " + phases + " refused: previous pass still in flight");
            metrics.incrementPassesSkipped();
            return TickSummary.busy();
        }
        try {
            long startNanos = clock.nanoTime();
            int processed = 0;
            int skipped = 0;
            int failed = 0;
            int events = 0;
            Map<ResourceType, Double> waste = new EnumMap<>(ResourceType.class);
            Set<Phase> ran = EnumSet.noneOf(Phase.class);

            for (Phase phase : Phase.values()) {
                if (!phases.contains(phase)) {
                    continue;
                }
                PhaseHandler handler = handlers.get(phase);
                if (handler == null) {
                    logger.fine("No handler registered for " + phase);
                    continue;
                }
                List<Outcome> outcomes = runPhase(handler, now);
                ran.add(phase);
                for (Outcome outcome : outcomes) {
                    switch (outcome.status()) {
                        case PROCESSED -> processed++;
                        case SKIPPED -> skipped++;
                        case FAILED -> failed++;
                    }
                    events += outcome.events();
                    outcome.waste().forEach((resource, amount) -> waste.merge(resource, amount, Double::sum));
                }
            }

            Duration elapsed = Duration.ofNanos(clock.nanoTime() - startNanos);
            TickSummary summary = new TickSummary(true, ran, processed, skipped, failed, waste, events, elapsed);
            metrics.recordPass(summary);
            if (failed > 0 || skipped > 0) {
                logger.warning("Pass finished with problems: " + summary);
            } else {
                logger.fine("Pass finished: " + summary);
            }
            return summary;
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * Manual single-shot trigger of the given phases at the current time.
     *
     * @return "OK" followed by the summary, or "BUSY" if a pass is in flight
     */
    public String triggerOnce(Set<Phase> phases) {
        TickSummary summary = runPhases(phases, clock.now());
        if (!summary.ran()) {
            return "BUSY";
        }
        return "OK " + summary;
    }

    public String triggerOnce() {
        return triggerOnce(EnumSet.allOf(Phase.class));
    }

    public boolean inFlight() {
        return inFlight.get();
    }

    /**
     * Stops accepting work and waits for running settlements to finish.
     */
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warning("Workers did not finish within " + SHUTDOWN_TIMEOUT_SECONDS + "s; forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<Outcome> runPhase(PhaseHandler handler, long now) {
        List<String> ids;
        try {
            ids = repository.listIds();
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Cannot list settlements for " + handler.phase() + "; phase skipped", e);
            return List.of();
        }
        List<Callable<Outcome>> tasks = new ArrayList<>(ids.size());
        for (String id : ids) {
            tasks.add(() -> processSettlement(handler, id, now));
        }

        List<Outcome> outcomes = new ArrayList<>(ids.size());
        try {
            for (Future<Outcome> future : workers.invokeAll(tasks)) {
                try {
                    outcomes.add(future.get());
                } catch (ExecutionException e) {
                    logger.log(Level.SEVERE, "Settlement task for " + handler.phase() + " died", e.getCause());
                    outcomes.add(Outcome.of(Status.FAILED));
                }
            }
        } catch (InterruptedException e) {
            logger.warning("Interrupted while running " + handler.phase());
            Thread.currentThread().interrupt();
        }
        return outcomes;
    }

    private Outcome processSettlement(PhaseHandler handler, String settlementId, long now) {
        try {
            Optional<Settlement> loaded = repository.findById(settlementId);
            if (loaded.isEmpty()) {
                logger.fine("Settlement " + settlementId + " disappeared before " + handler.phase());
                return Outcome.of(Status.SKIPPED);
            }
            Settlement settlement = loaded.get();
            if (!handler.appliesTo(settlement)) {
                return Outcome.of(Status.PROCESSED);
            }

            PhaseContext context = new PhaseContext(now, config.schedule(handler.phase()),
                randomSource.forSettlement(settlementId, Math.floorDiv(now, 1000L)));
            handler.process(settlement, context);
            repository.save(settlement);
            publish(settlementId, context.events());
            return new Outcome(Status.PROCESSED, context.waste(), context.events().size());
        } catch (ValidationException e) {
            logger.warning("Skipping settlement " + settlementId + " in " + handler.phase() + ": " + e.getMessage());
            return Outcome.of(Status.SKIPPED);
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Settlement " + settlementId + " not saved in " + handler.phase()
                + "; will retry on the next occurrence", e);
            return Outcome.of(Status.FAILED);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Settlement " + settlementId + " failed in " + handler.phase(), e);
            return Outcome.of(Status.FAILED);
        }
    }

    private void publish(String settlementId, List<EngineEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        try {
            publisher.publishAll(events);
            metrics.addEventsPublished(events.size());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Publishing events of settlement " + settlementId + " failed", e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tick-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
