package uncharted.simulation;

import org.junit.jupiter.api.Test;
import uncharted.clock.SystemClock;
import uncharted.codec.JsonCodec;
import uncharted.config.EngineConfig;
import uncharted.repository.SettlementRepository;
import uncharted.repository.StorageSettlementRepository;
import uncharted.settlement.Settlement;
import uncharted.storage.SimulatedStorage;
import uncharted.support.Fixtures;
import uncharted.support.ManualClock;
import uncharted.support.RecordingPublisher;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TickLoopTest {

    private final EngineMetrics metrics = new EngineMetrics();
    private TickOrchestrator orchestrator;

    private static PhaseHandler counting(Phase phase) {
        return new PhaseHandler() {
            @Override
            public Phase phase() {
                return phase;
            }

            @Override
            public void process(Settlement settlement, PhaseContext context) {
                settlement.setResilience(settlement.getResilience() + 1);
            }
        };
    }

    private TickLoop loop(SettlementRepository repository, SystemClock clock, PhaseHandler... handlers) {
        WallClockScheduler scheduler = new WallClockScheduler(EngineConfig.defaults().schedules().values(), clock);
        orchestrator = new TickOrchestrator(EngineConfig.defaults(), repository, List.of(handlers),
            new RecordingPublisher(), metrics, new SeededRandomSource(42L), clock);
        return new TickLoop(scheduler, orchestrator, clock, metrics, 250);
    }

    @Test
    void shouldRunDuePhasesOncePerSecond() {
        // Given
        StorageSettlementRepository repository =
            new StorageSettlementRepository(new SimulatedStorage(new Random(42L)), new JsonCodec());
        repository.save(Fixtures.settlement("s1", 5));
        ManualClock clock = ManualClock.at("2024-05-01T10:00:00Z");
        TickLoop loop = loop(repository, clock, counting(Phase.CONSTRUCTION), counting(Phase.PRODUCTION));

        // When
        TickSummary first = loop.runIteration();
        clock.advance(Duration.ofMillis(250));
        TickSummary repeat = loop.runIteration();
        clock.advance(Duration.ofMillis(750));
        TickSummary next = loop.runIteration();

        // Then
        assertEquals(EnumSet.of(Phase.CONSTRUCTION, Phase.PRODUCTION), first.phases());
        assertNull(repeat);
        assertEquals(EnumSet.of(Phase.CONSTRUCTION), next.phases());
        assertEquals(3, repository.findById("s1").orElseThrow().getResilience());
    }

    @Test
    void shouldCarryPhasesRefusedByBusyPassIntoNextIteration() throws Exception {
        // Given
        StorageSettlementRepository repository =
            new StorageSettlementRepository(new SimulatedStorage(new Random(42L)), new JsonCodec());
        repository.save(Fixtures.settlement("s1", 5));
        ManualClock clock = ManualClock.at("2024-05-01T10:00:00Z");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PhaseHandler blocking = new PhaseHandler() {
            @Override
            public Phase phase() {
                return Phase.PRODUCTION;
            }

            @Override
            public void process(Settlement settlement, PhaseContext context) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        TickLoop loop = loop(repository, clock, counting(Phase.CONSTRUCTION), blocking);
        CompletableFuture<TickSummary> manual = CompletableFuture.supplyAsync(
            () -> orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When
        TickSummary refused = loop.runIteration();
        release.countDown();
        assertTrue(manual.get(5, TimeUnit.SECONDS).ran());
        clock.advance(Duration.ofMillis(250));
        TickSummary retried = loop.runIteration();
        clock.advance(Duration.ofMillis(250));
        TickSummary idle = loop.runIteration();

        // Then
        assertFalse(refused.ran());
        assertTrue(retried.ran());
        assertEquals(EnumSet.of(Phase.CONSTRUCTION, Phase.PRODUCTION), retried.phases());
        assertNull(idle);
        assertEquals(1, repository.findById("s1").orElseThrow().getResilience());
        orchestrator.shutdown();
    }

    @Test
    void shouldFaultWhenPassThrowsUnexpectedly() {
        // Given
        SettlementRepository broken = new SettlementRepository() {
            @Override
            public Optional<Settlement> findById(String settlementId) {
                return Optional.empty();
            }

            @Override
            public void save(Settlement settlement) {
            }

            @Override
            public List<String> listIds() {
                throw new IllegalStateException("index corrupted");
            }

            @Override
            public void delete(String settlementId) {
            }
        };
        ManualClock clock = ManualClock.at("2024-05-01T10:00:00Z");
        TickLoop loop = loop(broken, clock, counting(Phase.CONSTRUCTION));

        // When
        loop.run(new CancellationToken());

        // Then
        assertTrue(loop.faulted());
        assertTrue(metrics.snapshot().faulted());
    }

    @Test
    void shouldStartAndStopLoopThread() throws Exception {
        // Given
        StorageSettlementRepository repository =
            new StorageSettlementRepository(new SimulatedStorage(new Random(42L)), new JsonCodec());
        TickLoop loop = loop(repository, new SystemClock(), counting(Phase.CONSTRUCTION));

        // When
        loop.start();

        // Then
        assertTrue(loop.running());
        assertThrows(IllegalStateException.class, loop::start);

        loop.stop();
        assertFalse(loop.running());
        assertFalse(loop.faulted());
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        // Given
        SystemClock clock = new SystemClock();
        WallClockScheduler scheduler = new WallClockScheduler(EngineConfig.defaults().schedules().values(), clock);
        TickOrchestrator orchestrator = new TickOrchestrator(EngineConfig.defaults(),
            new StorageSettlementRepository(new SimulatedStorage(new Random(42L)), new JsonCodec()),
            List.of(), new RecordingPublisher(), metrics, new SeededRandomSource(42L), clock);

        // When & Then
        try {
            assertThrows(IllegalArgumentException.class, () -> new TickLoop(scheduler, orchestrator, clock, metrics, 0));
        } finally {
            orchestrator.shutdown();
        }
    }
}
