package uncharted.simulation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uncharted.codec.JsonCodec;
import uncharted.catalog.GameCatalog;
import uncharted.config.EngineConfig;
import uncharted.economy.ConsumptionCalculator;
import uncharted.economy.ProductionCalculator;
import uncharted.economy.StorageCapacityCalculator;
import uncharted.economy.StorageLedger;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.population.StaffingPlanner;
import uncharted.repository.StorageSettlementRepository;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.storage.BytesKey;
import uncharted.storage.SimulatedStorage;
import uncharted.storage.VersionedValue;
import uncharted.support.Fixtures;
import uncharted.support.ManualClock;
import uncharted.support.RecordingPublisher;
import uncharted.world.StorageTerrainService;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class TickOrchestratorTest {

    private SimulatedStorage storage;
    private StorageSettlementRepository repository;
    private RecordingPublisher publisher;
    private EngineMetrics metrics;
    private ManualClock clock;
    private TickOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        storage = new SimulatedStorage(new Random(42L));
        repository = new StorageSettlementRepository(storage, new JsonCodec());
        publisher = new RecordingPublisher();
        metrics = new EngineMetrics();
        clock = ManualClock.at("2024-05-01T10:00:00Z");
        repository.save(Fixtures.settlement("s1", 5));
        repository.save(Fixtures.settlement("s2", 5));
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private TickOrchestrator orchestrator(PhaseHandler... handlers) {
        orchestrator = new TickOrchestrator(EngineConfig.defaults(), repository, List.of(handlers), publisher,
            metrics, new SeededRandomSource(42L), clock);
        return orchestrator;
    }

    private static PhaseHandler handler(Phase phase, BiConsumer<Settlement, PhaseContext> work) {
        return handler(phase, s -> true, work);
    }

    private static PhaseHandler handler(Phase phase, Predicate<Settlement> appliesTo,
                                        BiConsumer<Settlement, PhaseContext> work) {
        return new PhaseHandler() {
            @Override
            public Phase phase() {
                return phase;
            }

            @Override
            public boolean appliesTo(Settlement settlement) {
                return appliesTo.test(settlement);
            }

            @Override
            public void process(Settlement settlement, PhaseContext context) {
                work.accept(settlement, context);
            }
        };
    }

    private static void bumpResilience(Settlement settlement, PhaseContext context) {
        settlement.setResilience(settlement.getResilience() + 1);
        context.emit(EngineEvent.builder(EventType.RESOURCE_TICK, settlement.getId(), context.now()).build());
        context.recordWaste(ResourceType.FOOD, 2.5);
    }

    @Test
    void shouldProcessEverySettlementThenPublish() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());

        // Then
        assertTrue(summary.ran());
        assertEquals(EnumSet.of(Phase.PRODUCTION), summary.phases());
        assertEquals(2, summary.processed());
        assertEquals(2, summary.events());
        assertEquals(5.0, summary.totalWaste(), 1e-9);
        assertEquals(1, repository.findById("s1").orElseThrow().getResilience());
        assertEquals(1, repository.findById("s2").orElseThrow().getResilience());
        assertEquals(2, publisher.events().size());
        assertEquals(1, metrics.snapshot().passesRun());
        assertEquals(2, metrics.snapshot().eventsPublished());
    }

    @Test
    void shouldSkipMalformedSettlementWithoutAffectingOthers() {
        // Given
        storage.set(BytesKey.of("settlement:broken").bytes(),
            new VersionedValue("{\"id\":".getBytes(StandardCharsets.UTF_8), 1L));
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());

        // Then
        assertEquals(2, summary.processed());
        assertEquals(1, summary.skipped());
        assertEquals(0, summary.failed());
        assertEquals(1, repository.findById("s1").orElseThrow().getResilience());
        assertTrue(publisher.events().stream().noneMatch(e -> e.settlementId().equals("broken")));
    }

    @Test
    void shouldKeepStoredStateAndDropEventsWhenSaveFails() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));
        storage.setWriteFailureProbability(1.0);

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());

        // Then
        assertEquals(2, summary.failed());
        assertTrue(publisher.events().isEmpty());
        assertEquals(0, repository.findById("s1").orElseThrow().getResilience());
        assertEquals(1, repository.findById("s1").orElseThrow().getVersion());
    }

    @Test
    void shouldFailSettlementWhenTerrainStoreFaults() {
        // Given
        Settlement farming = repository.findById("s1").orElseThrow();
        farming.addStructure(Fixtures.structure("farm-1", "FARM"));
        repository.save(farming);
        SimulatedStorage terrainStore = new SimulatedStorage(new Random(42L));
        terrainStore.setReadFailureProbability(1.0);
        GameCatalog catalog = Fixtures.catalog();
        orchestrator(new ProductionPhaseHandler(new StorageCapacityCalculator(catalog),
            new ProductionCalculator(catalog, new StorageTerrainService(terrainStore, new JsonCodec())),
            new ConsumptionCalculator(catalog), new StaffingPlanner(catalog), new StorageLedger(), 0.9));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());

        // Then
        assertEquals(1, summary.failed());
        assertEquals(1, summary.processed());
        Settlement stored = repository.findById("s1").orElseThrow();
        assertEquals(2, stored.getVersion());
        assertEquals(0.0, stored.stock(ResourceType.FOOD).amount(), 1e-9);
        assertTrue(publisher.events().stream().noneMatch(e -> e.settlementId().equals("s1")));
    }

    @Test
    void shouldIsolateHandlerFailure() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, (settlement, context) -> {
            if (settlement.getId().equals("s1")) {
                throw new IllegalStateException("bad data");
            }
            bumpResilience(settlement, context);
        }));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());

        // Then
        assertEquals(1, summary.processed());
        assertEquals(1, summary.failed());
        assertEquals(1, repository.findById("s2").orElseThrow().getResilience());
        assertEquals(0, repository.findById("s1").orElseThrow().getResilience());
    }

    @Test
    void shouldNotSaveSettlementsTheHandlerDoesNotApplyTo() {
        // Given
        orchestrator(handler(Phase.CONSTRUCTION, s -> s.getId().equals("s2"),
            TickOrchestratorTest::bumpResilience));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.CONSTRUCTION), clock.now());

        // Then
        assertEquals(2, summary.processed());
        assertEquals(1, repository.findById("s1").orElseThrow().getVersion());
        assertEquals(2, repository.findById("s2").orElseThrow().getVersion());
    }

    @Test
    void shouldRunPhasesInOrder() {
        // Given
        List<Phase> order = Collections.synchronizedList(new ArrayList<>());
        orchestrator(
            handler(Phase.POPULATION, (s, c) -> order.add(Phase.POPULATION)),
            handler(Phase.PRODUCTION, (s, c) -> order.add(Phase.PRODUCTION)),
            handler(Phase.DISASTER_CHECK, (s, c) -> order.add(Phase.DISASTER_CHECK)));

        // When
        orchestrator.runPhases(EnumSet.of(Phase.DISASTER_CHECK, Phase.POPULATION, Phase.PRODUCTION), clock.now());

        // Then
        assertEquals(List.of(Phase.PRODUCTION, Phase.PRODUCTION, Phase.POPULATION, Phase.POPULATION,
            Phase.DISASTER_CHECK, Phase.DISASTER_CHECK), order);
    }

    @Test
    void shouldIgnorePhasesWithoutHandler() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION, Phase.PASSIVE_REPAIR), clock.now());

        // Then
        assertEquals(EnumSet.of(Phase.PRODUCTION), summary.phases());
    }

    @Test
    void shouldRefuseOverlappingPass() throws Exception {
        // Given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator(handler(Phase.PRODUCTION, (settlement, context) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        CompletableFuture<TickSummary> first = CompletableFuture.supplyAsync(
            () -> orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When
        TickSummary second = orchestrator.runPhases(EnumSet.of(Phase.PRODUCTION), clock.now());
        String manual = orchestrator.triggerOnce();

        // Then
        assertTrue(orchestrator.inFlight());
        assertFalse(second.ran());
        assertEquals("BUSY", manual);
        assertEquals(2, metrics.snapshot().passesSkipped());

        release.countDown();
        assertTrue(first.get(5, TimeUnit.SECONDS).ran());
        assertFalse(orchestrator.inFlight());
    }

    @Test
    void shouldReportOkForManualTrigger() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));

        // When
        String result = orchestrator.triggerOnce(EnumSet.of(Phase.PRODUCTION));

        // Then
        assertTrue(result.startsWith("OK "), result);
        assertTrue(result.contains("processed=2"), result);
    }

    @Test
    void shouldReturnEmptySummaryForNoPhases() {
        // Given
        orchestrator(handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience));

        // When
        TickSummary summary = orchestrator.runPhases(EnumSet.noneOf(Phase.class), clock.now());

        // Then
        assertTrue(summary.ran());
        assertEquals(0, summary.processed());
        assertEquals(0, metrics.snapshot().passesRun());
    }

    @Test
    void shouldRejectTwoHandlersForOnePhase() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> orchestrator(
            handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience),
            handler(Phase.PRODUCTION, TickOrchestratorTest::bumpResilience)));
    }
}
