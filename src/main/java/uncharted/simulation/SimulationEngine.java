package uncharted.simulation;

import uncharted.catalog.GameCatalog;
import uncharted.clock.SystemClock;
import uncharted.config.EngineConfig;
import uncharted.construction.ConstructionQueue;
import uncharted.disaster.DamageCalculator;
import uncharted.disaster.DisasterDirector;
import uncharted.disaster.PreparednessCalculator;
import uncharted.economy.ConsumptionCalculator;
import uncharted.economy.ProductionCalculator;
import uncharted.economy.StorageCapacityCalculator;
import uncharted.economy.StorageLedger;
import uncharted.events.EventPublisher;
import uncharted.population.HappinessCalculator;
import uncharted.population.PopulationModel;
import uncharted.population.StaffingPlanner;
import uncharted.repair.PassiveRepair;
import uncharted.repository.SettlementRepository;
import uncharted.world.TerrainService;

import java.util.List;

/**
 * Wires the domain services, phase handlers, scheduler, orchestrator and loop together.
 */
public final class SimulationEngine {

    private final EngineConfig config;
    private final ConstructionQueue constructionQueue;
    private final DisasterDirector disasterDirector;
    private final PopulationModel populationModel;
    private final EngineMetrics metrics;
    private final WallClockScheduler scheduler;
    private final TickOrchestrator orchestrator;
    private final TickLoop loop;

    public SimulationEngine(EngineConfig config,
                            GameCatalog catalog,
                            TerrainService terrain,
                            SettlementRepository repository,
                            EventPublisher publisher,
                            SystemClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.config = config;

        PreparednessCalculator preparedness = new PreparednessCalculator(catalog);
        this.constructionQueue = new ConstructionQueue(catalog, config);
        this.disasterDirector = new DisasterDirector(catalog, terrain, new DamageCalculator(catalog, preparedness), config);
        this.populationModel = new PopulationModel(catalog, new HappinessCalculator(catalog, preparedness));

        List<PhaseHandler> handlers = List.of(
            new ConstructionPhaseHandler(constructionQueue),
            new ProductionPhaseHandler(new StorageCapacityCalculator(catalog), new ProductionCalculator(catalog, terrain),
                new ConsumptionCalculator(catalog), new StaffingPlanner(catalog), new StorageLedger(),
                config.storageWarningThreshold()),
            new PopulationPhaseHandler(populationModel),
            new PassiveRepairPhaseHandler(new PassiveRepair(config.repairPerHour())),
            new DisasterLifecyclePhaseHandler(disasterDirector),
            new DisasterCheckPhaseHandler(disasterDirector));

        RandomSource randomSource = config.randomSeed() != null
            ? new SeededRandomSource(config.randomSeed())
            : new ThreadLocalRandomSource();
        this.metrics = new EngineMetrics();
        this.scheduler = new WallClockScheduler(config.schedules().values(), clock);
        this.orchestrator = new TickOrchestrator(config, repository, handlers, publisher, metrics, randomSource, clock);
        this.loop = new TickLoop(scheduler, orchestrator, clock, metrics, config.tickIntervalMillis());
    }

    public void start() {
        loop.start();
    }

    public void stop() {
        loop.stop();
    }

    public EngineConfig config() {
        return config;
    }

    public ConstructionQueue constructionQueue() {
        return constructionQueue;
    }

    public DisasterDirector disasterDirector() {
        return disasterDirector;
    }

    public PopulationModel populationModel() {
        return populationModel;
    }

    public EngineMetrics metrics() {
        return metrics;
    }

    public WallClockScheduler scheduler() {
        return scheduler;
    }

    public TickOrchestrator orchestrator() {
        return orchestrator;
    }

    public TickLoop loop() {
        return loop;
    }
}
