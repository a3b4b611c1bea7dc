package uncharted.cmd;

import uncharted.catalog.CatalogLoader;
import uncharted.catalog.GameCatalog;
import uncharted.clock.SystemClock;
import uncharted.codec.JsonCodec;
import uncharted.config.EngineConfig;
import uncharted.construction.ConstructionCommands;
import uncharted.disaster.DisasterMode;
import uncharted.events.EventBus;
import uncharted.events.JsonLinesEventListener;
import uncharted.repository.SettlementRepository;
import uncharted.repository.StorageSettlementRepository;
import uncharted.simulation.SimulationEngine;
import uncharted.storage.RocksDbStorage;
import uncharted.storage.Storage;
import uncharted.world.StorageTerrainService;
import uncharted.world.TileInfo;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point that runs the tick engine against a RocksDB store and writes the
 * event stream to stdout as JSON lines.
 */
public class EngineApplication {
    private static final Logger logger = Logger.getLogger(EngineApplication.class.getName());

    static final String LOGGING_RESOURCE = "logging.properties";

    private final String storagePath;
    private final String configPath;
    private final DisasterMode mode;
    private final Integer workers;
    private final boolean triggerOnce;
    private final String tilesPath;

    private Storage storage;
    private StorageTerrainService terrain;
    private EventBus eventBus;
    private SimulationEngine engine;
    private ConstructionCommands constructionCommands;
    private volatile boolean running = false;

    public EngineApplication(String storagePath, String configPath, DisasterMode mode, Integer workers,
                             boolean triggerOnce) {
        this(storagePath, configPath, mode, workers, triggerOnce, null);
    }

    /**
     * @param tilesPath JSON array of tiles to import before the engine starts, or null
     */
    public EngineApplication(String storagePath, String configPath, DisasterMode mode, Integer workers,
                             boolean triggerOnce, String tilesPath) {
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be null or blank");
        }
        this.storagePath = storagePath;
        this.configPath = configPath;
        this.mode = mode;
        this.workers = workers;
        this.triggerOnce = triggerOnce;
        this.tilesPath = tilesPath;
    }

    public static void main(String[] args) {
        configureLogging();
        EngineApplication application = EngineApplication.fromArgs(args);
        if (!application.start()) {
            logger.severe("Failed to start engine");
            System.exit(1);
        }
        if (application.isTriggerOnce()) {
            System.out.println(application.engine.orchestrator().triggerOnce());
            application.stop();
            return;
        }
        application.runEventLoop();
    }

    /**
     * Parses {@code --storage=}, {@code --config=}, {@code --mode=}, {@code --workers=},
     * {@code --tiles=} and {@code --trigger-once}.
     *
     * @throws IllegalArgumentException for an unknown mode or a non-numeric worker count
     */
    public static EngineApplication fromArgs(String[] args) {
        String storagePath = "data/engine";
        String configPath = null;
        DisasterMode mode = null;
        Integer workers = null;
        boolean triggerOnce = false;
        String tilesPath = null;
        for (String arg : args) {
            if (arg.startsWith("--storage=")) storagePath = arg.substring(10);
            else if (arg.startsWith("--config=")) configPath = arg.substring(9);
            else if (arg.startsWith("--mode=")) mode = DisasterMode.valueOf(arg.substring(7).toUpperCase());
            else if (arg.startsWith("--workers=")) workers = Integer.parseInt(arg.substring(10));
            else if (arg.startsWith("--tiles=")) tilesPath = arg.substring(8);
            else if (arg.equals("--trigger-once")) triggerOnce = true;
            else logger.warning("Ignoring unknown argument " + arg);
        }
        return new EngineApplication(storagePath, configPath, mode, workers, triggerOnce, tilesPath);
    }

    /**
     * Builds the engine configuration: defaults, then the properties file, then command-line
     * overrides.
     */
    EngineConfig buildConfig() {
        Properties properties = new Properties();
        if (configPath != null) {
            try (InputStream in = Files.newInputStream(Path.of(configPath))) {
                properties.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read engine config " + configPath, e);
            }
        }
        if (mode != null) {
            properties.setProperty("engine.disasterMode", mode.name());
        }
        if (workers != null) {
            properties.setProperty("engine.workerThreads", workers.toString());
        }
        return EngineConfig.fromProperties(properties);
    }

    /**
     * Opens storage and wires the engine. The tick loop is not started in trigger-once mode.
     *
     * @return true if the engine started successfully
     */
    public boolean start() {
        try {
            EngineConfig config = buildConfig();
            logger.info("Starting engine with " + config);

            this.storage = new RocksDbStorage(storagePath);
            logger.info("Storage opened at " + storagePath);

            JsonCodec codec = new JsonCodec();
            GameCatalog catalog = new CatalogLoader().loadDefault();
            SettlementRepository repository = new StorageSettlementRepository(storage, codec);

            this.eventBus = new EventBus();
            eventBus.registerListener(new JsonLinesEventListener(
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8), codec));

            this.terrain = new StorageTerrainService(storage, codec);
            if (tilesPath != null) {
                importTiles(codec);
            }

            SystemClock clock = new SystemClock();
            this.engine = new SimulationEngine(config, catalog, terrain, repository, eventBus, clock);
            this.constructionCommands = new ConstructionCommands(repository, engine.constructionQueue(), eventBus, clock);

            if (!triggerOnce) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    logger.info("Shutdown signal received, stopping engine...");
                    stop();
                }));
                engine.start();
            }
            running = true;
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to start engine", e);
            closeStorage();
            return false;
        }
    }

    private void importTiles(JsonCodec codec) {
        byte[] json;
        try {
            json = Files.readAllBytes(Path.of(tilesPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tiles " + tilesPath, e);
        }
        TileInfo[] tiles = codec.decode(json, TileInfo[].class);
        terrain.saveAll(Arrays.asList(tiles));
    }

    public void runEventLoop() {
        if (!running) {
            logger.warning("Engine not started. Call start() first.");
            return;
        }
        while (running) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (engine.loop().faulted()) {
                logger.severe("Tick loop faulted; metrics " + engine.metrics().snapshot());
                break;
            }
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (engine != null) {
            engine.stop();
        }
        closeStorage();
        logger.info("Engine stopped");
    }

    private void closeStorage() {
        if (storage != null) {
            try {
                storage.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Error closing storage", e);
            }
            storage = null;
        }
    }

    static void configureLogging() {
        try (InputStream in = EngineApplication.class.getClassLoader().getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load " + LOGGING_RESOURCE, e);
        }
    }

    // Getters for testing and diagnostics
    public String getStoragePath() { return storagePath; }
    public String getConfigPath() { return configPath; }
    public DisasterMode getMode() { return mode; }
    public Integer getWorkers() { return workers; }
    public boolean isTriggerOnce() { return triggerOnce; }
    public String getTilesPath() { return tilesPath; }
    public StorageTerrainService getTerrain() { return terrain; }
    public SimulationEngine getEngine() { return engine; }
    public ConstructionCommands getConstructionCommands() { return constructionCommands; }
}
