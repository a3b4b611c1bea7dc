package uncharted.cmd;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uncharted.config.EngineConfig;
import uncharted.disaster.DisasterMode;
import uncharted.world.TileInfo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineApplicationTest {

    @Test
    void shouldParseArguments() {
        // When
        EngineApplication application = EngineApplication.fromArgs(new String[]{
            "--storage=/tmp/engine", "--config=engine.properties", "--mode=apocalypse", "--workers=2",
            "--trigger-once", "--unknown"});

        // Then
        assertEquals("/tmp/engine", application.getStoragePath());
        assertEquals("engine.properties", application.getConfigPath());
        assertEquals(DisasterMode.APOCALYPSE, application.getMode());
        assertEquals(2, application.getWorkers());
        assertTrue(application.isTriggerOnce());
    }

    @Test
    void shouldUseDefaultsWithoutArguments() {
        // When
        EngineApplication application = EngineApplication.fromArgs(new String[0]);

        // Then
        assertEquals("data/engine", application.getStoragePath());
        assertNull(application.getConfigPath());
        assertNull(application.getMode());
        assertFalse(application.isTriggerOnce());
    }

    @Test
    void shouldRejectUnknownMode() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> EngineApplication.fromArgs(new String[]{"--mode=chaos"}));
    }

    @Test
    void shouldLetCommandLineOverrideConfigFile(@TempDir Path dir) throws IOException {
        // Given
        Path file = dir.resolve("engine.properties");
        Files.writeString(file, "engine.workerThreads=6\nengine.disasterMode=RELAXED\nengine.repairPerHour=2.5\n");
        EngineApplication application = new EngineApplication(dir.resolve("db").toString(), file.toString(),
            DisasterMode.SURVIVAL, null, true);

        // When
        EngineConfig config = application.buildConfig();

        // Then
        assertEquals(6, config.workerThreads());
        assertEquals(DisasterMode.SURVIVAL, config.disasterMode());
        assertEquals(2.5, config.repairPerHour());
    }

    @Test
    void shouldFailOnMissingConfigFile(@TempDir Path dir) {
        // Given
        EngineApplication application = new EngineApplication(dir.resolve("db").toString(),
            dir.resolve("absent.properties").toString(), null, null, true);

        // When & Then
        assertThrows(java.io.UncheckedIOException.class, application::buildConfig);
        assertFalse(application.start());
    }

    @Test
    void shouldRunSinglePassInTriggerOnceMode(@TempDir Path dir) {
        // Given
        EngineApplication application = new EngineApplication(dir.resolve("db").toString(), null, null, 1, true);

        // When
        boolean started = application.start();

        // Then
        try {
            assertTrue(started);
            assertFalse(application.getEngine().loop().running());
            assertNotNull(application.getConstructionCommands());
            assertTrue(application.getEngine().orchestrator().triggerOnce().startsWith("OK "));
        } finally {
            application.stop();
        }
    }

    @Test
    void shouldImportTilesBeforeStarting(@TempDir Path dir) throws IOException {
        // Given
        Path tiles = dir.resolve("tiles.json");
        Files.writeString(tiles, "[{\"tileId\":\"t9\",\"biome\":\"FOREST\",\"quality\":{\"WOOD\":70.0},"
            + "\"plotCapacity\":3}]", StandardCharsets.UTF_8);
        EngineApplication application = EngineApplication.fromArgs(new String[]{
            "--storage=" + dir.resolve("db"), "--tiles=" + tiles, "--trigger-once"});

        // When
        boolean started = application.start();

        // Then
        try {
            assertTrue(started);
            assertEquals(tiles.toString(), application.getTilesPath());
            TileInfo tile = application.getTerrain().tile("t9").orElseThrow();
            assertEquals("FOREST", tile.biome());
        } finally {
            application.stop();
        }
    }

    @Test
    void shouldFailToStartWithMissingTilesFile(@TempDir Path dir) {
        // Given
        EngineApplication application = new EngineApplication(dir.resolve("db").toString(), null, null, 1, true,
            dir.resolve("missing.json").toString());

        // When & Then
        assertFalse(application.start());
    }

    @Test
    void shouldRejectBlankStoragePath() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new EngineApplication(" ", null, null, null, false));
    }
}
