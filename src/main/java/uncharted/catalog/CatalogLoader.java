package uncharted.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import uncharted.codec.JsonCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads the {@link GameCatalog} from JSON, by default from the {@code game-catalog.json}
 * classpath resource.
 */
public final class CatalogLoader {
    private static final Logger logger = Logger.getLogger(CatalogLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "game-catalog.json";

    private final ObjectMapper objectMapper = JsonCodec.createConfiguredObjectMapper();

    public GameCatalog loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public GameCatalog loadResource(String resourceName) {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Catalog resource not found on classpath: " + resourceName);
            }
            return read(in, resourceName);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog resource " + resourceName, e);
        }
    }

    public GameCatalog loadFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog file " + path, e);
        }
    }

    private GameCatalog read(InputStream in, String source) throws IOException {
        CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
        GameCatalog catalog = new GameCatalog(
            document.baseStorageCapacity(),
            document.basePopulationCapacity(),
            document.levelMultiplierBase(),
            document.consumptionPerCapitaPerHour(),
            document.baseRates(),
            document.structures(),
            document.biomes(),
            document.staffing());
        logger.info("Loaded catalog from " + source + " with " + catalog.structures().size() + " structures");
        return catalog;
    }
}
