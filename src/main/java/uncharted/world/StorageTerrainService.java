package uncharted.world;

import uncharted.codec.CodecException;
import uncharted.codec.JsonCodec;
import uncharted.repository.PersistenceException;
import uncharted.storage.BytesKey;
import uncharted.storage.Storage;
import uncharted.storage.StorageException;
import uncharted.storage.VersionedValue;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Tiles stored as JSON documents under {@code tile:<id>} in the shared key-value store.
 * {@link #save(TileInfo)} and {@link #saveAll(Collection)} are the write paths used when the world
 * generator publishes tiles.
 * <p>
 * A tile that is absent or does not decode is unavailable. A store fault is not: it surfaces as a
 * {@link PersistenceException} so the settlement's pass fails instead of saving zero production.
 */
public class StorageTerrainService implements TerrainService {
    private static final Logger logger = Logger.getLogger(StorageTerrainService.class.getName());

    static final String KEY_PREFIX = "tile:";

    private final Storage storage;
    private final JsonCodec codec;

    public StorageTerrainService(Storage storage, JsonCodec codec) {
        if (storage == null) {
            throw new IllegalArgumentException("Storage cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        this.storage = storage;
        this.codec = codec;
    }

    @Override
    public Optional<TileInfo> tile(String tileId) {
        if (tileId == null) {
            return Optional.empty();
        }
        VersionedValue value;
        try {
            value = storage.get(key(tileId));
        } catch (StorageException e) {
            throw new PersistenceException("Failed to read tile " + tileId, e);
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(value.value(), TileInfo.class));
        } catch (CodecException e) {
            logger.warning("Could not decode tile " + tileId + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public void save(TileInfo tile) {
        VersionedValue existing = storage.get(key(tile.tileId()));
        long version = existing == null ? 1L : existing.version() + 1;
        storage.set(key(tile.tileId()), new VersionedValue(codec.encode(tile), version));
    }

    /**
     * Writes all tiles in one atomic batch; a later tile with the same id wins.
     *
     * @throws uncharted.storage.StorageException if the batch write fails; no tile is written then
     */
    public void saveAll(Collection<TileInfo> tiles) {
        Map<BytesKey, VersionedValue> batch = new LinkedHashMap<>();
        for (TileInfo tile : tiles) {
            VersionedValue existing = storage.get(key(tile.tileId()));
            long version = existing == null ? 1L : existing.version() + 1;
            batch.put(BytesKey.of(KEY_PREFIX + tile.tileId()), new VersionedValue(codec.encode(tile), version));
        }
        storage.setAll(batch);
        logger.info("Imported " + batch.size() + " tile(s)");
    }

    private static byte[] key(String tileId) {
        return BytesKey.of(KEY_PREFIX + tileId).bytes();
    }
}
