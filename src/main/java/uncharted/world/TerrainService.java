package uncharted.world;

import java.util.Optional;

/**
 * Read-only view of the world map owned by the world-generation subsystem.
 */
public interface TerrainService {

    /**
     * Looks up a tile.
     *
     * @return the tile, or empty when the id is unknown or the tile cannot be read
     */
    Optional<TileInfo> tile(String tileId);
}
