package uncharted.world;

import uncharted.settlement.ResourceType;

import java.util.Map;
import java.util.Optional;

/**
 * What the world generator knows about one tile.
 *
 * @param quality resource quality score 0..100 per resource
 * @param plotCapacity how many extractor plots the tile offers
 */
public record TileInfo(String tileId, String biome, Map<ResourceType, Double> quality, int plotCapacity) {

    public TileInfo {
        if (tileId == null || tileId.isBlank()) {
            throw new IllegalArgumentException("Tile id cannot be null or blank");
        }
        if (plotCapacity < 0) {
            throw new IllegalArgumentException("Plot capacity cannot be negative");
        }
        quality = quality == null ? Map.of() : Map.copyOf(quality);
    }

    public Optional<Double> qualityOf(ResourceType resource) {
        return Optional.ofNullable(quality.get(resource));
    }
}
