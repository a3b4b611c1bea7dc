package uncharted.settlement;

/**
 * A built structure owned by one settlement.
 *
 * @param id unique within the settlement
 * @param type catalog structure type, e.g. FARM
 * @param level 1..maxLevel of the type
 * @param health 0..100; a structure at 0 is destroyed and removed
 * @param tileId tile an extractor draws from, or null to use the settlement's own tile
 * @param builtAt epoch millis when construction completed
 */
public record StructureInstance(String id, String type, int level, double health, String tileId, long builtAt) {

    public static final double FULL_HEALTH = 100.0;

    public static StructureInstance newlyBuilt(String id, String type, String tileId, long builtAt) {
        return new StructureInstance(id, type, 1, FULL_HEALTH, tileId, builtAt);
    }

    public StructureInstance withHealth(double newHealth) {
        return new StructureInstance(id, type, level, Math.max(0.0, Math.min(FULL_HEALTH, newHealth)), tileId, builtAt);
    }

    public StructureInstance withLevel(int newLevel) {
        return new StructureInstance(id, type, newLevel, health, tileId, builtAt);
    }

    public boolean destroyed() {
        return health <= 0.0;
    }
}
