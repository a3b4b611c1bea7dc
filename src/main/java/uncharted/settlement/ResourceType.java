package uncharted.settlement;

/**
 * Resources held in settlement storage.
 */
public enum ResourceType {
    FOOD,
    WATER,
    WOOD,
    STONE,
    ORE;

    /** Lower-case name used in event payloads and modifier names. */
    public String key() {
        return name().toLowerCase();
    }
}
