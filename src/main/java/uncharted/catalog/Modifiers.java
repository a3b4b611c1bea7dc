package uncharted.catalog;

import uncharted.settlement.ResourceType;

/**
 * Names of the structure modifiers the simulation reads.
 */
public final class Modifiers {
    public static final String POPULATION_CAPACITY = "Population Capacity";
    public static final String STORAGE_CAPACITY = "Storage Capacity";
    public static final String MORALE_BOOST = "Morale Boost";
    public static final String CONSTRUCTION_SPEED = "Construction Speed";
    public static final String DEFENSE = "Defense";
    public static final String SHELTER_CAPACITY = "Shelter Capacity";

    private Modifiers() {
    }

    /** Per-resource capacity modifier, e.g. "Food Storage". */
    public static String storageOf(ResourceType resource) {
        String key = resource.key();
        return Character.toUpperCase(key.charAt(0)) + key.substring(1) + " Storage";
    }
}
