package uncharted.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outbound event kinds, named as they appear on the wire.
 */
public enum EventType {
    RESOURCE_TICK("resource-tick"),
    RESOURCE_WASTE("resource-waste"),
    STORAGE_WARNING("storage-warning"),

    POPULATION_GROWTH("population-growth"),
    SETTLER_ARRIVED("settler-arrived"),
    SETTLER_DEPARTED("settler-departed"),
    POPULATION_WARNING("population-warning"),

    DISASTER_WARNING("disaster-warning"),
    DISASTER_IMMINENT("disaster-imminent"),
    DISASTER_IMPACT_START("disaster-impact-start"),
    DISASTER_DAMAGE_UPDATE("disaster-damage-update"),
    DISASTER_IMPACT_END("disaster-impact-end"),
    DISASTER_AFTERMATH("disaster-aftermath"),
    DISASTER_RESOLVED("disaster-resolved"),
    CASUALTIES_REPORT("casualties-report"),

    STRUCTURE_DAMAGED("structure-damaged"),
    STRUCTURE_DESTROYED("structure-destroyed"),
    STRUCTURE_REPAIRED("structure-repaired"),

    CONSTRUCTION_STARTED("construction-started"),
    CONSTRUCTION_PROGRESS("construction-progress"),
    CONSTRUCTION_COMPLETE("construction-complete"),
    QUEUE_UPDATED("queue-updated");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
