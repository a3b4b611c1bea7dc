package uncharted.repair;

import uncharted.catalog.StructureTypes;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.List;

/**
 * Slow hourly self-repair of lightly damaged structures, available once a settlement has a
 * standing workshop. Badly damaged structures (health 20 or less) need an explicit repair.
 */
public class PassiveRepair {

    static final double MIN_REPAIRABLE_HEALTH = 20.0;

    private final double repairPerHour;

    public PassiveRepair(double repairPerHour) {
        if (repairPerHour < 0) {
            throw new IllegalArgumentException("Repair per hour cannot be negative");
        }
        this.repairPerHour = repairPerHour;
    }

    /**
     * @return number of structures repaired
     */
    public int repair(Settlement settlement, long now, List<EngineEvent> events) {
        if (repairPerHour == 0 || !settlement.hasStandingStructure(StructureTypes.WORKSHOP)) {
            return 0;
        }
        int repaired = 0;
        for (StructureInstance structure : List.copyOf(settlement.getStructures())) {
            if (structure.health() <= MIN_REPAIRABLE_HEALTH || structure.health() >= StructureInstance.FULL_HEALTH) {
                continue;
            }
            StructureInstance healed = structure.withHealth(structure.health() + repairPerHour);
            settlement.replaceStructure(healed);
            repaired++;
            events.add(EngineEvent.builder(EventType.STRUCTURE_REPAIRED, settlement.getId(), now)
                .with("structureId", healed.id())
                .with("structureType", healed.type())
                .with("health", healed.health())
                .with("restored", healed.health() - structure.health())
                .build());
        }
        return repaired;
    }
}
