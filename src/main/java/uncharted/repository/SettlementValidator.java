package uncharted.repository;

import uncharted.disaster.DisasterEvent;
import uncharted.disaster.DisasterPhase;
import uncharted.settlement.ConstructionQueueEntry;
import uncharted.settlement.PopulationState;
import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the invariants of a settlement aggregate at the repository boundary.
 */
public class SettlementValidator {

    // Tolerates floating-point drift in amount <= capacity.
    private static final double EPSILON = 1e-6;

    public void validate(Settlement settlement) {
        List<String> problems = problemsOf(settlement);
        if (!problems.isEmpty()) {
            String id = settlement == null ? "<null>" : settlement.getId();
            throw new ValidationException(id, problems);
        }
    }

    public List<String> problemsOf(Settlement settlement) {
        List<String> problems = new ArrayList<>();
        if (settlement == null) {
            problems.add("settlement is null");
            return problems;
        }
        if (isBlank(settlement.getId())) {
            problems.add("id is blank");
        }
        if (isBlank(settlement.getPlayerId())) {
            problems.add("playerId is blank");
        }
        if (settlement.getResilience() < 0 || settlement.getResilience() > 100) {
            problems.add("resilience " + settlement.getResilience() + " outside 0..100");
        }
        checkStorage(settlement, problems);
        checkPopulation(settlement.getPopulation(), problems);
        checkStructures(settlement.getStructures(), problems);
        checkQueue(settlement.getConstructionQueue(), problems);
        checkDisaster(settlement.getActiveDisaster(), problems);
        return problems;
    }

    private void checkStorage(Settlement settlement, List<String> problems) {
        if (settlement.getStorage() == null) {
            problems.add("storage is missing");
            return;
        }
        for (ResourceType resource : ResourceType.values()) {
            ResourceStock stock = settlement.getStorage().get(resource);
            if (stock == null) {
                problems.add("storage has no entry for " + resource);
                continue;
            }
            if (stock.capacity() < 0) {
                problems.add(resource + " capacity is negative");
            }
            if (stock.amount() < 0) {
                problems.add(resource + " amount is negative");
            }
            if (stock.amount() > stock.capacity() + EPSILON) {
                problems.add(resource + " amount " + stock.amount() + " exceeds capacity " + stock.capacity());
            }
        }
    }

    private void checkPopulation(PopulationState population, List<String> problems) {
        // Population may be absent while it is being rebuilt; consumption treats that as zero.
        if (population == null) {
            return;
        }
        if (population.current() < 0) {
            problems.add("population is negative");
        }
        if (population.capacity() < 0) {
            problems.add("population capacity is negative");
        }
        if (population.current() > population.capacity()) {
            problems.add("population " + population.current() + " exceeds capacity " + population.capacity());
        }
        if (population.happiness() < 0 || population.happiness() > 100) {
            problems.add("happiness " + population.happiness() + " outside 0..100");
        }
        if (population.status() == null) {
            problems.add("population status is missing");
        }
    }

    private void checkStructures(List<StructureInstance> structures, List<String> problems) {
        if (structures == null) {
            problems.add("structures list is missing");
            return;
        }
        Set<String> ids = new HashSet<>();
        for (StructureInstance structure : structures) {
            if (structure == null || isBlank(structure.id())) {
                problems.add("structure without id");
                continue;
            }
            if (!ids.add(structure.id())) {
                problems.add("duplicate structure id " + structure.id());
            }
            if (isBlank(structure.type())) {
                problems.add("structure " + structure.id() + " has no type");
            }
            if (structure.level() < 1) {
                problems.add("structure " + structure.id() + " level " + structure.level() + " below 1");
            }
            if (structure.health() < 0 || structure.health() > 100) {
                problems.add("structure " + structure.id() + " health " + structure.health() + " outside 0..100");
            }
        }
    }

    private void checkQueue(List<ConstructionQueueEntry> queue, List<String> problems) {
        if (queue == null) {
            problems.add("construction queue is missing");
            return;
        }
        Set<String> ids = new HashSet<>();
        Set<Integer> positions = new HashSet<>();
        for (ConstructionQueueEntry entry : queue) {
            if (entry == null || isBlank(entry.id())) {
                problems.add("queue entry without id");
                continue;
            }
            if (!ids.add(entry.id())) {
                problems.add("duplicate queue entry " + entry.id());
            }
            if (entry.position() < 1 || entry.position() > queue.size() || !positions.add(entry.position())) {
                problems.add("queue entry " + entry.id() + " has invalid position " + entry.position());
            }
            if (entry.active() && entry.completesAt() < entry.startedAt()) {
                problems.add("queue entry " + entry.id() + " completes before it starts");
            }
        }
    }

    private void checkDisaster(DisasterEvent disaster, List<String> problems) {
        if (disaster == null) {
            return;
        }
        if (disaster.getType() == null) {
            problems.add("active disaster has no type");
        }
        if (disaster.getPhase() == null
                || disaster.getPhase() == DisasterPhase.IDLE
                || disaster.getPhase() == DisasterPhase.RESOLVED) {
            problems.add("active disaster is in phase " + disaster.getPhase());
        }
        if (disaster.getSeverity() < 0 || disaster.getSeverity() > 100) {
            problems.add("disaster severity " + disaster.getSeverity() + " outside 0..100");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
