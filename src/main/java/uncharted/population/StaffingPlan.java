package uncharted.population;

import java.util.List;
import java.util.Map;

/**
 * Workers handed out to a settlement's structures for one production phase.
 *
 * @param workers assigned worker count per structure id
 * @param bonuses output multiplier per structure id, 1.0 when there is no bonus
 * @param assigned total workers placed
 * @param idle settlers left without a post
 * @param understaffed ids of structures below their required workers, in assignment order
 */
public record StaffingPlan(Map<String, Integer> workers,
                           Map<String, Double> bonuses,
                           int assigned,
                           int idle,
                           List<String> understaffed) {

    public StaffingPlan {
        workers = Map.copyOf(workers);
        bonuses = Map.copyOf(bonuses);
        understaffed = List.copyOf(understaffed);
    }

    public int workersOf(String structureId) {
        return workers.getOrDefault(structureId, 0);
    }

    public double bonusOf(String structureId) {
        return bonuses.getOrDefault(structureId, 1.0);
    }
}
