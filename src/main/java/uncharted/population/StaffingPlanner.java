package uncharted.population;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.StaffingRequirement;
import uncharted.settlement.StructureInstance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hands the settlement's population out to its staffed structures.
 * <p>
 * Two passes: first every structure gets up to its required workers, highest priority first; then the
 * settlers left over fill optional slots, highest bonus per worker first. Ties keep the structures'
 * own order. Structures without a staffing entry, or with zero required workers, take nobody.
 */
public class StaffingPlanner {

    private final GameCatalog catalog;

    public StaffingPlanner(GameCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.catalog = catalog;
    }

    public StaffingPlan assign(int population, List<StructureInstance> structures) {
        List<Staffed> staffed = new ArrayList<>();
        for (StructureInstance structure : structures) {
            if (structure.destroyed()) {
                continue;
            }
            Optional<StaffingRequirement> requirement = catalog.staffing(structure.type());
            if (requirement.isPresent() && requirement.get().required() > 0) {
                staffed.add(new Staffed(structure.id(), requirement.get()));
            }
        }

        int remaining = Math.max(0, population);
        Map<String, Integer> workers = new LinkedHashMap<>();
        staffed.sort(Comparator.comparingInt((Staffed s) -> s.requirement.priority()).reversed());
        for (Staffed s : staffed) {
            int take = Math.min(s.requirement.required(), remaining);
            workers.put(s.id, take);
            remaining -= take;
        }

        staffed.sort(Comparator.comparingDouble((Staffed s) -> s.requirement.bonusPerWorker()).reversed());
        for (Staffed s : staffed) {
            if (remaining == 0) {
                break;
            }
            int current = workers.get(s.id);
            if (current < s.requirement.required()) {
                continue;
            }
            int take = Math.min(s.requirement.optional(), remaining);
            workers.put(s.id, current + take);
            remaining -= take;
        }

        Map<String, Double> bonuses = new LinkedHashMap<>();
        List<String> understaffed = new ArrayList<>();
        int assigned = 0;
        staffed.sort(Comparator.comparingInt((Staffed s) -> s.requirement.priority()).reversed());
        for (Staffed s : staffed) {
            int count = workers.get(s.id);
            assigned += count;
            bonuses.put(s.id, s.requirement.bonus(count));
            if (count < s.requirement.required()) {
                understaffed.add(s.id);
            }
        }
        return new StaffingPlan(workers, bonuses, assigned, remaining, understaffed);
    }

    private record Staffed(String id, StaffingRequirement requirement) {
    }
}
