package uncharted.disaster;

import java.util.List;

/**
 * Disaster kinds with their timing and impact constants.
 * Warning and impact times are in seconds; the warning time is scaled by the world's
 * {@link DisasterMode} before use.
 */
public enum DisasterType {
    EARTHQUAKE(3600, 600, 1.0, 0.25, ActionGroup.STRUCTURAL),
    FLOOD(7200, 3600, 0.8, 0.30, ActionGroup.WATER),
    DROUGHT(86400, 86400, 0.6, 0.20, ActionGroup.DRY),
    WILDFIRE(5400, 7200, 0.9, 0.15, ActionGroup.FIRE),
    TORNADO(1800, 300, 1.3, 0.35, ActionGroup.NONE),
    HURRICANE(14400, 5400, 1.2, 0.35, ActionGroup.WATER),
    BLIZZARD(10800, 10800, 0.7, 0.20, ActionGroup.COLD),
    HEATWAVE(43200, 43200, 0.8, 0.20, ActionGroup.DRY),
    SANDSTORM(5400, 3600, 0.5, 0.25, ActionGroup.NONE),
    LANDSLIDE(3600, 1800, 1.1, 0.35, ActionGroup.STRUCTURAL),
    AVALANCHE(1800, 600, 1.2, 0.35, ActionGroup.STRUCTURAL),
    VOLCANO(7200, 3600, 1.0, 0.40, ActionGroup.NONE),
    TSUNAMI(7200, 3600, 1.5, 0.40, ActionGroup.WATER),
    LOCUST_SWARM(7200, 21600, 0.3, 0.25, ActionGroup.NONE),
    INSECT_PLAGUE(7200, 43200, 0.3, 0.25, ActionGroup.SICKNESS),
    BLIGHT(7200, 172800, 0.4, 0.25, ActionGroup.SICKNESS);

    private final long warningSeconds;
    private final long impactSeconds;
    private final double casualtyMultiplier;
    private final double repairCostMultiplier;
    private final ActionGroup actionGroup;

    DisasterType(long warningSeconds, long impactSeconds, double casualtyMultiplier,
                 double repairCostMultiplier, ActionGroup actionGroup) {
        this.warningSeconds = warningSeconds;
        this.impactSeconds = impactSeconds;
        this.casualtyMultiplier = casualtyMultiplier;
        this.repairCostMultiplier = repairCostMultiplier;
        this.actionGroup = actionGroup;
    }

    public long warningSeconds() {
        return warningSeconds;
    }

    public long impactSeconds() {
        return impactSeconds;
    }

    public double casualtyMultiplier() {
        return casualtyMultiplier;
    }

    /** Share of the structure's build cost charged per 10% of health restored. */
    public double repairCostMultiplier() {
        return repairCostMultiplier;
    }

    List<String> specificActions() {
        return actionGroup.actions;
    }

    private enum ActionGroup {
        NONE(List.of()),
        STRUCTURAL(List.of(
            "Inspect structure health (stone/ore production buildings at risk)",
            "Consider seismic foundations if available")),
        DRY(List.of(
            "Stockpile water reserves immediately",
            "Activate water conservation measures")),
        WATER(List.of(
            "Move resources to higher ground if possible",
            "Activate storm barriers if available")),
        FIRE(List.of(
            "Clear wood stockpiles from settlement center",
            "Use fire-resistant structures if available")),
        COLD(List.of(
            "Stockpile fuel and heating resources",
            "Ensure population shelter capacity")),
        SICKNESS(List.of(
            "Stockpile medicinal herbs and medical supplies",
            "Activate hospitals and medical facilities"));

        private final List<String> actions;

        ActionGroup(List<String> actions) {
            this.actions = actions;
        }
    }
}
