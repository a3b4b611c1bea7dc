package uncharted.disaster;

import java.util.ArrayList;
import java.util.List;

/**
 * Advice attached to a disaster warning.
 */
public final class RecommendedActions {

    private RecommendedActions() {
    }

    public static List<String> of(DisasterType type, SeverityLevel level) {
        List<String> actions = new ArrayList<>();
        actions.add("Check settlement resources and stockpile food/water");
        actions.add("Review emergency shelter capacity");
        actions.addAll(type.specificActions());
        if (level == SeverityLevel.MAJOR || level == SeverityLevel.CATASTROPHIC) {
            actions.add("Consider requesting emergency aid from allies");
            actions.add("Prepare for potential population evacuation");
        }
        return List.copyOf(actions);
    }
}
