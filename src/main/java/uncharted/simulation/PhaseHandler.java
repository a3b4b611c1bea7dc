package uncharted.simulation;

import uncharted.settlement.Settlement;

/**
 * Work done on one settlement when a phase comes due. Handlers mutate the settlement in place
 * and emit events into the context; they never save or publish.
 */
public interface PhaseHandler {

    Phase phase();

    /**
     * Whether the settlement has anything for this phase to do. Settlements that do not are left
     * untouched and are not written back.
     */
    default boolean appliesTo(Settlement settlement) {
        return true;
    }

    void process(Settlement settlement, PhaseContext context);
}
