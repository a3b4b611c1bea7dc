package uncharted.simulation;

import uncharted.construction.ConstructionQueue;
import uncharted.settlement.Settlement;

public class ConstructionPhaseHandler implements PhaseHandler {

    private final ConstructionQueue queue;

    public ConstructionPhaseHandler(ConstructionQueue queue) {
        if (queue == null) {
            throw new IllegalArgumentException("Construction queue cannot be null");
        }
        this.queue = queue;
    }

    @Override
    public Phase phase() {
        return Phase.CONSTRUCTION;
    }

    @Override
    public boolean appliesTo(Settlement settlement) {
        return !settlement.getConstructionQueue().isEmpty();
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        queue.process(settlement, context.now(), context.sink());
    }
}
