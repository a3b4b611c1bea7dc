package uncharted.simulation;

import uncharted.disaster.DisasterDirector;
import uncharted.settlement.Settlement;

/**
 * Moves active disasters through their phases and applies due impact damage.
 */
public class DisasterLifecyclePhaseHandler implements PhaseHandler {

    private final DisasterDirector director;

    public DisasterLifecyclePhaseHandler(DisasterDirector director) {
        if (director == null) {
            throw new IllegalArgumentException("Disaster director cannot be null");
        }
        this.director = director;
    }

    @Override
    public Phase phase() {
        return Phase.DISASTER_LIFECYCLE;
    }

    @Override
    public boolean appliesTo(Settlement settlement) {
        return settlement.getActiveDisaster() != null;
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        director.advance(settlement, context.now(), context.random(), context.sink());
    }
}
