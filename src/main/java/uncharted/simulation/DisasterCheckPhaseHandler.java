package uncharted.simulation;

import uncharted.disaster.DisasterDirector;
import uncharted.settlement.Settlement;

/**
 * Rolls for a new disaster on every idle settlement.
 */
public class DisasterCheckPhaseHandler implements PhaseHandler {

    private final DisasterDirector director;

    public DisasterCheckPhaseHandler(DisasterDirector director) {
        if (director == null) {
            throw new IllegalArgumentException("Disaster director cannot be null");
        }
        this.director = director;
    }

    @Override
    public Phase phase() {
        return Phase.DISASTER_CHECK;
    }

    @Override
    public boolean appliesTo(Settlement settlement) {
        return settlement.getActiveDisaster() == null;
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        director.roll(settlement, context.now(), context.schedule().periodSeconds(), context.random(),
            context.sink());
    }
}
