package uncharted.simulation;

import uncharted.population.PopulationModel;
import uncharted.settlement.Settlement;

public class PopulationPhaseHandler implements PhaseHandler {

    private final PopulationModel model;

    public PopulationPhaseHandler(PopulationModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Population model cannot be null");
        }
        this.model = model;
    }

    @Override
    public Phase phase() {
        return Phase.POPULATION;
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        model.update(settlement, context.now(), context.random(), context.sink());
    }
}
