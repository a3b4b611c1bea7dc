package uncharted.simulation;

import uncharted.repair.PassiveRepair;
import uncharted.settlement.Settlement;

public class PassiveRepairPhaseHandler implements PhaseHandler {

    private final PassiveRepair repair;

    public PassiveRepairPhaseHandler(PassiveRepair repair) {
        if (repair == null) {
            throw new IllegalArgumentException("Passive repair cannot be null");
        }
        this.repair = repair;
    }

    @Override
    public Phase phase() {
        return Phase.PASSIVE_REPAIR;
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        repair.repair(settlement, context.now(), context.sink());
    }
}
