package uncharted.catalog;

/**
 * Workers a structure type takes from the settlement's population.
 *
 * @param required workers needed before any bonus applies
 * @param optional extra workers the structure can take on top of {@code required}
 * @param bonusPerWorker output bonus per extra worker, e.g. 0.1 for +10%
 * @param priority assignment order, higher first
 */
public record StaffingRequirement(int required, int optional, double bonusPerWorker, int priority) {

    public StaffingRequirement {
        if (required < 0 || optional < 0) {
            throw new IllegalArgumentException("Worker counts cannot be negative");
        }
        if (bonusPerWorker < 0) {
            throw new IllegalArgumentException("bonusPerWorker cannot be negative");
        }
    }

    public int maxWorkers() {
        return required + optional;
    }

    /**
     * Output multiplier for the given number of workers. Below {@code required} there is no bonus.
     */
    public double bonus(int assigned) {
        if (assigned < required) {
            return 1.0;
        }
        int extra = Math.min(assigned, maxWorkers()) - required;
        return 1.0 + extra * bonusPerWorker;
    }
}
