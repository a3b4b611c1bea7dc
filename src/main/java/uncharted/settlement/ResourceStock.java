package uncharted.settlement;

/**
 * Amount of one resource held by a settlement and the most it can hold.
 * Range checks are done by the settlement validator so a malformed document can still be loaded
 * and reported.
 */
public record ResourceStock(double amount, double capacity) {

    public static ResourceStock empty(double capacity) {
        return new ResourceStock(0.0, capacity);
    }

    public ResourceStock withAmount(double newAmount) {
        return new ResourceStock(newAmount, capacity);
    }

    public ResourceStock withCapacity(double newCapacity) {
        return new ResourceStock(amount, newCapacity);
    }

    public double fillRatio() {
        return capacity <= 0 ? 0.0 : amount / capacity;
    }
}
