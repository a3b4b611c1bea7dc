package uncharted.disaster;

/**
 * Lifecycle phases in the only order a disaster may pass through them.
 */
public enum DisasterPhase {
    IDLE,
    WARNING,
    IMMINENT,
    IMPACT,
    AFTERMATH,
    RESOLVED;

    /**
     * The phase that follows this one.
     *
     * @throws IllegalStateException when called on RESOLVED
     */
    public DisasterPhase next() {
        if (this == RESOLVED) {
            throw new IllegalStateException("RESOLVED is terminal");
        }
        return values()[ordinal() + 1];
    }
}
