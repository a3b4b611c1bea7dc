package uncharted.disaster;

public enum SeverityLevel {
    MILD(2),
    MODERATE(5),
    MAJOR(10),
    CATASTROPHIC(15);

    private final int resilienceGain;

    SeverityLevel(int resilienceGain) {
        this.resilienceGain = resilienceGain;
    }

    /** Resilience a settlement earns for surviving a disaster of this level. */
    public int resilienceGain() {
        return resilienceGain;
    }

    public static SeverityLevel of(double severity) {
        if (severity < 25) return MILD;
        if (severity < 50) return MODERATE;
        if (severity < 75) return MAJOR;
        return CATASTROPHIC;
    }
}
