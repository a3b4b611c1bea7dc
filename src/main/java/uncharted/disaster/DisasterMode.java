package uncharted.disaster;

/**
 * World-level disaster tuning.
 */
public enum DisasterMode {
    STANDARD(0.015, 1.0, 1.0),
    SURVIVAL(0.04, 1.2, 0.75),
    RELAXED(0.005, 0.7, 1.5),
    APOCALYPSE(0.08, 1.5, 0.5);

    private final double probabilityPerHour;
    private final double severityMultiplier;
    private final double warningTimeMultiplier;

    DisasterMode(double probabilityPerHour, double severityMultiplier, double warningTimeMultiplier) {
        this.probabilityPerHour = probabilityPerHour;
        this.severityMultiplier = severityMultiplier;
        this.warningTimeMultiplier = warningTimeMultiplier;
    }

    public double probabilityPerHour() {
        return probabilityPerHour;
    }

    public double severityMultiplier() {
        return severityMultiplier;
    }

    public double warningTimeMultiplier() {
        return warningTimeMultiplier;
    }
}
