package uncharted.population;

import uncharted.settlement.PopulationStatus;

/**
 * Happiness bands, highest first. A band covers happiness from its lower bound up to the next
 * band's lower bound.
 */
public enum HappinessBand {
    VERY_HAPPY(80.0, "Very Happy", PopulationStatus.GROWING),
    HAPPY(60.0, "Happy", PopulationStatus.GROWING),
    CONTENT(40.0, "Content", PopulationStatus.STABLE),
    UNHAPPY(20.0, "Unhappy", PopulationStatus.DECLINING),
    VERY_UNHAPPY(0.0, "Very Unhappy", PopulationStatus.DECLINING);

    private final double lowerBound;
    private final String label;
    private final PopulationStatus status;

    HappinessBand(double lowerBound, String label, PopulationStatus status) {
        this.lowerBound = lowerBound;
        this.label = label;
        this.status = status;
    }

    public static HappinessBand of(double happiness) {
        for (HappinessBand band : values()) {
            if (happiness >= band.lowerBound) {
                return band;
            }
        }
        return VERY_UNHAPPY;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public String label() {
        return label;
    }

    public PopulationStatus status() {
        return status;
    }
}
