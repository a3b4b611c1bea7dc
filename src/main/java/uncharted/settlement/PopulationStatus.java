package uncharted.settlement;

public enum PopulationStatus {
    GROWING("Growing"),
    STABLE("Stable"),
    DECLINING("Declining");

    private final String label;

    PopulationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
