package uncharted.catalog;

/**
 * Structure types the simulation gives special behaviour to.
 */
public final class StructureTypes {
    public static final String HOUSE = "HOUSE";
    public static final String STORAGE = "STORAGE";
    public static final String WAREHOUSE = "WAREHOUSE";
    public static final String WORKSHOP = "WORKSHOP";
    public static final String SHELTER = "SHELTER";
    public static final String HOSPITAL = "HOSPITAL";
    public static final String WATCHTOWER = "WATCHTOWER";
    public static final String METEOROLOGY_STATION = "METEOROLOGY_STATION";
    public static final String SEISMOLOGY_STATION = "SEISMOLOGY_STATION";
    public static final String FORTRESS = "FORTRESS";

    private StructureTypes() {
    }
}
