package uncharted.catalog;

public enum StructureCategory {
    /** Converts tile resource quality into production. */
    EXTRACTOR,
    /** Provides population capacity. */
    HOUSING,
    BUILDING
}
