package uncharted.simulation;

/**
 * Processing phases, in the order they run when several are due in the same second.
 */
public enum Phase {
    CONSTRUCTION(1, 0),
    PRODUCTION(3600, 0),
    POPULATION(3600, 1800),
    PASSIVE_REPAIR(3600, 2700),
    DISASTER_LIFECYCLE(60, 0),
    DISASTER_CHECK(900, 0);

    private final long defaultPeriodSeconds;
    private final long defaultOffsetSeconds;

    Phase(long defaultPeriodSeconds, long defaultOffsetSeconds) {
        this.defaultPeriodSeconds = defaultPeriodSeconds;
        this.defaultOffsetSeconds = defaultOffsetSeconds;
    }

    public PhaseSchedule defaultSchedule() {
        return new PhaseSchedule(this, defaultPeriodSeconds, defaultOffsetSeconds);
    }
}
