package uncharted.simulation;

/**
 * When a phase is due: every epoch second {@code s} with {@code s % periodSeconds == offsetSeconds}.
 */
public record PhaseSchedule(Phase phase, long periodSeconds, long offsetSeconds) {

    public PhaseSchedule {
        if (phase == null) {
            throw new IllegalArgumentException("Phase cannot be null");
        }
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("Period must be positive for " + phase);
        }
        if (offsetSeconds < 0 || offsetSeconds >= periodSeconds) {
            throw new IllegalArgumentException("Offset must be in [0, period) for " + phase);
        }
    }

    public boolean dueAt(long epochSecond) {
        return Math.floorMod(epochSecond, periodSeconds) == offsetSeconds;
    }

    public double periodHours() {
        return periodSeconds / 3600.0;
    }
}
