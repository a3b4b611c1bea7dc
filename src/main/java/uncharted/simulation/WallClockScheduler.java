package uncharted.simulation;

import uncharted.clock.SystemClock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decides which phases are due from the wall clock alone.
 * <p>
 * A phase is due in every epoch second {@code s} with {@code s % period == offset}. Asking again
 * within the same second returns nothing for that phase: each phase fires at most once per
 * epoch second however often the loop polls.
 * <p>
 * Between two polls the scheduler looks back over the seconds it has not seen yet, up to
 * {@code maxCatchUpSeconds}, so a boundary that fell inside a slow pass still fires once on the
 * next poll. The first poll only considers its own second.
 */
public class WallClockScheduler {
    private static final Logger logger = Logger.getLogger(WallClockScheduler.class.getName());

    public static final long DEFAULT_MAX_CATCH_UP_SECONDS = 60;

    private final Map<Phase, PhaseSchedule> schedules = new EnumMap<>(Phase.class);
    private final SystemClock clock;
    private final long maxCatchUpSeconds;
    private final Map<Phase, Long> lastTriggeredSecond = new EnumMap<>(Phase.class);
    private Long lastPolledSecond;

    public WallClockScheduler(Collection<PhaseSchedule> schedules, SystemClock clock) {
        this(schedules, clock, DEFAULT_MAX_CATCH_UP_SECONDS);
    }

    /**
     * @throws IllegalArgumentException if a phase is scheduled twice, or two schedules with the
     *                                  same period share an offset
     */
    public WallClockScheduler(Collection<PhaseSchedule> schedules, SystemClock clock, long maxCatchUpSeconds) {
        if (schedules == null || schedules.isEmpty()) {
            throw new IllegalArgumentException("Schedules cannot be null or empty");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (maxCatchUpSeconds < 0) {
            throw new IllegalArgumentException("maxCatchUpSeconds cannot be negative");
        }
        Map<String, Phase> slots = new HashMap<>();
        for (PhaseSchedule schedule : schedules) {
            if (this.schedules.put(schedule.phase(), schedule) != null) {
                throw new IllegalArgumentException("Phase " + schedule.phase() + " is scheduled twice");
            }
            String slot = schedule.periodSeconds() + "/" + schedule.offsetSeconds();
            Phase clash = slots.putIfAbsent(slot, schedule.phase());
            if (clash != null) {
                throw new IllegalArgumentException("Phases " + clash + " and " + schedule.phase()
                    + " share period " + schedule.periodSeconds() + "s and offset " + schedule.offsetSeconds() + "s");
            }
        }
        this.clock = clock;
        this.maxCatchUpSeconds = maxCatchUpSeconds;
    }

    public Set<Phase> duePhases() {
        return duePhases(clock.now());
    }

    /**
     * Returns the phases due at {@code epochMillis} that have not fired yet in their second, and
     * marks them fired.
     */
    public synchronized Set<Phase> duePhases(long epochMillis) {
        long second = Math.floorDiv(epochMillis, 1000L);
        long from = second;
        if (lastPolledSecond != null && second > lastPolledSecond) {
            from = Math.max(lastPolledSecond + 1, second - maxCatchUpSeconds);
        }
        if (lastPolledSecond == null || second > lastPolledSecond) {
            lastPolledSecond = second;
        }

        Set<Phase> due = EnumSet.noneOf(Phase.class);
        for (PhaseSchedule schedule : schedules.values()) {
            Long last = lastTriggeredSecond.get(schedule.phase());
            for (long s = second; s >= from; s--) {
                if (!schedule.dueAt(s)) {
                    continue;
                }
                if (last != null && last >= s) {
                    logger.fine("Suppressed repeat trigger of " + schedule.phase() + " at second " + s);
                } else {
                    lastTriggeredSecond.put(schedule.phase(), s);
                    due.add(schedule.phase());
                }
                break;
            }
        }
        return due;
    }

    /**
     * Whether the phase's boundary falls on this second, without marking anything.
     */
    public boolean isBoundary(Phase phase, long epochMillis) {
        PhaseSchedule schedule = schedules.get(phase);
        return schedule != null && schedule.dueAt(Math.floorDiv(epochMillis, 1000L));
    }

    public synchronized Optional<Long> lastTriggeredSecond(Phase phase) {
        return Optional.ofNullable(lastTriggeredSecond.get(phase));
    }

    public List<PhaseSchedule> schedules() {
        return new ArrayList<>(schedules.values());
    }

    public PhaseSchedule schedule(Phase phase) {
        return schedules.get(phase);
    }
}
