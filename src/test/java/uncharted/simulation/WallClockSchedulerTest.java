package uncharted.simulation;

import org.junit.jupiter.api.Test;
import uncharted.config.EngineConfig;
import uncharted.support.ManualClock;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WallClockSchedulerTest {

    private static final Set<Phase> HOURLY = EnumSet.of(Phase.PRODUCTION, Phase.POPULATION, Phase.PASSIVE_REPAIR);

    private static WallClockScheduler freshScheduler() {
        return new WallClockScheduler(EngineConfig.defaults().schedules().values(), ManualClock.at("2024-05-01T00:00:00Z"));
    }

    private static long millis(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    private static Set<Phase> hourlyDue(String iso) {
        Set<Phase> due = EnumSet.copyOf(freshScheduler().duePhases(millis(iso)));
        due.retainAll(HOURLY);
        return due;
    }

    @Test
    void shouldFireHourlyPhasesOnTheirOwnBoundaries() {
        // When & Then
        assertEquals(EnumSet.of(Phase.PRODUCTION), hourlyDue("2024-05-01T10:00:00Z"));
        assertEquals(EnumSet.of(Phase.POPULATION), hourlyDue("2024-05-01T10:30:00Z"));
        assertEquals(EnumSet.of(Phase.PASSIVE_REPAIR), hourlyDue("2024-05-01T10:45:00Z"));
        assertEquals(EnumSet.noneOf(Phase.class), hourlyDue("2024-05-01T10:15:00Z"));
        assertEquals(EnumSet.noneOf(Phase.class), hourlyDue("2024-05-01T10:00:01Z"));
    }

    @Test
    void shouldFireIffOnBoundaryAcrossADay() {
        // Given
        long start = millis("2024-05-01T00:00:00Z");

        for (long s = 0; s < 86_400; s += 7) {
            long at = start + s * 1000L + 250L;

            // When
            Set<Phase> due = freshScheduler().duePhases(at);

            // Then
            for (Phase phase : Phase.values()) {
                PhaseSchedule schedule = phase.defaultSchedule();
                assertEquals(schedule.dueAt(at / 1000L), due.contains(phase), phase + " at +" + s + "s");
            }
        }
    }

    @Test
    void shouldFireDisasterCheckOnQuarterHours() {
        // When & Then
        assertTrue(freshScheduler().duePhases(millis("2024-05-01T10:15:00Z")).contains(Phase.DISASTER_CHECK));
        assertTrue(freshScheduler().duePhases(millis("2024-05-01T10:45:00Z")).contains(Phase.DISASTER_CHECK));
        assertFalse(freshScheduler().duePhases(millis("2024-05-01T10:20:00Z")).contains(Phase.DISASTER_CHECK));
    }

    @Test
    void shouldFireOncePerSecondHoweverOftenPolled() {
        // Given
        WallClockScheduler scheduler = freshScheduler();
        long second = millis("2024-05-01T10:00:00Z");
        int productionRuns = 0;
        int constructionRuns = 0;

        // When
        for (int i = 0; i < 60; i++) {
            Set<Phase> due = scheduler.duePhases(second + i * 15L);
            if (due.contains(Phase.PRODUCTION)) {
                productionRuns++;
            }
            if (due.contains(Phase.CONSTRUCTION)) {
                constructionRuns++;
            }
        }

        // Then
        assertEquals(1, productionRuns);
        assertEquals(1, constructionRuns);
        assertEquals(millis("2024-05-01T10:00:00Z") / 1000L,
            scheduler.lastTriggeredSecond(Phase.PRODUCTION).orElseThrow());
    }

    @Test
    void shouldCatchUpBoundaryMissedBySlowPass() {
        // Given
        WallClockScheduler scheduler = freshScheduler();
        scheduler.duePhases(millis("2024-05-01T10:59:59Z"));

        // When
        Set<Phase> due = scheduler.duePhases(millis("2024-05-01T11:00:02Z"));

        // Then
        assertTrue(due.contains(Phase.PRODUCTION));
        assertTrue(scheduler.duePhases(millis("2024-05-01T11:00:03Z")).stream().noneMatch(HOURLY::contains));
    }

    @Test
    void shouldNotCatchUpBeyondLimit() {
        // Given
        WallClockScheduler scheduler = freshScheduler();
        scheduler.duePhases(millis("2024-05-01T10:59:00Z"));

        // When
        Set<Phase> due = scheduler.duePhases(millis("2024-05-01T11:02:00Z"));

        // Then
        assertFalse(due.contains(Phase.PRODUCTION));
        assertTrue(due.contains(Phase.DISASTER_LIFECYCLE));
    }

    @Test
    void shouldNotFireAgainWhenClockStepsBack() {
        // Given
        WallClockScheduler scheduler = freshScheduler();
        assertTrue(scheduler.duePhases(millis("2024-05-01T10:00:00Z")).contains(Phase.PRODUCTION));

        // When
        Set<Phase> due = scheduler.duePhases(millis("2024-05-01T10:00:00Z") - 500L);
        Set<Phase> again = scheduler.duePhases(millis("2024-05-01T10:00:00Z") + 200L);

        // Then
        assertFalse(due.contains(Phase.PRODUCTION));
        assertFalse(again.contains(Phase.PRODUCTION));
    }

    @Test
    void shouldReportBoundariesWithoutMarking() {
        // Given
        WallClockScheduler scheduler = freshScheduler();
        long tenOClock = millis("2024-05-01T10:00:00Z");

        // When & Then
        assertTrue(scheduler.isBoundary(Phase.PRODUCTION, tenOClock + 999L));
        assertFalse(scheduler.isBoundary(Phase.PRODUCTION, tenOClock + 1000L));
        assertTrue(scheduler.lastTriggeredSecond(Phase.PRODUCTION).isEmpty());
        assertTrue(scheduler.duePhases(tenOClock).contains(Phase.PRODUCTION));
    }

    @Test
    void shouldRejectSchedulesSharingPeriodAndOffset() {
        // Given
        List<PhaseSchedule> clashing = List.of(
            new PhaseSchedule(Phase.PRODUCTION, 3600, 0),
            new PhaseSchedule(Phase.POPULATION, 3600, 0));

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new WallClockScheduler(clashing, ManualClock.at("2024-05-01T00:00:00Z")));
    }

    @Test
    void shouldRejectPhaseScheduledTwice() {
        // Given
        List<PhaseSchedule> twice = List.of(
            new PhaseSchedule(Phase.PRODUCTION, 3600, 0),
            new PhaseSchedule(Phase.PRODUCTION, 3600, 60));

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new WallClockScheduler(twice, ManualClock.at("2024-05-01T00:00:00Z")));
    }

    @Test
    void shouldUseClockForDefaultPoll() {
        // Given
        ManualClock clock = ManualClock.at("2024-05-01T10:30:00Z");
        WallClockScheduler scheduler = new WallClockScheduler(EngineConfig.defaults().schedules().values(), clock);

        // When & Then
        assertTrue(scheduler.duePhases().contains(Phase.POPULATION));
    }
}
