package uncharted.clock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SystemClockTest {

    @Test
    void shouldApplySkewToWallClockTime() {
        // Given
        SystemClock clock = new SystemClock();
        long before = clock.now();

        // When
        clock.setSkew(Duration.ofHours(1));

        // Then
        long skewed = clock.now();
        assertTrue(skewed - before >= Duration.ofHours(1).toMillis());
        assertTrue(skewed - before < Duration.ofHours(1).toMillis() + 5_000);
    }

    @Test
    void shouldReplaceRatherThanAccumulateSkew() {
        // Given
        SystemClock clock = new SystemClock();
        clock.setSkew(Duration.ofDays(1));

        // When
        clock.setSkew(Duration.ZERO);

        // Then
        assertTrue(Math.abs(clock.now() - System.currentTimeMillis()) < 5_000);
    }

    @Test
    void shouldDeriveEpochSecondAndInstantFromWallClock() {
        // Given
        SystemClock clock = new SystemClock();

        // When
        long millis = clock.now();
        long second = clock.epochSecond();
        long instantMillis = clock.instant().toEpochMilli();

        // Then
        assertTrue(second >= millis / 1000);
        assertTrue(instantMillis >= millis);
    }

    @Test
    void shouldRejectNullSkew() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new SystemClock().setSkew(null));
    }
}
