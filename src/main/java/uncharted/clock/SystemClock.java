package uncharted.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock the engine schedules against.
 * <p>
 * Phase boundaries are derived from {@link #now()} in epoch milliseconds, never from process
 * uptime, so an engine restarted mid-hour still fires on the same boundaries as the one it
 * replaced. {@link #nanoTime()} is only used to time passes.
 */
public class SystemClock {
    private volatile long skewMillis = 0L;

    public long nanoTime() {
        return System.nanoTime();
    }

    /**
     * Current wall-clock time in epoch milliseconds, including any configured skew.
     * Not monotonic: NTP corrections and skew changes can move it backwards.
     */
    public long now() {
        return System.currentTimeMillis() + skewMillis;
    }

    public long epochSecond() {
        return Math.floorDiv(now(), 1000L);
    }

    public Instant instant() {
        return Instant.ofEpochMilli(now());
    }

    /**
     * Shifts wall-clock time, e.g. to exercise a boundary without waiting for it.
     */
    public void setSkew(Duration skew) {
        if (skew == null) {
            throw new IllegalArgumentException("Skew cannot be null");
        }
        this.skewMillis = skew.toMillis();
    }
}
