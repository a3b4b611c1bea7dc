package uncharted.config;

import uncharted.disaster.DisasterMode;
import uncharted.simulation.Phase;
import uncharted.simulation.PhaseSchedule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the tick engine: loop cadence, worker pool, phase schedules and game tuning.
 * Immutable configuration object with builder pattern support.
 */
public final class EngineConfig {

    // === Loop ===
    private final long tickIntervalMillis;
    private final int workerThreads;
    private final Map<Phase, PhaseSchedule> schedules;

    // === Disasters ===
    private final DisasterMode disasterMode;
    private final long imminentLeadSeconds;
    private final long damageIntervalSeconds;
    private final long aftermathSeconds;

    // === Construction, repair, storage ===
    private final int constructionSlots;
    private final int maxQueueLength;
    private final double repairPerHour;
    private final double storageWarningThreshold;

    private final Long randomSeed;

    private EngineConfig(Builder builder) {
        this.tickIntervalMillis = builder.tickIntervalMillis;
        this.workerThreads = builder.workerThreads;
        this.schedules = Collections.unmodifiableMap(new EnumMap<>(builder.schedules));
        this.disasterMode = builder.disasterMode;
        this.imminentLeadSeconds = builder.imminentLeadSeconds;
        this.damageIntervalSeconds = builder.damageIntervalSeconds;
        this.aftermathSeconds = builder.aftermathSeconds;
        this.constructionSlots = builder.constructionSlots;
        this.maxQueueLength = builder.maxQueueLength;
        this.repairPerHour = builder.repairPerHour;
        this.storageWarningThreshold = builder.storageWarningThreshold;
        this.randomSeed = builder.randomSeed;

        validate();
    }

    private void validate() {
        if (tickIntervalMillis <= 0) {
            throw new IllegalArgumentException("tickIntervalMillis must be positive");
        }
        if (tickIntervalMillis > 1000) {
            throw new IllegalArgumentException("tickIntervalMillis must not exceed 1000 or epoch seconds could be missed");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        for (Phase phase : Phase.values()) {
            if (!schedules.containsKey(phase)) {
                throw new IllegalArgumentException("No schedule for phase " + phase);
            }
        }
        if (disasterMode == null) {
            throw new IllegalArgumentException("disasterMode cannot be null");
        }
        if (imminentLeadSeconds < 0) {
            throw new IllegalArgumentException("imminentLeadSeconds cannot be negative");
        }
        if (damageIntervalSeconds <= 0) {
            throw new IllegalArgumentException("damageIntervalSeconds must be positive");
        }
        if (aftermathSeconds < 0) {
            throw new IllegalArgumentException("aftermathSeconds cannot be negative");
        }
        if (constructionSlots <= 0) {
            throw new IllegalArgumentException("constructionSlots must be positive");
        }
        if (maxQueueLength < constructionSlots) {
            throw new IllegalArgumentException("maxQueueLength must be at least constructionSlots");
        }
        if (repairPerHour < 0) {
            throw new IllegalArgumentException("repairPerHour cannot be negative");
        }
        if (storageWarningThreshold <= 0 || storageWarningThreshold > 1) {
            throw new IllegalArgumentException("storageWarningThreshold must be in (0, 1]");
        }
    }

    public long tickIntervalMillis() {
        return tickIntervalMillis;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Map<Phase, PhaseSchedule> schedules() {
        return schedules;
    }

    public PhaseSchedule schedule(Phase phase) {
        return schedules.get(phase);
    }

    public DisasterMode disasterMode() {
        return disasterMode;
    }

    public long imminentLeadSeconds() {
        return imminentLeadSeconds;
    }

    public long damageIntervalSeconds() {
        return damageIntervalSeconds;
    }

    public long aftermathSeconds() {
        return aftermathSeconds;
    }

    public int constructionSlots() {
        return constructionSlots;
    }

    public int maxQueueLength() {
        return maxQueueLength;
    }

    public double repairPerHour() {
        return repairPerHour;
    }

    public double storageWarningThreshold() {
        return storageWarningThreshold;
    }

    /** Seed for reproducible runs, or null to draw from ThreadLocalRandom. */
    public Long randomSeed() {
        return randomSeed;
    }

    /**
     * Creates a builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration with default values.
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a configuration from defaults overlaid with any {@code engine.*} keys present.
     * Schedules use {@code engine.schedule.<phase>.period} and {@code engine.schedule.<phase>.offset}
     * with the phase name in lower case.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or the result is invalid
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        try {
            String value;
            if ((value = properties.getProperty("engine.tickIntervalMillis")) != null) {
                builder.tickIntervalMillis(Long.parseLong(value.trim()));
            }
            if ((value = properties.getProperty("engine.workerThreads")) != null) {
                builder.workerThreads(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("engine.disasterMode")) != null) {
                builder.disasterMode(DisasterMode.valueOf(value.trim().toUpperCase()));
            }
            if ((value = properties.getProperty("engine.imminentLeadSeconds")) != null) {
                builder.imminentLeadSeconds(Long.parseLong(value.trim()));
            }
            if ((value = properties.getProperty("engine.damageIntervalSeconds")) != null) {
                builder.damageIntervalSeconds(Long.parseLong(value.trim()));
            }
            if ((value = properties.getProperty("engine.aftermathSeconds")) != null) {
                builder.aftermathSeconds(Long.parseLong(value.trim()));
            }
            if ((value = properties.getProperty("engine.constructionSlots")) != null) {
                builder.constructionSlots(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("engine.maxQueueLength")) != null) {
                builder.maxQueueLength(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("engine.repairPerHour")) != null) {
                builder.repairPerHour(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("engine.storageWarningThreshold")) != null) {
                builder.storageWarningThreshold(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("engine.randomSeed")) != null && !value.isBlank()) {
                builder.randomSeed(Long.parseLong(value.trim()));
            }
            for (Phase phase : Phase.values()) {
                String prefix = "engine.schedule." + phase.name().toLowerCase() + ".";
                String period = properties.getProperty(prefix + "period");
                String offset = properties.getProperty(prefix + "offset");
                if (period != null || offset != null) {
                    PhaseSchedule current = builder.schedules.get(phase);
                    builder.schedule(new PhaseSchedule(phase,
                        period != null ? Long.parseLong(period.trim()) : current.periodSeconds(),
                        offset != null ? Long.parseLong(offset.trim()) : current.offsetSeconds()));
                }
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric engine property: " + e.getMessage(), e);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("EngineConfig{tickIntervalMillis=%d, workerThreads=%d, disasterMode=%s, "
                + "imminentLeadSeconds=%d, damageIntervalSeconds=%d, aftermathSeconds=%d, constructionSlots=%d, "
                + "maxQueueLength=%d, repairPerHour=%.2f, schedules=%s}",
            tickIntervalMillis, workerThreads, disasterMode, imminentLeadSeconds, damageIntervalSeconds,
            aftermathSeconds, constructionSlots, maxQueueLength, repairPerHour, schedules.values());
    }

    /**
     * Builder for EngineConfig with fluent API.
     */
    public static final class Builder {
        private long tickIntervalMillis = 250; // several looks per epoch second so none is skipped
        private int workerThreads = 4;
        private final Map<Phase, PhaseSchedule> schedules = new EnumMap<>(Phase.class);
        private DisasterMode disasterMode = DisasterMode.STANDARD;
        private long imminentLeadSeconds = 30 * 60;
        private long damageIntervalSeconds = 10 * 60;
        private long aftermathSeconds = 48 * 60 * 60;
        private int constructionSlots = 1;
        private int maxQueueLength = 10;
        private double repairPerHour = 1.0;
        private double storageWarningThreshold = 0.9;
        private Long randomSeed;

        private Builder() {
            for (Phase phase : Phase.values()) {
                schedules.put(phase, phase.defaultSchedule());
            }
        }

        public Builder tickIntervalMillis(long tickIntervalMillis) {
            this.tickIntervalMillis = tickIntervalMillis;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder schedule(PhaseSchedule schedule) {
            this.schedules.put(schedule.phase(), schedule);
            return this;
        }

        public Builder disasterMode(DisasterMode disasterMode) {
            this.disasterMode = disasterMode;
            return this;
        }

        public Builder imminentLeadSeconds(long imminentLeadSeconds) {
            this.imminentLeadSeconds = imminentLeadSeconds;
            return this;
        }

        public Builder damageIntervalSeconds(long damageIntervalSeconds) {
            this.damageIntervalSeconds = damageIntervalSeconds;
            return this;
        }

        public Builder aftermathSeconds(long aftermathSeconds) {
            this.aftermathSeconds = aftermathSeconds;
            return this;
        }

        public Builder constructionSlots(int constructionSlots) {
            this.constructionSlots = constructionSlots;
            return this;
        }

        public Builder maxQueueLength(int maxQueueLength) {
            this.maxQueueLength = maxQueueLength;
            return this;
        }

        public Builder repairPerHour(double repairPerHour) {
            this.repairPerHour = repairPerHour;
            return this;
        }

        public Builder storageWarningThreshold(double storageWarningThreshold) {
            this.storageWarningThreshold = storageWarningThreshold;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
