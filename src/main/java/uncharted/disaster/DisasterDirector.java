package uncharted.disaster;

import uncharted.catalog.BiomeProfile;
import uncharted.catalog.GameCatalog;
import uncharted.catalog.StructureTypes;
import uncharted.config.EngineConfig;
import uncharted.economy.ResourceDelta;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.repair.RepairCostCalculator;
import uncharted.settlement.PopulationState;
import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;
import uncharted.world.TerrainService;
import uncharted.world.TileInfo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Drives each settlement's disaster through its lifecycle.
 * <p>
 * Phases only ever move forward, one at a time:
 * <ul>
 *   <li><b>IDLE → WARNING</b> - a periodic roll, scaled by the biome's vulnerability, picks a type
 *       from the biome's risk lists and a severity, and fixes the schedule</li>
 *   <li><b>WARNING → IMMINENT</b> - a fixed lead time before impact</li>
 *   <li><b>IMMINENT → IMPACT</b> - at the impact time; the damage plan is fixed once</li>
 *   <li><b>IMPACT</b> - damage lands in equal steps on its own sub-interval, independent of the
 *       roll cadence</li>
 *   <li><b>IMPACT → AFTERMATH</b> - after the impact duration; the repair discount window opens</li>
 *   <li><b>AFTERMATH → RESOLVED</b> - when the window closes; resilience is granted and the event
 *       is archived, leaving the settlement IDLE</li>
 * </ul>
 * {@link #advance} catches up as far as the clock allows, so a settlement that was not processed
 * for a while still passes through, and reports, every phase in order.
 */
public class DisasterDirector {
    private static final Logger logger = Logger.getLogger(DisasterDirector.class.getName());

    static final double HIGH_RISK_SHARE = 0.6;
    static final double MODERATE_RISK_SHARE = 0.3;
    static final double SEVERITY_BASE = 20.0;
    static final double SEVERITY_SPREAD = 60.0;

    private final GameCatalog catalog;
    private final TerrainService terrain;
    private final DamageCalculator damageCalculator;
    private final EngineConfig config;
    private final RepairCostCalculator repairCosts;

    public DisasterDirector(GameCatalog catalog, TerrainService terrain, DamageCalculator damageCalculator,
                            EngineConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (terrain == null) {
            throw new IllegalArgumentException("Terrain service cannot be null");
        }
        if (damageCalculator == null) {
            throw new IllegalArgumentException("Damage calculator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.catalog = catalog;
        this.terrain = terrain;
        this.damageCalculator = damageCalculator;
        this.config = config;
        this.repairCosts = new RepairCostCalculator(catalog);
    }

    /**
     * Chance that one disaster check starts a disaster in the given biome.
     */
    public double chancePerCheck(BiomeProfile biome, long checkPeriodSeconds) {
        double chance = config.disasterMode().probabilityPerHour() * (checkPeriodSeconds / 3600.0) * biome.vulnerability();
        return Math.min(1.0, chance);
    }

    /**
     * Rolls for a new disaster. Settlements with an active disaster are not rolled.
     *
     * @return the disaster that was started, if the roll succeeded
     */
    public Optional<DisasterEvent> roll(Settlement settlement, long now, long checkPeriodSeconds,
                                        Random random, List<EngineEvent> events) {
        if (settlement.getActiveDisaster() != null) {
            return Optional.empty();
        }
        Optional<TileInfo> tile = terrain.tile(settlement.getTileId());
        if (tile.isEmpty()) {
            logger.warning("Tile " + settlement.getTileId() + " unavailable; skipping disaster roll for settlement "
                + settlement.getId());
            return Optional.empty();
        }
        Optional<BiomeProfile> biome = catalog.biome(tile.get().biome());
        if (biome.isEmpty()) {
            logger.warning("Unknown biome " + tile.get().biome() + "; skipping disaster roll for settlement "
                + settlement.getId());
            return Optional.empty();
        }
        if (!biome.get().disasterProne()) {
            return Optional.empty();
        }
        if (random.nextDouble() >= chancePerCheck(biome.get(), checkPeriodSeconds)) {
            return Optional.empty();
        }
        DisasterType type = pickType(biome.get(), random);
        int severity = rollSeverity(random);
        return Optional.of(startWarning(settlement, type, severity, tile.get().biome(), now, random, events));
    }

    /**
     * Puts a settlement into WARNING for the given disaster and fixes its schedule.
     *
     * @throws IllegalStateException if the settlement already has an active disaster
     */
    public DisasterEvent startWarning(Settlement settlement, DisasterType type, int severity, String biome,
                                      long now, Random random, List<EngineEvent> events) {
        if (settlement.getActiveDisaster() != null) {
            throw new IllegalStateException("Settlement " + settlement.getId() + " already has an active disaster");
        }
        long warningMillis = Math.round(type.warningSeconds() * config.disasterMode().warningTimeMultiplier()) * 1000L;
        long impactAt = now + warningMillis;
        long imminentAt = Math.max(now, impactAt - config.imminentLeadSeconds() * 1000L);
        long impactEndAt = impactAt + type.impactSeconds() * 1000L;
        String id = new UUID(random.nextLong(), random.nextLong()).toString();

        DisasterEvent disaster = new DisasterEvent(id, type, severity, biome, now, imminentAt, impactAt, impactEndAt);
        settlement.setActiveDisaster(disaster);
        logger.info("Disaster " + type + " (severity " + severity + ") warned for settlement " + settlement.getId()
            + ", impact in " + warningMillis / 1000 + "s");

        events.add(event(EventType.DISASTER_WARNING, settlement, disaster, now)
            .with("severity", severity)
            .with("severityLevel", disaster.getSeverityLevel().name())
            .with("timeToImpactSeconds", warningMillis / 1000)
            .with("impactAt", impactAt)
            .with("recommendedActions", RecommendedActions.of(type, disaster.getSeverityLevel()))
            .build());
        return disaster;
    }

    /**
     * Moves the active disaster forward as far as {@code now} allows, emitting each phase's events
     * in order. Does nothing for an IDLE settlement.
     */
    public void advance(Settlement settlement, long now, Random random, List<EngineEvent> events) {
        while (settlement.getActiveDisaster() != null) {
            DisasterEvent disaster = settlement.getActiveDisaster();
            boolean moved = switch (disaster.getPhase()) {
                case WARNING -> enterImminent(settlement, disaster, now, events);
                case IMMINENT -> enterImpact(settlement, disaster, now, random, events);
                case IMPACT -> {
                    applyDueDamage(settlement, disaster, now, events);
                    yield enterAftermath(settlement, disaster, now, events);
                }
                case AFTERMATH -> resolve(settlement, disaster, now, events);
                case IDLE, RESOLVED -> throw new IllegalStateException(
                    "Active disaster " + disaster.getId() + " is in phase " + disaster.getPhase());
            };
            if (!moved) {
                return;
            }
        }
    }

    DisasterType pickType(BiomeProfile biome, Random random) {
        double roll = random.nextDouble();
        List<List<DisasterType>> order = new ArrayList<>();
        if (roll < HIGH_RISK_SHARE) {
            order.add(biome.highRisk());
        } else if (roll < HIGH_RISK_SHARE + MODERATE_RISK_SHARE) {
            order.add(biome.moderateRisk());
        } else {
            order.add(biome.lowRisk());
        }
        order.add(biome.highRisk());
        order.add(biome.moderateRisk());
        order.add(biome.lowRisk());
        for (List<DisasterType> candidates : order) {
            if (!candidates.isEmpty()) {
                return candidates.get(random.nextInt(candidates.size()));
            }
        }
        throw new IllegalStateException("Biome has no disaster risks");
    }

    int rollSeverity(Random random) {
        double raw = (SEVERITY_BASE + random.nextDouble() * SEVERITY_SPREAD) * config.disasterMode().severityMultiplier();
        return (int) Math.max(0, Math.min(100, Math.round(raw)));
    }

    private boolean enterImminent(Settlement settlement, DisasterEvent disaster, long now, List<EngineEvent> events) {
        if (now < disaster.getImminentAt()) {
            return false;
        }
        disaster.advance(disaster.getImminentAt());
        events.add(event(EventType.DISASTER_IMMINENT, settlement, disaster, disaster.getImminentAt())
            .with("impactAt", disaster.getImpactAt())
            .with("timeToImpactSeconds", (disaster.getImpactAt() - disaster.getImminentAt()) / 1000)
            .build());
        return true;
    }

    private boolean enterImpact(Settlement settlement, DisasterEvent disaster, long now, Random random,
                                List<EngineEvent> events) {
        if (now < disaster.getImpactAt()) {
            return false;
        }
        DamagePlan plan = damageCalculator.plan(settlement, disaster.getType(), disaster.getSeverity(), random);
        long durationSeconds = disaster.impactDurationSeconds();
        int steps = (int) Math.max(1, (durationSeconds + config.damageIntervalSeconds() - 1) / config.damageIntervalSeconds());
        disaster.setNetDamage(plan.netDamage());
        disaster.setPlannedCasualties(plan.casualties());
        disaster.setDamageSteps(steps);
        disaster.setDamageStepsApplied(0);
        disaster.advance(disaster.getImpactAt());
        logger.info("Disaster " + disaster.getId() + " impacting settlement " + settlement.getId()
            + " with net damage " + String.format("%.1f", plan.netDamage()) + " over " + steps + " steps");

        events.add(event(EventType.DISASTER_IMPACT_START, settlement, disaster, disaster.getImpactAt())
            .with("durationSeconds", durationSeconds)
            .with("impactEndsAt", disaster.getImpactEndAt())
            .with("severity", disaster.getSeverity())
            .with("preparedness", plan.preparedness())
            .build());
        return true;
    }

    private void applyDueDamage(Settlement settlement, DisasterEvent disaster, long now, List<EngineEvent> events) {
        int steps = disaster.getDamageSteps();
        int due;
        if (now >= disaster.getImpactEndAt()) {
            due = steps;
        } else {
            long elapsedSeconds = Math.max(0, (now - disaster.getImpactAt()) / 1000L);
            due = (int) Math.min(steps, elapsedSeconds / config.damageIntervalSeconds());
        }
        while (disaster.getDamageStepsApplied() < due) {
            int step = disaster.getDamageStepsApplied() + 1;
            long stepAt = step == steps
                ? disaster.getImpactEndAt()
                : disaster.getImpactAt() + step * config.damageIntervalSeconds() * 1000L;
            applyDamageStep(settlement, disaster, step, stepAt, events);
            disaster.setDamageStepsApplied(step);
        }
    }

    private void applyDamageStep(Settlement settlement, DisasterEvent disaster, int step, long at,
                                 List<EngineEvent> events) {
        int steps = disaster.getDamageSteps();
        double stepDamage = disaster.getNetDamage() / steps;
        double storageDamage = 0.0;
        int storageStructures = 0;

        for (StructureInstance structure : new ArrayList<>(settlement.getStructures())) {
            if (structure.destroyed()) {
                continue;
            }
            double damage = damageCalculator.structureDamage(structure, disaster.getType(), stepDamage);
            if (damage <= 0) {
                continue;
            }
            double dealt = Math.min(structure.health(), damage);
            if (isStorage(structure)) {
                storageDamage += dealt;
                storageStructures++;
            }
            StructureInstance damaged = structure.withHealth(structure.health() - damage);
            if (damaged.destroyed()) {
                settlement.removeStructure(structure.id());
                disaster.recordDestroyed(structure.id());
                events.add(event(EventType.STRUCTURE_DESTROYED, settlement, disaster, at)
                    .with("structureId", structure.id())
                    .with("structureType", structure.type())
                    .build());
            } else {
                settlement.replaceStructure(damaged);
                disaster.recordDamaged(structure.id());
                events.add(event(EventType.STRUCTURE_DAMAGED, settlement, disaster, at)
                    .with("structureId", structure.id())
                    .with("structureType", structure.type())
                    .with("damage", dealt)
                    .with("health", damaged.health())
                    .build());
            }
        }

        if (storageStructures > 0) {
            loseStoredResources(settlement, disaster, storageDamage / storageStructures / 100.0);
        }
        applyCasualties(settlement, disaster, step);

        int progress = step == steps ? 100 : (int) Math.floor(step * 100.0 / steps);
        events.add(event(EventType.DISASTER_DAMAGE_UPDATE, settlement, disaster, at)
            .with("step", step)
            .with("steps", steps)
            .with("progress", progress)
            .with("casualties", disaster.getCasualties())
            .with("structuresDamaged", disaster.getDamagedStructureIds().size())
            .with("structuresDestroyed", disaster.getDestroyedStructureIds().size())
            .build());
    }

    private void loseStoredResources(Settlement settlement, DisasterEvent disaster, double lossFraction) {
        Map<ResourceType, ResourceStock> storage = new EnumMap<>(ResourceType.class);
        storage.putAll(settlement.getStorage());
        for (Map.Entry<ResourceType, ResourceStock> entry : settlement.getStorage().entrySet()) {
            double lost = entry.getValue().amount() * Math.min(1.0, lossFraction);
            if (lost > 0) {
                storage.put(entry.getKey(), entry.getValue().withAmount(entry.getValue().amount() - lost));
                disaster.recordResourceLost(entry.getKey(), lost);
            }
        }
        settlement.setStorage(storage);
    }

    private void applyCasualties(Settlement settlement, DisasterEvent disaster, int step) {
        int planned = disaster.getPlannedCasualties();
        int steps = disaster.getDamageSteps();
        int share = (int) ((long) planned * step / steps - (long) planned * (step - 1) / steps);
        PopulationState population = settlement.getPopulation();
        if (share <= 0 || population == null) {
            return;
        }
        int applied = Math.min(share, population.current());
        settlement.setPopulation(new PopulationState(population.current() - applied, population.capacity(),
            population.happiness(), population.growthRate(), population.status(), population.growthProgress(),
            population.lastUpdatedAt()));
        disaster.setCasualties(disaster.getCasualties() + applied);
    }

    private boolean enterAftermath(Settlement settlement, DisasterEvent disaster, long now, List<EngineEvent> events) {
        if (now < disaster.getImpactEndAt() || disaster.getDamageStepsApplied() < disaster.getDamageSteps()) {
            return false;
        }
        long at = disaster.getImpactEndAt();
        disaster.advance(at);
        disaster.setAftermathEndsAt(at + config.aftermathSeconds() * 1000L);

        Map<String, Double> lost = new java.util.LinkedHashMap<>();
        disaster.getResourcesLost().forEach((resource, amount) -> lost.put(resource.key(), amount));
        events.add(event(EventType.DISASTER_IMPACT_END, settlement, disaster, at)
            .with("casualties", disaster.getCasualties())
            .with("structuresDamaged", disaster.getDamagedStructureIds().size())
            .with("structuresDestroyed", disaster.getDestroyedStructureIds().size())
            .with("resourcesLost", lost)
            .build());
        if (disaster.getCasualties() > 0) {
            events.add(event(EventType.CASUALTIES_REPORT, settlement, disaster, at)
                .with("casualties", disaster.getCasualties())
                .with("population", settlement.getPopulation() == null ? 0 : settlement.getPopulation().current())
                .build());
        }
        Map<String, Double> repairCost = new java.util.LinkedHashMap<>();
        estimateRepairCost(settlement, disaster, at).asMap()
            .forEach((resource, amount) -> repairCost.put(resource.key(), amount));
        events.add(event(EventType.DISASTER_AFTERMATH, settlement, disaster, at)
            .with("repairDiscountEndsAt", disaster.getAftermathEndsAt())
            .with("estimatedRepairCost", repairCost)
            .build());
        return true;
    }

    /**
     * Cost of bringing every damaged standing structure back to full health, priced inside the
     * aftermath discount window.
     */
    private ResourceDelta estimateRepairCost(Settlement settlement, DisasterEvent disaster, long at) {
        ResourceDelta total = ResourceDelta.zero();
        for (StructureInstance structure : settlement.standingStructures()) {
            if (structure.health() >= StructureInstance.FULL_HEALTH || catalog.structure(structure.type()).isEmpty()) {
                continue;
            }
            total = total.plus(repairCosts.cost(settlement, structure.type(), disaster.getType(),
                StructureInstance.FULL_HEALTH - structure.health(), at));
        }
        return total;
    }

    private boolean resolve(Settlement settlement, DisasterEvent disaster, long now, List<EngineEvent> events) {
        if (now < disaster.getAftermathEndsAt()) {
            return false;
        }
        long at = disaster.getAftermathEndsAt();
        int gain = disaster.getSeverityLevel().resilienceGain();
        int before = settlement.getResilience();
        settlement.setResilience(Math.min(100, before + gain));
        disaster.advance(at);
        settlement.archiveDisaster(new DisasterRecord(disaster.getId(), disaster.getType(), disaster.getSeverity(),
            disaster.getSeverityLevel(), disaster.getWarningAt(), at, disaster.getCasualties(),
            disaster.getDamagedStructureIds().size(), disaster.getDestroyedStructureIds().size(),
            settlement.getResilience() - before));
        logger.info("Disaster " + disaster.getId() + " resolved for settlement " + settlement.getId()
            + "; resilience " + before + " -> " + settlement.getResilience());

        events.add(event(EventType.DISASTER_RESOLVED, settlement, disaster, at)
            .with("resilienceGain", settlement.getResilience() - before)
            .with("resilience", settlement.getResilience())
            .build());
        return true;
    }

    private static boolean isStorage(StructureInstance structure) {
        return StructureTypes.STORAGE.equals(structure.type()) || StructureTypes.WAREHOUSE.equals(structure.type());
    }

    private static EngineEvent.Builder event(EventType type, Settlement settlement, DisasterEvent disaster, long at) {
        return EngineEvent.builder(type, settlement.getId(), at)
            .with("disasterId", disaster.getId())
            .with("disasterType", disaster.getType().name())
            .with("phase", disaster.getPhase().name());
    }
}
