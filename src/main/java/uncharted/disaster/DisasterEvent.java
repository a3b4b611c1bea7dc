package uncharted.disaster;

import uncharted.settlement.ResourceType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An active disaster bearing down on, or recovering in, one settlement.
 * <p>
 * The schedule ({@code imminentAt}, {@code impactAt}, {@code impactEndAt}) is fixed when the
 * warning is issued. {@code transitions} records when each phase was actually entered, and the
 * damage plan is fixed once at the start of impact so every damage step applies an equal share
 * of it.
 */
public class DisasterEvent {
    private String id;
    private DisasterType type;
    private int severity;
    private SeverityLevel severityLevel;
    private String biome;
    private DisasterPhase phase = DisasterPhase.WARNING;

    private long warningAt;
    private long imminentAt;
    private long impactAt;
    private long impactEndAt;
    private long aftermathEndsAt;
    private Map<DisasterPhase, Long> transitions = new LinkedHashMap<>();

    private double netDamage;
    private int plannedCasualties;
    private int damageSteps;
    private int damageStepsApplied;

    private int casualties;
    private List<String> damagedStructureIds = new ArrayList<>();
    private List<String> destroyedStructureIds = new ArrayList<>();
    private Map<ResourceType, Double> resourcesLost = new EnumMap<>(ResourceType.class);

    public DisasterEvent() {
    }

    public DisasterEvent(String id, DisasterType type, int severity, String biome,
                         long warningAt, long imminentAt, long impactAt, long impactEndAt) {
        if (severity < 0 || severity > 100) {
            throw new IllegalArgumentException("Severity must be between 0 and 100");
        }
        if (!(warningAt <= imminentAt && imminentAt <= impactAt && impactAt <= impactEndAt)) {
            throw new IllegalArgumentException("Disaster schedule must be ordered warning <= imminent <= impact <= end");
        }
        this.id = id;
        this.type = type;
        this.severity = severity;
        this.severityLevel = SeverityLevel.of(severity);
        this.biome = biome;
        this.warningAt = warningAt;
        this.imminentAt = imminentAt;
        this.impactAt = impactAt;
        this.impactEndAt = impactEndAt;
        this.transitions.put(DisasterPhase.WARNING, warningAt);
    }

    /**
     * Moves to the next phase, recording when it happened.
     *
     * @return the phase just entered
     */
    public DisasterPhase advance(long at) {
        phase = phase.next();
        transitions.put(phase, at);
        return phase;
    }

    public long impactDurationSeconds() {
        return (impactEndAt - impactAt) / 1000L;
    }

    public void recordDamaged(String structureId) {
        if (!damagedStructureIds.contains(structureId)) {
            damagedStructureIds.add(structureId);
        }
    }

    public void recordDestroyed(String structureId) {
        if (!destroyedStructureIds.contains(structureId)) {
            destroyedStructureIds.add(structureId);
        }
    }

    public void recordResourceLost(ResourceType resource, double amount) {
        resourcesLost.merge(resource, amount, Double::sum);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public DisasterType getType() { return type; }
    public void setType(DisasterType type) { this.type = type; }

    public int getSeverity() { return severity; }
    public void setSeverity(int severity) { this.severity = severity; }

    public SeverityLevel getSeverityLevel() { return severityLevel; }
    public void setSeverityLevel(SeverityLevel severityLevel) { this.severityLevel = severityLevel; }

    public String getBiome() { return biome; }
    public void setBiome(String biome) { this.biome = biome; }

    public DisasterPhase getPhase() { return phase; }
    public void setPhase(DisasterPhase phase) { this.phase = phase; }

    public long getWarningAt() { return warningAt; }
    public void setWarningAt(long warningAt) { this.warningAt = warningAt; }

    public long getImminentAt() { return imminentAt; }
    public void setImminentAt(long imminentAt) { this.imminentAt = imminentAt; }

    public long getImpactAt() { return impactAt; }
    public void setImpactAt(long impactAt) { this.impactAt = impactAt; }

    public long getImpactEndAt() { return impactEndAt; }
    public void setImpactEndAt(long impactEndAt) { this.impactEndAt = impactEndAt; }

    public long getAftermathEndsAt() { return aftermathEndsAt; }
    public void setAftermathEndsAt(long aftermathEndsAt) { this.aftermathEndsAt = aftermathEndsAt; }

    public Map<DisasterPhase, Long> getTransitions() { return transitions; }
    public void setTransitions(Map<DisasterPhase, Long> transitions) { this.transitions = new LinkedHashMap<>(transitions); }

    public double getNetDamage() { return netDamage; }
    public void setNetDamage(double netDamage) { this.netDamage = netDamage; }

    public int getPlannedCasualties() { return plannedCasualties; }
    public void setPlannedCasualties(int plannedCasualties) { this.plannedCasualties = plannedCasualties; }

    public int getDamageSteps() { return damageSteps; }
    public void setDamageSteps(int damageSteps) { this.damageSteps = damageSteps; }

    public int getDamageStepsApplied() { return damageStepsApplied; }
    public void setDamageStepsApplied(int damageStepsApplied) { this.damageStepsApplied = damageStepsApplied; }

    public int getCasualties() { return casualties; }
    public void setCasualties(int casualties) { this.casualties = casualties; }

    public List<String> getDamagedStructureIds() { return damagedStructureIds; }
    public void setDamagedStructureIds(List<String> ids) { this.damagedStructureIds = new ArrayList<>(ids); }

    public List<String> getDestroyedStructureIds() { return destroyedStructureIds; }
    public void setDestroyedStructureIds(List<String> ids) { this.destroyedStructureIds = new ArrayList<>(ids); }

    public Map<ResourceType, Double> getResourcesLost() { return resourcesLost; }
    public void setResourcesLost(Map<ResourceType, Double> resourcesLost) {
        this.resourcesLost = new EnumMap<>(ResourceType.class);
        this.resourcesLost.putAll(resourcesLost);
    }
}
