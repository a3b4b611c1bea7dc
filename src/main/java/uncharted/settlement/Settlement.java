package uncharted.settlement;

import uncharted.disaster.DisasterEvent;
import uncharted.disaster.DisasterRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A player-owned settlement: the unit of isolation for every simulation phase.
 * <p>
 * The aggregate holds four independent sub-states:
 * <ul>
 *   <li><b>Storage</b> - amount and capacity per {@link ResourceType}</li>
 *   <li><b>Population</b> - the {@link PopulationState} left by the last population phase</li>
 *   <li><b>Queue</b> - pending and active {@link ConstructionQueueEntry} builds</li>
 *   <li><b>Disaster</b> - the active {@link DisasterEvent}, if any, plus archived history</li>
 * </ul>
 * A phase handler receives a freshly loaded copy, mutates it, and the repository persists the
 * whole document in one write. Nothing else shares the instance, so no locking is needed.
 */
public class Settlement {
    private String id;
    private String playerId;
    private String tileId;
    private int resilience;
    private long createdAt;
    private long version;

    private Map<ResourceType, ResourceStock> storage = new EnumMap<>(ResourceType.class);
    private PopulationState population;
    private List<StructureInstance> structures = new ArrayList<>();
    private List<ConstructionQueueEntry> constructionQueue = new ArrayList<>();
    private DisasterEvent activeDisaster;
    private List<DisasterRecord> disasterHistory = new ArrayList<>();

    public Settlement() {
    }

    /**
     * Creates a new settlement with empty storage at the given capacity for every resource.
     */
    public static Settlement create(String id, String playerId, String tileId, long createdAt,
                                    double storageCapacity, PopulationState population) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Settlement id cannot be null or blank");
        }
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id cannot be null or blank");
        }
        Settlement settlement = new Settlement();
        settlement.id = id;
        settlement.playerId = playerId;
        settlement.tileId = tileId;
        settlement.createdAt = createdAt;
        settlement.population = population;
        for (ResourceType resource : ResourceType.values()) {
            settlement.storage.put(resource, ResourceStock.empty(storageCapacity));
        }
        return settlement;
    }

    public ResourceStock stock(ResourceType resource) {
        ResourceStock stock = storage.get(resource);
        return stock != null ? stock : ResourceStock.empty(0.0);
    }

    public List<StructureInstance> standingStructures() {
        return structures.stream().filter(s -> !s.destroyed()).toList();
    }

    public boolean hasStandingStructure(String type) {
        return structures.stream().anyMatch(s -> s.type().equals(type) && !s.destroyed());
    }

    public Optional<StructureInstance> structure(String structureId) {
        return structures.stream().filter(s -> s.id().equals(structureId)).findFirst();
    }

    public void addStructure(StructureInstance structure) {
        structures.add(structure);
    }

    public void replaceStructure(StructureInstance updated) {
        for (int i = 0; i < structures.size(); i++) {
            if (structures.get(i).id().equals(updated.id())) {
                structures.set(i, updated);
                return;
            }
        }
        throw new IllegalArgumentException("Unknown structure " + updated.id() + " in settlement " + id);
    }

    public void removeStructure(String structureId) {
        structures.removeIf(s -> s.id().equals(structureId));
    }

    public void archiveDisaster(DisasterRecord record) {
        disasterHistory.add(record);
        activeDisaster = null;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getPlayerId() { return playerId; }
    public void setPlayerId(String playerId) { this.playerId = playerId; }

    public String getTileId() { return tileId; }
    public void setTileId(String tileId) { this.tileId = tileId; }

    public int getResilience() { return resilience; }
    public void setResilience(int resilience) { this.resilience = resilience; }

    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    /** Document version this copy was loaded at; 0 for a settlement never saved. */
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public Map<ResourceType, ResourceStock> getStorage() { return storage; }
    public void setStorage(Map<ResourceType, ResourceStock> storage) {
        this.storage = new EnumMap<>(ResourceType.class);
        this.storage.putAll(storage);
    }

    public PopulationState getPopulation() { return population; }
    public void setPopulation(PopulationState population) { this.population = population; }

    public List<StructureInstance> getStructures() { return structures; }
    public void setStructures(List<StructureInstance> structures) { this.structures = new ArrayList<>(structures); }

    public List<ConstructionQueueEntry> getConstructionQueue() { return constructionQueue; }
    public void setConstructionQueue(List<ConstructionQueueEntry> constructionQueue) {
        this.constructionQueue = new ArrayList<>(constructionQueue);
    }

    public DisasterEvent getActiveDisaster() { return activeDisaster; }
    public void setActiveDisaster(DisasterEvent activeDisaster) { this.activeDisaster = activeDisaster; }

    public List<DisasterRecord> getDisasterHistory() { return disasterHistory; }
    public void setDisasterHistory(List<DisasterRecord> disasterHistory) {
        this.disasterHistory = new ArrayList<>(disasterHistory);
    }
}
