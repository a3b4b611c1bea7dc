package uncharted.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uncharted.codec.JsonCodec;
import uncharted.disaster.DisasterEvent;
import uncharted.disaster.DisasterType;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.storage.BytesKey;
import uncharted.storage.SimulatedStorage;
import uncharted.storage.VersionedValue;
import uncharted.support.Fixtures;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StorageSettlementRepositoryTest {

    private SimulatedStorage storage;
    private StorageSettlementRepository repository;

    @BeforeEach
    void setUp() {
        storage = new SimulatedStorage(new Random(42L));
        repository = new StorageSettlementRepository(storage, new JsonCodec());
    }

    @Test
    void shouldRoundTripWholeAggregate() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 7);
        Fixtures.setAmount(settlement, ResourceType.FOOD, 123.5);
        settlement.addStructure(Fixtures.structure("farm-1", "FARM").withHealth(64.0));
        settlement.setResilience(12);
        settlement.setActiveDisaster(new DisasterEvent("d1", DisasterType.FLOOD, 55, "GRASSLAND",
            1_000L, 2_000L, 3_000L, 4_000L));

        // When
        repository.save(settlement);
        Settlement loaded = repository.findById("s1").orElseThrow();

        // Then
        assertEquals(1, loaded.getVersion());
        assertEquals(123.5, loaded.stock(ResourceType.FOOD).amount(), 1e-9);
        assertEquals(1000.0, loaded.stock(ResourceType.ORE).capacity(), 1e-9);
        assertEquals(7, loaded.getPopulation().current());
        assertEquals(64.0, loaded.structure("farm-1").orElseThrow().health(), 1e-9);
        assertEquals(12, loaded.getResilience());
        assertEquals(DisasterType.FLOOD, loaded.getActiveDisaster().getType());
        assertEquals(3_000L, loaded.getActiveDisaster().getImpactAt());
    }

    @Test
    void shouldReturnEmptyForUnknownId() {
        // When & Then
        assertTrue(repository.findById("missing").isEmpty());
    }

    @Test
    void shouldHandOutIndependentCopies() {
        // Given
        repository.save(Fixtures.settlement("s1", 5));
        Settlement first = repository.findById("s1").orElseThrow();

        // When
        first.setResilience(50);

        // Then
        assertEquals(0, repository.findById("s1").orElseThrow().getResilience());
    }

    @Test
    void shouldRejectStaleSave() {
        // Given
        repository.save(Fixtures.settlement("s1", 5));
        Settlement a = repository.findById("s1").orElseThrow();
        Settlement b = repository.findById("s1").orElseThrow();
        a.setResilience(10);
        repository.save(a);

        // When
        b.setResilience(20);

        // Then
        assertThrows(PersistenceException.class, () -> repository.save(b));
        assertEquals(10, repository.findById("s1").orElseThrow().getResilience());
    }

    @Test
    void shouldLeaveStoredStateUnchangedWhenWriteFails() {
        // Given
        repository.save(Fixtures.settlement("s1", 5));
        Settlement loaded = repository.findById("s1").orElseThrow();
        loaded.setResilience(30);
        storage.setWriteFailureProbability(1.0);

        // When
        assertThrows(PersistenceException.class, () -> repository.save(loaded));

        // Then
        storage.setWriteFailureProbability(0.0);
        assertEquals(1, loaded.getVersion());
        Settlement stored = repository.findById("s1").orElseThrow();
        assertEquals(0, stored.getResilience());
        assertEquals(1, stored.getVersion());

        repository.save(loaded);
        assertEquals(30, repository.findById("s1").orElseThrow().getResilience());
    }

    @Test
    void shouldRejectInvalidAggregateWithoutWriting() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);
        settlement.getStorage().remove(ResourceType.WATER);

        // When & Then
        assertThrows(ValidationException.class, () -> repository.save(settlement));
        assertEquals(0, storage.size());
    }

    @Test
    void shouldReportUndecodableDocument() {
        // Given
        storage.set(BytesKey.of("settlement:broken").bytes(),
            new VersionedValue("{not json".getBytes(StandardCharsets.UTF_8), 1L));

        // When
        ValidationException error = assertThrows(ValidationException.class, () -> repository.findById("broken"));

        // Then
        assertEquals("broken", error.settlementId());
    }

    @Test
    void shouldWrapReadFailures() {
        // Given
        storage.setReadFailureProbability(1.0);

        // When & Then
        assertThrows(PersistenceException.class, () -> repository.findById("s1"));
        assertThrows(PersistenceException.class, () -> repository.save(Fixtures.settlement("s1", 5)));
    }

    @Test
    void shouldListIdsInOrder() {
        // Given
        repository.save(Fixtures.settlement("b", 1));
        repository.save(Fixtures.settlement("a", 1));
        repository.save(Fixtures.settlement("c", 1));
        storage.set(BytesKey.of("tile:x").bytes(), new VersionedValue(new byte[]{1}, 1L));

        // When
        List<String> ids = repository.listIds();

        // Then
        assertEquals(List.of("a", "b", "c"), ids);
    }

    @Test
    void shouldDeleteSettlement() {
        // Given
        repository.save(Fixtures.settlement("s1", 1));

        // When
        repository.delete("s1");

        // Then
        assertTrue(repository.findById("s1").isEmpty());
        assertTrue(repository.listIds().isEmpty());
    }
}
