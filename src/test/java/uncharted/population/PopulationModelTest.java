package uncharted.population;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uncharted.disaster.PreparednessCalculator;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.settlement.PopulationState;
import uncharted.settlement.PopulationStatus;
import uncharted.settlement.Settlement;
import uncharted.support.Fixtures;
import uncharted.support.FixedRandom;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PopulationModelTest {

    private static final long ONE_HOUR_LATER = Fixtures.CREATED_AT + 3_600_000L;

    private PopulationModel model;
    private List<EngineEvent> events;

    @BeforeEach
    void setUp() {
        model = new PopulationModel(Fixtures.catalog(),
            new HappinessCalculator(Fixtures.catalog(), new PreparednessCalculator(Fixtures.catalog())));
        events = new ArrayList<>();
    }

    @Test
    void shouldReportGrowingWhenVeryHappy() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);

        // When
        PopulationState state = model.apply(settlement, 85.0, 10, ONE_HOUR_LATER, FixedRandom.neverHits(), events);

        // Then
        assertEquals(PopulationStatus.GROWING, state.status());
        assertEquals(0.025, state.growthRate(), 1e-9);
        assertEquals(5, state.current());
        assertEquals(0.125, state.growthProgress(), 1e-9);
        assertSame(state, settlement.getPopulation());
        assertEquals(ONE_HOUR_LATER, state.lastUpdatedAt());
    }

    @Test
    void shouldAddImmigrantsWhenRollSucceeds() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);

        // When
        PopulationState state = model.apply(settlement, 85.0, 10, ONE_HOUR_LATER, FixedRandom.alwaysHits(), events);

        // Then
        assertEquals(10, state.current());
        EngineEvent arrived = events.stream().filter(e -> e.type() == EventType.SETTLER_ARRIVED).findFirst().orElseThrow();
        assertEquals(5, arrived.data().get("count"));
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.POPULATION_GROWTH));
    }

    @Test
    void shouldLimitImmigrantsToRemainingCapacity() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 9);

        // When
        PopulationState state = model.apply(settlement, 95.0, 10, ONE_HOUR_LATER, FixedRandom.alwaysHits(), events);

        // Then
        assertEquals(10, state.current());
        assertTrue(state.current() <= state.capacity());
    }

    @Test
    void shouldEvictOverflowWhenHousingShrinks() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 8);

        // When
        PopulationState state = model.apply(settlement, 50.0, 5, ONE_HOUR_LATER, FixedRandom.neverHits(), events);

        // Then
        assertEquals(5, state.current());
        assertEquals(5, state.capacity());
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.POPULATION_WARNING
            && PopulationModel.NO_HOUSING.equals(e.data().get("warning"))));
        EngineEvent departed = events.stream().filter(e -> e.type() == EventType.SETTLER_DEPARTED).findFirst().orElseThrow();
        assertEquals(3, departed.data().get("count"));
    }

    @Test
    void shouldEmigrateWhenMiserable() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 10);

        // When
        PopulationState state = model.apply(settlement, 10.0, 10, ONE_HOUR_LATER, new FixedRandom(0.0, 2), events);

        // Then: at most a fifth of the settlers leave in one phase
        assertEquals(8, state.current());
        assertEquals(PopulationStatus.DECLINING, state.status());
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.SETTLER_DEPARTED
            && "emigration".equals(e.data().get("reason"))));
        assertTrue(events.stream().anyMatch(e -> PopulationModel.LOW_HAPPINESS.equals(e.data().get("warning"))));
        assertTrue(events.stream().anyMatch(e -> PopulationModel.EMIGRATION_RISK.equals(e.data().get("warning"))));
    }

    @Test
    void shouldCarryFractionalGrowthBetweenPhases() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);
        long twentyHoursLater = Fixtures.CREATED_AT + 20 * 3_600_000L;

        // When
        PopulationState state = model.apply(settlement, 70.0, 10, twentyHoursLater, FixedRandom.neverHits(), events);

        // Then: 5 × 0.015 × 20h = 1.5 settlers
        assertEquals(6, state.current());
        assertEquals(0.5, state.growthProgress(), 1e-9);
    }

    @Test
    void shouldStayStableWhenContent() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);

        // When
        PopulationState state = model.apply(settlement, 50.0, 10, ONE_HOUR_LATER, FixedRandom.alwaysHits(), events);

        // Then
        assertEquals(PopulationStatus.STABLE, state.status());
        assertEquals(5, state.current());
        assertTrue(events.isEmpty());
    }

    @Test
    void shouldAddHousingModifiersToBaseCapacity() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 5);
        settlement.addStructure(Fixtures.structure("house-1", "HOUSE"));
        settlement.addStructure(Fixtures.structure("tent-1", "TENT"));

        // When
        int capacity = model.capacity(settlement);

        // Then
        assertEquals(22, capacity);
    }

    @Test
    void shouldInitialiseMissingPopulationOnUpdate() {
        // Given
        Settlement settlement = Fixtures.settlement("s1", 0);
        settlement.setPopulation(null);

        // When
        PopulationState state = model.update(settlement, ONE_HOUR_LATER, FixedRandom.neverHits(), events);

        // Then
        assertNotNull(settlement.getPopulation());
        assertEquals(0, state.current());
        assertEquals(10, state.capacity());
        assertTrue(state.happiness() >= 0.0 && state.happiness() <= 100.0);
    }

    @Test
    void shouldFollowBandGrowthFormulas() {
        // When & Then
        assertEquals(0.0, PopulationModel.growthRate(HappinessBand.VERY_HAPPY, 90.0, 10, 10), 1e-9);
        assertEquals(0.03, PopulationModel.growthRate(HappinessBand.VERY_HAPPY, 90.0, 5, 10), 1e-9);
        assertEquals(0.0, PopulationModel.growthRate(HappinessBand.CONTENT, 50.0, 5, 10), 1e-9);
        assertEquals(-0.01, PopulationModel.growthRate(HappinessBand.UNHAPPY, 20.0, 5, 10), 1e-9);
        assertEquals(-0.02, PopulationModel.growthRate(HappinessBand.VERY_UNHAPPY, 0.0, 5, 10), 1e-9);
    }

    @Test
    void shouldOnlyOfferImmigrationWhenHappyAndHoused() {
        // When & Then
        assertEquals(0.0, PopulationModel.immigrationChance(74.0, 5, 10));
        assertEquals(0.0, PopulationModel.immigrationChance(90.0, 10, 10));
        assertTrue(PopulationModel.immigrationChance(90.0, 5, 10) > 0.0);
        assertEquals(0.0, PopulationModel.emigrationChance(40.0, 10));
        assertEquals(0.0, PopulationModel.emigrationChance(10.0, 1));
        assertEquals(0.15, PopulationModel.emigrationChance(0.0, 10), 1e-9);
    }
}
