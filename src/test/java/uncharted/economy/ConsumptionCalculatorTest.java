package uncharted.economy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uncharted.settlement.PopulationState;
import uncharted.settlement.ResourceType;
import uncharted.support.Fixtures;

import static org.junit.jupiter.api.Assertions.*;

class ConsumptionCalculatorTest {

    private ConsumptionCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ConsumptionCalculator(Fixtures.catalog());
    }

    @Test
    void shouldConsumeFoodAndWaterPerCapita() {
        // Given
        PopulationState population = PopulationState.initial(10, 20, 0L);

        // When
        ResourceDelta delta = calculator.calculate(population, 1.0);

        // Then
        assertEquals(-3.0, delta.amount(ResourceType.FOOD), 1e-9);
        assertEquals(-6.0, delta.amount(ResourceType.WATER), 1e-9);
        assertEquals(0.0, delta.amount(ResourceType.WOOD), 1e-9);
    }

    @Test
    void shouldReturnZeroForMissingPopulation() {
        // When
        ResourceDelta delta = calculator.calculate(null, 1.0);

        // Then
        assertTrue(delta.isZero());
    }

    @Test
    void shouldReturnZeroForEmptySettlement() {
        // When
        ResourceDelta delta = calculator.calculate(PopulationState.initial(0, 10, 0L), 1.0);

        // Then
        assertTrue(delta.isZero());
    }
}
