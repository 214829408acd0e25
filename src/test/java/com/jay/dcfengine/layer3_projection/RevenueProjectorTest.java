package com.jay.dcfengine.layer3_projection;

import com.jay.dcfengine.TestFixtures;
import com.jay.dcfengine.model.ScenarioAssumptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RevenueProjectorTest {

    private final RevenueProjector projector = new RevenueProjector(TestFixtures.config());

    private static ScenarioAssumptions assumptions(int horizon) {
        return ScenarioAssumptions.builder()
            .scenarioName("base_case")
            .revenueGrowthRate(0.05)
            .marginAdjustmentFactor(1.0)
            .discountRate(0.10)
            .terminalGrowthRate(0.025)
            .confidenceLevel(0.5)
            .projectionHorizonYears(horizon)
            .build();
    }

    @Test
    void firstYearGrowsAtBlendedRate() {
        List<Double> revenue = projector.project(TestFixtures.referenceBundle(), assumptions(5));

        // 0.3 × mean(10%, 9.09%, 8.33%, 7.69%) + 0.7 × 5%
        double blended = 0.3 * RevenueProjector.meanHistoricalGrowth(
            List.of(1000.0, 1100.0, 1200.0, 1300.0, 1400.0)) + 0.7 * 0.05;
        assertThat(revenue).hasSize(5);
        assertThat(revenue.get(0)).isCloseTo(1400 * (1 + blended), within(1e-9));
        assertThat(revenue.get(0)).isCloseTo(1485.8724, within(1e-3));
    }

    @Test
    void secondYearDecaysTowardTerminal() {
        List<Double> revenue = projector.project(TestFixtures.referenceBundle(), assumptions(2));

        double blended = revenue.get(0) / 1400 - 1;
        double expectedGrowth = blended * 0.8 + 0.025 * 0.2;
        assertThat(revenue.get(1) / revenue.get(0) - 1).isCloseTo(expectedGrowth, within(1e-12));
    }

    @Test
    void longHorizonConvergesToTerminalGrowth() {
        List<Double> revenue = projector.project(TestFixtures.referenceBundle(), assumptions(40));

        double lastGrowth = revenue.get(39) / revenue.get(38) - 1;
        assertThat(lastGrowth).isCloseTo(0.025, within(1e-4));
    }

    @Test
    void skipsGrowthPairsWithNonPositivePriorYear() {
        assertThat(RevenueProjector.meanHistoricalGrowth(List.of(0.0, 100.0, 110.0))).isCloseTo(0.10, within(1e-12));
        assertThat(RevenueProjector.meanHistoricalGrowth(List.of(-5.0, 0.0, 10.0))).isZero();
    }
}
