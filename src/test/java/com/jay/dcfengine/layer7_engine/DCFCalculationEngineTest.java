package com.jay.dcfengine.layer7_engine;

import com.jay.dcfengine.TestFixtures;
import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.DomainException;
import com.jay.dcfengine.exception.ValidationException;
import com.jay.dcfengine.layer5_scenario.ScenarioRunner;
import com.jay.dcfengine.model.DCFAnalysisReport;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioAssumptions;
import com.jay.dcfengine.model.ScenarioResult;
import com.jay.dcfengine.model.enums.ScenarioType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DCFCalculationEngineTest {

    private final EngineConfig config = TestFixtures.config();
    private DCFCalculationEngine engine = TestFixtures.engine(config);

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static ScenarioAssumptions custom(double discountRate, double terminalGrowth) {
        return ScenarioAssumptions.builder()
            .scenarioName("my view")
            .revenueGrowthRate(0.06)
            .marginAdjustmentFactor(1.1)
            .discountRate(discountRate)
            .terminalGrowthRate(terminalGrowth)
            .confidenceLevel(0.4)
            .projectionHorizonYears(7)
            .build();
    }

    @Test
    void reportCarriesThreeCanonicalScenariosInOrder() {
        DCFAnalysisReport report = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle());

        assertThat(report.getScenarios()).containsOnlyKeys("worst_case", "base_case", "best_case");
        assertThat(report.getScenarios().keySet()).containsExactly("worst_case", "base_case", "best_case");
        assertThat(report.getTicker()).isEqualTo("ACME");
        assertThat(report.getCurrentMarketPrice()).isEqualTo(100.0);
        assertThat(report.getTimestamp()).isEqualTo(TestFixtures.NOW);
        assertThat(report.hasCustomScenario()).isFalse();
    }

    @Test
    void scenarioDiscountRatesFollowBaseWaccAndOffsets() {
        DCFAnalysisReport report = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle());

        assertThat(report.getBaseWacc()).isCloseTo(0.09125, within(1e-12));
        assertThat(report.scenario(ScenarioType.BASE_CASE).getDiscountRate()).isEqualTo(report.getBaseWacc());
        assertThat(report.scenario(ScenarioType.WORST_CASE).getDiscountRate()).isCloseTo(0.11125, within(1e-12));
        assertThat(report.scenario(ScenarioType.BEST_CASE).getDiscountRate()).isCloseTo(0.08125, within(1e-12));
        report.getScenarios().values().forEach(r ->
            assertThat(r.getDiscountRate()).isGreaterThan(r.getTerminalGrowthRate()));
    }

    @Test
    void worstBaseBestValuesAreMonotonic() {
        for (FinancialInputBundle bundle : List.of(TestFixtures.referenceBundle(), TestFixtures.scaledBundle())) {
            DCFAnalysisReport report = engine.calculateComprehensiveDcf(bundle);

            double worst = report.scenario(ScenarioType.WORST_CASE).getIntrinsicValuePerShare();
            double base = report.scenario(ScenarioType.BASE_CASE).getIntrinsicValuePerShare();
            double best = report.scenario(ScenarioType.BEST_CASE).getIntrinsicValuePerShare();
            assertThat(worst).isLessThanOrEqualTo(base);
            assertThat(base).isLessThanOrEqualTo(best);
        }
    }

    @Test
    void identicalInputsGiveIdenticalNumbers() {
        DCFAnalysisReport first = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle());
        DCFAnalysisReport second = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle());

        assertThat(second.getScenarios()).isEqualTo(first.getScenarios());
        assertThat(second.getBaseWacc()).isEqualTo(first.getBaseWacc());
        assertThat(Arrays.deepEquals(second.getSensitivityGrid().valueMatrix(),
            first.getSensitivityGrid().valueMatrix())).isTrue();
        assertThat(second.getSensitivityGrid().waccAxis()).isEqualTo(first.getSensitivityGrid().waccAxis());
        assertThat(second.getQualityScore()).isEqualTo(first.getQualityScore());
    }

    @Test
    void gridCentreEqualsBaseCase() {
        DCFAnalysisReport report = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle());

        assertThat(report.getSensitivityGrid().baseCaseValue())
            .isCloseTo(report.scenario(ScenarioType.BASE_CASE).getIntrinsicValuePerShare(), within(1e-9));
    }

    @Test
    void referenceExampleWaccInRange() {
        DCFAnalysisReport report = engine.calculateComprehensiveDcf(TestFixtures.referenceBundle());

        assertThat(report.getBaseWacc()).isBetween(0.05, 0.15);
        assertThat(report.getQualityScore()).isEqualTo(1.0);
        assertThat(report.getDataFreshnessScore()).isEqualTo(1.0);
        assertThat(report.isQualityWarning()).isFalse();
    }

    @Test
    void customScenarioIsAddedUnderCustomKey() {
        ScenarioAssumptions mine = custom(0.095, 0.02);
        DCFAnalysisReport report = engine.calculateComprehensiveDcf(TestFixtures.scaledBundle(), mine);

        ScenarioResult c = report.scenario(ScenarioType.CUSTOM);
        assertThat(report.getScenarios().keySet()).containsExactly("worst_case", "base_case", "best_case", "custom");
        assertThat(c.getScenarioName()).isEqualTo("my view");
        assertThat(c.getAssumptions()).isSameAs(mine);
        assertThat(c.getDiscountRate()).isEqualTo(0.095);
        assertThat(c.getProjectedCashFlows()).hasSize(7);
        assertThat(c.getPresentValues()).hasSize(8);
    }

    @Test
    void invalidCustomScenarioFailsWholeRequestNamingScenario() {
        DomainException e = catchThrowableOfType(
            () -> engine.calculateComprehensiveDcf(TestFixtures.scaledBundle(), custom(0.08, 0.10)),
            DomainException.class);

        assertThat(e).isNotNull();
        assertThat(e.getScenarioName()).isEqualTo("custom");
        assertThat(e.getMessage()).contains("my view");
    }

    @Test
    void partialCustomScenarioIsRejectedBeforeAnyCalculation() {
        ScenarioRunner runner = mock(ScenarioRunner.class);
        engine.shutdown();
        engine = TestFixtures.engine(config, runner);
        ScenarioAssumptions partial = ScenarioAssumptions.builder()
            .scenarioName("partial")
            .discountRate(0.10)
            .build();

        assertThatThrownBy(() -> engine.calculateComprehensiveDcf(TestFixtures.scaledBundle(), partial))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("revenue growth rate is missing");
        verifyNoInteractions(runner);
    }

    @Test
    void singleScenarioWithOmittedRatesIsRejected() {
        ScenarioAssumptions partial = ScenarioAssumptions.builder()
            .scenarioName("partial")
            .discountRate(0.10)
            .build();

        ValidationException e = catchThrowableOfType(
            () -> engine.calculateScenarioDcf(TestFixtures.scaledBundle(), partial), ValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getFailures()).contains("terminal growth rate is missing", "margin adjustment factor is missing");
    }

    @Test
    void misconfiguredScenarioTableFailsValidationBeforeAnyCalculation() {
        config.scenarios().getWorstCase().setProjectionHorizonYears(0);
        ScenarioRunner runner = mock(ScenarioRunner.class);
        engine.shutdown();
        engine = TestFixtures.engine(config, runner);

        assertThatThrownBy(() -> engine.calculateComprehensiveDcf(TestFixtures.scaledBundle()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("worst_case")
            .hasMessageContaining("projection horizon 0");
        verifyNoInteractions(runner);
    }

    @Test
    void canonicalScenarioBelowGrowthFailsWholeRequest() {
        // Offset the best case far enough that its discount rate falls under its terminal growth
        config.scenarios().getBestCase().setDiscountRateOffset(-0.08);
        engine.shutdown();
        engine = TestFixtures.engine(config);

        assertThatThrownBy(() -> engine.calculateComprehensiveDcf(TestFixtures.scaledBundle()))
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("best_case");
    }

    @Test
    void unexpectedScenarioFailureSurfacesAsDomainError() {
        ScenarioRunner failing = mock(ScenarioRunner.class);
        when(failing.run(any(), any())).thenThrow(new IllegalStateException("boom"));
        engine.shutdown();
        engine = TestFixtures.engine(config, failing);

        DomainException e = catchThrowableOfType(
            () -> engine.calculateComprehensiveDcf(TestFixtures.scaledBundle()), DomainException.class);

        assertThat(e).isNotNull();
        assertThat(e.getMessage()).contains("boom");
        assertThat(e.getScenarioName()).isIn("worst_case", "base_case", "best_case");
        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void malformedBundleFailsBeforeAnyCalculation() {
        ScenarioRunner runner = mock(ScenarioRunner.class);
        engine.shutdown();
        engine = TestFixtures.engine(config, runner);
        FinancialInputBundle bundle = TestFixtures.scaledBundle().toBuilder()
            .capexHistory(List.of(1.0, 2.0, 3.0))
            .build();

        assertThatThrownBy(() -> engine.calculateComprehensiveDcf(bundle))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(runner);
    }

    @Test
    void lowQualityIsReportedNotRejected() {
        config.quality().setWarningThreshold(0.6);
        engine.shutdown();
        engine = TestFixtures.engine(config);
        FinancialInputBundle shaky = TestFixtures.scaledBundle().toBuilder()
            .revenueHistory(List.of(0.0, 1000e6, 400e6, 1200e6, 1400e6))
            .operatingCashFlowHistory(List.of(-50e6, 220e6, 240e6, 260e6, 280e6))
            .asOf(null)
            .build();

        DCFAnalysisReport report = engine.calculateComprehensiveDcf(shaky);

        assertThat(report.getQualityScore()).isCloseTo(0.5, within(1e-12));
        assertThat(report.isQualityWarning()).isTrue();
        assertThat(report.getQualityIssues()).hasSize(4);
        assertThat(report.getDataFreshnessScore()).isZero();
        assertThat(report.getScenarios()).hasSize(3);
    }

    @Test
    void singleScenarioUsesItsOwnDiscountRate() {
        ScenarioResult r = engine.calculateScenarioDcf(TestFixtures.scaledBundle(), custom(0.12, 0.02));

        assertThat(r.getScenarioName()).isEqualTo("my view");
        assertThat(r.getDiscountRate()).isEqualTo(0.12);
        assertThat(r.getTerminalValue()).isPositive();
    }

    @Test
    void singleScenarioRejectsRateBelowGrowth() {
        assertThatThrownBy(() -> engine.calculateScenarioDcf(TestFixtures.scaledBundle(), custom(0.08, 0.10)))
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("my view");
    }
}
