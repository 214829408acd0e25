package com.jay.dcfengine.layer5_scenario;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.model.ScenarioAssumptions;
import com.jay.dcfengine.model.enums.ScenarioType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Canonical worst / base / best assumptions, read from the scenarios section of dcf-config.yaml.
 * A scenario's discount rate is the request's base WACC shifted by the table offset.
 */
@Component
@RequiredArgsConstructor
public class ScenarioTable {

    private final EngineConfig config;

    public ScenarioAssumptions assumptionsFor(ScenarioType type, double baseWacc) {
        EngineConfig.ScenarioSettings row = settingsFor(type);
        return ScenarioAssumptions.builder()
            .scenarioName(type.key())
            .revenueGrowthRate(row.getRevenueGrowthRate())
            .marginAdjustmentFactor(row.getMarginAdjustmentFactor())
            .discountRate(baseWacc + discountRateOffset(type))
            .terminalGrowthRate(row.getTerminalGrowthRate())
            .confidenceLevel(row.getConfidenceLevel())
            .projectionHorizonYears(row.getProjectionHorizonYears())
            .build();
    }

    /** Shift applied to the base WACC for a canonical scenario. */
    public double discountRateOffset(ScenarioType type) {
        return settingsFor(type).getDiscountRateOffset();
    }

    private EngineConfig.ScenarioSettings settingsFor(ScenarioType type) {
        EngineConfig.Scenarios scenarios = config.scenarios();
        return switch (type) {
            case WORST_CASE -> scenarios.getWorstCase();
            case BASE_CASE -> scenarios.getBaseCase();
            case BEST_CASE -> scenarios.getBestCase();
            case CUSTOM -> throw new IllegalArgumentException("Custom scenarios have no table entry");
        };
    }
}
