package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Assumptions for one named scenario. Canonical instances come from ScenarioTable;
 * callers may also build a custom one.
 *
 * The rates are boxed so an omitted builder field stays null and is reported by
 * InputValidator instead of being valued as zero.
 */
@Value
@With
@Builder(toBuilder = true)
public class ScenarioAssumptions {

    String scenarioName;
    Double revenueGrowthRate;
    Double marginAdjustmentFactor;
    Double discountRate;
    Double terminalGrowthRate;
    Double confidenceLevel;

    @Builder.Default
    int projectionHorizonYears = 5;
}
