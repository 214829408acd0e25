package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Valuation output for one scenario.
 * presentValues holds one entry per projected year followed by the discounted terminal value.
 */
@Value
public class ScenarioResult {

    String scenarioName;
    double intrinsicValuePerShare;
    double totalEnterpriseValue;     // sum of present values
    double equityValue;              // enterprise value - debt + cash
    double terminalValue;            // undiscounted
    List<Double> projectedRevenues;
    List<Double> projectedCashFlows;
    List<Double> presentValues;
    double discountRate;
    double terminalGrowthRate;
    double upsideDownsidePercentage;
    ScenarioAssumptions assumptions;

    @Builder
    public ScenarioResult(String scenarioName, double intrinsicValuePerShare, double totalEnterpriseValue,
                          double equityValue, double terminalValue, List<Double> projectedRevenues,
                          List<Double> projectedCashFlows, List<Double> presentValues,
                          double discountRate, double terminalGrowthRate, double upsideDownsidePercentage,
                          ScenarioAssumptions assumptions) {
        this.scenarioName = scenarioName;
        this.intrinsicValuePerShare = intrinsicValuePerShare;
        this.totalEnterpriseValue = totalEnterpriseValue;
        this.equityValue = equityValue;
        this.terminalValue = terminalValue;
        this.projectedRevenues = List.copyOf(projectedRevenues);
        this.projectedCashFlows = List.copyOf(projectedCashFlows);
        this.presentValues = List.copyOf(presentValues);
        this.discountRate = discountRate;
        this.terminalGrowthRate = terminalGrowthRate;
        this.upsideDownsidePercentage = upsideDownsidePercentage;
        this.assumptions = assumptions;
    }

    /** Present value of the terminal value (last entry of presentValues). */
    public double getDiscountedTerminalValue() {
        return presentValues.get(presentValues.size() - 1);
    }
}
