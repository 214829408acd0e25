package com.jay.dcfengine.layer5_scenario;

import com.jay.dcfengine.exception.DomainException;
import com.jay.dcfengine.layer3_projection.FreeCashFlowProjector;
import com.jay.dcfengine.layer3_projection.RevenueProjector;
import com.jay.dcfengine.layer4_valuation.PresentValueDiscounter;
import com.jay.dcfengine.layer4_valuation.TerminalValueCalculator;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioAssumptions;
import com.jay.dcfengine.model.ScenarioResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 5 — Scenario Runner.
 * Runs revenue projection → FCF projection → terminal value → discounting for
 * one set of assumptions and packages the result. A pure function of its
 * inputs, so scenarios can run in parallel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScenarioRunner {

    private final RevenueProjector revenueProjector;
    private final FreeCashFlowProjector fcfProjector;
    private final TerminalValueCalculator terminalValueCalculator;
    private final PresentValueDiscounter discounter;

    /** Discounting outcome for a fixed cash-flow path at one (rate, growth) pair. */
    public record DiscountedValue(
        double terminalValue,
        List<Double> presentValues,
        double totalPresentValue,
        double equityValue,
        double valuePerShare
    ) {}

    public ScenarioResult run(FinancialInputBundle bundle, ScenarioAssumptions assumptions) {
        String name = assumptions.getScenarioName();
        try {
            // Check the Gordon precondition before doing any projection work
            TerminalValueCalculator.requireRateAboveGrowth(
                assumptions.getDiscountRate(), assumptions.getTerminalGrowthRate());

            List<Double> revenue = revenueProjector.project(bundle, assumptions);
            List<Double> cashFlows = fcfProjector.project(bundle, assumptions, revenue);
            DiscountedValue value = valueCashFlows(bundle, cashFlows,
                assumptions.getDiscountRate(), assumptions.getTerminalGrowthRate());

            double upside = (value.valuePerShare() - bundle.getCurrentPrice()) / bundle.getCurrentPrice() * 100;
            log.debug("Scenario {} for {}: value/share={} upside={}%",
                name, bundle.getTicker(), value.valuePerShare(), upside);

            return ScenarioResult.builder()
                .scenarioName(name)
                .intrinsicValuePerShare(value.valuePerShare())
                .totalEnterpriseValue(value.totalPresentValue())
                .equityValue(value.equityValue())
                .terminalValue(value.terminalValue())
                .projectedRevenues(revenue)
                .projectedCashFlows(cashFlows)
                .presentValues(value.presentValues())
                .discountRate(assumptions.getDiscountRate())
                .terminalGrowthRate(assumptions.getTerminalGrowthRate())
                .upsideDownsidePercentage(upside)
                .assumptions(assumptions)
                .build();
        } catch (DomainException e) {
            if (e.getScenarioName() != null) throw e;
            throw new DomainException(name, e.getMessage(), e);
        }
    }

    /**
     * Terminal value, discounting and per-share equity for an already projected
     * cash-flow path. Shared with the sensitivity grid so both produce identical
     * numbers for identical rates.
     */
    public DiscountedValue valueCashFlows(FinancialInputBundle bundle, List<Double> cashFlows,
                                          double discountRate, double terminalGrowthRate) {
        double finalCashFlow = cashFlows.get(cashFlows.size() - 1);
        double terminalValue = terminalValueCalculator.calculate(finalCashFlow, discountRate, terminalGrowthRate);
        List<Double> presentValues = discounter.discount(cashFlows, terminalValue, discountRate);

        double totalPv = 0;
        for (double pv : presentValues) {
            totalPv += pv;
        }
        double equityValue = totalPv - bundle.getTotalDebt() + bundle.getCashAndEquivalents();
        double perShare = equityValue / bundle.getSharesOutstanding();
        return new DiscountedValue(terminalValue, presentValues, totalPv, equityValue, perShare);
    }
}
