package com.jay.dcfengine.layer3_projection;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.DomainException;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioAssumptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Layer 3 — Free Cash Flow Projector.
 * Derives an FCF margin (OCF − capex − ΔWC over revenue) from the most recent
 * years, scales it by the scenario's margin adjustment and applies it to
 * projected revenue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FreeCashFlowProjector {

    private final EngineConfig config;

    public List<Double> project(FinancialInputBundle bundle, ScenarioAssumptions assumptions,
                                List<Double> projectedRevenue) {
        double adjustedMargin = historicalMargin(bundle, assumptions.getScenarioName())
            * assumptions.getMarginAdjustmentFactor();
        List<Double> fcf = projectedRevenue.stream()
            .map(revenue -> revenue * adjustedMargin)
            .collect(Collectors.toList());
        log.debug("{} FCF path ({}): margin {} → {}",
            bundle.getTicker(), assumptions.getScenarioName(), adjustedMargin, fcf);
        return fcf;
    }

    /**
     * Mean FCF margin over the configured window of latest years. Years with
     * non-positive revenue have no margin and are left out.
     */
    public double historicalMargin(FinancialInputBundle bundle, String scenarioName) {
        List<Double> revenue = bundle.getRevenueHistory();
        List<Double> ocf = bundle.getOperatingCashFlowHistory();
        List<Double> capex = bundle.getCapexHistory();
        List<Double> wc = bundle.getWorkingCapitalChangeHistory();

        int years = revenue.size();
        int start = Math.max(0, years - config.projection().getMarginWindowYears());
        double sum = 0;
        int count = 0;
        for (int i = start; i < years; i++) {
            if (revenue.get(i) <= 0) continue;
            double fcf = ocf.get(i) - capex.get(i) - wc.get(i);
            sum += fcf / revenue.get(i);
            count++;
        }
        if (count == 0) {
            throw new DomainException(scenarioName,
                "no year with positive revenue in the FCF margin window for " + bundle.getTicker());
        }
        return sum / count;
    }
}
