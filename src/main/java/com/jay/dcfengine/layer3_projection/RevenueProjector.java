package com.jay.dcfengine.layer3_projection;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioAssumptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3 — Revenue Projector.
 * Blends mean historical growth with the scenario's growth rate, then lets the
 * blended rate relax geometrically toward the terminal rate year by year.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevenueProjector {

    private final EngineConfig config;

    public List<Double> project(FinancialInputBundle bundle, ScenarioAssumptions assumptions) {
        EngineConfig.Projection cfg = config.projection();
        double historicalWeight = cfg.getHistoricalGrowthWeight();

        double blendedGrowth = historicalWeight * meanHistoricalGrowth(bundle.getRevenueHistory())
            + (1 - historicalWeight) * assumptions.getRevenueGrowthRate();
        double terminalGrowth = assumptions.getTerminalGrowthRate();

        List<Double> projected = new ArrayList<>(assumptions.getProjectionHorizonYears());
        double lastRevenue = bundle.lastRevenue();
        for (int year = 0; year < assumptions.getProjectionHorizonYears(); year++) {
            double decay = Math.pow(cfg.getGrowthDecay(), year);
            double yearGrowth = blendedGrowth * decay + terminalGrowth * (1 - decay);
            lastRevenue = lastRevenue * (1 + yearGrowth);
            projected.add(lastRevenue);
        }

        log.debug("{} revenue path ({}): blended growth {} → {}",
            bundle.getTicker(), assumptions.getScenarioName(), blendedGrowth, projected);
        return projected;
    }

    /**
     * Mean year-over-year growth. Pairs whose prior year is not positive carry no
     * meaningful rate and are skipped; with no usable pair the mean is 0.
     */
    static double meanHistoricalGrowth(List<Double> revenue) {
        double sum = 0;
        int count = 0;
        for (int i = 1; i < revenue.size(); i++) {
            double prior = revenue.get(i - 1);
            if (prior <= 0) continue;
            sum += (revenue.get(i) - prior) / prior;
            count++;
        }
        return count == 0 ? 0 : sum / count;
    }
}
