package com.jay.dcfengine.layer2_capital;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.model.FinancialInputBundle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 2 — Cost of Capital.
 * Weighted average cost of capital from CAPM cost of equity and a
 * spread-over-risk-free cost of debt, weighted by market cap and total debt.
 * Computed once per request; scenarios shift it by their table offset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WaccCalculator {

    private final EngineConfig config;

    public record WaccBreakdown(
        double costOfEquity,
        double costOfDebt,
        double equityWeight,
        double debtWeight,
        double wacc
    ) {}

    public double calculate(FinancialInputBundle bundle) {
        return breakdown(bundle).wacc();
    }

    public WaccBreakdown breakdown(FinancialInputBundle bundle) {
        double costOfEquity = bundle.getRiskFreeRate() + bundle.getBeta() * bundle.getMarketRiskPremium();
        double costOfDebt = bundle.getRiskFreeRate() + config.wacc().getDebtSpread();

        double totalCapital = bundle.getMarketCap() + bundle.getTotalDebt();
        if (totalCapital == 0) {
            log.debug("No capital base for {} — WACC falls back to cost of equity {}",
                bundle.getTicker(), costOfEquity);
            return new WaccBreakdown(costOfEquity, costOfDebt, 1.0, 0.0, costOfEquity);
        }

        double equityWeight = bundle.getMarketCap() / totalCapital;
        double debtWeight = 1 - equityWeight;
        double wacc = equityWeight * costOfEquity
            + debtWeight * costOfDebt * (1 - bundle.getTaxRate());

        log.debug("WACC for {}: Ke={} Kd={} E/V={} → {}",
            bundle.getTicker(), costOfEquity, costOfDebt, equityWeight, wacc);
        return new WaccBreakdown(costOfEquity, costOfDebt, equityWeight, debtWeight, wacc);
    }
}
