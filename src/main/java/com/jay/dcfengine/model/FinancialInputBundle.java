package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the engine needs to value one company.
 * Historical sequences are chronological (oldest first) and fiscally aligned.
 * Shape is checked by InputValidator, not here, so a malformed bundle can still be built and reported on.
 */
@Value
public class FinancialInputBundle {

    String ticker;
    double currentPrice;
    double sharesOutstanding;
    double marketCap;

    // Historical financials, oldest first
    List<Double> revenueHistory;
    List<Double> operatingCashFlowHistory;
    List<Double> capexHistory;
    List<Double> workingCapitalChangeHistory;

    // Capital structure
    double totalDebt;
    double cashAndEquivalents;

    // Market risk inputs (fractions)
    double beta;
    double riskFreeRate;
    double marketRiskPremium;
    double taxRate;

    LocalDateTime asOf;   // when the upstream data snapshot was taken

    @Builder(toBuilder = true)
    public FinancialInputBundle(String ticker, double currentPrice, double sharesOutstanding, double marketCap,
                                List<Double> revenueHistory, List<Double> operatingCashFlowHistory,
                                List<Double> capexHistory, List<Double> workingCapitalChangeHistory,
                                double totalDebt, double cashAndEquivalents,
                                double beta, double riskFreeRate, double marketRiskPremium, double taxRate,
                                LocalDateTime asOf) {
        this.ticker = ticker;
        this.currentPrice = currentPrice;
        this.sharesOutstanding = sharesOutstanding;
        this.marketCap = marketCap;
        this.revenueHistory = copy(revenueHistory);
        this.operatingCashFlowHistory = copy(operatingCashFlowHistory);
        this.capexHistory = copy(capexHistory);
        this.workingCapitalChangeHistory = copy(workingCapitalChangeHistory);
        this.totalDebt = totalDebt;
        this.cashAndEquivalents = cashAndEquivalents;
        this.beta = beta;
        this.riskFreeRate = riskFreeRate;
        this.marketRiskPremium = marketRiskPremium;
        this.taxRate = taxRate;
        this.asOf = asOf;
    }

    public int historyYears() {
        return revenueHistory == null ? 0 : revenueHistory.size();
    }

    /** Latest reported revenue. */
    public double lastRevenue() {
        return revenueHistory.get(revenueHistory.size() - 1);
    }

    private static List<Double> copy(List<Double> values) {
        return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
