package com.jay.dcfengine.layer1_quality;

import com.jay.dcfengine.exception.ValidationException;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioAssumptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 1 — Input Validator.
 * Checks the shape and domain constraints of what the data collaborator hands over.
 * Every rule is evaluated and all failures are reported together; nothing is
 * truncated or repaired.
 *
 * Runs BEFORE quality assessment and before any number is computed.
 */
@Slf4j
@Component
public class InputValidator {

    public static final int MIN_HISTORY_YEARS = 3;

    public void validate(FinancialInputBundle bundle) {
        if (bundle == null) {
            throw new ValidationException("financial input bundle", List.of("bundle is null"));
        }
        List<String> failures = new ArrayList<>();
        String ticker = bundle.getTicker();

        // ── Identity & market data ────────────────────────────────────────────
        if (ticker == null || ticker.isBlank()) {
            failures.add("ticker is missing");
        }
        if (!(bundle.getCurrentPrice() > 0)) {
            failures.add(String.format("current price %.4f must be positive", bundle.getCurrentPrice()));
        }
        if (!(bundle.getSharesOutstanding() > 0)) {
            failures.add(String.format("shares outstanding %.0f must be positive", bundle.getSharesOutstanding()));
        }
        if (!(bundle.getMarketCap() > 0)) {
            failures.add(String.format("market cap %.0f must be positive", bundle.getMarketCap()));
        }

        // ── Capital structure ─────────────────────────────────────────────────
        if (!(bundle.getTotalDebt() >= 0)) {
            failures.add(String.format("total debt %.0f cannot be negative", bundle.getTotalDebt()));
        }
        if (!(bundle.getCashAndEquivalents() >= 0)) {
            failures.add(String.format("cash %.0f cannot be negative", bundle.getCashAndEquivalents()));
        }

        // ── Market risk inputs ────────────────────────────────────────────────
        if (!Double.isFinite(bundle.getBeta())) failures.add("beta is not a finite number");
        if (!Double.isFinite(bundle.getRiskFreeRate())) failures.add("risk-free rate is not a finite number");
        if (!Double.isFinite(bundle.getMarketRiskPremium())) failures.add("market risk premium is not a finite number");
        if (!(bundle.getTaxRate() >= 0 && bundle.getTaxRate() <= 1)) {
            failures.add(String.format("tax rate %.4f must be between 0 and 1", bundle.getTaxRate()));
        }

        // ── Historical sequences ──────────────────────────────────────────────
        checkHistory("revenue history", bundle.getRevenueHistory(), failures);
        checkHistory("operating cash flow history", bundle.getOperatingCashFlowHistory(), failures);
        checkHistory("capex history", bundle.getCapexHistory(), failures);
        checkHistory("working capital change history", bundle.getWorkingCapitalChangeHistory(), failures);

        List<List<Double>> histories = new ArrayList<>();
        histories.add(bundle.getRevenueHistory());
        histories.add(bundle.getOperatingCashFlowHistory());
        histories.add(bundle.getCapexHistory());
        histories.add(bundle.getWorkingCapitalChangeHistory());
        if (histories.stream().noneMatch(h -> h == null)) {
            long distinctLengths = histories.stream().mapToInt(List::size).distinct().count();
            if (distinctLengths > 1) {
                failures.add(String.format("historical sequences differ in length: revenue=%d ocf=%d capex=%d wc=%d",
                    bundle.getRevenueHistory().size(), bundle.getOperatingCashFlowHistory().size(),
                    bundle.getCapexHistory().size(), bundle.getWorkingCapitalChangeHistory().size()));
            }
        }

        if (!failures.isEmpty()) {
            log.info("Input validation FAILED for {} — {} violations: {}",
                ticker, failures.size(), String.join("; ", failures));
            throw new ValidationException("financial input bundle for " + ticker, failures);
        }
        log.debug("Input validation PASSED for {} ({} years of history)", ticker, bundle.historyYears());
    }

    public void validate(ScenarioAssumptions assumptions) {
        if (assumptions == null) {
            throw new ValidationException("scenario assumptions", List.of("assumptions are null"));
        }
        List<String> failures = new ArrayList<>();
        String name = assumptions.getScenarioName();

        if (name == null || name.isBlank()) failures.add("scenario name is missing");
        checkRate("revenue growth rate", assumptions.getRevenueGrowthRate(), failures);
        checkRate("discount rate", assumptions.getDiscountRate(), failures);
        checkRate("terminal growth rate", assumptions.getTerminalGrowthRate(), failures);

        Double margin = assumptions.getMarginAdjustmentFactor();
        if (margin == null) {
            failures.add("margin adjustment factor is missing");
        } else if (!(margin >= 0)) {
            failures.add(String.format("margin adjustment factor %.4f cannot be negative", margin));
        }
        Double confidence = assumptions.getConfidenceLevel();
        if (confidence == null) {
            failures.add("confidence level is missing");
        } else if (!(confidence >= 0 && confidence <= 1)) {
            failures.add(String.format("confidence level %.4f must be between 0 and 1", confidence));
        }
        if (assumptions.getProjectionHorizonYears() < 1) {
            failures.add(String.format("projection horizon %d must be at least 1 year",
                assumptions.getProjectionHorizonYears()));
        }

        if (!failures.isEmpty()) {
            throw new ValidationException("assumptions for scenario " + name, failures);
        }
    }

    private void checkRate(String label, Double value, List<String> failures) {
        if (value == null) {
            failures.add(label + " is missing");
        } else if (!Double.isFinite(value)) {
            failures.add(label + " is not a finite number");
        }
    }

    private void checkHistory(String label, List<Double> values, List<String> failures) {
        if (values == null) {
            failures.add(label + " is missing");
            return;
        }
        if (values.size() < MIN_HISTORY_YEARS) {
            failures.add(String.format("%s has %d years, at least %d required",
                label, values.size(), MIN_HISTORY_YEARS));
        }
        for (int i = 0; i < values.size(); i++) {
            Double v = values.get(i);
            if (v == null || !Double.isFinite(v)) {
                failures.add(String.format("%s[%d] is not a finite number", label, i));
            }
        }
    }
}
