package com.jay.dcfengine.layer1_quality;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.QualityAssessment;
import com.jay.dcfengine.model.enums.QualityGrade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 1 — Quality Assessor.
 * Scores how far the input bundle can be trusted, 0 (unusable) to 1 (clean).
 * Heuristic deductions are independent and may stack below zero before clamping.
 * A low score is a warning, never a rejection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityAssessor {

    private final EngineConfig config;

    public QualityAssessment assess(FinancialInputBundle bundle) {
        EngineConfig.Quality cfg = config.quality();
        List<String> issues = new ArrayList<>();
        double score = 1.0;

        // ── Revenue sign ───────────────────────────────────────────────────────
        if (anyNonPositive(bundle.getRevenueHistory())) {
            score -= cfg.getNonPositiveRevenuePenalty();
            issues.add("Revenue history contains zero or negative values");
        }

        // ── Operating cash flow sign ───────────────────────────────────────────
        if (anyNonPositive(bundle.getOperatingCashFlowHistory())) {
            score -= cfg.getNonPositiveCashFlowPenalty();
            issues.add("Operating cash flow history contains zero or negative values");
        }

        // ── Revenue volatility ─────────────────────────────────────────────────
        double cv = coefficientOfVariation(bundle.getRevenueHistory());
        if (cv > cfg.getVolatilityCvThreshold()) {
            score -= cfg.getHighVolatilityPenalty();
            issues.add(String.format("Revenue volatility high (CV=%.2f > %.2f)", cv, cfg.getVolatilityCvThreshold()));
        }

        // ── Market data ────────────────────────────────────────────────────────
        if (bundle.getMarketCap() <= 0 || bundle.getSharesOutstanding() <= 0) {
            score -= cfg.getInvalidMarketDataPenalty();
            issues.add("Market cap or shares outstanding is not positive");
        }

        score = Math.max(0, Math.min(1, score));
        boolean warning = score < cfg.getWarningThreshold();
        if (warning) {
            log.warn("Low data quality for {}: score={} issues={}", bundle.getTicker(), score, issues);
        } else {
            log.debug("Quality score for {}: {}", bundle.getTicker(), score);
        }
        return new QualityAssessment(score, QualityGrade.fromScore(score), issues, warning);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private boolean anyNonPositive(List<Double> values) {
        return values != null && values.stream().anyMatch(v -> v != null && v <= 0);
    }

    /**
     * Sample standard deviation over mean. Returns +Infinity when the mean is not
     * positive (the series cannot be called stable) and 0 when fewer than two values exist.
     */
    static double coefficientOfVariation(List<Double> values) {
        if (values == null || values.size() < 2) return 0;
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (mean <= 0) return Double.POSITIVE_INFINITY;
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        double stdev = Math.sqrt(sumSq / (values.size() - 1));
        return stdev / mean;
    }
}
