package com.jay.dcfengine.model;

import com.jay.dcfengine.model.enums.QualityGrade;
import com.jay.dcfengine.model.enums.ScenarioType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full multi-scenario valuation for one ticker.
 * Scenario keys are worst_case, base_case, best_case and optionally custom, in that order.
 */
@Value
public class DCFAnalysisReport {

    String ticker;
    double currentMarketPrice;
    Map<String, ScenarioResult> scenarios;
    SensitivityGrid sensitivityGrid;
    double baseWacc;

    // ── Data quality ──────────────────────────────────────────────────────────
    double qualityScore;
    QualityGrade qualityGrade;
    List<String> qualityIssues;
    boolean qualityWarning;
    double dataFreshnessScore;

    LocalDateTime timestamp;

    @Builder
    public DCFAnalysisReport(String ticker, double currentMarketPrice, Map<String, ScenarioResult> scenarios,
                             SensitivityGrid sensitivityGrid, double baseWacc, double qualityScore,
                             QualityGrade qualityGrade, List<String> qualityIssues, boolean qualityWarning,
                             double dataFreshnessScore, LocalDateTime timestamp) {
        this.ticker = ticker;
        this.currentMarketPrice = currentMarketPrice;
        this.scenarios = Collections.unmodifiableMap(new LinkedHashMap<>(scenarios));
        this.sensitivityGrid = sensitivityGrid;
        this.baseWacc = baseWacc;
        this.qualityScore = qualityScore;
        this.qualityGrade = qualityGrade;
        this.qualityIssues = qualityIssues == null ? List.of() : List.copyOf(qualityIssues);
        this.qualityWarning = qualityWarning;
        this.dataFreshnessScore = dataFreshnessScore;
        this.timestamp = timestamp;
    }

    public ScenarioResult scenario(ScenarioType type) {
        return scenarios.get(type.key());
    }

    public boolean hasCustomScenario() {
        return scenarios.containsKey(ScenarioType.CUSTOM.key());
    }
}
