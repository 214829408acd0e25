package com.jay.dcfengine.layer8_report;

import com.jay.dcfengine.model.DCFAnalysisReport;
import com.jay.dcfengine.model.ScenarioResult;
import com.jay.dcfengine.model.SensitivityGrid;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Layer 8 — Valuation Summary.
 * Renders a DCF report as plain text for logs, notifications and exports.
 * This is the only place values are rounded; the report itself keeps full precision.
 */
@Component
public class ValuationSummaryGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter FMT = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm", Locale.ENGLISH);

    public String generate(DCFAnalysisReport report) {
        String timestamp = report.getTimestamp() != null ? report.getTimestamp().format(FMT) : "NOW";

        StringBuilder sb = new StringBuilder();
        sb.append("DCF VALUATION REPORT  —  ").append(timestamp).append("\n");
        sb.append(DIVIDER).append("\n");
        sb.append(line("TICKER            :  %s", report.getTicker()));
        sb.append(line("MARKET PRICE      :  %.2f", report.getCurrentMarketPrice()));
        sb.append(line("BASE WACC         :  %.2f%%", report.getBaseWacc() * 100));
        sb.append(DIVIDER).append("\n");

        report.getScenarios().values().forEach(s -> sb.append(scenarioLine(s)));
        sb.append(DIVIDER).append("\n");

        SensitivityGrid grid = report.getSensitivityGrid();
        if (grid != null) {
            sb.append(line("SENSITIVITY RANGE :  %.2f – %.2f  (centre %.2f)",
                grid.minValue(), grid.maxValue(), grid.baseCaseValue()));
            sb.append(line("WACC AXIS         :  %.2f%% – %.2f%%",
                first(grid.waccAxis()) * 100, last(grid.waccAxis()) * 100));
            sb.append(line("GROWTH AXIS       :  %.2f%% – %.2f%%",
                first(grid.growthAxis()) * 100, last(grid.growthAxis()) * 100));
            if (grid.invalidCellCount() > 0) {
                sb.append(line("INVALID CELLS     :  %d (discount rate ≤ growth)", grid.invalidCellCount()));
            }
            sb.append(DIVIDER).append("\n");
        }

        sb.append(line("DATA QUALITY      :  %.2f  [grade %s]", report.getQualityScore(), report.getQualityGrade()));
        sb.append(line("DATA FRESHNESS    :  %.2f", report.getDataFreshnessScore()));
        if (report.isQualityWarning() || !report.getQualityIssues().isEmpty()) {
            sb.append(report.isQualityWarning() ? "⚠️  QUALITY WARNING:\n" : "QUALITY NOTES:\n");
            report.getQualityIssues().forEach(i -> sb.append("   • ").append(i).append("\n"));
        }
        sb.append("─────────────────────────────────────────────────────────\n");
        return sb.toString();
    }

    /** One-line summary of a single scenario result. */
    public String scenarioLine(ScenarioResult s) {
        return line("%-17s :  %.2f / share  (%+.1f%%)  r=%.2f%% g=%.2f%%",
            s.getScenarioName().toUpperCase(Locale.ROOT),
            s.getIntrinsicValuePerShare(), s.getUpsideDownsidePercentage(),
            s.getDiscountRate() * 100, s.getTerminalGrowthRate() * 100);
    }

    private static String line(String format, Object... args) {
        return String.format(Locale.ROOT, format, args) + "\n";
    }

    private static double first(List<Double> axis) {
        return axis.get(0);
    }

    private static double last(List<Double> axis) {
        return axis.get(axis.size() - 1);
    }
}
