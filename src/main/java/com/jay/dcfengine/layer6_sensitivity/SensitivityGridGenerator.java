package com.jay.dcfengine.layer6_sensitivity;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.DomainException;
import com.jay.dcfengine.layer5_scenario.ScenarioRunner;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.ScenarioResult;
import com.jay.dcfengine.model.SensitivityGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Layer 6 — Sensitivity Grid.
 * Re-values the base case over a WACC × terminal-growth grid centred on the
 * base-case rates.
 *
 * Every cell reuses the base case's projected cash flows; only the discount
 * rate and terminal growth change. The grid therefore measures sensitivity to
 * discounting and terminal assumptions, not to the revenue path. Do not
 * reproject per cell.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SensitivityGridGenerator {

    private final ScenarioRunner scenarioRunner;
    private final EngineConfig config;

    public SensitivityGrid generate(FinancialInputBundle bundle, ScenarioResult baseCase) {
        EngineConfig.Sensitivity cfg = config.sensitivity();
        if (cfg.getPoints() < 1) {
            throw new IllegalStateException("sensitivity.points " + cfg.getPoints() + " must be at least 1");
        }
        List<Double> waccAxis = axis(baseCase.getDiscountRate(), cfg.getWaccStep(), cfg.getPoints());
        List<Double> growthAxis = axis(baseCase.getTerminalGrowthRate(), cfg.getGrowthStep(), cfg.getPoints());
        List<Double> cashFlows = baseCase.getProjectedCashFlows();

        double[][] matrix = new double[waccAxis.size()][growthAxis.size()];
        // Rows are independent; each worker writes only its own row
        IntStream.range(0, waccAxis.size()).parallel().forEach(i -> {
            for (int j = 0; j < growthAxis.size(); j++) {
                matrix[i][j] = cellValue(bundle, cashFlows, waccAxis.get(i), growthAxis.get(j));
            }
        });

        int centre = cfg.getPoints() / 2;
        SensitivityGrid grid = new SensitivityGrid(waccAxis, growthAxis, matrix, matrix[centre][centre]);
        if (grid.invalidCellCount() > 0) {
            log.warn("Sensitivity grid for {}: {} cell(s) have discount rate ≤ growth and were marked invalid",
                bundle.getTicker(), grid.invalidCellCount());
        }
        log.debug("Sensitivity grid for {}: range {} – {}", bundle.getTicker(), grid.minValue(), grid.maxValue());
        return grid;
    }

    private double cellValue(FinancialInputBundle bundle, List<Double> cashFlows, double wacc, double growth) {
        try {
            return scenarioRunner.valueCashFlows(bundle, cashFlows, wacc, growth).valuePerShare();
        } catch (DomainException e) {
            return Double.NaN;
        }
    }

    /** Points centred on {@code centre}; the middle point is exactly {@code centre}. */
    static List<Double> axis(double centre, double step, int points) {
        int half = points / 2;
        List<Double> axis = new ArrayList<>(points);
        for (int k = -half; k < points - half; k++) {
            axis.add(k == 0 ? centre : centre + k * step);
        }
        return axis;
    }
}
