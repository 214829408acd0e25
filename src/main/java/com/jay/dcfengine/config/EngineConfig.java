package com.jay.dcfengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and exposes all valuation settings from dcf-config.yaml.
 * Values are read once at startup and cached. The coded defaults below
 * match the shipped file, so a missing file still yields a working engine.
 */
@Slf4j
@Component
public class EngineConfig {

    @Value("${dcf.config-file:dcf-config.yaml}")
    private String configFile = "dcf-config.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Scenarios scenarios = new Scenarios();
    private Wacc wacc = new Wacc();
    private Projection projection = new Projection();
    private Sensitivity sensitivity = new Sensitivity();
    private Quality quality = new Quality();
    private Engine engine = new Engine();

    public EngineConfig() {
    }

    /** Builds a config from an explicit resource name (used outside the Spring context). */
    public EngineConfig(String configFile) {
        this.configFile = configFile;
        load();
    }

    @PostConstruct
    public void load() {
        ConfigRoot root = read();
        if (root == null) return;

        List<String> problems = problems(root);
        if (!problems.isEmpty()) {
            throw new IllegalStateException(String.format("Invalid %s: %s", configFile, String.join("; ", problems)));
        }
        if (root.getScenarios() != null)   this.scenarios   = root.getScenarios();
        if (root.getWacc() != null)        this.wacc        = root.getWacc();
        if (root.getProjection() != null)  this.projection  = root.getProjection();
        if (root.getSensitivity() != null) this.sensitivity = root.getSensitivity();
        if (root.getQuality() != null)     this.quality     = root.getQuality();
        if (root.getEngine() != null)      this.engine      = root.getEngine();
        log.info("EngineConfig loaded from '{}'. Base-case terminal growth: {}, grid points: {}",
            configFile, scenarios.getBaseCase().getTerminalGrowthRate(), sensitivity.getPoints());
    }

    private ConfigRoot read() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return null;
            }
            try (is) {
                return mapper.readValue(is, ConfigRoot.class);
            }
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", configFile, e.getMessage());
            return null;
        }
    }

    // Values the engine cannot run with at all; everything else is left to request validation
    private static List<String> problems(ConfigRoot root) {
        List<String> problems = new ArrayList<>();
        Sensitivity grid = root.getSensitivity();
        if (grid != null && grid.getPoints() < 1) {
            problems.add("sensitivity.points " + grid.getPoints() + " must be at least 1");
        }
        Scenarios table = root.getScenarios();
        if (table != null) {
            checkRow("worst_case", table.getWorstCase(), problems);
            checkRow("base_case", table.getBaseCase(), problems);
            checkRow("best_case", table.getBestCase(), problems);
        }
        return problems;
    }

    private static void checkRow(String key, ScenarioSettings row, List<String> problems) {
        if (row == null) {
            problems.add("scenarios." + key + " is missing");
        } else if (row.getProjectionHorizonYears() < 1) {
            problems.add("scenarios." + key + ".projection_horizon_years "
                + row.getProjectionHorizonYears() + " must be at least 1");
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Scenarios scenarios()     { return scenarios; }
    public Wacc wacc()               { return wacc; }
    public Projection projection()   { return projection; }
    public Sensitivity sensitivity() { return sensitivity; }
    public Quality quality()         { return quality; }
    public Engine engine()           { return engine; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Scenarios scenarios = new Scenarios();
        private Wacc wacc = new Wacc();
        private Projection projection = new Projection();
        private Sensitivity sensitivity = new Sensitivity();
        private Quality quality = new Quality();
        private Engine engine = new Engine();
    }

    @Data public static class Scenarios {
        private ScenarioSettings worstCase = new ScenarioSettings(0.02, 0.80, 0.020, 0.25, 0.020, 5);
        private ScenarioSettings baseCase  = new ScenarioSettings(0.05, 1.00, 0.025, 0.50, 0.000, 5);
        private ScenarioSettings bestCase  = new ScenarioSettings(0.08, 1.20, 0.030, 0.25, -0.010, 5);
    }

    /** One row of the scenario table. The discount rate is base WACC + offset. */
    @Data public static class ScenarioSettings {
        private double revenueGrowthRate;
        private double marginAdjustmentFactor = 1.0;
        private double terminalGrowthRate = 0.025;
        private double confidenceLevel;
        private double discountRateOffset;
        private int projectionHorizonYears = 5;

        public ScenarioSettings() {
        }

        public ScenarioSettings(double revenueGrowthRate, double marginAdjustmentFactor,
                                double terminalGrowthRate, double confidenceLevel,
                                double discountRateOffset, int projectionHorizonYears) {
            this.revenueGrowthRate = revenueGrowthRate;
            this.marginAdjustmentFactor = marginAdjustmentFactor;
            this.terminalGrowthRate = terminalGrowthRate;
            this.confidenceLevel = confidenceLevel;
            this.discountRateOffset = discountRateOffset;
            this.projectionHorizonYears = projectionHorizonYears;
        }
    }

    @Data public static class Wacc {
        // Flat credit spread over the risk-free rate; not derived from credit data
        private double debtSpread = 0.02;
    }

    @Data public static class Projection {
        private double historicalGrowthWeight = 0.3;
        private double growthDecay = 0.8;
        private int marginWindowYears = 3;
    }

    @Data public static class Sensitivity {
        private int points = 9;
        private double waccStep = 0.005;
        private double growthStep = 0.0025;
    }

    @Data public static class Quality {
        private double warningThreshold = 0.5;
        private double volatilityCvThreshold = 0.3;
        private double nonPositiveRevenuePenalty = 0.2;
        private double nonPositiveCashFlowPenalty = 0.2;
        private double highVolatilityPenalty = 0.1;
        private double invalidMarketDataPenalty = 0.3;
    }

    @Data public static class Engine {
        private int scenarioThreads = 3;
    }
}
