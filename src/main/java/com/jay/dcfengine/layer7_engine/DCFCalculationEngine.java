package com.jay.dcfengine.layer7_engine;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.DcfException;
import com.jay.dcfengine.exception.DomainException;
import com.jay.dcfengine.layer1_quality.DataFreshnessScorer;
import com.jay.dcfengine.layer1_quality.InputValidator;
import com.jay.dcfengine.layer1_quality.QualityAssessor;
import com.jay.dcfengine.layer2_capital.WaccCalculator;
import com.jay.dcfengine.layer5_scenario.ScenarioRunner;
import com.jay.dcfengine.layer5_scenario.ScenarioTable;
import com.jay.dcfengine.layer6_sensitivity.SensitivityGridGenerator;
import com.jay.dcfengine.layer8_report.ValuationSummaryGenerator;
import com.jay.dcfengine.model.DCFAnalysisReport;
import com.jay.dcfengine.model.FinancialInputBundle;
import com.jay.dcfengine.model.QualityAssessment;
import com.jay.dcfengine.model.ScenarioAssumptions;
import com.jay.dcfengine.model.ScenarioResult;
import com.jay.dcfengine.model.SensitivityGrid;
import com.jay.dcfengine.model.enums.ScenarioType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Layer 7 — DCF Calculation Engine.
 * Entry point for callers. Validates the bundle, scores its quality, derives the
 * base WACC, runs the worst / base / best scenarios in parallel, builds the
 * sensitivity grid from the base case and assembles the report.
 *
 * All-or-nothing: if any scenario fails, the remaining ones are cancelled and
 * the failure is rethrown naming that scenario. No partial report is returned.
 */
@Slf4j
@Service
public class DCFCalculationEngine {

    private final InputValidator validator;
    private final QualityAssessor qualityAssessor;
    private final DataFreshnessScorer freshnessScorer;
    private final WaccCalculator waccCalculator;
    private final ScenarioTable scenarioTable;
    private final ScenarioRunner scenarioRunner;
    private final SensitivityGridGenerator gridGenerator;
    private final ValuationSummaryGenerator summaryGenerator;
    private final Clock clock;

    private final ExecutorService executor;

    public DCFCalculationEngine(InputValidator validator,
                                QualityAssessor qualityAssessor,
                                DataFreshnessScorer freshnessScorer,
                                WaccCalculator waccCalculator,
                                ScenarioTable scenarioTable,
                                ScenarioRunner scenarioRunner,
                                SensitivityGridGenerator gridGenerator,
                                ValuationSummaryGenerator summaryGenerator,
                                Clock clock,
                                EngineConfig config) {
        this.validator = validator;
        this.qualityAssessor = qualityAssessor;
        this.freshnessScorer = freshnessScorer;
        this.waccCalculator = waccCalculator;
        this.scenarioTable = scenarioTable;
        this.scenarioRunner = scenarioRunner;
        this.gridGenerator = gridGenerator;
        this.summaryGenerator = summaryGenerator;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.engine().getScenarioThreads()));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public DCFAnalysisReport calculateComprehensiveDcf(FinancialInputBundle bundle) {
        return calculateComprehensiveDcf(bundle, null);
    }

    /**
     * Runs the three canonical scenarios plus, when {@code custom} is non-null,
     * the caller's own assumptions under the "custom" key.
     */
    public DCFAnalysisReport calculateComprehensiveDcf(FinancialInputBundle bundle, ScenarioAssumptions custom) {
        validator.validate(bundle);
        if (custom != null) validator.validate(custom);

        String ticker = bundle.getTicker();
        log.info("DCF analysis requested for {}", ticker);

        QualityAssessment quality = qualityAssessor.assess(bundle);
        double freshness = freshnessScorer.score(bundle);
        List<String> issues = new ArrayList<>(quality.issues());
        if (bundle.getAsOf() == null) {
            issues.add("Data snapshot timestamp missing — freshness unknown");
        }

        double baseWacc = waccCalculator.calculate(bundle);

        // ── Scenario assumptions ──────────────────────────────────────────────
        // Keys are report keys; a custom scenario keeps the caller's own name inside its result
        Map<String, ScenarioAssumptions> assumptions = new LinkedHashMap<>();
        for (ScenarioType type : ScenarioType.canonical()) {
            ScenarioAssumptions row = scenarioTable.assumptionsFor(type, baseWacc);
            validator.validate(row);
            assumptions.put(type.key(), row);
        }
        if (custom != null) {
            assumptions.put(ScenarioType.CUSTOM.key(), custom);
        }

        Map<String, ScenarioResult> results = runScenarios(bundle, assumptions);
        ScenarioResult baseCase = results.get(ScenarioType.BASE_CASE.key());
        SensitivityGrid grid = gridGenerator.generate(bundle, baseCase);

        DCFAnalysisReport report = DCFAnalysisReport.builder()
            .ticker(ticker)
            .currentMarketPrice(bundle.getCurrentPrice())
            .scenarios(results)
            .sensitivityGrid(grid)
            .baseWacc(baseWacc)
            .qualityScore(quality.score())
            .qualityGrade(quality.grade())
            .qualityIssues(issues)
            .qualityWarning(quality.warning())
            .dataFreshnessScore(freshness)
            .timestamp(LocalDateTime.now(clock))
            .build();

        log.info("DCF analysis complete for {}: WACC={} worst={} base={} best={} quality={}",
            ticker, baseWacc,
            results.get(ScenarioType.WORST_CASE.key()).getIntrinsicValuePerShare(),
            baseCase.getIntrinsicValuePerShare(),
            results.get(ScenarioType.BEST_CASE.key()).getIntrinsicValuePerShare(),
            quality.score());
        if (log.isDebugEnabled()) {
            log.debug("\n{}", summaryGenerator.generate(report));
        }
        return report;
    }

    /** Values a single ad-hoc scenario using exactly the discount rate it carries. */
    public ScenarioResult calculateScenarioDcf(FinancialInputBundle bundle, ScenarioAssumptions assumptions) {
        validator.validate(bundle);
        validator.validate(assumptions);
        log.info("Single-scenario DCF requested for {} ({})", bundle.getTicker(), assumptions.getScenarioName());
        return scenarioRunner.run(bundle, assumptions);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<String, ScenarioResult> runScenarios(FinancialInputBundle bundle,
                                                     Map<String, ScenarioAssumptions> assumptions) {
        Map<String, CompletableFuture<ScenarioResult>> futures = new LinkedHashMap<>();
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();

        assumptions.forEach((name, a) -> {
            CompletableFuture<ScenarioResult> future =
                CompletableFuture.supplyAsync(() -> scenarioRunner.run(bundle, a), executor);
            future.whenComplete((result, ex) -> {
                if (ex != null) firstFailure.completeExceptionally(ex);
            });
            futures.put(name, future);
        });

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.values().forEach(f -> f.cancel(true));
            throw new DcfException("DCF analysis interrupted for " + bundle.getTicker(), e);
        } catch (ExecutionException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw translate(failedScenario(futures), e.getCause());
        }

        Map<String, ScenarioResult> results = new LinkedHashMap<>();
        futures.forEach((name, f) -> results.put(name, f.join()));
        return results;
    }

    private String failedScenario(Map<String, CompletableFuture<ScenarioResult>> futures) {
        return futures.entrySet().stream()
            .filter(e -> e.getValue().isCompletedExceptionally() && !e.getValue().isCancelled())
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse("unknown");
    }

    private DcfException translate(String scenario, Throwable cause) {
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof DomainException domain && !scenario.equals(domain.getScenarioName())) {
            // Custom scenarios fail under their caller-given name; report them under their report key
            log.error("Scenario {} failed: {}", scenario, domain.getMessage());
            return new DomainException(scenario, domain.getMessage(), domain);
        }
        if (cause instanceof DcfException dcf) {
            log.error("Scenario {} failed: {}", scenario, dcf.getMessage());
            return dcf;
        }
        if (cause instanceof CancellationException) {
            return new DomainException(scenario, "calculation was cancelled", cause);
        }
        log.error("Scenario {} failed unexpectedly: {}", scenario, cause.getMessage());
        return new DomainException(scenario, "calculation failed: " + cause.getMessage(), cause);
    }
}
