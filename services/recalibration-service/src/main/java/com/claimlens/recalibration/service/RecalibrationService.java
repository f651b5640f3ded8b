package com.claimlens.recalibration.service;

import com.claimlens.recalibration.config.MetricsConfig;
import com.claimlens.recalibration.config.properties.RecalibrationProperties;
import com.claimlens.recalibration.dto.ConvergencePoint;
import com.claimlens.recalibration.dto.ImprovementMetrics;
import com.claimlens.recalibration.dto.PerformanceMetrics;
import com.claimlens.recalibration.dto.RecalibrationResponse;
import com.claimlens.recalibration.dto.SensitivityAnalysisResponse;
import com.claimlens.recalibration.dto.SensitivityResult;
import com.claimlens.recalibration.dto.WeightComparisonResponse;
import com.claimlens.recalibration.dto.WeightOptimizationResponse;
import com.claimlens.recalibration.dto.WeightRecommendationResponse;
import com.claimlens.recalibration.engine.CorrelationAnalyzer;
import com.claimlens.recalibration.engine.FactorImpactRanker;
import com.claimlens.recalibration.engine.MetricsEvaluator;
import com.claimlens.recalibration.engine.OptimizationBudget;
import com.claimlens.recalibration.engine.PreparedClaims;
import com.claimlens.recalibration.engine.RecalibrationRunner;
import com.claimlens.recalibration.engine.WeightOptimizer;
import com.claimlens.recalibration.engine.WeightTableValidator;
import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.EvaluationMetrics;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.RecalibrationReport;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightRecommendation;
import com.claimlens.recalibration.model.WeightVector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Recalibration Service
 *
 * <p>Entry point for callers outside the engine: evaluates weight vectors, runs optimizers,
 * perturbs factors for sensitivity and produces weight recommendations. Claim loading and
 * request binding belong to the caller; every operation here requires the claims up front.
 *
 * <p>Failures are counted, logged with context and rethrown unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecalibrationService {

    private static final String SERVICE_TAG = "recalibration";
    private static final int DAYS_PER_MONTH = 30;

    private final RecalibrationRunner runner;
    private final WeightOptimizer optimizer;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final FactorImpactRanker factorImpactRanker;
    private final WeightTableValidator validator;
    private final RecalibrationProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Metrics of the supplied weights
     */
    public RecalibrationResponse recalibrate(List<ClaimRecord> claims, Map<String, Double> weights) {
        return guarded("recalibrate", claims, () -> {
            WeightVector vector = toVector(weights);
            validator.validateVector(vector, defaultWeightTable());
            EvaluationMetrics metrics = runner.evaluate(claims, vector);
            recalibrations().increment();
            return RecalibrationResponse.builder()
                    .success(true)
                    .metrics(PerformanceMetrics.from(metrics))
                    .message("Recalibration completed successfully")
                    .build();
        });
    }

    /**
     * Optimize from current weights. Factors in the configured weight table keep its bounds;
     * others get {@code [min(0, w), max(1, w)]}.
     */
    public WeightOptimizationResponse optimize(List<ClaimRecord> claims, Map<String, Double> currentWeights,
                                               String method) {
        WeightVector current = toVector(currentWeights);
        Map<String, WeightEntry> configured = defaultWeightTable().stream()
                .collect(Collectors.toMap(WeightEntry::getFactorName, entry -> entry, (a, b) -> a, LinkedHashMap::new));

        List<WeightEntry> table = new ArrayList<>();
        for (String factor : current.factorNames()) {
            double weight = current.get(factor);
            WeightEntry known = configured.get(factor);
            table.add(known != null
                    ? known.toBuilder().baseWeight(weight).build()
                    : WeightEntry.of(factor, weight, Math.min(0.0, weight), Math.max(1.0, weight)));
        }
        return optimize(claims, table, method);
    }

    public WeightOptimizationResponse optimize(List<ClaimRecord> claims, List<WeightEntry> table, String method) {
        return optimize(claims, table, defaultOptimizationConfig(), method,
                OptimizationBudget.withTimeout(properties.getOptimization().getRunTimeout(), clock));
    }

    public WeightOptimizationResponse optimize(List<ClaimRecord> claims, List<WeightEntry> table,
                                               OptimizationConfig config, String method, OptimizationBudget budget) {
        return guarded("optimize", claims, () -> {
            OptimizationMethod resolved = OptimizationMethod.fromName(method);
            optimizerRuns().increment();
            OptimizationResult result = runTimer(resolved).record(
                    () -> optimizer.optimize(claims, table, config, resolved, budget));

            PerformanceMetrics current = PerformanceMetrics.from(
                    runner.evaluate(claims, WeightVector.fromBaseWeights(table)));
            PerformanceMetrics optimized = PerformanceMetrics.from(
                    runner.evaluate(claims, result.getOptimizedWeights()));

            return WeightOptimizationResponse.builder()
                    .optimizedWeights(result.getOptimizedWeights().asMap())
                    .improvementMetrics(ImprovementMetrics.between(current, optimized))
                    .iterations(result.getIterationsRun())
                    .converged(result.isConverged())
                    .method(result.getMethod().getMethodName())
                    .status(result.getStatus().name())
                    .initialMape(result.getInitialMape())
                    .finalMape(result.getFinalMape())
                    .finalRmse(result.getFinalRmse())
                    .improvementPct(result.getImprovementPct())
                    .convergenceHistory(result.getConvergenceHistory().stream()
                            .map(ConvergencePoint::from)
                            .collect(Collectors.toList()))
                    .build();
        }, this::optimizerFailures);
    }

    public SensitivityAnalysisResponse sensitivityAnalysis(List<ClaimRecord> claims, Map<String, Double> weights) {
        return sensitivityAnalysis(claims, weights, properties.getSensitivity().getPerturbation());
    }

    /**
     * Perturb each factor by {@code ±perturbation} (relative), others held at baseline, and
     * report how far MAE moves. Perturbed weights are clamped to configured bounds where known.
     */
    public SensitivityAnalysisResponse sensitivityAnalysis(List<ClaimRecord> claims, Map<String, Double> weights,
                                                           double perturbation) {
        return guarded("sensitivityAnalysis", claims, () -> {
            if (!(perturbation > 0.0 && perturbation <= 1.0)) {
                throw new InputValidationException("perturbation must be in (0, 1]: " + perturbation);
            }
            WeightVector baseline = toVector(weights);
            Map<String, WeightEntry> bounds = defaultWeightTable().stream()
                    .collect(Collectors.toMap(WeightEntry::getFactorName, entry -> entry, (a, b) -> a));

            PreparedClaims prepared = runner.prepare(claims, new ArrayList<>(baseline.factorNames()),
                    runner.defaultCoefficients());
            double baseMae = runner.evaluate(prepared, baseline).getMae();

            Map<String, SensitivityResult> results = new LinkedHashMap<>();
            for (String factor : baseline.factorNames()) {
                double weight = baseline.get(factor);
                double increased = weight * (1.0 + perturbation);
                double decreased = weight * (1.0 - perturbation);
                WeightEntry entry = bounds.get(factor);
                if (entry != null) {
                    increased = entry.clamp(increased);
                    decreased = entry.clamp(decreased);
                }
                double increasedMae = runner.evaluate(prepared, baseline.with(factor, increased)).getMae();
                double decreasedMae = runner.evaluate(prepared, baseline.with(factor, decreased)).getMae();

                results.put(factor, SensitivityResult.builder()
                        .baseMae(baseMae)
                        .increasedMae(increasedMae)
                        .decreasedMae(decreasedMae)
                        .sensitivityScore(baseMae == 0.0 ? 0.0 : Math.abs(increasedMae - decreasedMae) / baseMae)
                        .build());
            }
            log.debug("Sensitivity of {} factors at ±{}: {}", results.size(), perturbation, results);

            return SensitivityAnalysisResponse.builder()
                    .success(true)
                    .perturbation(perturbation)
                    .sensitivityResults(results)
                    .build();
        });
    }

    public WeightComparisonResponse compareWeights(List<ClaimRecord> claims, Map<String, Double> weightsA,
                                                   Map<String, Double> weightsB) {
        return guarded("compareWeights", claims, () -> {
            WeightVector vectorA = toVector(weightsA);
            WeightVector vectorB = toVector(weightsB);
            validator.validateVector(vectorA, defaultWeightTable());
            validator.validateVector(vectorB, defaultWeightTable());
            PerformanceMetrics a = PerformanceMetrics.from(runner.evaluate(claims, vectorA));
            PerformanceMetrics b = PerformanceMetrics.from(runner.evaluate(claims, vectorB));
            recalibrations().increment();

            return WeightComparisonResponse.builder()
                    .weightsAMetrics(a)
                    .weightsBMetrics(b)
                    .comparison(WeightComparisonResponse.Comparison.builder()
                            .maeDifference(a.getMae() - b.getMae())
                            .rmseDifference(a.getRmse() - b.getRmse())
                            .betterWeights(a.getMae() < b.getMae()
                                    ? WeightComparisonResponse.WEIGHTS_A
                                    : WeightComparisonResponse.WEIGHTS_B)
                            .build())
                    .build();
        });
    }

    /**
     * Per-claim before/after comparison of two weight vectors
     */
    public RecalibrationReport recalibrationReport(List<ClaimRecord> claims, Map<String, Double> baseline,
                                                   Map<String, Double> candidate) {
        return guarded("recalibrationReport", claims, () -> {
            RecalibrationReport report = runner.run(claims, toVector(baseline), toVector(candidate));
            recalibrations().increment();
            log.info("Recalibration report: {} claims, improved={}, degraded={}, mape {} -> {}",
                    report.getMetrics().getTotalClaims(), report.getMetrics().getImprovedCount(),
                    report.getMetrics().getDegradedCount(), report.getMetrics().getMapeBefore(),
                    report.getMetrics().getMapeAfter());
            return report;
        });
    }

    /**
     * Correlation and impact based weight suggestions for the table. With {@code recentMonths},
     * only claims dated within that many 30-day months of today are analyzed; undated claims are
     * then left out.
     */
    public WeightRecommendationResponse recommendWeights(List<ClaimRecord> claims, List<WeightEntry> table,
                                                         Integer recentMonths) {
        return guarded("recommendWeights", claims, () -> {
            validator.validateTable(table);
            List<ClaimRecord> analyzed = recentMonths == null ? claims : recentClaims(claims, recentMonths);
            if (analyzed.isEmpty()) {
                throw new InsufficientDataException("No claims within the last " + recentMonths + " months");
            }

            WeightVector current = WeightVector.fromBaseWeights(table);
            List<String> factors = table.stream().map(WeightEntry::getFactorName).collect(Collectors.toList());
            double[] predicted = runner.prepare(analyzed, factors, runner.defaultCoefficients()).predict(current);

            List<Double> predictions = new ArrayList<>(predicted.length);
            List<Double> deviations = new ArrayList<>(predicted.length);
            for (int i = 0; i < predicted.length; i++) {
                predictions.add(predicted[i]);
                deviations.add(MetricsEvaluator.absoluteErrorPct(predicted[i], analyzed.get(i).getActualSettlement()));
            }

            Map<String, Double> correlations = new LinkedHashMap<>();
            for (String factor : factors) {
                correlations.put(factor, correlationAnalyzer.correlate(analyzed, predictions, factor));
            }
            Map<String, Double> impacts = factorImpactRanker.computeImpacts(analyzed, current, deviations);

            WeightVector recommended = factorImpactRanker.recommendAll(table, correlations, impacts);
            List<WeightRecommendation> explanations = factorImpactRanker.explain(table, current, correlations, impacts);
            log.info("Recommended weights for {} factors from {} claims, {} suggested changes",
                    factors.size(), analyzed.size(), explanations.size());

            return WeightRecommendationResponse.builder()
                    .recommendedWeights(recommended.asMap())
                    .recommendations(explanations)
                    .claimsAnalyzed(analyzed.size())
                    .recentMonths(recentMonths)
                    .build();
        });
    }

    public List<WeightEntry> defaultWeightTable() {
        return properties.toWeightTable();
    }

    public OptimizationConfig defaultOptimizationConfig() {
        return properties.getOptimization().toConfig();
    }

    private List<ClaimRecord> recentClaims(List<ClaimRecord> claims, int months) {
        if (months < 1) {
            throw new InputValidationException("recent months must be at least 1: " + months);
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays((long) months * DAYS_PER_MONTH);
        return claims.stream()
                .filter(claim -> claim.getClaimDate() != null && !claim.getClaimDate().isBefore(cutoff))
                .collect(Collectors.toList());
    }

    private static WeightVector toVector(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InputValidationException("At least one factor weight is required");
        }
        weights.forEach((factor, weight) -> {
            if (weight == null || !Double.isFinite(weight)) {
                throw new InputValidationException("Non-finite weight for factor " + factor);
            }
        });
        return WeightVector.of(weights);
    }

    private <T> T guarded(String operation, List<ClaimRecord> claims, Supplier<T> action) {
        return guarded(operation, claims, action, null);
    }

    private <T> T guarded(String operation, List<ClaimRecord> claims, Supplier<T> action,
                          Supplier<Counter> failureCounter) {
        try {
            validator.validateClaims(claims);
            return action.get();
        } catch (RuntimeException e) {
            Optional.ofNullable(failureCounter).map(Supplier::get).ifPresent(Counter::increment);
            log.error("{} failed for {} claims: {}", operation, claims == null ? 0 : claims.size(), e.getMessage(), e);
            throw e;
        }
    }

    private Timer runTimer(OptimizationMethod method) {
        return Timer.builder(MetricsConfig.OPTIMIZER_RUN_TIME)
                .description("Optimizer run wall time")
                .tag("service", SERVICE_TAG)
                .tag("method", method.getMethodName())
                .register(meterRegistry);
    }

    private Counter optimizerRuns() {
        return meterRegistry.counter(MetricsConfig.OPTIMIZER_RUNS, "service", SERVICE_TAG);
    }

    private Counter optimizerFailures() {
        return meterRegistry.counter(MetricsConfig.OPTIMIZER_FAILURES, "service", SERVICE_TAG);
    }

    private Counter recalibrations() {
        return meterRegistry.counter(MetricsConfig.RECALIBRATIONS, "service", SERVICE_TAG);
    }
}
