package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightRecommendation;
import com.claimlens.recalibration.model.WeightRecommendation.Confidence;
import com.claimlens.recalibration.model.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Factor Impact Ranking
 *
 * <p>Scores how strongly each factor is tied to prediction error and turns that score into a
 * recommended weight:
 * <ul>
 *   <li>impact: mean of {@code factorScore * weight * |variance %|} over the claim set</li>
 *   <li>combined score: {@code 0.6 * |correlation| + 0.4 * impact / max(impact)}</li>
 *   <li>recommended weight: {@code min + combined * (max - min)}</li>
 * </ul>
 * A full recommended vector is rescaled so its total matches the base-weight total, keeping the
 * overall scale of the scoring formula while shifting relative emphasis.
 */
@Slf4j
@Component
public class FactorImpactRanker {

    static final double CORRELATION_SHARE = 0.6;
    static final double IMPACT_SHARE = 0.4;
    static final double MIN_MEANINGFUL_CHANGE = 0.01;
    private static final double BUDGET_TOLERANCE = 1e-12;

    /**
     * Impact per factor against the variance of each claim's recorded prediction
     */
    public Map<String, Double> computeImpacts(List<ClaimRecord> claims, WeightVector weights) {
        List<Double> deviations = new ArrayList<>(claims.size());
        for (ClaimRecord claim : claims) {
            OptionalDouble variance = claim.recordedVariancePct();
            deviations.add(variance.isPresent() ? Math.abs(variance.getAsDouble()) : null);
        }
        return computeImpacts(claims, weights, deviations);
    }

    /**
     * Impact per factor; {@code absoluteDeviations} holds |variance %| per claim, {@code null}
     * where it is undefined (such claims contribute nothing but still count in the mean)
     */
    public Map<String, Double> computeImpacts(List<ClaimRecord> claims, WeightVector weights,
                                              List<Double> absoluteDeviations) {
        Map<String, Double> impacts = new LinkedHashMap<>();
        if (claims.isEmpty()) {
            weights.factorNames().forEach(factor -> impacts.put(factor, 0.0));
            return impacts;
        }
        for (String factor : weights.factorNames()) {
            double weight = weights.get(factor);
            double total = 0.0;
            for (int i = 0; i < claims.size(); i++) {
                Double deviation = absoluteDeviations.get(i);
                if (deviation != null) {
                    total += FeatureValues.toFactorScore(claims.get(i).feature(factor)) * weight * deviation;
                }
            }
            impacts.put(factor, Math.abs(total / claims.size()));
        }
        return impacts;
    }

    public double normalizedImpact(String factorName, Map<String, Double> impacts) {
        double maxImpact = maxImpact(impacts.values());
        if (maxImpact <= 0.0) {
            return 0.0;
        }
        return impacts.getOrDefault(factorName, 0.0) / maxImpact;
    }

    public double combinedScore(double correlation, double normalizedImpact) {
        return CORRELATION_SHARE * Math.abs(correlation) + IMPACT_SHARE * normalizedImpact;
    }

    /**
     * Recommended weight for one factor, always inside its bounds
     */
    public double recommend(WeightEntry entry, double correlation, Map<String, Double> impacts) {
        double combined = combinedScore(correlation, normalizedImpact(entry.getFactorName(), impacts));
        return entry.clamp(entry.getMinWeight() + combined * entry.range());
    }

    /**
     * Recommended weight for every factor, rescaled so the vector total equals the base total
     */
    public WeightVector recommendAll(List<WeightEntry> table, Map<String, Double> correlations,
                                     Map<String, Double> impacts) {
        Map<String, Double> recommended = new LinkedHashMap<>();
        for (WeightEntry entry : table) {
            recommended.put(entry.getFactorName(),
                    recommend(entry, correlations.getOrDefault(entry.getFactorName(), 0.0), impacts));
        }
        double budget = table.stream().mapToDouble(WeightEntry::getBaseWeight).sum();
        WeightVector rescaled = rescaleToBudget(table, recommended, budget);
        log.debug("Recommended weights rescaled to budget {}: {}", budget, rescaled);
        return rescaled;
    }

    /**
     * Scale {@code weights} by {@code budget / sum(weights)}. Entries pushed past a bound are
     * pinned to it and the remainder is spread over the others, so the result keeps both the
     * budget and every factor's bounds whenever {@code sum(min) <= budget <= sum(max)}.
     */
    public WeightVector rescaleToBudget(List<WeightEntry> table, Map<String, Double> weights, double budget) {
        Map<String, Double> values = new LinkedHashMap<>(weights);
        List<WeightEntry> free = new ArrayList<>(table);

        for (int round = 0; round <= table.size() && !free.isEmpty(); round++) {
            double pinnedSum = 0.0;
            double freeSum = 0.0;
            for (WeightEntry entry : table) {
                double value = values.get(entry.getFactorName());
                if (free.contains(entry)) {
                    freeSum += value;
                } else {
                    pinnedSum += value;
                }
            }
            if (freeSum == 0.0) {
                break;
            }
            double scale = (budget - pinnedSum) / freeSum;
            List<WeightEntry> pinned = new ArrayList<>();
            for (WeightEntry entry : free) {
                double scaled = values.get(entry.getFactorName()) * scale;
                if (!entry.contains(scaled)) {
                    pinned.add(entry);
                }
                values.put(entry.getFactorName(), entry.clamp(scaled));
            }
            if (pinned.isEmpty()) {
                break;
            }
            free.removeAll(pinned);
        }

        spreadResidual(table, values, budget);
        Map<String, Double> ordered = new LinkedHashMap<>();
        table.forEach(entry -> ordered.put(entry.getFactorName(), values.get(entry.getFactorName())));
        return WeightVector.of(ordered);
    }

    /**
     * Factors ordered by combined score, highest first; ties keep table order. Frozen factors are
     * left out.
     */
    public List<String> rankFactors(List<WeightEntry> table, Map<String, Double> correlations,
                                    Map<String, Double> impacts, Set<String> frozenFactors) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (WeightEntry entry : table) {
            String factor = entry.getFactorName();
            if (!frozenFactors.contains(factor)) {
                scores.put(factor, combinedScore(correlations.getOrDefault(factor, 0.0),
                        normalizedImpact(factor, impacts)));
            }
        }
        List<String> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.comparingDouble((String factor) -> scores.get(factor)).reversed());
        return ranked;
    }

    /**
     * Human-readable recommendations, strongest expected improvement first. Factors whose
     * suggestion is within 0.01 of the current weight are omitted.
     */
    public List<WeightRecommendation> explain(List<WeightEntry> table, WeightVector current,
                                              Map<String, Double> correlations, Map<String, Double> impacts) {
        List<WeightRecommendation> recommendations = new ArrayList<>();

        for (WeightEntry entry : table) {
            String factor = entry.getFactorName();
            double currentWeight = current.contains(factor) ? current.get(factor) : entry.getBaseWeight();
            double correlation = Math.abs(correlations.getOrDefault(factor, 0.0));
            double impact = impacts.getOrDefault(factor, 0.0);
            double normalized = normalizedImpact(factor, impacts);
            double recommended = entry.getMinWeight() + combinedScore(correlation, normalized) * entry.range();

            double suggested = recommended;
            String reason;
            Confidence confidence;
            int expectedImprovement;

            if (correlation > 0.5 && normalized > 0.6 && currentWeight < recommended) {
                suggested = Math.min(entry.getMaxWeight(), recommended);
                reason = String.format("High correlation (%.1f%%) and high impact (%.2f). Increasing weight will likely improve predictions.",
                        correlation * 100, impact);
                confidence = Confidence.HIGH;
                expectedImprovement = (int) Math.round(correlation * 10);
            } else if (normalized > 0.5 && currentWeight < recommended * 0.8) {
                suggested = Math.min(entry.getMaxWeight(), recommended);
                reason = String.format("Factor has high impact (%.2f) but is underweighted. Analysis suggests increasing to %.3f.",
                        impact, suggested);
                confidence = Confidence.HIGH;
                expectedImprovement = (int) Math.round(normalized * 8);
            } else if (normalized < 0.3 && currentWeight > recommended * 1.2) {
                suggested = Math.max(entry.getMinWeight(), recommended);
                reason = String.format("Low impact factor (%.2f) is overweighted. Reducing weight may improve efficiency without hurting accuracy.",
                        impact);
                confidence = Confidence.MEDIUM;
                expectedImprovement = (int) Math.round((currentWeight - suggested) * 20);
            } else if (Math.abs(currentWeight - recommended) > 0.02) {
                reason = String.format("Analysis suggests optimal weight is %.3f (correlation: %.1f%%, impact: %.2f).",
                        recommended, correlation * 100, normalized);
                confidence = Confidence.MEDIUM;
                expectedImprovement = (int) Math.round(Math.abs(currentWeight - recommended) * 30);
            } else {
                reason = String.format("Weight is near optimal (current: %.3f, recommended: %.3f).",
                        currentWeight, recommended);
                confidence = Confidence.LOW;
                expectedImprovement = 0;
            }

            if (Math.abs(suggested - currentWeight) > MIN_MEANINGFUL_CHANGE) {
                recommendations.add(WeightRecommendation.builder()
                        .factorName(factor)
                        .currentWeight(currentWeight)
                        .suggestedWeight(suggested)
                        .correlation(correlation)
                        .normalizedImpact(normalized)
                        .reason(reason)
                        .expectedImprovement(expectedImprovement)
                        .confidence(confidence)
                        .build());
            }
        }

        recommendations.sort(Comparator.comparingInt(WeightRecommendation::getExpectedImprovement).reversed());
        return recommendations;
    }

    private void spreadResidual(List<WeightEntry> table, Map<String, Double> values, double budget) {
        double residual = budget - values.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(residual) <= BUDGET_TOLERANCE) {
            return;
        }
        double totalHeadroom = 0.0;
        for (WeightEntry entry : table) {
            totalHeadroom += headroom(entry, values.get(entry.getFactorName()), residual);
        }
        if (totalHeadroom <= 0.0) {
            log.warn("Weight budget {} cannot be met within factor bounds, residual {}", budget, residual);
            return;
        }
        double share = Math.min(1.0, Math.abs(residual) / totalHeadroom);
        for (WeightEntry entry : table) {
            double value = values.get(entry.getFactorName());
            double move = headroom(entry, value, residual) * share * Math.signum(residual);
            values.put(entry.getFactorName(), entry.clamp(value + move));
        }
    }

    private static double headroom(WeightEntry entry, double value, double residual) {
        return residual > 0 ? Math.max(0.0, entry.getMaxWeight() - value) : Math.max(0.0, value - entry.getMinWeight());
    }

    private static double maxImpact(Collection<Double> impacts) {
        return impacts.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
