package org.dxworks.cobolscope.analyzer.quality;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.quality.EvaluationLevel;
import org.dxworks.cobolscope.model.quality.EvaluationResult;
import org.dxworks.cobolscope.model.quality.MetricCategory;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;
import org.dxworks.cobolscope.model.quality.QualityResult;
import org.dxworks.cobolscope.model.quality.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores each metric with a benchmark definition, aggregates per category and overall, and recommends
 * improvements for the metrics scoring under the configured cutoff.
 * <p>
 * A metric equal to its target scores 1.0. Moving away from the target the score falls linearly to 0 at the
 * bound on that side; with no bound on that side it decays as {@code 1 / (1 + |v - t| / max(|t|, 1))}.
 */
public class QualityEvaluator implements Analyzer<QualityResult> {

    public static final String NAME = "quality";

    private static final Logger LOGGER = LoggerFactory.getLogger(QualityEvaluator.class);

    private static final Comparator<Recommendation> PRIORITY = Comparator
            .comparing((Recommendation r) -> r.severity.ordinal())
            .thenComparing(r -> r.gap, Comparator.reverseOrder())
            .thenComparing(r -> r.metric);

    private final SuggestionCatalog suggestions;

    public QualityEvaluator(SuggestionCatalog suggestions) {
        this.suggestions = Objects.requireNonNull(suggestions, "suggestions");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public QualityResult analyze(AstNode program, AnalysisContext context) {
        QualityResult result = new QualityResult();
        MetricsResult metrics = context.metrics();
        Map<String, Double> raw = metrics == null ? Map.of() : metrics.raw;
        CobolscopeConfig config = context.config();

        Map<EvaluationResult, Double> weights = new IdentityHashMap<>();
        for (QualityMetricDefinition definition : context.benchmarks()) {
            Double value = raw.get(definition.name);
            if (value == null || value.isNaN()) {
                result.skippedMetrics.add(definition.name);
                continue;
            }
            EvaluationResult evaluation = evaluate(definition, value, config);
            weights.put(evaluation, definition.weight);
            result.evaluations.add(evaluation);
        }
        if (!result.skippedMetrics.isEmpty()) {
            LOGGER.debug("No value for benchmarked metrics {}", result.skippedMetrics);
        }

        aggregate(result, weights);
        recommend(result, config.getRecommendationCutoff());
        return result;
    }

    EvaluationResult evaluate(QualityMetricDefinition definition, double value, CobolscopeConfig config) {
        Double target = effectiveTarget(definition);
        double score = score(value, target, definition.minValue, definition.maxValue);

        EvaluationResult evaluation = new EvaluationResult();
        evaluation.metricName = definition.name;
        evaluation.category = definition.category;
        evaluation.actualValue = value;
        evaluation.benchmarkValue = benchmarkValue(definition, target, value);
        evaluation.score = score;
        evaluation.level = level(value, target, definition, score, config);
        putIfPresent(evaluation.details, "min", definition.minValue);
        putIfPresent(evaluation.details, "max", definition.maxValue);
        putIfPresent(evaluation.details, "target", definition.targetValue);
        evaluation.details.put("weight", definition.weight);
        if (target != null) {
            evaluation.details.put("deviation", value - target);
        }
        putIfPresent(evaluation.details, "description", definition.description);
        return evaluation;
    }

    /** Declared target, else the midpoint of both bounds, else none. */
    private static Double effectiveTarget(QualityMetricDefinition definition) {
        if (definition.targetValue != null) {
            return definition.targetValue;
        }
        if (definition.minValue != null && definition.maxValue != null) {
            return (definition.minValue + definition.maxValue) / 2.0;
        }
        return null;
    }

    private static double benchmarkValue(QualityMetricDefinition definition, Double target, double value) {
        if (target != null) {
            return target;
        }
        if (definition.minValue != null) {
            return definition.minValue;
        }
        return definition.maxValue != null ? definition.maxValue : value;
    }

    static double score(double value, Double target, Double min, Double max) {
        if (target == null) {
            if (min != null && value < min) {
                return decay(value, min);
            }
            if (max != null && value > max) {
                return decay(value, max);
            }
            return 1.0;
        }
        if (value == target) {
            return 1.0;
        }
        Double bound = value > target ? max : min;
        if (bound == null) {
            return decay(value, target);
        }
        double room = Math.abs(bound - target);
        if (room == 0.0) {
            return 0.0;
        }
        return clip(1.0 - Math.abs(value - target) / room);
    }

    private static double decay(double value, double reference) {
        return 1.0 / (1.0 + Math.abs(value - reference) / Math.max(Math.abs(reference), 1.0));
    }

    private static EvaluationLevel level(double value, Double target, QualityMetricDefinition definition,
                                         double score, CobolscopeConfig config) {
        boolean onTarget = target != null && value == target;
        boolean outOfBounds = (definition.minValue != null && value < definition.minValue)
                || (definition.maxValue != null && value > definition.maxValue);
        if (outOfBounds && !onTarget) {
            return EvaluationLevel.CRITICAL;
        }
        if (target != null
                && Math.abs(value - target) > config.getWarningTolerance() * Math.max(Math.abs(target), 1.0)) {
            return EvaluationLevel.WARNING;
        }
        if (score >= config.getExcellentScore()) {
            return EvaluationLevel.EXCELLENT;
        }
        return score >= config.getGoodScore() ? EvaluationLevel.GOOD : EvaluationLevel.ACCEPTABLE;
    }

    /** Category score is the weighted mean of its metrics; overall score is the mean of the category scores. */
    private static void aggregate(QualityResult result, Map<EvaluationResult, Double> weights) {
        for (MetricCategory category : MetricCategory.values()) {
            double weighted = 0.0;
            double totalWeight = 0.0;
            for (EvaluationResult evaluation : result.evaluations) {
                if (evaluation.category == category) {
                    double weight = weights.get(evaluation);
                    weighted += weight * evaluation.score;
                    totalWeight += weight;
                }
            }
            if (totalWeight > 0.0) {
                result.categoryScores.put(category, weighted / totalWeight);
            }
        }
        result.overallScore = result.categoryScores.values().stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    private void recommend(QualityResult result, double cutoff) {
        for (EvaluationResult evaluation : result.evaluations) {
            if (evaluation.score >= cutoff) {
                continue;
            }
            Recommendation recommendation = new Recommendation();
            recommendation.metric = evaluation.metricName;
            recommendation.category = evaluation.category;
            recommendation.severity = evaluation.level;
            recommendation.currentValue = evaluation.actualValue;
            recommendation.targetValue = evaluation.benchmarkValue;
            recommendation.score = evaluation.score;
            recommendation.gap = 1.0 - evaluation.score;
            recommendation.suggestion = suggestions.suggestion(evaluation.metricName, evaluation.level,
                    evaluation.actualValue, evaluation.benchmarkValue);
            result.recommendations.add(recommendation);
        }
        result.recommendations.sort(PRIORITY);
    }

    private static double clip(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static void putIfPresent(Map<String, Object> details, String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
