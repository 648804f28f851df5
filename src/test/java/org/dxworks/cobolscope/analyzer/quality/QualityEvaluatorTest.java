package org.dxworks.cobolscope.analyzer.quality;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.CancellationToken;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.quality.EvaluationLevel;
import org.dxworks.cobolscope.model.quality.EvaluationResult;
import org.dxworks.cobolscope.model.quality.MetricCategory;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;
import org.dxworks.cobolscope.model.quality.QualityResult;
import org.dxworks.cobolscope.model.quality.Recommendation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityEvaluatorTest {

    private static final CobolscopeConfig CONFIG = CobolscopeConfig.defaults();

    private final QualityEvaluator evaluator = new QualityEvaluator(SuggestionCatalog.loadDefault());

    @Test
    void scoreIsOneOnTarget() {
        assertEquals(1.0, QualityEvaluator.score(10, 10.0, 1.0, 50.0));
        assertEquals(1.0, QualityEvaluator.score(0, 0.0, 0.0, 0.0));
    }

    @Test
    void scoreFallsLinearlyTowardTheBound() {
        assertEquals(0.5, QualityEvaluator.score(30, 10.0, 1.0, 50.0), 1e-9);
        assertEquals(0.5, QualityEvaluator.score(5.5, 10.0, 1.0, 50.0), 1e-9);
        assertEquals(0.0, QualityEvaluator.score(60, 10.0, 1.0, 50.0));
        assertEquals(0.0, QualityEvaluator.score(1, 0.0, null, 0.0));
    }

    @Test
    void scoreDecaysWithoutABound() {
        assertEquals(0.5, QualityEvaluator.score(20, 10.0, 0.0, null), 1e-9);
        assertEquals(0.5, QualityEvaluator.score(0, null, 2.0, null), 1e-9);
        assertEquals(1.0, QualityEvaluator.score(4, null, 2.0, 8.0));
    }

    @Test
    void onTargetValueIsNeverCritical() {
        QualityMetricDefinition odd = definition("odd", MetricCategory.COMPLEXITY, 5.0, 10.0, 3.0);

        EvaluationResult evaluation = evaluator.evaluate(odd, 3.0, CONFIG);

        assertEquals(1.0, evaluation.score);
        assertEquals(EvaluationLevel.EXCELLENT, evaluation.level);
    }

    @Test
    void levelsFollowBoundsToleranceAndScore() {
        QualityMetricDefinition cyclomatic = definition("cyclomatic_complexity", MetricCategory.COMPLEXITY,
                1.0, 50.0, 10.0);
        assertEquals(EvaluationLevel.CRITICAL, evaluator.evaluate(cyclomatic, 60, CONFIG).level);
        assertEquals(EvaluationLevel.WARNING, evaluator.evaluate(cyclomatic, 13, CONFIG).level);
        assertEquals(EvaluationLevel.EXCELLENT, evaluator.evaluate(cyclomatic, 11.5, CONFIG).level);

        QualityMetricDefinition narrow = definition("narrow", MetricCategory.READABILITY, 9.0, 11.0, 10.0);
        assertEquals(EvaluationLevel.GOOD, evaluator.evaluate(narrow, 10.2, CONFIG).level);
        assertEquals(EvaluationLevel.ACCEPTABLE, evaluator.evaluate(narrow, 10.5, CONFIG).level);
        assertEquals(EvaluationLevel.WARNING,
                evaluator.evaluate(narrow, 10.5, CONFIG.withWarningTolerance(0.01)).level);
    }

    @Test
    void missingTargetUsesMidpoint() {
        QualityMetricDefinition bounded = definition("bounded", MetricCategory.TESTABILITY, 0.0, 10.0, null);

        EvaluationResult evaluation = evaluator.evaluate(bounded, 5.0, CONFIG);

        assertEquals(5.0, evaluation.benchmarkValue);
        assertEquals(1.0, evaluation.score);
        assertEquals(0.0, evaluation.details.get("deviation"));
        assertFalse(evaluation.details.containsKey("target"));
    }

    @Test
    void aggregatesWeightedCategoryScores() {
        QualityMetricDefinition light = definition("a", MetricCategory.COMPLEXITY, 0.0, 20.0, 10.0);
        QualityMetricDefinition heavy = definition("b", MetricCategory.COMPLEXITY, 0.0, 20.0, 10.0);
        heavy.weight = 3.0;
        QualityMetricDefinition docs = definition("c", MetricCategory.DOCUMENTATION, 0.0, 1.0, 0.5);

        QualityResult result = evaluate(Map.of("a", 10.0, "b", 15.0, "c", 0.5), List.of(light, heavy, docs));

        assertEquals(List.of(MetricCategory.COMPLEXITY, MetricCategory.DOCUMENTATION),
                List.copyOf(result.categoryScores.keySet()));
        assertEquals((1.0 + 3.0 * 0.5) / 4.0, result.categoryScores.get(MetricCategory.COMPLEXITY), 1e-9);
        assertEquals(1.0, result.categoryScores.get(MetricCategory.DOCUMENTATION), 1e-9);
        assertEquals((0.625 + 1.0) / 2, result.overallScore, 1e-9);
    }

    @Test
    void unavailableMetricsAreSkipped() {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("maintainability_index", null);
        raw.put("goto_count", 0.0);
        List<QualityMetricDefinition> benchmarks = List.of(
                definition("maintainability_index", MetricCategory.MAINTAINABILITY, 20.0, 100.0, 85.0),
                definition("goto_count", MetricCategory.MAINTAINABILITY, 0.0, 20.0, 0.0),
                definition("not_measured", MetricCategory.MODULARITY, 0.0, 1.0, 0.0));

        QualityResult result = evaluate(raw, benchmarks);

        assertEquals(List.of("maintainability_index", "not_measured"), result.skippedMetrics);
        assertEquals(1, result.evaluations.size());
        assertEquals(1.0, result.overallScore);
    }

    @Test
    void nothingToEvaluateScoresZero() {
        QualityResult result = evaluate(Map.of(), List.of());

        assertTrue(result.evaluations.isEmpty());
        assertTrue(result.categoryScores.isEmpty());
        assertEquals(0.0, result.overallScore);

        AnalysisContext withoutMetrics = AnalysisContext.of(CONFIG,
                List.of(definition("goto_count", MetricCategory.MAINTAINABILITY, 0.0, 20.0, 0.0)),
                CancellationToken.none());
        assertEquals(List.of("goto_count"),
                evaluator.analyze(TestUtils.sample("payroll.json"), withoutMetrics).skippedMetrics);
    }

    @Test
    void recommendationsAreOrderedBySeverityThenGap() {
        Map<String, Double> raw = Map.of(
                "cyclomatic_complexity", 60.0,
                "data_complexity", 3.75,
                "goto_count", 14.0,
                "comment_ratio", 0.25);
        List<QualityMetricDefinition> benchmarks = List.of(
                definition("cyclomatic_complexity", MetricCategory.COMPLEXITY, 1.0, 50.0, 10.0),
                definition("data_complexity", MetricCategory.MODULARITY, 0.0, 6.0, 1.5),
                definition("goto_count", MetricCategory.MAINTAINABILITY, 0.0, 20.0, 0.0),
                definition("comment_ratio", MetricCategory.DOCUMENTATION, 0.05, 0.6, 0.25));

        QualityResult result = evaluate(raw, benchmarks);

        assertEquals(List.of("cyclomatic_complexity", "goto_count", "data_complexity"),
                result.recommendations.stream().map(r -> r.metric).collect(Collectors.toList()));

        Recommendation first = result.recommendations.get(0);
        assertEquals(EvaluationLevel.CRITICAL, first.severity);
        assertEquals(1.0, first.gap);
        assertTrue(first.suggestion.contains("Current complexity: 60.00"), first.suggestion);
        assertTrue(first.suggestion.contains("Target: 10.00"), first.suggestion);

        Recommendation generic = result.recommendations.get(1);
        assertEquals(EvaluationLevel.WARNING, generic.severity);
        assertEquals(0.7, generic.gap, 1e-9);
        assertTrue(generic.suggestion.startsWith("No specific guidance is available for goto_count"),
                generic.suggestion);
    }

    @Test
    void cutoffControlsRecommendations() {
        Map<String, Double> raw = Map.of("goto_count", 14.0);
        List<QualityMetricDefinition> benchmarks = List.of(
                definition("goto_count", MetricCategory.MAINTAINABILITY, 0.0, 20.0, 0.0));

        assertEquals(1, evaluate(raw, benchmarks).recommendations.size());

        AnalysisContext strict = context(raw, benchmarks, CONFIG.withRecommendationCutoff(0.2));
        assertTrue(evaluator.analyze(TestUtils.sample("payroll.json"), strict).recommendations.isEmpty());
    }

    private QualityResult evaluate(Map<String, Double> raw, List<QualityMetricDefinition> benchmarks) {
        return evaluator.analyze(TestUtils.sample("payroll.json"), context(raw, benchmarks, CONFIG));
    }

    private static AnalysisContext context(Map<String, Double> raw, List<QualityMetricDefinition> benchmarks,
                                           CobolscopeConfig config) {
        MetricsResult metrics = new MetricsResult();
        metrics.raw = new LinkedHashMap<>(raw);
        return AnalysisContext.of(config, benchmarks, CancellationToken.none()).withMetrics(metrics);
    }

    private static QualityMetricDefinition definition(String name, MetricCategory category,
                                                      Double min, Double max, Double target) {
        return new QualityMetricDefinition(name, category, min, max, target, 1.0);
    }
}
