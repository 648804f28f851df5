package org.dxworks.cobolscope.model.quality;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class QualityResult extends PartialResult {
    public List<EvaluationResult> evaluations = new ArrayList<>();
    public Map<MetricCategory, Double> categoryScores = new LinkedHashMap<>();
    public double overallScore;
    public List<Recommendation> recommendations = new ArrayList<>();
    public List<String> skippedMetrics = new ArrayList<>();

    public EvaluationResult evaluation(String metricName) {
        for (EvaluationResult evaluation : evaluations) {
            if (evaluation.metricName.equals(metricName)) {
                return evaluation;
            }
        }
        return null;
    }
}
