package org.dxworks.cobolscope.model.quality;

import java.util.LinkedHashMap;
import java.util.Map;

public class EvaluationResult {
    public String metricName;
    public MetricCategory category;
    public double actualValue;
    public double benchmarkValue;
    public EvaluationLevel level;
    public double score;
    public Map<String, Object> details = new LinkedHashMap<>();
}
