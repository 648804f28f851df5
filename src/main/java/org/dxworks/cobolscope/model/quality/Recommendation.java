package org.dxworks.cobolscope.model.quality;

public class Recommendation {
    public String metric;
    public MetricCategory category;
    public EvaluationLevel severity;
    public double currentValue;
    public double targetValue;
    public double score;
    public double gap;
    public String suggestion;
}
