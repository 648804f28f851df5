package org.dxworks.cobolscope.model.quality;

/**
 * Benchmark criteria for one metric, supplied by the caller. Any of the bounds and the target may be absent.
 */
public class QualityMetricDefinition {
    public String name;
    public MetricCategory category;
    public Double minValue;
    public Double maxValue;
    public Double targetValue;
    public double weight = 1.0;
    public String description;

    public QualityMetricDefinition() {
    }

    public QualityMetricDefinition(String name, MetricCategory category,
                                   Double minValue, Double maxValue, Double targetValue, double weight) {
        this.name = name;
        this.category = category;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.targetValue = targetValue;
        this.weight = weight;
    }
}
