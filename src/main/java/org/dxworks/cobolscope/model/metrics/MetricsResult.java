package org.dxworks.cobolscope.model.metrics;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MetricsResult extends PartialResult {
    public int cyclomaticComplexity;
    public int cognitiveComplexity;
    public int maxNestingDepth;
    public HalsteadMetrics halstead;      // null when unavailable
    public Double maintainabilityIndex;   // null when unavailable
    public double commentRatio;
    public int linesOfCode;
    public double decisionDensity;
    public List<ParagraphMetrics> paragraphs = new ArrayList<>();
    public List<Hotspot> hotspots = new ArrayList<>();
    public List<String> unavailable = new ArrayList<>();

    /** Flat metric name to value map consumed by the quality evaluator; unavailable metrics map to null. */
    public Map<String, Double> raw = new LinkedHashMap<>();
}
