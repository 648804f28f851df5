package org.dxworks.cobolscope.model.metrics;

public class ParagraphMetrics {
    public String name;
    public int statements;
    public int cyclomaticComplexity;
    public int cognitiveComplexity;
}
