package org.dxworks.cobolscope.model.metrics;

public class HalsteadMetrics {
    public int distinctOperators;  // n1
    public int distinctOperands;   // n2
    public int totalOperators;     // N1
    public int totalOperands;      // N2
    public int vocabulary;
    public int length;
    public double volume;
    public double difficulty;
    public double effort;
}
