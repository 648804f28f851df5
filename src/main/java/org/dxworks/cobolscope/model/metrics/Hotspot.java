package org.dxworks.cobolscope.model.metrics;

public class Hotspot {
    public String paragraph;
    public String metric;
    public double value;
    public double threshold;
}
