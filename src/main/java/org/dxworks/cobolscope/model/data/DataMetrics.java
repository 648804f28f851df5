package org.dxworks.cobolscope.model.data;

import java.util.LinkedHashMap;
import java.util.Map;

public class DataMetrics {
    // hierarchy
    public int totalItems;
    public int maxDepth;
    public double averageChildren;
    public int redefinesCount;
    public int conditionNames;
    public Map<String, Integer> itemsBySection = new LinkedHashMap<>();

    // dependencies
    public int totalDependencies;
    public double averageDegree;
    public int maxDegree;
    public int criticalItemsCount;

    // data flow
    public int totalFlows;
    public Map<String, Integer> flowsByStatement = new LinkedHashMap<>();
}
