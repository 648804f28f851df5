package org.dxworks.cobolscope.model.data;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DataResult extends PartialResult {
    public List<DataItemInfo> items = new ArrayList<>();
    public List<String> roots = new ArrayList<>();
    public List<DataDependency> dependencies = new ArrayList<>();
    public List<DataFlow> dataFlows = new ArrayList<>();

    /** Combined dependency graph: item name to outgoing edges, data-flow edges included. */
    public Map<String, List<DataDependency>> graph = new LinkedHashMap<>();
    public Map<String, Integer> degrees = new LinkedHashMap<>();
    public List<String> criticalItems = new ArrayList<>();
    public DataMetrics metrics = new DataMetrics();
}
