package org.dxworks.cobolscope.model.callgraph;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CallGraphResult extends PartialResult {
    public Map<String, List<String>> graph = new LinkedHashMap<>();
    public List<CallEdge> calls = new ArrayList<>();
    public List<String> entryPoints = new ArrayList<>();
    public List<String> leafNodes = new ArrayList<>();
    public List<UnresolvedCall> unresolvedCalls = new ArrayList<>();

    public int totalCalls;
    public int distinctCallees;
    public int maxCallDepth;
    public double averageCallsPerCaller;
}
