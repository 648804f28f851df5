package org.dxworks.cobolscope.model.controlflow;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ControlFlowResult extends PartialResult {
    public List<String> nodes = new ArrayList<>();
    public List<ControlFlowEdge> edges = new ArrayList<>();
    public List<String> entryPoints = new ArrayList<>();
    public List<String> exitPoints = new ArrayList<>();
    public List<Cycle> cycles = new ArrayList<>();
    public List<DecisionPoint> decisionPoints = new ArrayList<>();

    public int cyclomaticComplexity = 1;
    public int maxNestingDepth;
    public int gotoCount;
    public int statementCount;
    public double decisionDensity;
    public Map<String, Integer> paragraphComplexity = new LinkedHashMap<>();
}
