package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.cobolscope.model.callgraph.CallGraphResult;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.data.DataResult;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.quality.QualityResult;
import org.dxworks.cobolscope.model.structure.StructureResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate output of one analysis call. A plain value: no references back into the AST, serializable as JSON.
 * Sections that were not computed (fatal input, cancellation) are {@code null}; {@link #issues} and
 * {@link #errors} are never null.
 */
public class AnalysisResult {
    public String sourceId;
    public String programId;
    public AnalysisStatus status = AnalysisStatus.COMPLETE;
    public boolean complete = true;

    public StructureResult structure;
    public ControlFlowResult controlFlow;
    public DataResult data;
    public CallGraphResult callGraph;
    public MetricsResult metrics;
    public QualityResult quality;

    public List<Issue> issues = new ArrayList<>();
    public List<Issue> errors = new ArrayList<>();

    @JsonIgnore
    public boolean isFatal() {
        return status == AnalysisStatus.FATAL;
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == AnalysisStatus.CANCELLED;
    }
}
