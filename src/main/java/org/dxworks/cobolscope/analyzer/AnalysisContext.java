package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.model.callgraph.CallGraphResult;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.data.DataResult;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;
import org.dxworks.cobolscope.model.structure.StructureResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything an analyzer may read besides the AST: configuration, benchmarks, the cancellation token and the
 * results of the analyzers it depends on. Immutable; each stage gets a copy carrying the upstream results.
 */
public final class AnalysisContext {

    private final CobolscopeConfig config;
    private final List<QualityMetricDefinition> benchmarks;
    private final CancellationToken cancellation;

    private final StructureResult structure;
    private final ControlFlowResult controlFlow;
    private final DataResult data;
    private final CallGraphResult callGraph;
    private final MetricsResult metrics;

    private AnalysisContext(CobolscopeConfig config, List<QualityMetricDefinition> benchmarks,
                            CancellationToken cancellation, StructureResult structure,
                            ControlFlowResult controlFlow, DataResult data, CallGraphResult callGraph,
                            MetricsResult metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.benchmarks = benchmarks == null ? List.of() : List.copyOf(benchmarks);
        this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
        this.structure = structure;
        this.controlFlow = controlFlow;
        this.data = data;
        this.callGraph = callGraph;
        this.metrics = metrics;
    }

    public static AnalysisContext of(CobolscopeConfig config, List<QualityMetricDefinition> benchmarks,
                                     CancellationToken cancellation) {
        return new AnalysisContext(config, benchmarks, cancellation, null, null, null, null, null);
    }

    public static AnalysisContext of(CobolscopeConfig config) {
        return of(config, List.of(), CancellationToken.none());
    }

    public AnalysisContext withUpstream(StructureResult structure, ControlFlowResult controlFlow,
                                        DataResult data, CallGraphResult callGraph) {
        return new AnalysisContext(config, benchmarks, cancellation, structure, controlFlow, data, callGraph, metrics);
    }

    public AnalysisContext withMetrics(MetricsResult metrics) {
        return new AnalysisContext(config, benchmarks, cancellation, structure, controlFlow, data, callGraph, metrics);
    }

    public CobolscopeConfig config() {
        return config;
    }

    public List<QualityMetricDefinition> benchmarks() {
        return benchmarks;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /** Upstream results; {@code null} when that analyzer failed or has not run. */
    public StructureResult structure() {
        return structure;
    }

    public ControlFlowResult controlFlow() {
        return controlFlow;
    }

    public DataResult data() {
        return data;
    }

    public CallGraphResult callGraph() {
        return callGraph;
    }

    public MetricsResult metrics() {
        return metrics;
    }
}
