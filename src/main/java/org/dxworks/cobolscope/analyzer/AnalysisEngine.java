package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.analyzer.callgraph.CallGraphAnalyzer;
import org.dxworks.cobolscope.analyzer.controlflow.ControlFlowAnalyzer;
import org.dxworks.cobolscope.analyzer.data.DataAnalyzer;
import org.dxworks.cobolscope.analyzer.metrics.MetricsAggregator;
import org.dxworks.cobolscope.analyzer.quality.QualityEvaluator;
import org.dxworks.cobolscope.analyzer.quality.SuggestionCatalog;
import org.dxworks.cobolscope.analyzer.structure.StructuralAnalyzer;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.model.AnalysisResult;
import org.dxworks.cobolscope.model.AnalysisStatus;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.PartialResult;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.callgraph.CallGraphResult;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.data.DataResult;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.quality.QualityResult;
import org.dxworks.cobolscope.model.structure.StructureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

/**
 * Runs the analyzers over one program AST and assembles the {@link AnalysisResult}.
 * <p>
 * Structure, control flow, data and call graph read only the AST and may run concurrently on the injected
 * executor; metrics runs once all four have finished, quality after metrics. A failing analyzer is recorded as an
 * {@link IssueKind#ANALYZER_FAILURE} error and its section left {@code null}. Only a fatal input or a tripped
 * cancellation token ends the call early.
 */
public class AnalysisEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisEngine.class);

    private static final String ENGINE = "engine";

    private final Analyzer<StructureResult> structureAnalyzer;
    private final Analyzer<ControlFlowResult> controlFlowAnalyzer;
    private final Analyzer<DataResult> dataAnalyzer;
    private final Analyzer<CallGraphResult> callGraphAnalyzer;
    private final Analyzer<MetricsResult> metricsAnalyzer;
    private final Analyzer<QualityResult> qualityAnalyzer;
    private final ExecutorService executor;

    public AnalysisEngine(Analyzer<StructureResult> structureAnalyzer,
                          Analyzer<ControlFlowResult> controlFlowAnalyzer,
                          Analyzer<DataResult> dataAnalyzer,
                          Analyzer<CallGraphResult> callGraphAnalyzer,
                          Analyzer<MetricsResult> metricsAnalyzer,
                          Analyzer<QualityResult> qualityAnalyzer,
                          ExecutorService executor) {
        this.structureAnalyzer = Objects.requireNonNull(structureAnalyzer);
        this.controlFlowAnalyzer = Objects.requireNonNull(controlFlowAnalyzer);
        this.dataAnalyzer = Objects.requireNonNull(dataAnalyzer);
        this.callGraphAnalyzer = Objects.requireNonNull(callGraphAnalyzer);
        this.metricsAnalyzer = Objects.requireNonNull(metricsAnalyzer);
        this.qualityAnalyzer = Objects.requireNonNull(qualityAnalyzer);
        this.executor = executor;
    }

    /** Standard analyzers, run one after the other on the calling thread. */
    public static AnalysisEngine create(SuggestionCatalog suggestions) {
        return create(suggestions, null);
    }

    /** Standard analyzers; the four AST readers are submitted to {@code executor} when it is not null. */
    public static AnalysisEngine create(SuggestionCatalog suggestions, ExecutorService executor) {
        return new AnalysisEngine(new StructuralAnalyzer(), new ControlFlowAnalyzer(), new DataAnalyzer(),
                new CallGraphAnalyzer(), new MetricsAggregator(), new QualityEvaluator(suggestions), executor);
    }

    public AnalysisResult analyze(AstNode program, AnalysisContext context) {
        return analyze(null, program, context);
    }

    public AnalysisResult analyze(String sourceId, AstNode program, AnalysisContext context) {
        AnalysisResult result = new AnalysisResult();
        result.sourceId = sourceId;
        try {
            checkRoot(program);
            result.programId = program.name();
            run(program, context, result);
        } catch (FatalAnalysisException e) {
            LOGGER.warn("Fatal input{}: {}", sourceId == null ? "" : " " + sourceId, e.getMessage());
            return fatal(sourceId, e.getMessage());
        }

        if (result.status != AnalysisStatus.CANCELLED) {
            result.status = result.errors.isEmpty() ? AnalysisStatus.COMPLETE : AnalysisStatus.PARTIAL;
        }
        result.complete = result.status != AnalysisStatus.CANCELLED;
        return result;
    }

    private static void checkRoot(AstNode program) {
        if (program == null) {
            throw new FatalAnalysisException("AST root is missing");
        }
        if (!program.is(NodeType.PROGRAM)) {
            throw new FatalAnalysisException("AST root is a " + program.getType().getName() + ", not a program");
        }
    }

    private void run(AstNode program, AnalysisContext context, AnalysisResult result) {
        Future<StructureResult> structure = start(structureAnalyzer, program, context);
        Future<ControlFlowResult> controlFlow = start(controlFlowAnalyzer, program, context);
        Future<DataResult> data = start(dataAnalyzer, program, context);
        Future<CallGraphResult> callGraph = start(callGraphAnalyzer, program, context);

        result.structure = join(structureAnalyzer, structure, result);
        result.controlFlow = join(controlFlowAnalyzer, controlFlow, result);
        result.data = join(dataAnalyzer, data, result);
        result.callGraph = join(callGraphAnalyzer, callGraph, result);
        if (result.status == AnalysisStatus.CANCELLED) {
            return;
        }

        AnalysisContext upstream = context.withUpstream(result.structure, result.controlFlow, result.data,
                result.callGraph);
        result.metrics = join(metricsAnalyzer, start(metricsAnalyzer, program, upstream, false), result);
        if (result.status == AnalysisStatus.CANCELLED) {
            return;
        }

        AnalysisContext measured = upstream.withMetrics(result.metrics);
        result.quality = join(qualityAnalyzer, start(qualityAnalyzer, program, measured, false), result);
    }

    private <R extends PartialResult> Future<R> start(Analyzer<R> analyzer, AstNode program,
                                                      AnalysisContext context) {
        return start(analyzer, program, context, true);
    }

    private <R extends PartialResult> Future<R> start(Analyzer<R> analyzer, AstNode program,
                                                      AnalysisContext context, boolean concurrent) {
        Callable<R> task = () -> {
            context.cancellation().checkpoint(analyzer.name());
            LOGGER.debug("Running {} on {}", analyzer.name(), program.name());
            return analyzer.analyze(program, context);
        };
        if (concurrent && executor != null) {
            return executor.submit(task);
        }
        FutureTask<R> inline = new FutureTask<>(task);
        inline.run();
        return inline;
    }

    private <R extends PartialResult> R join(Analyzer<R> analyzer, Future<R> future, AnalysisResult result) {
        try {
            R section = future.get();
            file(section, result);
            return section;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled(result, "Interrupted while waiting for " + analyzer.name());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisCancelledException) {
                cancelled(result, cause.getMessage());
                return null;
            }
            if (cause instanceof FatalAnalysisException fatal) {
                throw fatal;
            }
            LOGGER.warn("Analyzer {} failed, continuing without it", analyzer.name(), cause);
            result.errors.add(new Issue(IssueKind.ANALYZER_FAILURE, Severity.ERROR, analyzer.name(),
                    analyzer.name() + " analysis failed: " + cause)
                    .detail("exception", cause.getClass().getName()));
            return null;
        }
    }

    /** Findings of one section, split into issues and errors by kind. */
    private static void file(PartialResult section, AnalysisResult result) {
        for (Issue finding : section.findings) {
            if (isError(finding.kind)) {
                result.errors.add(finding);
            } else {
                result.issues.add(finding);
            }
        }
    }

    static boolean isError(IssueKind kind) {
        return switch (kind) {
            case COMPUTATION_ERROR, ANALYZER_FAILURE, CANCELLED, FATAL -> true;
            case STRUCTURAL_VIOLATION, DATA_MODEL_VIOLATION, CONTROL_FLOW, UNRESOLVED_CALL, MAINTAINABILITY -> false;
        };
    }

    private static void cancelled(AnalysisResult result, String message) {
        if (result.status != AnalysisStatus.CANCELLED) {
            LOGGER.info("{}", message);
            result.status = AnalysisStatus.CANCELLED;
            result.errors.add(new Issue(IssueKind.CANCELLED, Severity.WARNING, ENGINE, message));
        }
    }

    private static AnalysisResult fatal(String sourceId, String message) {
        AnalysisResult result = new AnalysisResult();
        result.sourceId = sourceId;
        result.status = AnalysisStatus.FATAL;
        result.complete = false;
        result.errors.add(new Issue(IssueKind.FATAL, Severity.CRITICAL, ENGINE, message));
        return result;
    }
}
