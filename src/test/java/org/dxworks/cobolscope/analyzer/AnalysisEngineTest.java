package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.analyzer.callgraph.CallGraphAnalyzer;
import org.dxworks.cobolscope.analyzer.data.DataAnalyzer;
import org.dxworks.cobolscope.analyzer.metrics.MetricsAggregator;
import org.dxworks.cobolscope.analyzer.quality.BenchmarkLoader;
import org.dxworks.cobolscope.analyzer.quality.QualityEvaluator;
import org.dxworks.cobolscope.analyzer.quality.SuggestionCatalog;
import org.dxworks.cobolscope.analyzer.structure.StructuralAnalyzer;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.model.AnalysisResult;
import org.dxworks.cobolscope.model.AnalysisStatus;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisEngineTest {

    private static final SuggestionCatalog SUGGESTIONS = SuggestionCatalog.loadDefault();

    private final AnalysisEngine engine = AnalysisEngine.create(SUGGESTIONS);

    @Test
    void analyzesEverySection() {
        AnalysisResult result = engine.analyze("payroll.json", TestUtils.sample("payroll.json"), context());

        assertEquals(AnalysisStatus.COMPLETE, result.status);
        assertTrue(result.complete);
        assertEquals("PAYROLL", result.programId);
        assertEquals("payroll.json", result.sourceId);
        assertNotNull(result.structure);
        assertNotNull(result.controlFlow);
        assertNotNull(result.data);
        assertNotNull(result.callGraph);
        assertNotNull(result.metrics);
        assertNotNull(result.quality);
        assertTrue(result.errors.isEmpty());
        assertEquals(List.of(IssueKind.DATA_MODEL_VIOLATION, IssueKind.UNRESOLVED_CALL),
                result.issues.stream().map(i -> i.kind).collect(Collectors.toList()));
        assertEquals(11, result.quality.evaluations.size());
        assertTrue(result.quality.overallScore > 0.0 && result.quality.overallScore <= 1.0);
    }

    @Test
    void repeatedRunsAreIdentical() throws IOException {
        AstNode program = TestUtils.sample("payroll.json");

        String first = TestUtils.APPROVAL_MAPPER.writeValueAsString(engine.analyze(program, context()));
        String second = TestUtils.APPROVAL_MAPPER.writeValueAsString(engine.analyze(program, context()));

        assertEquals(first, second);
    }

    @Test
    void concurrentExecutionMatchesSequential() throws IOException {
        AstNode program = TestUtils.sample("payroll.json");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            AnalysisEngine concurrent = AnalysisEngine.create(SUGGESTIONS, executor);

            String sequential = TestUtils.APPROVAL_MAPPER.writeValueAsString(engine.analyze(program, context()));
            String parallel = TestUtils.APPROVAL_MAPPER.writeValueAsString(concurrent.analyze(program, context()));

            assertEquals(sequential, parallel);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void missingRootIsFatal() {
        AnalysisResult result = engine.analyze("absent", null, context());

        assertEquals(AnalysisStatus.FATAL, result.status);
        assertTrue(result.isFatal());
        assertFalse(result.complete);
        assertNull(result.structure);
        assertNull(result.quality);
        assertEquals(1, result.errors.size());
        assertEquals(IssueKind.FATAL, result.errors.get(0).kind);
        assertEquals(Severity.CRITICAL, result.errors.get(0).severity);
    }

    @Test
    void nonProgramRootIsFatal() {
        AstNode division = AstNode.builder(NodeType.DIVISION).value("PROCEDURE").build();

        AnalysisResult result = engine.analyze(division, context());

        assertEquals(AnalysisStatus.FATAL, result.status);
        assertTrue(result.errors.get(0).message.contains("division"));
    }

    @Test
    void missingProcedureDivisionIsNotFatal() {
        AnalysisResult result = engine.analyze(TestUtils.sample("missing-procedure.json"), context());

        assertEquals(AnalysisStatus.COMPLETE, result.status);
        assertTrue(result.issues.stream().anyMatch(i -> i.kind == IssueKind.STRUCTURAL_VIOLATION
                && i.severity == Severity.ERROR));
        assertEquals(1, result.controlFlow.cyclomaticComplexity);
        assertTrue(result.controlFlow.nodes.isEmpty());
    }

    @Test
    void cancelledTokenStopsTheRun() {
        CancellationToken token = CancellationToken.none();
        token.cancel();
        AnalysisContext cancelled = AnalysisContext.of(CobolscopeConfig.defaults(), BenchmarkLoader.loadDefault(),
                token);

        AnalysisResult result = engine.analyze(TestUtils.sample("payroll.json"), cancelled);

        assertEquals(AnalysisStatus.CANCELLED, result.status);
        assertTrue(result.isCancelled());
        assertFalse(result.complete);
        assertNull(result.metrics);
        assertNull(result.quality);
        assertEquals(1, result.errors.size());
        assertEquals(IssueKind.CANCELLED, result.errors.get(0).kind);
    }

    @Test
    void failingAnalyzerLeavesTheOthersIntact() {
        Analyzer<ControlFlowResult> broken = new Analyzer<>() {
            @Override
            public String name() {
                return "control_flow";
            }

            @Override
            public ControlFlowResult analyze(AstNode program, AnalysisContext context) {
                throw new IllegalStateException("boom");
            }
        };
        AnalysisEngine partial = new AnalysisEngine(new StructuralAnalyzer(), broken, new DataAnalyzer(),
                new CallGraphAnalyzer(), new MetricsAggregator(), new QualityEvaluator(SUGGESTIONS), null);

        AnalysisResult result = partial.analyze(TestUtils.sample("payroll.json"), context());

        assertEquals(AnalysisStatus.PARTIAL, result.status);
        assertTrue(result.complete);
        assertNull(result.controlFlow);
        assertNotNull(result.structure);
        assertNotNull(result.data);
        assertNotNull(result.metrics);
        assertNotNull(result.quality);

        Issue failure = result.errors.get(0);
        assertEquals(IssueKind.ANALYZER_FAILURE, failure.kind);
        assertEquals("control_flow", failure.analyzer);
        assertEquals(IllegalStateException.class.getName(), failure.details.get("exception"));
        assertTrue(result.metrics.unavailable.contains(MetricsAggregator.CYCLOMATIC_COMPLEXITY));
        assertTrue(result.quality.skippedMetrics.contains(MetricsAggregator.CYCLOMATIC_COMPLEXITY));
    }

    @Test
    void computationErrorsAreFiledAsErrors() {
        AstNode program = TestUtils.program("BROKEN",
                TestUtils.division("PROCEDURE",
                        TestUtils.paragraph("P", TestUtils.statement("DISPLAY",
                                Map.of("operands", Map.of("x", 1))))));

        AnalysisResult result = engine.analyze(program, context());

        assertEquals(AnalysisStatus.PARTIAL, result.status);
        assertTrue(result.errors.stream().anyMatch(i -> i.kind == IssueKind.COMPUTATION_ERROR));
        assertTrue(result.issues.stream().noneMatch(i -> i.kind == IssueKind.COMPUTATION_ERROR));
    }

    @Test
    void errorKindsAreRouted() {
        assertTrue(AnalysisEngine.isError(IssueKind.COMPUTATION_ERROR));
        assertTrue(AnalysisEngine.isError(IssueKind.FATAL));
        assertFalse(AnalysisEngine.isError(IssueKind.CONTROL_FLOW));
        assertFalse(AnalysisEngine.isError(IssueKind.MAINTAINABILITY));
    }

    private static AnalysisContext context() {
        return AnalysisContext.of(CobolscopeConfig.defaults(), BenchmarkLoader.loadDefault(),
                CancellationToken.none());
    }
}
