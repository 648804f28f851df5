package org.dxworks.cobolscope.analyzer.metrics;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.HalsteadLogMode;
import org.dxworks.cobolscope.analyzer.callgraph.CallGraphAnalyzer;
import org.dxworks.cobolscope.analyzer.controlflow.ControlFlowAnalyzer;
import org.dxworks.cobolscope.analyzer.data.DataAnalyzer;
import org.dxworks.cobolscope.analyzer.structure.StructuralAnalyzer;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.metrics.ParagraphMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.cobolscope.TestUtils.division;
import static org.dxworks.cobolscope.TestUtils.paragraph;
import static org.dxworks.cobolscope.TestUtils.program;
import static org.dxworks.cobolscope.TestUtils.statement;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsAggregatorTest {

    private final MetricsAggregator aggregator = new MetricsAggregator();

    @Test
    void producesEveryRawMetric() {
        MetricsResult result = analyze(TestUtils.sample("payroll.json"), CobolscopeConfig.defaults());

        assertEquals(List.of(
                MetricsAggregator.CYCLOMATIC_COMPLEXITY, MetricsAggregator.COGNITIVE_COMPLEXITY,
                MetricsAggregator.MAX_NESTING_DEPTH, MetricsAggregator.HALSTEAD_VOLUME,
                MetricsAggregator.HALSTEAD_DIFFICULTY, MetricsAggregator.HALSTEAD_EFFORT,
                MetricsAggregator.HALSTEAD_COMPLEXITY, MetricsAggregator.MAINTAINABILITY_INDEX,
                MetricsAggregator.COMMENT_RATIO, MetricsAggregator.LINES_OF_CODE,
                MetricsAggregator.DECISION_DENSITY, MetricsAggregator.DATA_COMPLEXITY,
                MetricsAggregator.CRITICAL_DATA_ITEMS, MetricsAggregator.GOTO_COUNT,
                MetricsAggregator.CALL_FAN_OUT, MetricsAggregator.AVERAGE_PARAGRAPH_SIZE),
                List.copyOf(result.raw.keySet()));
        assertTrue(result.unavailable.isEmpty());

        assertEquals(5.0, result.raw.get(MetricsAggregator.CYCLOMATIC_COMPLEXITY));
        assertEquals(6.0, result.raw.get(MetricsAggregator.COGNITIVE_COMPLEXITY));
        assertEquals(2.0, result.raw.get(MetricsAggregator.MAX_NESTING_DEPTH));
        assertEquals(60.0, result.raw.get(MetricsAggregator.LINES_OF_CODE));
        assertEquals(0.1, result.raw.get(MetricsAggregator.COMMENT_RATIO), 1e-9);
        assertEquals(7.0 / 11, result.raw.get(MetricsAggregator.DATA_COMPLEXITY), 1e-9);
        assertEquals(0.0, result.raw.get(MetricsAggregator.CRITICAL_DATA_ITEMS));
        assertEquals(0.0, result.raw.get(MetricsAggregator.GOTO_COUNT));
        assertEquals(1.0, result.raw.get(MetricsAggregator.CALL_FAN_OUT));

        double mi = result.maintainabilityIndex;
        assertTrue(mi > 0.0 && mi < 100.0, "maintainability index " + mi);
        assertTrue(result.findings.isEmpty());
    }

    @Test
    void perParagraphComplexity() {
        MetricsResult result = analyze(TestUtils.sample("payroll.json"), CobolscopeConfig.defaults());

        ParagraphMetrics process = paragraphMetrics(result, "PROCESS-PARA");
        assertEquals(9, process.statements);
        assertEquals(4, process.cyclomaticComplexity);
        assertEquals(5, process.cognitiveComplexity);

        ParagraphMetrics exit = paragraphMetrics(result, "EXIT-PARA");
        assertEquals(1, exit.statements);
        assertEquals(1, exit.cyclomaticComplexity);
        assertEquals(0, exit.cognitiveComplexity);
        assertTrue(result.hotspots.isEmpty());
    }

    @Test
    void halsteadCounts() {
        AstNode program = program("MOVES",
                division("PROCEDURE",
                        paragraph("P",
                                statement("MOVE", Map.of("sources", List.of("A"), "targets", List.of("B"))),
                                statement("MOVE", Map.of("sources", List.of("A"), "targets", List.of("C"))))));

        MetricsResult result = analyze(program, CobolscopeConfig.defaults());

        assertEquals(1, result.halstead.distinctOperators);
        assertEquals(3, result.halstead.distinctOperands);
        assertEquals(2, result.halstead.totalOperators);
        assertEquals(4, result.halstead.totalOperands);
        assertEquals(12.0, result.halstead.volume, 1e-9);
        assertEquals(2.0 / 3, result.halstead.difficulty, 1e-9);
        assertEquals(8.0, result.halstead.effort, 1e-9);
        assertEquals(result.halstead.difficulty, result.raw.get(MetricsAggregator.HALSTEAD_COMPLEXITY), 1e-9);
    }

    @Test
    void bitLengthModeRoundsTheLogarithmUp() {
        AstNode program = program("MOVES",
                division("PROCEDURE",
                        paragraph("P",
                                statement("MOVE", Map.of("sources", List.of("A"), "targets", List.of("B"))),
                                statement("ADD", Map.of("sources", List.of("C"), "targets", List.of("B"))))));

        MetricsResult log2 = analyze(program, CobolscopeConfig.defaults());
        MetricsResult bitLength = analyze(program,
                CobolscopeConfig.defaults().withHalsteadLogMode(HalsteadLogMode.BIT_LENGTH));

        // vocabulary 5: log2(5) = 2.32..., bit length 3
        assertEquals(6 * Math.log(5) / Math.log(2), log2.halstead.volume, 1e-9);
        assertEquals(18.0, bitLength.halstead.volume, 1e-9);
    }

    @Test
    void malformedOperandsOnlyDisableHalstead() {
        AstNode program = program("BROKEN",
                division("PROCEDURE",
                        paragraph("P",
                                statement("IF", Map.of("condition", "X > 1"),
                                        statement("DISPLAY", Map.of("operands", Map.of("x", 1)))))));

        MetricsResult result = analyze(program, CobolscopeConfig.defaults());

        assertNull(result.halstead);
        assertNull(result.maintainabilityIndex);
        assertEquals(List.of(MetricsAggregator.HALSTEAD_VOLUME, MetricsAggregator.HALSTEAD_DIFFICULTY,
                        MetricsAggregator.HALSTEAD_EFFORT, MetricsAggregator.HALSTEAD_COMPLEXITY,
                        MetricsAggregator.MAINTAINABILITY_INDEX),
                result.unavailable);
        assertEquals(2.0, result.raw.get(MetricsAggregator.CYCLOMATIC_COMPLEXITY));

        Issue error = result.findings.stream()
                .filter(i -> i.kind == IssueKind.COMPUTATION_ERROR)
                .findFirst().orElseThrow();
        assertEquals(Severity.ERROR, error.severity);
        assertEquals("halstead", error.details.get("metric"));
    }

    @Test
    void nestedOperandListIsMalformed() {
        AstNode program = program("BROKEN",
                division("PROCEDURE",
                        paragraph("P", statement("DISPLAY", Map.of("operands", List.of("A", List.of("B")))))));

        MetricsResult result = analyze(program, CobolscopeConfig.defaults());

        assertNull(result.halstead);
        assertTrue(result.unavailable.contains(MetricsAggregator.HALSTEAD_VOLUME));
    }

    @Test
    void missingUpstreamResultsAreUnavailable() {
        AstNode program = TestUtils.sample("payroll.json");

        MetricsResult result = aggregator.analyze(program, TestUtils.defaultContext());

        assertNotNull(result.halstead);
        assertNull(result.maintainabilityIndex);
        assertNull(result.raw.get(MetricsAggregator.CYCLOMATIC_COMPLEXITY));
        assertTrue(result.unavailable.containsAll(List.of(MetricsAggregator.DATA_COMPLEXITY,
                MetricsAggregator.CALL_FAN_OUT, MetricsAggregator.AVERAGE_PARAGRAPH_SIZE)));
        assertEquals(60.0, result.raw.get(MetricsAggregator.LINES_OF_CODE));
    }

    @Test
    void lowCommentRatioIsReported() {
        AstNode program = AstNode.builder(NodeType.PROGRAM)
                .value("QUIET")
                .line(1)
                .attribute("total_lines", 100)
                .attribute("comment_lines", 2)
                .child(division("PROCEDURE", paragraph("P", statement("CONTINUE", Map.of()))))
                .build();

        MetricsResult result = analyze(program, CobolscopeConfig.defaults());

        assertEquals(100, result.linesOfCode);
        assertEquals(0.02, result.commentRatio, 1e-9);
        assertTrue(result.findings.stream().anyMatch(i -> i.kind == IssueKind.MAINTAINABILITY));
    }

    @Test
    void hotspotsExceedTheirThresholds() {
        AstNode[] flat = new AstNode[11];
        for (int i = 0; i < flat.length; i++) {
            flat[i] = statement("IF", Map.of("condition", "X = " + i), statement("CONTINUE", Map.of()));
        }
        AstNode nested = statement("CONTINUE", Map.of());
        for (int i = 0; i < 6; i++) {
            nested = statement("IF", Map.of("condition", "Y = " + i), nested);
        }
        AstNode program = program("HOT",
                division("PROCEDURE", paragraph("WIDE", flat), paragraph("DEEP", nested)));

        MetricsResult result = analyze(program, CobolscopeConfig.defaults());

        assertEquals(2, result.hotspots.size());
        assertEquals("WIDE", result.hotspots.get(0).paragraph);
        assertEquals(MetricsAggregator.CYCLOMATIC_COMPLEXITY, result.hotspots.get(0).metric);
        assertEquals(12.0, result.hotspots.get(0).value);
        assertEquals("DEEP", result.hotspots.get(1).paragraph);
        assertEquals(MetricsAggregator.COGNITIVE_COMPLEXITY, result.hotspots.get(1).metric);
        assertEquals(21.0, result.hotspots.get(1).value);
    }

    @Test
    void maintainabilityIndexIsClipped() {
        assertEquals((171.0 - 0.23) * 100.0 / 171.0, MetricsAggregator.maintainabilityIndex(1.0, 1, 1, 0.0), 1e-9);
        assertEquals(0.0, MetricsAggregator.maintainabilityIndex(1e30, 500, 1_000_000, 0.0));
        assertEquals(100.0, MetricsAggregator.maintainabilityIndex(0.0, 0, 0, 0.5));
    }

    private MetricsResult analyze(AstNode program, CobolscopeConfig config) {
        AnalysisContext context = AnalysisContext.of(config);
        AnalysisContext upstream = context.withUpstream(
                new StructuralAnalyzer().analyze(program, context),
                new ControlFlowAnalyzer().analyze(program, context),
                new DataAnalyzer().analyze(program, context),
                new CallGraphAnalyzer().analyze(program, context));
        return aggregator.analyze(program, upstream);
    }

    private static ParagraphMetrics paragraphMetrics(MetricsResult result, String name) {
        return result.paragraphs.stream().filter(p -> p.name.equals(name)).findFirst().orElseThrow();
    }
}
