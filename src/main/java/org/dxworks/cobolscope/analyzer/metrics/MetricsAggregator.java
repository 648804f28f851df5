package org.dxworks.cobolscope.analyzer.metrics;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.analyzer.ComputationException;
import org.dxworks.cobolscope.analyzer.StatementWalker;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.callgraph.CallGraphResult;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.controlflow.DecisionPoint;
import org.dxworks.cobolscope.model.data.DataResult;
import org.dxworks.cobolscope.model.metrics.Hotspot;
import org.dxworks.cobolscope.model.metrics.MetricsResult;
import org.dxworks.cobolscope.model.metrics.ParagraphMetrics;
import org.dxworks.cobolscope.model.structure.StructureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives program-level metrics from the structural, control-flow, data and call-graph results plus its own
 * Halstead pass over the statements. A metric whose input is missing or malformed is reported as unavailable
 * ({@code null} in {@link MetricsResult#raw}); the others are still computed.
 */
public class MetricsAggregator implements Analyzer<MetricsResult> {

    public static final String NAME = "metrics";

    public static final String CYCLOMATIC_COMPLEXITY = "cyclomatic_complexity";
    public static final String COGNITIVE_COMPLEXITY = "cognitive_complexity";
    public static final String MAX_NESTING_DEPTH = "max_nesting_depth";
    public static final String HALSTEAD_VOLUME = "halstead_volume";
    public static final String HALSTEAD_DIFFICULTY = "halstead_difficulty";
    public static final String HALSTEAD_EFFORT = "halstead_effort";
    public static final String HALSTEAD_COMPLEXITY = "halstead_complexity";
    public static final String MAINTAINABILITY_INDEX = "maintainability_index";
    public static final String COMMENT_RATIO = "comment_ratio";
    public static final String LINES_OF_CODE = "lines_of_code";
    public static final String DECISION_DENSITY = "decision_density";
    public static final String DATA_COMPLEXITY = "data_complexity";
    public static final String CRITICAL_DATA_ITEMS = "critical_data_items";
    public static final String GOTO_COUNT = "goto_count";
    public static final String CALL_FAN_OUT = "call_fan_out";
    public static final String AVERAGE_PARAGRAPH_SIZE = "average_paragraph_size";

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsAggregator.class);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MetricsResult analyze(AstNode program, AnalysisContext context) {
        CobolscopeConfig config = context.config();
        MetricsResult result = new MetricsResult();
        Map<String, Double> raw = new LinkedHashMap<>();

        ControlFlowResult controlFlow = context.controlFlow();
        Map<String, ParagraphMetrics> paragraphs = countParagraphStatements(program, context);
        if (controlFlow != null) {
            result.cyclomaticComplexity = controlFlow.cyclomaticComplexity;
            result.maxNestingDepth = controlFlow.maxNestingDepth;
            result.decisionDensity = controlFlow.decisionDensity;
            result.cognitiveComplexity = cognitive(controlFlow, paragraphs);
            raw.put(CYCLOMATIC_COMPLEXITY, (double) result.cyclomaticComplexity);
            raw.put(COGNITIVE_COMPLEXITY, (double) result.cognitiveComplexity);
            raw.put(MAX_NESTING_DEPTH, (double) result.maxNestingDepth);
        } else {
            raw.put(CYCLOMATIC_COMPLEXITY, null);
            raw.put(COGNITIVE_COMPLEXITY, null);
            raw.put(MAX_NESTING_DEPTH, null);
        }
        result.paragraphs.addAll(paragraphs.values());
        findHotspots(config, result);

        context.cancellation().checkpoint("halstead");
        try {
            HalsteadCounter counter = new HalsteadCounter();
            StatementWalker.walk(program, context.cancellation(), visit -> counter.count(visit.statement()));
            result.halstead = counter.metrics(config.getHalsteadLogMode());
        } catch (ComputationException e) {
            LOGGER.debug("Halstead metrics unavailable for {}: {}", program.name(), e.getMessage());
            result.report(new Issue(IssueKind.COMPUTATION_ERROR, Severity.ERROR, NAME, e.getMessage())
                    .detail("metric", e.getMetric()));
        }
        raw.put(HALSTEAD_VOLUME, result.halstead == null ? null : result.halstead.volume);
        raw.put(HALSTEAD_DIFFICULTY, result.halstead == null ? null : result.halstead.difficulty);
        raw.put(HALSTEAD_EFFORT, result.halstead == null ? null : result.halstead.effort);
        raw.put(HALSTEAD_COMPLEXITY, result.halstead == null ? null : result.halstead.difficulty);

        result.linesOfCode = linesOfCode(program, context.structure());
        int commentLines = program.intAttribute("comment_lines");
        result.commentRatio = result.linesOfCode == 0 ? 0.0 : (double) commentLines / result.linesOfCode;
        if (result.halstead != null && controlFlow != null) {
            result.maintainabilityIndex = maintainabilityIndex(result.halstead.volume, result.cyclomaticComplexity,
                    result.linesOfCode, result.commentRatio);
        }
        raw.put(MAINTAINABILITY_INDEX, result.maintainabilityIndex);
        raw.put(COMMENT_RATIO, result.commentRatio);
        raw.put(LINES_OF_CODE, (double) result.linesOfCode);
        raw.put(DECISION_DENSITY, controlFlow == null ? null : result.decisionDensity);
        if (result.linesOfCode > 0 && result.commentRatio < config.getLowCommentRatio()) {
            result.report(new Issue(IssueKind.MAINTAINABILITY, Severity.INFO, NAME,
                    String.format("Comment ratio %.2f is below %.2f", result.commentRatio, config.getLowCommentRatio()))
                    .at(program.name(), 0)
                    .detail("comment_lines", commentLines)
                    .detail("lines_of_code", result.linesOfCode));
        }

        DataResult data = context.data();
        raw.put(DATA_COMPLEXITY, data == null ? null : dataComplexity(data));
        raw.put(CRITICAL_DATA_ITEMS, data == null ? null : (double) data.criticalItems.size());
        raw.put(GOTO_COUNT, controlFlow == null ? null : (double) controlFlow.gotoCount);
        CallGraphResult callGraph = context.callGraph();
        raw.put(CALL_FAN_OUT, callGraph == null ? null : (double) callGraph.distinctCallees);
        StructureResult structure = context.structure();
        raw.put(AVERAGE_PARAGRAPH_SIZE, structure == null ? null : structure.metrics.averageParagraphSize);

        raw.forEach((metric, value) -> {
            if (value == null) {
                result.unavailable.add(metric);
            }
        });
        result.raw = raw;
        return result;
    }

    private static Map<String, ParagraphMetrics> countParagraphStatements(AstNode program, AnalysisContext context) {
        Map<String, ParagraphMetrics> paragraphs = new LinkedHashMap<>();
        ControlFlowResult controlFlow = context.controlFlow();
        if (controlFlow != null) {
            for (String node : controlFlow.nodes) {
                paragraph(paragraphs, node);
            }
        }
        StatementWalker.walk(program, context.cancellation(), visit -> {
            if (visit.owner() != null) {
                paragraph(paragraphs, visit.owner()).statements++;
            }
        });
        return paragraphs;
    }

    private static ParagraphMetrics paragraph(Map<String, ParagraphMetrics> paragraphs, String name) {
        return paragraphs.computeIfAbsent(name, k -> {
            ParagraphMetrics metrics = new ParagraphMetrics();
            metrics.name = k;
            metrics.cyclomaticComplexity = 1;
            return metrics;
        });
    }

    /** Each decision point costs one plus the number of blocks it is nested in. */
    private static int cognitive(ControlFlowResult controlFlow, Map<String, ParagraphMetrics> paragraphs) {
        int total = 0;
        for (DecisionPoint point : controlFlow.decisionPoints) {
            int increment = 1 + point.nestingLevel;
            total += increment;
            paragraph(paragraphs, point.paragraph).cognitiveComplexity += increment;
        }
        controlFlow.paragraphComplexity.forEach((name, cyclomatic) ->
                paragraph(paragraphs, name).cyclomaticComplexity = cyclomatic);
        return total;
    }

    private static void findHotspots(CobolscopeConfig config, MetricsResult result) {
        for (ParagraphMetrics paragraph : result.paragraphs) {
            if (paragraph.cyclomaticComplexity > config.getCyclomaticHotspotThreshold()) {
                result.hotspots.add(hotspot(paragraph.name, CYCLOMATIC_COMPLEXITY, paragraph.cyclomaticComplexity,
                        config.getCyclomaticHotspotThreshold()));
            }
            if (paragraph.cognitiveComplexity > config.getCognitiveHotspotThreshold()) {
                result.hotspots.add(hotspot(paragraph.name, COGNITIVE_COMPLEXITY, paragraph.cognitiveComplexity,
                        config.getCognitiveHotspotThreshold()));
            }
        }
    }

    private static Hotspot hotspot(String paragraph, String metric, double value, double threshold) {
        Hotspot hotspot = new Hotspot();
        hotspot.paragraph = paragraph;
        hotspot.metric = metric;
        hotspot.value = value;
        hotspot.threshold = threshold;
        return hotspot;
    }

    private static int linesOfCode(AstNode program, StructureResult structure) {
        int declared = program.intAttribute("total_lines");
        if (declared > 0) {
            return declared;
        }
        if (structure != null) {
            return structure.metrics.totalLines;
        }
        int end = program.getEndLine();
        return end > 0 ? end - Math.max(1, program.getLine()) + 1 : 0;
    }

    /**
     * Maintainability index on the 0..100 scale:
     * {@code (171 - 5.2 ln V - 0.23 G - 16.2 ln LOC + 50 sin(sqrt(2.4 * radians(comment%)))) * 100 / 171}.
     */
    static double maintainabilityIndex(double volume, int cyclomatic, int linesOfCode, double commentRatio) {
        double commentPercent = commentRatio * 100.0;
        double raw = 171.0
                - 5.2 * Math.log(Math.max(1.0, volume))
                - 0.23 * cyclomatic
                - 16.2 * Math.log(Math.max(1, linesOfCode))
                + 50.0 * Math.sin(Math.sqrt(2.4 * Math.toRadians(commentPercent)));
        return Math.max(0.0, Math.min(100.0, raw * 100.0 / 171.0));
    }

    /** Dependency and flow edges per declared data item. */
    private static double dataComplexity(DataResult data) {
        int edges = data.metrics.totalDependencies + data.metrics.totalFlows;
        return data.metrics.totalItems == 0 ? 0.0 : (double) edges / data.metrics.totalItems;
    }
}
