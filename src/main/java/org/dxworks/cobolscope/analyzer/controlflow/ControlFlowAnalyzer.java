package org.dxworks.cobolscope.analyzer.controlflow;

import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.analyzer.Conditions;
import org.dxworks.cobolscope.analyzer.Divisions;
import org.dxworks.cobolscope.analyzer.StatementVisit;
import org.dxworks.cobolscope.analyzer.StatementWalker;
import org.dxworks.cobolscope.ast.AstAccessor;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.controlflow.ControlFlowEdge;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.controlflow.DecisionPoint;
import org.dxworks.cobolscope.model.controlflow.EdgeKind;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the paragraph-level control-flow graph (PERFORM, GO TO, IF/EVALUATE branches), counts decision points,
 * tracks block nesting and detects PERFORM/GO TO cycles.
 */
public class ControlFlowAnalyzer implements Analyzer<ControlFlowResult> {

    public static final String NAME = "control_flow";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ControlFlowResult analyze(AstNode program, AnalysisContext context) {
        ControlFlowResult result = new ControlFlowResult();
        AstAccessor accessor = new AstAccessor(program);
        Set<String> nodes = declaredNodes(program);

        GraphBuilder builder = new GraphBuilder(result, accessor, nodes);
        StatementWalker.walk(program, context.cancellation(), builder::visit);

        result.nodes.addAll(nodes);
        for (String node : nodes) {
            result.paragraphComplexity.putIfAbsent(node, 1);
        }
        result.cyclomaticComplexity = 1 + result.decisionPoints.size();
        result.decisionDensity = result.statementCount == 0
                ? 0.0
                : (double) result.decisionPoints.size() / result.statementCount;

        reportDanglingTargets(result, nodes);
        findEntryPoints(result, nodes);

        context.cancellation().checkpoint("cycle detection");
        new CycleDetector(result).detect();
        return result;
    }

    private static Set<String> declaredNodes(AstNode program) {
        Set<String> nodes = new LinkedHashSet<>();
        for (AstNode division : program.getChildren()) {
            if (!division.is(NodeType.DIVISION) || !Divisions.PROCEDURE.equals(Divisions.normalize(division.name()))) {
                continue;
            }
            for (AstNode child : division.getChildren()) {
                if (child.is(NodeType.STATEMENT)) {
                    nodes.add(StatementWalker.PROLOGUE);
                } else if (child.is(NodeType.SECTION)) {
                    nodes.add(child.name());
                    for (AstNode paragraph : child.getChildren()) {
                        if (paragraph.is(NodeType.PARAGRAPH)) {
                            nodes.add(paragraph.name());
                        }
                    }
                } else if (child.is(NodeType.PARAGRAPH)) {
                    nodes.add(child.name());
                }
            }
        }
        return nodes;
    }

    private static void reportDanglingTargets(ControlFlowResult result, Set<String> nodes) {
        Set<String> reported = new LinkedHashSet<>();
        for (ControlFlowEdge edge : result.edges) {
            if (edge.kind.isTransfer() && !nodes.contains(edge.to) && reported.add(edge.to)) {
                result.report(new Issue(IssueKind.CONTROL_FLOW, Severity.INFO, NAME,
                        edge.kind.name() + " target '" + edge.to + "' is not a paragraph or section of this program")
                        .at(edge.from, edge.line));
            }
        }
    }

    private static void findEntryPoints(ControlFlowResult result, Set<String> nodes) {
        Set<String> reached = new LinkedHashSet<>();
        for (ControlFlowEdge edge : result.edges) {
            if (edge.kind.isTransfer() && !edge.from.equals(edge.to)) {
                reached.add(edge.to);
            }
        }
        for (String node : nodes) {
            if (!reached.contains(node)) {
                result.entryPoints.add(node);
            }
        }
    }

    /** Per-walk state; one instance per analyze call. */
    private static final class GraphBuilder {
        private final ControlFlowResult result;
        private final AstAccessor accessor;
        private final Set<String> nodes;
        private final Map<String, Integer> ordinals = new HashMap<>();
        private final Set<String> exits = new LinkedHashSet<>();

        GraphBuilder(ControlFlowResult result, AstAccessor accessor, Set<String> nodes) {
            this.result = result;
            this.accessor = accessor;
            this.nodes = nodes;
        }

        void visit(StatementVisit visit) {
            String owner = visit.owner();
            if (owner == null) {
                return;
            }
            nodes.add(owner);
            result.statementCount++;
            AstNode statement = visit.statement();
            switch (statement.getStatementKind().role()) {
                case CONDITIONAL -> {
                    decision("IF", visit);
                    nesting(visit);
                    edge(owner, statementId(owner, "IF"), EdgeKind.IF_BRANCH, Conditions.ifCondition(statement),
                            statement.getLine());
                }
                case SELECTION -> nesting(visit);
                case SELECTION_BRANCH -> {
                    AstNode evaluate = accessor.parent(statement);
                    String subject = evaluate != null ? evaluate.text("subject") : "";
                    if (!Conditions.isWhenOther(statement)) {
                        decision("WHEN", visit);
                    }
                    edge(owner, statementId(owner, "WHEN"), EdgeKind.EVALUATE_BRANCH,
                            Conditions.whenCondition(statement, subject), statement.getLine());
                }
                case PERFORM -> perform(visit);
                case JUMP -> jump(visit);
                case TERMINATION -> {
                    if (exits.add(owner)) {
                        result.exitPoints.add(owner);
                    }
                }
                case CALL, DATA_TRANSFER, SIMPLE, DIRECTIVE -> {
                }
            }
        }

        private void perform(StatementVisit visit) {
            AstNode statement = visit.statement();
            String type = statement.text(AstNode.PERFORM_TYPE).toLowerCase(Locale.ROOT);
            EdgeKind kind;
            String condition;
            if (type.equals("varying") || statement.hasAttribute("varying")) {
                kind = EdgeKind.PERFORM_VARYING;
                condition = loopCondition(statement);
                decision("PERFORM_VARYING", visit);
            } else if (type.equals("until") || statement.hasAttribute("until")) {
                kind = EdgeKind.PERFORM_UNTIL;
                condition = loopCondition(statement);
                decision("PERFORM_UNTIL", visit);
            } else {
                kind = EdgeKind.PERFORM;
                condition = visit.conditions().isEmpty() ? null : String.join(" AND ", visit.conditions());
            }

            String target = statement.text("target");
            if (!target.isEmpty()) {
                ControlFlowEdge edge = edge(visit.owner(), target, kind, condition, statement.getLine());
                String through = statement.text("through");
                edge.through = through.isEmpty() ? null : through;
            }
            if (!statement.getChildren().isEmpty() && target.isEmpty()) {
                nesting(visit);
            }
        }

        private static String loopCondition(AstNode perform) {
            String until = perform.text("until");
            String varying = perform.text("varying");
            if (!varying.isEmpty() && !until.isEmpty()) {
                return "VARYING " + varying + " UNTIL " + until;
            }
            if (!varying.isEmpty()) {
                return "VARYING " + varying;
            }
            return until.isEmpty() ? "UNTIL ?" : until;
        }

        private void jump(StatementVisit visit) {
            AstNode statement = visit.statement();
            List<String> targets = statement.listAttribute("targets");
            if (targets.isEmpty()) {
                targets = statement.listAttribute("target");
            }
            String depending = statement.text("depending");
            result.gotoCount++;
            for (String target : targets) {
                ControlFlowEdge edge = edge(visit.owner(), target, EdgeKind.GOTO,
                        depending.isEmpty() ? null : "DEPENDING ON " + depending, statement.getLine());
                edge.flagged = true;
            }
            result.report(new Issue(IssueKind.CONTROL_FLOW, Severity.INFO, NAME,
                    "Unstructured GO TO " + String.join(", ", targets))
                    .at(visit.owner(), statement.getLine()));
        }

        private void decision(String kind, StatementVisit visit) {
            DecisionPoint point = new DecisionPoint();
            point.kind = kind;
            point.paragraph = visit.owner();
            point.nestingLevel = visit.depth();
            point.line = visit.statement().getLine();
            result.decisionPoints.add(point);
            result.paragraphComplexity.merge(visit.owner(), 2, (current, ignored) -> current + 1);
        }

        private void nesting(StatementVisit visit) {
            result.maxNestingDepth = Math.max(result.maxNestingDepth, visit.depth() + 1);
        }

        private ControlFlowEdge edge(String from, String to, EdgeKind kind, String condition, int line) {
            ControlFlowEdge edge = new ControlFlowEdge();
            edge.from = from;
            edge.to = to;
            edge.kind = kind;
            edge.condition = condition;
            edge.line = line;
            result.edges.add(edge);
            return edge;
        }

        private String statementId(String owner, String kind) {
            int ordinal = ordinals.merge(owner + ":" + kind, 1, Integer::sum);
            return owner + ":" + kind + "#" + ordinal;
        }
    }
}
