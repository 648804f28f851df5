package org.dxworks.cobolscope.analyzer.callgraph;

import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.analyzer.Operands;
import org.dxworks.cobolscope.analyzer.StatementVisit;
import org.dxworks.cobolscope.analyzer.StatementWalker;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.callgraph.CallEdge;
import org.dxworks.cobolscope.model.callgraph.CallGraphResult;
import org.dxworks.cobolscope.model.callgraph.UnresolvedCall;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CALL / INVOKE graph from paragraphs to external programs. Only literal program names are resolved; calls through
 * a data name are listed as unresolved.
 */
public class CallGraphAnalyzer implements Analyzer<CallGraphResult> {

    public static final String NAME = "call_graph";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CallGraphResult analyze(AstNode program, AnalysisContext context) {
        CallGraphResult result = new CallGraphResult();
        String programId = program.name();
        StatementWalker.walk(program, context.cancellation(), visit -> {
            switch (visit.statement().getStatementKind()) {
                case CALL -> call(visit, programId, visit.statement().text("program"), result);
                case INVOKE -> call(visit, programId, invokeTarget(visit.statement()), result);
                default -> {
                }
            }
        });

        Set<String> callees = new LinkedHashSet<>();
        for (CallEdge edge : result.calls) {
            callees.add(edge.callee);
        }
        for (String caller : result.graph.keySet()) {
            if (!callees.contains(caller)) {
                result.entryPoints.add(caller);
            }
        }
        for (String callee : callees) {
            if (!result.graph.containsKey(callee)) {
                result.leafNodes.add(callee);
            }
        }

        result.totalCalls = result.calls.size();
        result.distinctCallees = callees.size();
        result.averageCallsPerCaller = result.graph.isEmpty() ? 0.0 : (double) result.totalCalls / result.graph.size();
        result.maxCallDepth = maxDepth(result.graph);
        return result;
    }

    /** INVOKE object 'method': the literal method name, qualified by the object when one is given. */
    private static String invokeTarget(AstNode invoke) {
        String method = invoke.text("method");
        String literal = Operands.unquote(method);
        String object = invoke.text("object");
        if (literal == null || object.isEmpty()) {
            return method;
        }
        return "'" + object + "::" + literal + "'";
    }

    private static void call(StatementVisit visit, String programId, String operand, CallGraphResult result) {
        AstNode statement = visit.statement();
        String caller = visit.owner() != null ? visit.owner() : programId;
        String callee = Operands.unquote(operand);
        if (callee == null || callee.isEmpty()) {
            UnresolvedCall unresolved = new UnresolvedCall();
            unresolved.caller = caller;
            unresolved.operand = operand;
            unresolved.statementType = statement.getStatementKind().name();
            unresolved.line = statement.getLine();
            result.unresolvedCalls.add(unresolved);
            result.report(new Issue(IssueKind.UNRESOLVED_CALL, Severity.INFO, NAME,
                    unresolved.statementType + " target '" + operand + "' is not a literal and was not resolved")
                    .at(caller, statement.getLine()));
            return;
        }

        CallEdge edge = new CallEdge();
        edge.caller = caller;
        edge.callee = callee;
        edge.statementType = statement.getStatementKind().name();
        edge.using.addAll(statement.listAttribute("using"));
        edge.giving = statement.text("giving").isEmpty() ? null : statement.text("giving");
        edge.line = statement.getLine();
        result.calls.add(edge);

        List<String> targets = result.graph.computeIfAbsent(caller, k -> new ArrayList<>());
        if (!targets.contains(callee)) {
            targets.add(callee);
        }
    }

    /** Longest call chain, in edges; an edge back onto the current chain ends it. */
    static int maxDepth(Map<String, List<String>> graph) {
        Map<String, Integer> memo = new HashMap<>();
        int max = 0;
        for (String caller : graph.keySet()) {
            max = Math.max(max, depth(caller, graph, memo, new HashSet<>()));
        }
        return max;
    }

    private static int depth(String node, Map<String, List<String>> graph, Map<String, Integer> memo,
                             Set<String> chain) {
        Integer known = memo.get(node);
        if (known != null) {
            return known;
        }
        chain.add(node);
        int deepest = 0;
        for (String callee : graph.getOrDefault(node, List.of())) {
            if (!chain.contains(callee)) {
                deepest = Math.max(deepest, 1 + depth(callee, graph, memo, chain));
            } else {
                deepest = Math.max(deepest, 1);
            }
        }
        chain.remove(node);
        memo.put(node, deepest);
        return deepest;
    }
}
