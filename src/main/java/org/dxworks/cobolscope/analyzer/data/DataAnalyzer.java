package org.dxworks.cobolscope.analyzer.data;

import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.analyzer.Operands;
import org.dxworks.cobolscope.analyzer.StatementVisit;
import org.dxworks.cobolscope.analyzer.StatementWalker;
import org.dxworks.cobolscope.ast.AstAccessor;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.ast.StatementKind;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.data.DataDependency;
import org.dxworks.cobolscope.model.data.DataFlow;
import org.dxworks.cobolscope.model.data.DataItemInfo;
import org.dxworks.cobolscope.model.data.DataMetrics;
import org.dxworks.cobolscope.model.data.DataResult;
import org.dxworks.cobolscope.model.data.DependencyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Data division analysis: the level-number forest, REDEFINES / OCCURS DEPENDING ON / condition-name dependencies,
 * and the MOVE / COMPUTE / STRING / UNSTRING data-flow graph annotated with the enclosing condition chain.
 */
public class DataAnalyzer implements Analyzer<DataResult> {

    public static final String NAME = "data";

    private static final Logger LOGGER = LoggerFactory.getLogger(DataAnalyzer.class);

    private static final List<StatementKind> FLOW_STATEMENTS = List.of(
            StatementKind.MOVE, StatementKind.COMPUTE, StatementKind.STRING, StatementKind.UNSTRING);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DataResult analyze(AstNode program, AnalysisContext context) {
        DataResult result = new DataResult();
        AstAccessor accessor = new AstAccessor(program);

        buildForest(accessor, result);
        context.cancellation().checkpoint("data dependencies");
        Set<String> excluded = collectDependencies(result);

        collectFlows(program, context, excluded, result);
        buildGraph(excluded, result);
        findCriticalItems(context.config().getCriticalItemThreshold(), result);
        computeMetrics(result);
        LOGGER.debug("{} data items, {} dependencies, {} flows, {} critical",
                result.items.size(), result.dependencies.size(), result.dataFlows.size(), result.criticalItems.size());
        return result;
    }

    private void buildForest(AstAccessor accessor, DataResult result) {
        Deque<DataItemInfo> open = new ArrayDeque<>();
        DataItemInfo lastRecord = null;
        DataItemInfo lastItem = null;

        for (AstNode node : accessor.nodesByType(NodeType.DATA_ITEM)) {
            DataItemInfo item = item(node, sectionOf(node, accessor));
            DataItemInfo parent;
            if (item.level == 1 || item.level == 77) {
                open.clear();
                parent = null;
            } else if (item.level >= 2 && item.level <= 49) {
                while (!open.isEmpty() && open.peek().level >= item.level) {
                    open.pop();
                }
                if (open.isEmpty()) {
                    invalidLevel(item, "level " + item.level + " has no enclosing group item", result);
                    continue;
                }
                parent = open.peek();
            } else if (item.level == 88) {
                if (lastItem == null) {
                    invalidLevel(item, "condition name has no preceding data item", result);
                    continue;
                }
                parent = lastItem;
            } else if (item.level == 66) {
                if (lastRecord == null) {
                    invalidLevel(item, "RENAMES entry has no preceding record", result);
                    continue;
                }
                parent = lastRecord;
            } else {
                invalidLevel(item, "invalid level number " + item.level, result);
                continue;
            }

            if (parent == null) {
                item.depth = 1;
                result.roots.add(item.name);
            } else {
                item.parent = parent.name;
                item.depth = parent.depth + 1;
                parent.children.add(item.name);
            }
            if (item.level == 1) {
                lastRecord = item;
            }
            if (item.level != 88 && item.level != 66) {
                lastItem = item;
                if (item.level != 77) {
                    open.push(item);
                }
            }
            result.items.add(item);
        }
    }

    private static DataItemInfo item(AstNode node, String section) {
        DataItemInfo item = new DataItemInfo();
        item.name = node.name();
        item.level = node.intAttribute("level");
        item.section = section;
        item.picture = emptyToNull(node.text("picture"));
        item.usage = emptyToNull(node.text("usage"));
        int occurs = node.intAttribute("occurs");
        item.occurs = occurs > 0 ? occurs : null;
        item.occursDependingOn = emptyToNull(node.text("occurs_depending_on"));
        item.redefines = emptyToNull(node.text("redefines"));
        item.value = emptyToNull(node.text("value"));
        item.line = node.getLine();
        return item;
    }

    private static String sectionOf(AstNode node, AstAccessor accessor) {
        String declared = node.text("section");
        if (!declared.isEmpty()) {
            return declared;
        }
        for (AstNode ancestor = accessor.parent(node); ancestor != null; ancestor = accessor.parent(ancestor)) {
            if (ancestor.is(NodeType.SECTION)) {
                return ancestor.name();
            }
        }
        return null;
    }

    private static void invalidLevel(DataItemInfo item, String reason, DataResult result) {
        result.report(new Issue(IssueKind.DATA_MODEL_VIOLATION, Severity.WARNING, NAME,
                "Data item " + item.name + " excluded: " + reason)
                .at(item.name, item.line)
                .detail("type", "invalid_level_sequence")
                .detail("level", item.level));
    }

    /**
     * Returns the names left out of the dependency graph because of a dangling REDEFINES. A name stays in the graph
     * as long as one item declared under it is valid, so a bad {@code FILLER} does not take the others with it.
     */
    private Set<String> collectDependencies(DataResult result) {
        Set<String> dangling = new HashSet<>();
        Set<String> valid = new HashSet<>();
        List<DataItemInfo> items = result.items;

        for (int index = 0; index < items.size(); index++) {
            DataItemInfo item = items.get(index);
            if (item.redefines != null) {
                DataItemInfo target = nearestBefore(items, index, item.redefines);
                if (target != null && comparableLevels(item.level, target.level)) {
                    result.dependencies.add(new DataDependency(item.name, target.name, DependencyKind.REDEFINES,
                            item.line));
                } else {
                    dangling.add(item.name);
                    result.report(new Issue(IssueKind.DATA_MODEL_VIOLATION, Severity.WARNING, NAME,
                            item.name + " REDEFINES " + item.redefines
                                    + (target == null
                                    ? ", which is not declared before it"
                                    : ", which is declared at level " + target.level + " instead of " + item.level))
                            .at(item.name, item.line)
                            .detail("type", "dangling_redefines")
                            .detail("target", item.redefines));
                    continue;
                }
            }
            valid.add(item.name);
            if (item.occursDependingOn != null) {
                result.dependencies.add(new DataDependency(item.name, Operands.dataName(item.occursDependingOn),
                        DependencyKind.OCCURS_DEPENDING, item.line));
            }
            if (item.level == 88 && item.parent != null) {
                result.dependencies.add(new DataDependency(item.name, item.parent, DependencyKind.VALUE, item.line));
            }
        }

        dangling.removeAll(valid);
        result.dependencies.removeIf(d -> dangling.contains(d.source) || dangling.contains(d.target));
        return dangling;
    }

    private static DataItemInfo nearestBefore(List<DataItemInfo> items, int index, String name) {
        for (int i = index - 1; i >= 0; i--) {
            if (items.get(i).name.equals(name)) {
                return items.get(i);
            }
        }
        return null;
    }

    private static boolean comparableLevels(int level, int targetLevel) {
        if (level == targetLevel) {
            return true;
        }
        return (level == 1 || level == 77) && (targetLevel == 1 || targetLevel == 77);
    }

    private void collectFlows(AstNode program, AnalysisContext context, Set<String> excluded, DataResult result) {
        StatementWalker.walk(program, context.cancellation(), visit -> {
            StatementKind kind = visit.statement().getStatementKind();
            if (FLOW_STATEMENTS.contains(kind)) {
                addFlows(visit, kind, excluded, result);
            }
        });
    }

    private static void addFlows(StatementVisit visit, StatementKind kind, Set<String> excluded, DataResult result) {
        AstNode statement = visit.statement();
        List<String> sources = names(statement.listAttribute("sources"));
        if (sources.isEmpty() && kind == StatementKind.COMPUTE) {
            sources = Operands.identifiers(statement.text("expression"));
        }
        List<String> targets = names(statement.listAttribute("targets"));
        for (String source : sources) {
            for (String target : targets) {
                if (excluded.contains(source) || excluded.contains(target)) {
                    continue;
                }
                DataFlow flow = new DataFlow();
                flow.source = source;
                flow.target = target;
                flow.statementType = kind.name();
                flow.paragraph = visit.owner();
                flow.line = statement.getLine();
                flow.conditions.addAll(visit.conditions());
                result.dataFlows.add(flow);
            }
        }
    }

    private static List<String> names(List<String> operands) {
        List<String> out = new ArrayList<>();
        for (String operand : operands) {
            if (!Operands.isLiteral(operand)) {
                out.add(Operands.dataName(operand));
            }
        }
        return out;
    }

    private static void buildGraph(Set<String> excluded, DataResult result) {
        for (DataItemInfo item : result.items) {
            if (!excluded.contains(item.name)) {
                result.graph.computeIfAbsent(item.name, k -> new ArrayList<>());
            }
        }
        for (DataDependency dependency : result.dependencies) {
            addEdge(result, dependency);
        }
        for (DataFlow flow : result.dataFlows) {
            addEdge(result, new DataDependency(flow.source, flow.target, DependencyKind.DATA_FLOW, flow.line));
        }
    }

    private static void addEdge(DataResult result, DataDependency edge) {
        result.graph.computeIfAbsent(edge.source, k -> new ArrayList<>()).add(edge);
        result.graph.computeIfAbsent(edge.target, k -> new ArrayList<>());
    }

    private static void findCriticalItems(int threshold, DataResult result) {
        for (String name : result.graph.keySet()) {
            result.degrees.put(name, 0);
        }
        for (List<DataDependency> edges : result.graph.values()) {
            for (DataDependency edge : edges) {
                result.degrees.merge(edge.source, 1, Integer::sum);
                result.degrees.merge(edge.target, 1, Integer::sum);
            }
        }
        result.degrees.forEach((name, degree) -> {
            if (degree > threshold) {
                result.criticalItems.add(name);
            }
        });
    }

    private static void computeMetrics(DataResult result) {
        DataMetrics metrics = result.metrics;
        metrics.totalItems = result.items.size();
        int groups = 0;
        int children = 0;
        for (DataItemInfo item : result.items) {
            metrics.maxDepth = Math.max(metrics.maxDepth, item.depth);
            if (!item.children.isEmpty()) {
                groups++;
                children += item.children.size();
            }
            if (item.level == 88) {
                metrics.conditionNames++;
            }
            metrics.itemsBySection.merge(item.section == null ? "UNKNOWN" : item.section, 1, Integer::sum);
        }
        metrics.averageChildren = groups == 0 ? 0.0 : (double) children / groups;
        metrics.redefinesCount = (int) result.dependencies.stream()
                .filter(d -> d.kind == DependencyKind.REDEFINES)
                .count();

        metrics.totalDependencies = result.dependencies.size();
        metrics.averageDegree = result.degrees.values().stream().mapToInt(Integer::intValue).average().orElse(0.0);
        metrics.maxDegree = result.degrees.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        metrics.criticalItemsCount = result.criticalItems.size();

        metrics.totalFlows = result.dataFlows.size();
        for (StatementKind kind : FLOW_STATEMENTS) {
            metrics.flowsByStatement.put(kind.name(), 0);
        }
        for (DataFlow flow : result.dataFlows) {
            metrics.flowsByStatement.merge(flow.statementType, 1, Integer::sum);
        }
    }

    private static String emptyToNull(String text) {
        return text.isEmpty() ? null : text;
    }
}
