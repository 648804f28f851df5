package org.dxworks.cobolscope.analyzer.controlflow;

import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.controlflow.ControlFlowEdge;
import org.dxworks.cobolscope.model.controlflow.ControlFlowResult;
import org.dxworks.cobolscope.model.controlflow.Cycle;
import org.dxworks.cobolscope.model.controlflow.EdgeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search over PERFORM and GO TO edges. Every back edge closes one cycle; a cycle reached from
 * several starting points is recorded once, keyed by its rotation starting at the smallest paragraph name.
 */
class CycleDetector {

    private final ControlFlowResult result;
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, List<ControlFlowEdge>> edgesByPair = new LinkedHashMap<>();

    CycleDetector(ControlFlowResult result) {
        this.result = result;
        for (ControlFlowEdge edge : result.edges) {
            if (!edge.kind.isTransfer()) {
                continue;
            }
            successors.computeIfAbsent(edge.from, k -> new LinkedHashSet<>()).add(edge.to);
            edgesByPair.computeIfAbsent(pair(edge.from, edge.to), k -> new ArrayList<>()).add(edge);
        }
    }

    void detect() {
        Set<String> done = new HashSet<>();
        Set<String> recorded = new HashSet<>();
        List<String> starts = new ArrayList<>(result.entryPoints);
        starts.addAll(result.nodes);
        for (String start : starts) {
            if (!done.contains(start)) {
                search(start, done, recorded);
            }
        }
    }

    private void search(String start, Set<String> done, Set<String> recorded) {
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();

        path.add(start);
        onPath.add(start);
        pending.push(successors.getOrDefault(start, Set.of()).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                String finished = path.remove(path.size() - 1);
                onPath.remove(finished);
                done.add(finished);
                continue;
            }
            String target = next.next();
            if (onPath.contains(target)) {
                List<String> members = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                if (recorded.add(canonicalKey(members))) {
                    record(members);
                }
            } else if (!done.contains(target)) {
                path.add(target);
                onPath.add(target);
                pending.push(successors.getOrDefault(target, Set.of()).iterator());
            }
        }
    }

    private void record(List<String> members) {
        Cycle cycle = new Cycle();
        cycle.paragraphs.addAll(members);
        for (int i = 0; i < members.size(); i++) {
            String from = members.get(i);
            String to = members.get((i + 1) % members.size());
            for (ControlFlowEdge edge : edgesByPair.getOrDefault(pair(from, to), List.of())) {
                if (edge.kind == EdgeKind.GOTO) {
                    cycle.gotoInduced = true;
                }
                if (edge.condition != null) {
                    cycle.terminationDetected = true;
                }
            }
        }
        cycle.severity = cycle.gotoInduced || !cycle.terminationDetected ? Severity.WARNING : Severity.INFO;
        result.cycles.add(cycle);

        String description = String.join(" -> ", members) + " -> " + members.get(0);
        String message = cycle.gotoInduced
                ? "GO TO induced cycle: " + description
                : cycle.terminationDetected
                ? "Conditional PERFORM cycle: " + description
                : "PERFORM cycle without a visible exit condition: " + description;
        result.report(new Issue(IssueKind.CONTROL_FLOW, cycle.severity, ControlFlowAnalyzer.NAME, message)
                .at(members.get(0), 0)
                .detail("cycle", List.copyOf(members)));
    }

    static String canonicalKey(List<String> members) {
        int smallest = 0;
        for (int i = 1; i < members.size(); i++) {
            if (members.get(i).compareTo(members.get(smallest)) < 0) {
                smallest = i;
            }
        }
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < members.size(); i++) {
            key.append(members.get((smallest + i) % members.size())).append('\u0000');
        }
        return key.toString();
    }

    private static String pair(String from, String to) {
        return from + "\u0000" + to;
    }
}
