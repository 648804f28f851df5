package org.dxworks.cobolscope.analyzer.structure;

import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.Analyzer;
import org.dxworks.cobolscope.analyzer.Divisions;
import org.dxworks.cobolscope.analyzer.StatementWalker;
import org.dxworks.cobolscope.ast.AstAccessor;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.ast.StatementKind;
import org.dxworks.cobolscope.model.Issue;
import org.dxworks.cobolscope.model.IssueKind;
import org.dxworks.cobolscope.model.Severity;
import org.dxworks.cobolscope.model.structure.DivisionInfo;
import org.dxworks.cobolscope.model.structure.ParagraphInfo;
import org.dxworks.cobolscope.model.structure.SectionInfo;
import org.dxworks.cobolscope.model.structure.StatementInfo;
import org.dxworks.cobolscope.model.structure.StructureMetrics;
import org.dxworks.cobolscope.model.structure.StructureResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the division / section / paragraph hierarchy with counts and sizes, and checks the division layout.
 * Layout problems are reported as structural violations; analysis continues on whatever structure exists.
 */
public class StructuralAnalyzer implements Analyzer<StructureResult> {

    public static final String NAME = "structure";
    public static final String IMPLICIT_SECTION = "__IMPLICIT_SECTION__";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StructureResult analyze(AstNode program, AnalysisContext context) {
        StructureResult result = new StructureResult();
        result.programId = program.name();

        for (AstNode child : program.getChildren()) {
            context.cancellation().checkpoint("structure of " + child.name());
            if (child.is(NodeType.DIVISION)) {
                analyzeDivision(child, result);
            } else {
                result.report(violation(Severity.WARNING,
                        child.getType().getName() + " '" + child.name() + "' is outside any division")
                        .at(child.name(), child.getLine()));
            }
        }

        validateDivisions(result);
        collectStatements(program, context, result);
        computeMetrics(program, result);
        return result;
    }

    private void analyzeDivision(AstNode divisionNode, StructureResult result) {
        DivisionInfo division = new DivisionInfo();
        division.name = Divisions.normalize(divisionNode.name());
        division.startLine = divisionNode.getLine();
        division.endLine = divisionNode.getEndLine();
        division.size = size(division.startLine, division.endLine);
        division.statementCount = countStatements(divisionNode);
        result.divisions.add(division);

        SectionInfo implicit = null;
        for (AstNode child : divisionNode.getChildren()) {
            if (child.is(NodeType.SECTION)) {
                SectionInfo section = section(child.name(), division.name, false, child.getLine(), child.getEndLine());
                section.statementCount = countStatements(child);
                for (AstNode grandChild : child.getChildren()) {
                    if (grandChild.is(NodeType.PARAGRAPH)) {
                        addParagraph(grandChild, section, result);
                        division.paragraphCount++;
                    }
                }
                division.sections.add(section.name);
                result.sections.add(section);
            } else if (child.is(NodeType.PARAGRAPH)) {
                if (implicit == null) {
                    implicit = section(IMPLICIT_SECTION, division.name, true, child.getLine(), 0);
                    division.sections.add(implicit.name);
                    result.sections.add(implicit);
                }
                addParagraph(child, implicit, result);
                division.paragraphCount++;
                implicit.statementCount += countStatements(child);
                implicit.endLine = Math.max(implicit.endLine, child.getEndLine());
                implicit.size = size(implicit.startLine, implicit.endLine);
            }
        }
    }

    private static SectionInfo section(String name, String division, boolean implicit, int start, int end) {
        SectionInfo section = new SectionInfo();
        section.name = name;
        section.division = division;
        section.implicit = implicit;
        section.startLine = start;
        section.endLine = end;
        section.size = size(start, end);
        return section;
    }

    private static void addParagraph(AstNode node, SectionInfo section, StructureResult result) {
        ParagraphInfo paragraph = new ParagraphInfo();
        paragraph.name = node.name();
        paragraph.section = section.name;
        paragraph.division = section.division;
        paragraph.startLine = node.getLine();
        paragraph.endLine = node.getEndLine();
        paragraph.size = size(paragraph.startLine, paragraph.endLine);
        paragraph.statementCount = countStatements(node);
        section.paragraphs.add(paragraph.name);
        result.paragraphs.add(paragraph);
    }

    private void validateDivisions(StructureResult result) {
        List<String> present = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DivisionInfo division : result.divisions) {
            if (!seen.add(division.name)) {
                result.report(violation(Severity.ERROR, "Duplicate " + division.name + " DIVISION")
                        .at(division.name, division.startLine));
            } else {
                present.add(division.name);
            }
        }

        for (String mandatory : List.of(Divisions.IDENTIFICATION, Divisions.PROCEDURE)) {
            if (!present.contains(mandatory)) {
                result.report(violation(Severity.ERROR, mandatory + " DIVISION is missing")
                        .at(mandatory, 0)
                        .detail("type", "missing_division"));
            }
        }

        List<String> order = Divisions.REQUIRED_ORDER;
        for (int i = 0; i < order.size(); i++) {
            for (int j = i + 1; j < order.size(); j++) {
                int first = present.indexOf(order.get(i));
                int second = present.indexOf(order.get(j));
                if (first >= 0 && second >= 0 && first > second) {
                    result.report(violation(Severity.WARNING,
                            "Invalid division order: " + order.get(i) + " should come before " + order.get(j))
                            .at(order.get(i), 0)
                            .detail("type", "misordered_division"));
                }
            }
        }

        for (DivisionInfo division : result.divisions) {
            if (!order.contains(division.name)) {
                result.report(violation(Severity.WARNING, "Unknown division '" + division.name + "'")
                        .at(division.name, division.startLine));
            }
        }
    }

    private void collectStatements(AstNode program, AnalysisContext context, StructureResult result) {
        Map<String, Integer> distribution = new TreeMap<>();
        int[] total = {0};
        StatementWalker.walk(program, context.cancellation(), visit -> {
            AstNode statement = visit.statement();
            StatementKind kind = statement.getStatementKind();
            total[0]++;
            distribution.merge(kind.name(), 1, Integer::sum);
            switch (kind) {
                case COPY -> result.copyStatements.add(directive(visit.paragraph(), statement,
                        firstNonEmpty(statement.text("copybook"), statement.name())));
                case REPLACE -> result.replaceStatements.add(directive(visit.paragraph(), statement,
                        firstNonEmpty(statement.text("replacing"), statement.name())));
                case EXEC -> result.execStatements.add(directive(visit.paragraph(), statement,
                        firstNonEmpty(statement.text("command_type"), statement.name())));
                default -> {
                }
            }
        });
        result.metrics.totalStatements = total[0];
        result.metrics.statementTypeDistribution.putAll(distribution);
    }

    private static StatementInfo directive(String paragraph, AstNode statement, String target) {
        StatementInfo info = new StatementInfo();
        info.kind = statement.getStatementKind().name();
        info.paragraph = paragraph;
        info.line = statement.getLine();
        info.target = target;
        return info;
    }

    private void computeMetrics(AstNode program, StructureResult result) {
        StructureMetrics metrics = result.metrics;
        metrics.totalDivisions = result.divisions.size();
        metrics.totalSections = result.sections.size();
        metrics.totalParagraphs = result.paragraphs.size();
        metrics.averageSectionSize = result.sections.stream().mapToInt(s -> s.size).average().orElse(0.0);
        metrics.averageParagraphSize = result.paragraphs.stream().mapToInt(p -> p.size).average().orElse(0.0);
        metrics.structureDepth = depth(program);
        metrics.totalLines = totalLines(program, result);
    }

    static int totalLines(AstNode program, StructureResult result) {
        int declared = program.intAttribute("total_lines");
        if (declared > 0) {
            return declared;
        }
        int end = program.getEndLine();
        for (DivisionInfo division : result.divisions) {
            end = Math.max(end, division.endLine);
        }
        return end > 0 ? size(Math.max(1, program.getLine()), end) + 1 : 0;
    }

    private static int depth(AstNode root) {
        int max = 0;
        Deque<AstNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            AstNode node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (AstNode child : node.getChildren()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    private static int countStatements(AstNode node) {
        int count = 0;
        for (AstNode ignored : AstAccessor.nodesByType(node, NodeType.STATEMENT)) {
            count++;
        }
        return count;
    }

    private static int size(int start, int end) {
        return Math.max(0, end - start);
    }

    private static String firstNonEmpty(String first, String second) {
        return first != null && !first.isEmpty() ? first : second;
    }

    private static Issue violation(Severity severity, String message) {
        return new Issue(IssueKind.STRUCTURAL_VIOLATION, severity, NAME, message);
    }
}
