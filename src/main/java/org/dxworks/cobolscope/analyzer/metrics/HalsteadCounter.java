package org.dxworks.cobolscope.analyzer.metrics;

import org.dxworks.cobolscope.analyzer.ComputationException;
import org.dxworks.cobolscope.analyzer.Conditions;
import org.dxworks.cobolscope.analyzer.HalsteadLogMode;
import org.dxworks.cobolscope.analyzer.Operands;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;
import org.dxworks.cobolscope.model.metrics.HalsteadMetrics;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operator / operand inventory for Halstead metrics. Every statement verb is one operator occurrence; symbols and
 * relational words inside conditions and expressions are operators too. Operands come from the statement's
 * {@code operands} attribute when present, otherwise from its named operand attributes and condition text.
 */
class HalsteadCounter {

    static final String METRIC = "halstead";

    private static final List<String> OPERAND_ATTRIBUTES = List.of(
            "sources", "targets", "target", "through", "program", "object", "method",
            "using", "giving", "subject", "depending");
    private static final List<String> TEXT_ATTRIBUTES = List.of("until", "varying", "expression");

    private final Map<String, Integer> operators = new HashMap<>();
    private final Map<String, Integer> operands = new HashMap<>();

    void count(AstNode statement) {
        operator(statement.getStatementKind().name());
        if (statement.rawAttribute("operands") != null) {
            for (String token : explicitOperands(statement, statement.rawAttribute("operands"))) {
                operand(token);
            }
        } else {
            for (String attribute : OPERAND_ATTRIBUTES) {
                for (String value : statement.listAttribute(attribute)) {
                    operand(value);
                }
            }
            for (String attribute : TEXT_ATTRIBUTES) {
                text(statement.text(attribute));
            }
        }

        switch (statement.getStatementKind().role()) {
            case CONDITIONAL -> condition(statement);
            case SELECTION_BRANCH -> {
                if (!Conditions.isWhenOther(statement)) {
                    text(statement.name());
                }
            }
            case SELECTION, PERFORM, JUMP, CALL, TERMINATION, DATA_TRANSFER, SIMPLE, DIRECTIVE -> {
            }
        }
    }

    private void condition(AstNode ifStatement) {
        AstNode condition = ifStatement.firstChild(NodeType.CONDITION);
        if (condition != null && condition.rawAttribute("operands") != null) {
            for (String token : explicitOperands(condition, condition.rawAttribute("operands"))) {
                operand(token);
            }
            for (String token : Operands.tokens(condition.name())) {
                if (Operands.isOperatorSymbol(token) || Operands.isConditionWord(token)) {
                    operator(token.toUpperCase(Locale.ROOT));
                }
            }
            return;
        }
        text(Conditions.ifCondition(ifStatement));
    }

    private void text(String text) {
        if (text == null || text.isEmpty() || "?".equals(text)) {
            return;
        }
        for (String token : Operands.tokens(text)) {
            if (Operands.isOperatorSymbol(token) || Operands.isConditionWord(token)) {
                operator(token.toUpperCase(Locale.ROOT));
            } else {
                operand(token);
            }
        }
    }

    private static List<String> explicitOperands(AstNode node, Object raw) {
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item == null || item instanceof List<?> || item instanceof Map<?, ?>) {
                    throw malformed(node);
                }
            }
            return node.listAttribute("operands");
        }
        if (raw instanceof Map<?, ?>) {
            throw malformed(node);
        }
        return node.listAttribute("operands");
    }

    private static ComputationException malformed(AstNode node) {
        return new ComputationException(METRIC, "Malformed operand list on " + node.getType().getName()
                + " '" + node.name() + "' at line " + node.getLine());
    }

    private void operator(String token) {
        operators.merge(token, 1, Integer::sum);
    }

    private void operand(String token) {
        String text = token.trim();
        if (!text.isEmpty()) {
            operands.merge(text, 1, Integer::sum);
        }
    }

    HalsteadMetrics metrics(HalsteadLogMode logMode) {
        HalsteadMetrics metrics = new HalsteadMetrics();
        metrics.distinctOperators = operators.size();
        metrics.distinctOperands = operands.size();
        metrics.totalOperators = operators.values().stream().mapToInt(Integer::intValue).sum();
        metrics.totalOperands = operands.values().stream().mapToInt(Integer::intValue).sum();
        metrics.vocabulary = metrics.distinctOperators + metrics.distinctOperands;
        metrics.length = metrics.totalOperators + metrics.totalOperands;
        metrics.volume = metrics.length * logMode.log2(metrics.vocabulary);
        metrics.difficulty = metrics.distinctOperands == 0
                ? 0.0
                : (metrics.distinctOperators / 2.0) * ((double) metrics.totalOperands / metrics.distinctOperands);
        metrics.effort = metrics.difficulty * metrics.volume;
        return metrics;
    }
}
