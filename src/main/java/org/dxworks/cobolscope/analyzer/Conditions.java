package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;

public final class Conditions {

    public static final String WHEN_OTHER = "WHEN OTHER";

    private Conditions() {
    }

    public static String ifCondition(AstNode ifStatement) {
        AstNode condition = ifStatement.firstChild(NodeType.CONDITION);
        if (condition != null && !condition.name().isEmpty()) {
            return normalize(condition.name());
        }
        String attribute = ifStatement.text("condition");
        return attribute.isEmpty() ? "?" : normalize(attribute);
    }

    public static boolean isWhenOther(AstNode when) {
        return when.boolAttribute("other") || "OTHER".equalsIgnoreCase(when.name());
    }

    public static String whenCondition(AstNode when, String subject) {
        if (isWhenOther(when)) {
            return WHEN_OTHER;
        }
        String object = normalize(when.name());
        if (subject == null || subject.isBlank() || "TRUE".equalsIgnoreCase(subject.trim())) {
            return object;
        }
        return normalize(subject) + " = " + object;
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
