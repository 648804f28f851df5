package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Iterative pre-order walk over every statement of a program.
 * <p>
 * Scope (division, section, paragraph), block depth and the enclosing condition chain travel on the explicit
 * stack with each frame, so no counter is shared between frames and deep nesting costs heap, not call stack.
 * The cancellation token is checked at every division, section and paragraph boundary.
 */
public final class StatementWalker {

    public static final String PROLOGUE = "__PROCEDURE_DIVISION_PROLOGUE__";

    private StatementWalker() {
    }

    public static void walk(AstNode program, CancellationToken cancellation, Consumer<StatementVisit> visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(program, null, null, null, 0, List.of()));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            AstNode node = frame.node;
            switch (node.getType()) {
                case PROGRAM -> pushChildren(stack, node.getChildren(), frame, frame.depth, frame.conditions);
                case DIVISION -> {
                    cancellation.checkpoint("division " + node.name());
                    Frame scoped = new Frame(node, Divisions.normalize(node.name()), null, null, 0, List.of());
                    pushChildren(stack, node.getChildren(), scoped, 0, List.of());
                }
                case SECTION -> {
                    cancellation.checkpoint("section " + node.name());
                    Frame scoped = new Frame(node, frame.division, node.name(), null, 0, List.of());
                    pushChildren(stack, node.getChildren(), scoped, 0, List.of());
                }
                case PARAGRAPH -> {
                    cancellation.checkpoint("paragraph " + node.name());
                    Frame scoped = new Frame(node, frame.division, frame.section, node.name(), 0, List.of());
                    pushChildren(stack, node.getChildren(), scoped, 0, List.of());
                }
                case STATEMENT -> {
                    visitor.accept(new StatementVisit(node, frame.division, frame.section, frame.paragraph,
                            frame.depth, frame.conditions));
                    descend(stack, frame);
                }
                case DATA_ITEM, CONDITION, EXPRESSION -> {
                    // not statements; nested statements (COPY inside a data description) are still reached
                    pushChildren(stack, statementChildren(node), frame, frame.depth, frame.conditions);
                }
            }
        }
    }

    private static void descend(Deque<Frame> stack, Frame frame) {
        AstNode node = frame.node;
        List<AstNode> body = statementChildren(node);
        if (body.isEmpty()) {
            return;
        }
        switch (node.getStatementKind().role()) {
            case CONDITIONAL -> {
                String condition = Conditions.ifCondition(node);
                List<String> thenChain = append(frame.conditions, condition);
                List<String> elseChain = append(frame.conditions, "NOT (" + condition + ")");
                for (int i = body.size() - 1; i >= 0; i--) {
                    AstNode child = body.get(i);
                    boolean elseBranch = "else".equalsIgnoreCase(child.text("branch"));
                    stack.push(frame.child(child, frame.depth + 1, elseBranch ? elseChain : thenChain));
                }
            }
            // WHEN branches sit at the EVALUATE's own depth; their bodies are one level deeper
            case SELECTION -> {
                String subject = node.text("subject");
                for (int i = body.size() - 1; i >= 0; i--) {
                    Frame branch = frame.child(body.get(i), frame.depth, frame.conditions);
                    branch.subject = subject;
                    stack.push(branch);
                }
            }
            case SELECTION_BRANCH -> pushChildren(stack, body, frame, frame.depth + 1,
                    append(frame.conditions, Conditions.whenCondition(node, frame.subject)));
            case PERFORM -> pushChildren(stack, body, frame, frame.depth + 1, frame.conditions);
            case JUMP, CALL, TERMINATION, DATA_TRANSFER, SIMPLE, DIRECTIVE ->
                    pushChildren(stack, body, frame, frame.depth, frame.conditions);
        }
    }

    private static List<AstNode> statementChildren(AstNode node) {
        List<AstNode> out = new ArrayList<>();
        for (AstNode child : node.getChildren()) {
            if (child.is(NodeType.STATEMENT)) {
                out.add(child);
            }
        }
        return out;
    }

    private static void pushChildren(Deque<Frame> stack, List<AstNode> children, Frame parent,
                                     int depth, List<String> conditions) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(parent.child(children.get(i), depth, conditions));
        }
    }

    private static List<String> append(List<String> chain, String condition) {
        List<String> out = new ArrayList<>(chain.size() + 1);
        out.addAll(chain);
        out.add(condition);
        return Collections.unmodifiableList(out);
    }

    private static final class Frame {
        final AstNode node;
        final String division;
        final String section;
        final String paragraph;
        final int depth;
        final List<String> conditions;
        String subject; // set on WHEN frames to the owning EVALUATE's subject

        Frame(AstNode node, String division, String section, String paragraph, int depth, List<String> conditions) {
            this.node = node;
            this.division = division;
            this.section = section;
            this.paragraph = paragraph;
            this.depth = depth;
            this.conditions = conditions;
        }

        Frame child(AstNode childNode, int childDepth, List<String> childConditions) {
            return new Frame(childNode, division, section, paragraph, childDepth, childConditions);
        }
    }
}
