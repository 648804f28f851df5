package org.dxworks.cobolscope.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Read-only query helpers over one AST.
 * <p>
 * Sequences returned here are lazy, finite and restartable: every call to {@code iterator()} walks the tree
 * again in depth-first pre-order using an explicit stack, so arbitrarily deep trees never exhaust the call stack.
 */
public final class AstAccessor {

    private final AstNode root;
    private Map<AstNode, AstNode> parents;

    public AstAccessor(AstNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Iterable<AstNode> nodesByType(NodeType type) {
        return nodesByType(root, type);
    }

    public Iterable<AstNode> statements(StatementKind kind) {
        return select(root, node -> node.isStatement(kind));
    }

    public List<AstNode> children(AstNode node) {
        return node.getChildren();
    }

    /** Parent of {@code node} within this tree, {@code null} for the root or a foreign node. */
    public AstNode parent(AstNode node) {
        if (parents == null) {
            parents = indexParents(root);
        }
        return parents.get(node);
    }

    public static Iterable<AstNode> nodesByType(AstNode root, NodeType type) {
        return select(root, node -> node.getType() == type);
    }

    public static Iterable<AstNode> preOrder(AstNode root) {
        return select(root, node -> true);
    }

    public static Iterable<AstNode> select(AstNode root, Predicate<AstNode> filter) {
        return () -> new PreOrderIterator(root, filter);
    }

    private static Map<AstNode, AstNode> indexParents(AstNode root) {
        Map<AstNode, AstNode> index = new IdentityHashMap<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode current = stack.pop();
            for (AstNode child : current.getChildren()) {
                index.put(child, current);
                stack.push(child);
            }
        }
        return index;
    }

    private static final class PreOrderIterator implements Iterator<AstNode> {
        private final Deque<AstNode> stack = new ArrayDeque<>();
        private final Predicate<AstNode> filter;
        private AstNode next;

        PreOrderIterator(AstNode root, Predicate<AstNode> filter) {
            this.filter = filter;
            if (root != null) {
                stack.push(root);
            }
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                AstNode current = stack.pop();
                List<AstNode> children = current.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
                if (filter.test(current)) {
                    next = current;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public AstNode next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            AstNode result = next;
            advance();
            return result;
        }
    }
}
