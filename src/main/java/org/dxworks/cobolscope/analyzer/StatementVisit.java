package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.ast.AstNode;

import java.util.List;

/**
 * A statement as seen by {@link StatementWalker}: the node plus the scope it was reached in.
 */
public final class StatementVisit {

    private final AstNode statement;
    private final String division;
    private final String section;
    private final String paragraph;
    private final int depth;
    private final List<String> conditions;

    StatementVisit(AstNode statement, String division, String section, String paragraph,
                   int depth, List<String> conditions) {
        this.statement = statement;
        this.division = division;
        this.section = section;
        this.paragraph = paragraph;
        this.depth = depth;
        this.conditions = conditions;
    }

    public AstNode statement() {
        return statement;
    }

    public String division() {
        return division;
    }

    /** Enclosing section, {@code null} when the statement is not inside one. */
    public String section() {
        return section;
    }

    /** Enclosing paragraph, {@code null} when the statement is not inside one. */
    public String paragraph() {
        return paragraph;
    }

    /**
     * Paragraph, else section, else the procedure-division prologue, the unit control flow is attributed to.
     * {@code null} outside the procedure division.
     */
    public String owner() {
        if (paragraph != null) {
            return paragraph;
        }
        if (section != null) {
            return section;
        }
        return Divisions.PROCEDURE.equals(division) ? StatementWalker.PROLOGUE : null;
    }

    /** Number of enclosing IF, EVALUATE and inline PERFORM blocks. */
    public int depth() {
        return depth;
    }

    /** Enclosing IF/EVALUATE condition chain, outermost first. */
    public List<String> conditions() {
        return conditions;
    }
}
