package org.dxworks.cobolscope.model.structure;

/**
 * A COPY, REPLACE or EXEC directive found in the tree.
 */
public class StatementInfo {
    public String kind;
    public String paragraph; // nullable outside the procedure division
    public int line;
    public String target;    // copybook name, EXEC command type or replacement text
}
