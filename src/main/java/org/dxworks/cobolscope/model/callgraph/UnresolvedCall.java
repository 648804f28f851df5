package org.dxworks.cobolscope.model.callgraph;

public class UnresolvedCall {
    public String caller;
    public String operand;
    public String statementType;
    public int line;
}
