package org.dxworks.cobolscope.model.controlflow;

public class ControlFlowEdge {
    public String from;
    public String to;
    public EdgeKind kind;
    public String condition; // loop condition or enclosing IF/EVALUATE chain; nullable
    public String through;   // PERFORM ... THRU end point; nullable
    public int line;
    public boolean flagged;  // unstructured jump
}
