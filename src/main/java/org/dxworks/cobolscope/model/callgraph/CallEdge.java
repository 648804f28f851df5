package org.dxworks.cobolscope.model.callgraph;

import java.util.ArrayList;
import java.util.List;

public class CallEdge {
    public String caller;
    public String callee;
    public String statementType; // CALL or INVOKE
    public List<String> using = new ArrayList<>();
    public String giving; // nullable
    public int line;
}
