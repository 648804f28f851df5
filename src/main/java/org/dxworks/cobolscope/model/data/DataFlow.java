package org.dxworks.cobolscope.model.data;

import java.util.ArrayList;
import java.util.List;

public class DataFlow {
    public String source;
    public String target;
    public String statementType;
    public String paragraph;
    public int line;
    public List<String> conditions = new ArrayList<>(); // enclosing IF/EVALUATE chain, outermost first
}
