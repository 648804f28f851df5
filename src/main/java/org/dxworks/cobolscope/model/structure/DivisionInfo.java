package org.dxworks.cobolscope.model.structure;

import java.util.ArrayList;
import java.util.List;

public class DivisionInfo {
    public String name;
    public int startLine;
    public int endLine;
    public int size;
    public List<String> sections = new ArrayList<>();
    public int paragraphCount;
    public int statementCount;
}
