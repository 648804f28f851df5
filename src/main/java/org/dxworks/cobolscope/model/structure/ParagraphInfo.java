package org.dxworks.cobolscope.model.structure;

public class ParagraphInfo {
    public String name;
    public String section;
    public String division;
    public int startLine;
    public int endLine;
    public int size;
    public int statementCount;
}
