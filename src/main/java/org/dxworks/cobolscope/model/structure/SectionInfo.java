package org.dxworks.cobolscope.model.structure;

import java.util.ArrayList;
import java.util.List;

public class SectionInfo {
    public String name;
    public String division;
    public boolean implicit; // synthetic holder for paragraphs written directly under a division
    public int startLine;
    public int endLine;
    public int size;
    public List<String> paragraphs = new ArrayList<>();
    public int statementCount;
}
