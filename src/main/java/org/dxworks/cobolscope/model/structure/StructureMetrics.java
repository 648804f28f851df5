package org.dxworks.cobolscope.model.structure;

import java.util.LinkedHashMap;
import java.util.Map;

public class StructureMetrics {
    public int totalDivisions;
    public int totalSections;
    public int totalParagraphs;
    public int totalStatements;
    public int totalLines;
    public double averageSectionSize;
    public double averageParagraphSize;
    public int structureDepth;
    public Map<String, Integer> statementTypeDistribution = new LinkedHashMap<>();
}
