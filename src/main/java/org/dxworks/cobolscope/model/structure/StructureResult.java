package org.dxworks.cobolscope.model.structure;

import org.dxworks.cobolscope.model.PartialResult;

import java.util.ArrayList;
import java.util.List;

public class StructureResult extends PartialResult {
    public String programId;
    public List<DivisionInfo> divisions = new ArrayList<>();
    public List<SectionInfo> sections = new ArrayList<>();
    public List<ParagraphInfo> paragraphs = new ArrayList<>();
    public List<StatementInfo> copyStatements = new ArrayList<>();
    public List<StatementInfo> replaceStatements = new ArrayList<>();
    public List<StatementInfo> execStatements = new ArrayList<>();
    public StructureMetrics metrics = new StructureMetrics();

    public ParagraphInfo paragraph(String name) {
        for (ParagraphInfo paragraph : paragraphs) {
            if (paragraph.name.equals(name)) {
                return paragraph;
            }
        }
        return null;
    }
}
