package org.dxworks.cobolscope.model.controlflow;

import org.dxworks.cobolscope.model.Severity;

import java.util.ArrayList;
import java.util.List;

public class Cycle {
    public List<String> paragraphs = new ArrayList<>();
    public boolean gotoInduced;
    public boolean terminationDetected;
    public Severity severity;
}
