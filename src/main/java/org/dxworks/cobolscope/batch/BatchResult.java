package org.dxworks.cobolscope.batch;

import java.util.ArrayList;
import java.util.List;

public class BatchResult {
    public List<SourceOutcome> outcomes = new ArrayList<>(); // input order
    public int succeeded;
    public int failed;
}
