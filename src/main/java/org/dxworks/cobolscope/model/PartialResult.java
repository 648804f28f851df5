package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one analyzer. Findings collected while analyzing are handed to the orchestrator, which files them
 * under {@link AnalysisResult#issues} or {@link AnalysisResult#errors}; they are not serialized twice.
 */
public abstract class PartialResult {

    @JsonIgnore
    public final List<Issue> findings = new ArrayList<>();

    public void report(Issue issue) {
        findings.add(issue);
    }
}
