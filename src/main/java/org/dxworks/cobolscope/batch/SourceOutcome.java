package org.dxworks.cobolscope.batch;

import org.dxworks.cobolscope.model.AnalysisResult;

public class SourceOutcome {
    public String sourceId;
    public OutcomeStatus status;
    public AnalysisResult result; // null when FAILED
    public String error;          // null when ANALYZED

    public boolean isSuccess() {
        return status == OutcomeStatus.ANALYZED;
    }

    static SourceOutcome of(String sourceId, AnalysisResult result) {
        SourceOutcome outcome = new SourceOutcome();
        outcome.sourceId = sourceId;
        outcome.result = result;
        outcome.status = switch (result.status) {
            case COMPLETE, PARTIAL -> OutcomeStatus.ANALYZED;
            case CANCELLED -> OutcomeStatus.CANCELLED;
            case FATAL -> OutcomeStatus.FATAL;
        };
        if (!result.errors.isEmpty() && outcome.status != OutcomeStatus.ANALYZED) {
            outcome.error = result.errors.get(result.errors.size() - 1).message;
        }
        return outcome;
    }

    static SourceOutcome failed(String sourceId, String error) {
        SourceOutcome outcome = new SourceOutcome();
        outcome.sourceId = sourceId;
        outcome.status = OutcomeStatus.FAILED;
        outcome.error = error;
        return outcome;
    }
}
