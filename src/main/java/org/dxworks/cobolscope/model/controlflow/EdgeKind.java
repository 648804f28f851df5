package org.dxworks.cobolscope.model.controlflow;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EdgeKind {
    @JsonProperty("perform") PERFORM,
    @JsonProperty("perform-until") PERFORM_UNTIL,
    @JsonProperty("perform-varying") PERFORM_VARYING,
    @JsonProperty("goto") GOTO,
    @JsonProperty("if-branch") IF_BRANCH,
    @JsonProperty("evaluate-branch") EVALUATE_BRANCH;

    /** Edges between paragraphs/sections, the ones cycle detection follows. */
    public boolean isTransfer() {
        return switch (this) {
            case PERFORM, PERFORM_UNTIL, PERFORM_VARYING, GOTO -> true;
            case IF_BRANCH, EVALUATE_BRANCH -> false;
        };
    }

    public boolean isLoop() {
        return this == PERFORM_UNTIL || this == PERFORM_VARYING;
    }
}
