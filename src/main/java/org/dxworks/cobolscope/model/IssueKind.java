package org.dxworks.cobolscope.model;

public enum IssueKind {
    STRUCTURAL_VIOLATION,
    DATA_MODEL_VIOLATION,
    CONTROL_FLOW,
    UNRESOLVED_CALL,
    MAINTAINABILITY,
    COMPUTATION_ERROR,
    ANALYZER_FAILURE,
    CANCELLED,
    FATAL
}
