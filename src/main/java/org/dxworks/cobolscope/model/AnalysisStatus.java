package org.dxworks.cobolscope.model;

public enum AnalysisStatus {
    /** Every analyzer ran without an error entry. */
    COMPLETE,
    /** Analysis finished but at least one analyzer or metric degraded. */
    PARTIAL,
    /** Aborted by the caller's cancellation token; only finished sections are present. */
    CANCELLED,
    /** The AST root was missing or not a program; nothing was computed. */
    FATAL
}
