package org.dxworks.cobolscope.batch;

public enum OutcomeStatus {
    /** Analysis ran to the end; the result may still be PARTIAL. */
    ANALYZED,
    /** The source could not be loaded or the engine threw. */
    FAILED,
    FATAL,
    CANCELLED
}
