package org.dxworks.cobolscope.model.quality;

/**
 * Declared from worst to best; {@link #ordinal()} is the ranking used for sorting.
 */
public enum EvaluationLevel {
    CRITICAL,
    WARNING,
    ACCEPTABLE,
    GOOD,
    EXCELLENT;

    /** Key into the suggestion catalog: critical, warning or acceptable. */
    public String severityKey() {
        return switch (this) {
            case CRITICAL -> "critical";
            case WARNING -> "warning";
            case ACCEPTABLE, GOOD, EXCELLENT -> "acceptable";
        };
    }
}
