package org.dxworks.cobolscope.analyzer;

/**
 * A single metric could not be computed from the input. Callers report the metric as unavailable and go on.
 */
public class ComputationException extends RuntimeException {

    private final String metric;

    public ComputationException(String metric, String message) {
        super(message);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}
