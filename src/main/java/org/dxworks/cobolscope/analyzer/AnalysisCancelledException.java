package org.dxworks.cobolscope.analyzer;

public class AnalysisCancelledException extends RuntimeException {
    public AnalysisCancelledException(String message) {
        super(message);
    }
}
