package org.dxworks.cobolscope.analyzer;

public class FatalAnalysisException extends RuntimeException {
    public FatalAnalysisException(String message) {
        super(message);
    }
}
