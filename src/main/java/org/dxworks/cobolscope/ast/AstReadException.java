package org.dxworks.cobolscope.ast;

public class AstReadException extends RuntimeException {
    public AstReadException(String message) {
        super(message);
    }

    public AstReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
