package org.dxworks.cobolscope.ast;

public enum StatementRole {
    CONDITIONAL,
    SELECTION,
    SELECTION_BRANCH,
    PERFORM,
    JUMP,
    CALL,
    TERMINATION,
    DATA_TRANSFER,
    SIMPLE,
    DIRECTIVE
}
