package org.dxworks.cobolscope.ast;

import java.util.Locale;

/**
 * COBOL statement verbs the analyzers distinguish. Anything else decodes to {@link #OTHER}.
 */
public enum StatementKind {
    MOVE,
    COMPUTE,
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    STRING,
    UNSTRING,
    INITIALIZE,
    SET,
    IF,
    EVALUATE,
    WHEN,
    PERFORM,
    GO_TO,
    CALL,
    INVOKE,
    STOP_RUN,
    GOBACK,
    EXIT_PROGRAM,
    EXIT,
    CONTINUE,
    DISPLAY,
    ACCEPT,
    OPEN,
    CLOSE,
    READ,
    WRITE,
    REWRITE,
    DELETE,
    START,
    COPY,
    REPLACE,
    EXEC,
    OTHER;

    public static StatementKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return OTHER;
        }
        String normalized = normalize(tag);
        if (performVariant(tag) != null) {
            return PERFORM;
        }
        switch (normalized) {
            case "GO", "GOTO":
                return GO_TO;
            case "STOP":
                return STOP_RUN;
            case "EXEC_SQL", "EXEC_CICS":
                return EXEC;
            default:
                break;
        }
        for (StatementKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }

    /**
     * The loop form carried in a combined verb tag such as {@code PERFORM UNTIL}, lower-cased
     * ({@code until}, {@code varying}, {@code thru}, {@code times}); {@code null} for any other tag.
     */
    public static String performVariant(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = normalize(tag);
        if (!normalized.startsWith("PERFORM_")) {
            return null;
        }
        String variant = normalized.substring("PERFORM_".length());
        switch (variant) {
            case "UNTIL", "VARYING", "THRU", "TIMES":
                return variant.toLowerCase(Locale.ROOT);
            case "THROUGH":
                return "thru";
            default:
                return null;
        }
    }

    private static String normalize(String tag) {
        return tag.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    /**
     * Classifies the verb for the analyzers. Every constant is listed so that a new verb
     * does not compile until it is given a role.
     */
    public StatementRole role() {
        return switch (this) {
            case IF -> StatementRole.CONDITIONAL;
            case EVALUATE -> StatementRole.SELECTION;
            case WHEN -> StatementRole.SELECTION_BRANCH;
            case PERFORM -> StatementRole.PERFORM;
            case GO_TO -> StatementRole.JUMP;
            case CALL, INVOKE -> StatementRole.CALL;
            case STOP_RUN, GOBACK, EXIT_PROGRAM -> StatementRole.TERMINATION;
            case MOVE, COMPUTE, STRING, UNSTRING -> StatementRole.DATA_TRANSFER;
            case ADD, SUBTRACT, MULTIPLY, DIVIDE, INITIALIZE, SET, EXIT, CONTINUE, DISPLAY, ACCEPT,
                    OPEN, CLOSE, READ, WRITE, REWRITE, DELETE, START, OTHER -> StatementRole.SIMPLE;
            case COPY, REPLACE, EXEC -> StatementRole.DIRECTIVE;
        };
    }
}
