package com.trading.sdg.compiler;

/**
 * Raised inside the compiler passes; {@link StrategyCompiler#compile} turns it
 * into a {@link CompileError} value.
 */
public class CompileException extends RuntimeException {

    private final CompileError error;

    public CompileException(CompileError error) {
        super(error.toString());
        this.error = error;
    }

    public CompileException(CompileErrorKind kind, String message) {
        this(new CompileError(kind, message, null, null, null, 0));
    }

    public CompileException(CompileErrorKind kind, String message, int line) {
        this(new CompileError(kind, message, null, null, null, line));
    }

    public static CompileException forNode(CompileErrorKind kind, String message, String nodeId, String nodeType,
            String field) {
        return new CompileException(new CompileError(kind, message, nodeId, nodeType, field, 0));
    }

    public static CompileException forNode(CompileErrorKind kind, String message, String nodeId, String nodeType,
            String field, int line) {
        return new CompileException(new CompileError(kind, message, nodeId, nodeType, field, line));
    }

    public CompileError error() {
        return error;
    }

    public CompileErrorKind kind() {
        return error.kind();
    }
}
