package com.trading.sdg.compiler;

/**
 * Compile failure as a value.
 *
 * @param kind     failure category.
 * @param message  human readable description.
 * @param nodeId   offending node id, may be null.
 * @param nodeType offending operation type, may be null.
 * @param field    missing or invalid field (option, input, timeframe), may be null.
 * @param line     1-based source line, 0 when not tied to a line.
 */
public record CompileError(CompileErrorKind kind, String message, String nodeId, String nodeType, String field,
        int line) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(message);
        if (line > 0)
            sb.append(" (line ").append(line).append(')');
        return sb.toString();
    }
}
