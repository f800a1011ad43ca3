package com.trading.sdg.compiler;

/**
 * Result of {@link StrategyCompiler#compile}: either a graph or the first
 * error. Compilation is all-or-nothing, a failure never carries nodes.
 */
public final class CompileOutcome {

    private final CompilationResult result;
    private final CompileError error;

    private CompileOutcome(CompilationResult result, CompileError error) {
        this.result = result;
        this.error = error;
    }

    public static CompileOutcome success(CompilationResult result) {
        return new CompileOutcome(result, null);
    }

    public static CompileOutcome failure(CompileError error) {
        return new CompileOutcome(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if compilation failed.
     */
    public CompilationResult result() {
        if (error != null)
            throw new IllegalStateException("Compilation failed: " + error);
        return result;
    }

    /**
     * @throws IllegalStateException if compilation succeeded.
     */
    public CompileError error() {
        if (error == null)
            throw new IllegalStateException("Compilation succeeded");
        return error;
    }

    /** Returns the result or throws the error as a {@link CompileException}. */
    public CompilationResult orElseThrow() {
        if (error != null)
            throw new CompileException(error);
        return result;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + result.size() + " nodes)" : "Failure(" + error + ")";
    }
}
