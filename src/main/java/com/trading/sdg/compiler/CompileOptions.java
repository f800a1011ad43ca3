package com.trading.sdg.compiler;

/**
 * @param skipSinkValidation accept scripts without a report or executor and
 *                           tolerate nodes whose timeframe cannot be resolved.
 * @param inlineScalars      replace constant scalar nodes with literals.
 */
public record CompileOptions(boolean skipSinkValidation, boolean inlineScalars) {

    public static final CompileOptions DEFAULT = new CompileOptions(false, false);

    public CompileOptions withSkipSinkValidation(boolean v) {
        return new CompileOptions(v, inlineScalars);
    }

    public CompileOptions withInlineScalars(boolean v) {
        return new CompileOptions(skipSinkValidation, v);
    }
}
