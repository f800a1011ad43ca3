package com.trading.sdg.compiler;

/** Reason a script failed to compile. */
public enum CompileErrorKind {
    MISSING_TIMEFRAME,
    MISSING_REQUIRED_OPTION,
    MISSING_REQUIRED_INPUT,
    INVALID_TYPE_CAST,
    INVALID_SESSION_RANGE,
    UNKNOWN_OPERATION_TYPE,
    SYNTAX_ERROR,
    DISALLOWED_CONSTRUCT,
    UNBOUND_VARIABLE,
    VARIABLE_REBOUND,
    UNKNOWN_OPTION,
    INVALID_OPTION_VALUE,
    UNKNOWN_INPUT,
    ARGUMENT_COUNT,
    UNKNOWN_OUTPUT,
    INVALID_TIMEFRAME,
    CIRCULAR_DEPENDENCY,
    NO_OUTPUT
}
