package com.trading.sdg.engine;

/** Why a node did not produce output for an asset. */
public enum RuntimeErrorKind {
    /** The transform threw. */
    NODE_EXECUTION_FAILURE,
    /** Base data or an upstream column the node reads is absent. */
    INSUFFICIENT_INPUT_DATA,
    /** A node this one reads from failed for the same asset. */
    UPSTREAM_FAILURE,
    /** The run was cancelled or aborted before the node ran. */
    CANCELLED,
    /** The node cannot run at its timeframe (intraday-only operation on daily data). */
    UNSUPPORTED_TIMEFRAME
}
