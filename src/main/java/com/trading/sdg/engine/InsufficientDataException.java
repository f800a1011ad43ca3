package com.trading.sdg.engine;

/** Base data needed by a node is missing for the current asset or timeframe. */
public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
