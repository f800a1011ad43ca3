package com.trading.sdg.engine;

/** Thrown by long-running transforms that observe a cancelled {@link CancellationToken}. */
public class OperationCancelledException extends RuntimeException {
    public OperationCancelledException(String message) {
        super(message);
    }
}
