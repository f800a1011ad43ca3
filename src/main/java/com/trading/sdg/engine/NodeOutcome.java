package com.trading.sdg.engine;

/**
 * Result of one node for one asset.
 *
 * @param asset     asset id, or {@code ALL} for cross-sectional and scalar runs.
 * @param errorKind null on success.
 * @param message   first error message, null on success.
 */
public record NodeOutcome(String nodeId, String asset, Status status, RuntimeErrorKind errorKind, String message) {

    public enum Status {
        SUCCEEDED, FAILED, SKIPPED
    }

    static NodeOutcome succeeded(String nodeId, String asset) {
        return new NodeOutcome(nodeId, asset, Status.SUCCEEDED, null, null);
    }

    static NodeOutcome failed(String nodeId, String asset, RuntimeErrorKind kind, String message) {
        return new NodeOutcome(nodeId, asset, Status.FAILED, kind, message);
    }

    static NodeOutcome skipped(String nodeId, String asset, RuntimeErrorKind kind, String message) {
        return new NodeOutcome(nodeId, asset, Status.SKIPPED, kind, message);
    }
}
