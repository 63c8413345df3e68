package com.sokoban.core.ai;

/**
 * Why a solve attempt ended without a solution.
 */
public enum FailureReason {
    /** Structural problem found before search started. Never retried. */
    INVALID_PUZZLE("invalid_puzzle"),
    /** The frontier emptied without reaching the goal. */
    UNSOLVABLE("unsolvable"),
    /** The wall-clock or state budget ran out; a larger budget may succeed. */
    TIMEOUT("timeout");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    /**
     * Returns the wire name, e.g. {@code invalid_puzzle}.
     */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
