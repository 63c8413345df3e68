package com.sokoban.core;

/**
 * Thrown when a push requested during replay is not legal from the current state. This points to a
 * corrupted solution string or a solution that belongs to another puzzle.
 */
public class IllegalReplayException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public IllegalReplayException(String message) {
        super(message);
    }

    public IllegalReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
