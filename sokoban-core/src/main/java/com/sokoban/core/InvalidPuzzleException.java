package com.sokoban.core;

/**
 * Signals a structural problem in a puzzle text that is detected before any search starts.
 */
public class InvalidPuzzleException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPuzzleException(String message) {
        super(message);
    }
}
