package com.sokoban.core;

import java.util.Objects;

/**
 * A puzzle as read from text: its static facts and the starting state.
 */
public record ParsedPuzzle(PuzzleStatic puzzle, State initialState) {

    public ParsedPuzzle {
        Objects.requireNonNull(puzzle, "puzzle");
        Objects.requireNonNull(initialState, "initialState");
        if (initialState.getBoxCount() != puzzle.getGoalCount()) {
            throw new IllegalArgumentException("Box count (" + initialState.getBoxCount()
                    + ") != goal count (" + puzzle.getGoalCount() + ")");
        }
    }
}
