package com.sokoban.core.deadlock;

import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;

/**
 * Reports a deadlock when any box stands on one of the puzzle's precomputed deadlock squares.
 */
public final class DeadlockSquareCheck implements DeadlockCheck {

    private static final DeadlockSquareCheck INSTANCE = new DeadlockSquareCheck();

    private DeadlockSquareCheck() {
    }

    public static DeadlockSquareCheck getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isDeadlocked(State state, PuzzleStatic puzzle) {
        return puzzle.hasBoxOnDeadlockSquare(state);
    }

    @Override
    public String getName() {
        return "Deadlock square";
    }
}
