package com.sokoban.core.deadlock;

import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;

/**
 * A conservative proof that a state can never reach the solved configuration.
 * Implementations must be sound: a solvable state is never reported as deadlocked.
 */
public interface DeadlockCheck {

    /**
     * Returns {@code true} if {@code state} provably cannot be solved.
     *
     * @param state  the state to evaluate
     * @param puzzle the static facts of the puzzle the state belongs to
     */
    boolean isDeadlocked(State state, PuzzleStatic puzzle);

    /**
     * Returns a short name used in logs and validation messages.
     */
    String getName();
}
