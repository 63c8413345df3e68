package com.sokoban.core.deadlock;

import com.sokoban.core.Position;
import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;

/**
 * Reports a deadlock when four boxes fill an axis-aligned 2x2 block that is not entirely made of
 * goals. No box of such a block can ever move again.
 */
public final class SquareBlockDeadlockCheck implements DeadlockCheck {

    private static final SquareBlockDeadlockCheck INSTANCE = new SquareBlockDeadlockCheck();

    private SquareBlockDeadlockCheck() {
    }

    public static SquareBlockDeadlockCheck getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isDeadlocked(State state, PuzzleStatic puzzle) {
        // Each block is examined once, from its top-left box.
        for (Position box : state.getBoxes()) {
            Position right = new Position(box.x() + 1, box.y());
            Position below = new Position(box.x(), box.y() + 1);
            Position diagonal = new Position(box.x() + 1, box.y() + 1);
            if (!state.hasBox(right) || !state.hasBox(below) || !state.hasBox(diagonal)) {
                continue;
            }
            boolean allGoals = puzzle.isGoal(box) && puzzle.isGoal(right) && puzzle.isGoal(below)
                    && puzzle.isGoal(diagonal);
            if (!allGoals) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() {
        return "2x2 block";
    }
}
