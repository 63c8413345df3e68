package com.sokoban.core.deadlock;

import com.sokoban.core.Direction;
import com.sokoban.core.Position;
import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;

/**
 * Reports a deadlock when a box that is not on a goal cannot be pushed in any direction: every
 * destination is a wall or another box, or the square the player would need is a wall.
 */
public final class FreezeDeadlockCheck implements DeadlockCheck {

    private static final FreezeDeadlockCheck INSTANCE = new FreezeDeadlockCheck();

    private FreezeDeadlockCheck() {
    }

    public static FreezeDeadlockCheck getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isDeadlocked(State state, PuzzleStatic puzzle) {
        for (Position box : state.getBoxes()) {
            if (puzzle.isGoal(box)) {
                continue;
            }
            if (isFrozen(box, state, puzzle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if no push of {@code box} is possible in the live configuration.
     */
    public boolean isFrozen(Position box, State state, PuzzleStatic puzzle) {
        for (Direction direction : Direction.values()) {
            Position target = box.step(direction);
            Position pushFrom = box.stepBack(direction);
            boolean targetFree = puzzle.isWalkable(target) && !state.hasBox(target);
            if (targetFree && puzzle.isWalkable(pushFrom)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getName() {
        return "Freeze";
    }
}
