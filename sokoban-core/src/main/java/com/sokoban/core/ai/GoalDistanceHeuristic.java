package com.sokoban.core.ai;

import com.sokoban.core.Position;
import java.util.Collection;
import java.util.Objects;

/**
 * Sums, over each box independently, the precomputed push distance to its nearest goal.
 * Box-box blocking is ignored, which keeps the estimate admissible.
 */
public final class GoalDistanceHeuristic implements Heuristic {

    private final GoalDistanceTable table;

    public GoalDistanceHeuristic(GoalDistanceTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public int estimate(Collection<Position> boxes) {
        int total = 0;
        for (Position box : boxes) {
            int distance = table.nearestGoalDistance(box);
            if (distance == GoalDistanceTable.UNREACHABLE) {
                return INFINITE;
            }
            total += distance;
        }
        return total;
    }
}
