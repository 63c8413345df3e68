package com.sokoban.core.ai;

import com.sokoban.core.Position;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Sums, over each box, the Manhattan distance to its nearest goal. Boxes that walls separate from
 * every goal still make the estimate {@link #INFINITE}.
 */
public final class ManhattanHeuristic implements Heuristic {

    private final List<Position> goals;
    private final GoalDistanceTable table;

    public ManhattanHeuristic(List<Position> goals, GoalDistanceTable table) {
        this.goals = List.copyOf(Objects.requireNonNull(goals, "goals"));
        this.table = Objects.requireNonNull(table, "table");
        if (this.goals.isEmpty()) {
            throw new IllegalArgumentException("At least one goal is required");
        }
    }

    @Override
    public int estimate(Collection<Position> boxes) {
        int total = 0;
        for (Position box : boxes) {
            if (table.isWalledOff(box)) {
                return INFINITE;
            }
            int best = Integer.MAX_VALUE;
            for (Position goal : goals) {
                best = Math.min(best, box.manhattanDistance(goal));
            }
            total += best;
        }
        return total;
    }
}
