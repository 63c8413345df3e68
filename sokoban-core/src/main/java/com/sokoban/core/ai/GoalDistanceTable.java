package com.sokoban.core.ai;

import com.sokoban.core.Direction;
import com.sokoban.core.Position;
import com.sokoban.core.PuzzleStatic;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Push distances from every square to every goal, ignoring other boxes and respecting walls.
 * Computed by one breadth-first search per goal; read-only afterwards.
 */
public final class GoalDistanceTable {

    public static final int UNREACHABLE = Integer.MAX_VALUE;

    private final PuzzleStatic puzzle;
    private final int[][] distances;
    private final int[] nearest;

    private GoalDistanceTable(PuzzleStatic puzzle, int[][] distances) {
        this.puzzle = puzzle;
        this.distances = distances;
        this.nearest = new int[puzzle.getCellCount()];
        Arrays.fill(nearest, UNREACHABLE);
        for (int[] fromGoal : distances) {
            for (int cell = 0; cell < fromGoal.length; cell++) {
                nearest[cell] = Math.min(nearest[cell], fromGoal[cell]);
            }
        }
    }

    /**
     * Runs the per-goal breadth-first searches for {@code puzzle}.
     */
    public static GoalDistanceTable precompute(PuzzleStatic puzzle) {
        Objects.requireNonNull(puzzle, "puzzle");
        List<Position> goals = puzzle.getGoals();
        int[][] distances = new int[goals.size()][];
        for (int goalIndex = 0; goalIndex < goals.size(); goalIndex++) {
            distances[goalIndex] = distancesFrom(goals.get(goalIndex), puzzle);
        }
        return new GoalDistanceTable(puzzle, distances);
    }

    /**
     * Returns the push distance from {@code position} to the goal with index {@code goalIndex}, or
     * {@link #UNREACHABLE} if walls separate them.
     */
    public int distance(Position position, int goalIndex) {
        if (goalIndex < 0 || goalIndex >= distances.length) {
            throw new IllegalArgumentException("Goal index out of range: " + goalIndex);
        }
        if (!puzzle.isInside(position)) {
            return UNREACHABLE;
        }
        return distances[goalIndex][puzzle.index(position)];
    }

    /**
     * Returns the distance from {@code position} to its nearest goal, or {@link #UNREACHABLE}.
     */
    public int nearestGoalDistance(Position position) {
        if (!puzzle.isInside(position)) {
            return UNREACHABLE;
        }
        return nearest[puzzle.index(position)];
    }

    /**
     * Returns {@code true} if walls separate {@code position} from every goal.
     */
    public boolean isWalledOff(Position position) {
        return nearestGoalDistance(position) == UNREACHABLE;
    }

    public int getGoalCount() {
        return distances.length;
    }

    private static int[] distancesFrom(Position goal, PuzzleStatic puzzle) {
        int[] distances = new int[puzzle.getCellCount()];
        Arrays.fill(distances, UNREACHABLE);
        ArrayDeque<Position> queue = new ArrayDeque<>();
        distances[puzzle.index(goal)] = 0;
        queue.add(goal);
        while (!queue.isEmpty()) {
            Position current = queue.poll();
            int next = distances[puzzle.index(current)] + 1;
            for (Direction direction : Direction.values()) {
                Position neighbour = current.step(direction);
                if (!puzzle.isWalkable(neighbour)) {
                    continue;
                }
                int cell = puzzle.index(neighbour);
                if (distances[cell] <= next) {
                    continue;
                }
                distances[cell] = next;
                queue.add(neighbour);
            }
        }
        return distances;
    }
}
