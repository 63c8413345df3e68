package com.sokoban.core.deadlock;

import com.sokoban.core.Position;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Precomputes the squares on which a box is lost regardless of where the other boxes stand.
 * A non-goal square with walls on two orthogonal sides that meet at a right angle is a corner: every
 * push out of it needs the player on one of those walls.
 */
public final class StaticDeadlocks {

    private StaticDeadlocks() {
    }

    /**
     * Returns all non-wall, non-goal corner squares of the grid.
     */
    public static Set<Position> compute(Collection<Position> walls, Collection<Position> goals, int width, int height) {
        Set<Position> wallSet = new HashSet<>(walls);
        Set<Position> goalSet = new HashSet<>(goals);
        Set<Position> deadlocks = new TreeSet<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Position position = new Position(x, y);
                if (!wallSet.contains(position) && isCornerDeadlock(position, wallSet, goalSet)) {
                    deadlocks.add(position);
                }
            }
        }
        return Collections.unmodifiableSet(deadlocks);
    }

    /**
     * Returns {@code true} if {@code position} is not a goal and has a wall above or below it as well
     * as a wall to its left or right.
     */
    public static boolean isCornerDeadlock(Position position, Set<Position> walls, Set<Position> goals) {
        if (goals.contains(position)) {
            return false;
        }
        int x = position.x();
        int y = position.y();
        boolean top = walls.contains(new Position(x, y - 1));
        boolean bottom = walls.contains(new Position(x, y + 1));
        boolean left = walls.contains(new Position(x - 1, y));
        boolean right = walls.contains(new Position(x + 1, y));
        return (top || bottom) && (left || right);
    }
}
