package com.sokoban.core;

import com.sokoban.core.deadlock.StaticDeadlocks;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable puzzle facts that never change during a search: walls, goals, grid bounds and the
 * squares on which a box can never reach a goal.
 */
public final class PuzzleStatic {

    private final int width;
    private final int height;
    private final Set<Position> walls;
    private final List<Position> goals;
    private final Set<Position> deadlockSquares;
    private final boolean[] wallCells;
    private final boolean[] goalCells;
    private final boolean[] deadlockCells;

    /**
     * Creates the puzzle facts and precomputes its deadlock squares.
     */
    public static PuzzleStatic create(Collection<Position> walls, Collection<Position> goals, int width, int height) {
        Set<Position> deadlocks = StaticDeadlocks.compute(walls, goals, width, height);
        return new PuzzleStatic(walls, goals, width, height, deadlocks);
    }

    public PuzzleStatic(Collection<Position> walls, Collection<Position> goals, int width, int height,
            Collection<Position> deadlockSquares) {
        Objects.requireNonNull(walls, "walls");
        Objects.requireNonNull(goals, "goals");
        Objects.requireNonNull(deadlockSquares, "deadlockSquares");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.walls = Collections.unmodifiableSet(new TreeSet<>(walls));
        this.goals = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(goals)));
        this.deadlockSquares = Collections.unmodifiableSet(new TreeSet<>(deadlockSquares));
        this.wallCells = toCells(this.walls, "Wall");
        this.goalCells = toCells(this.goals, "Goal");
        this.deadlockCells = toCells(this.deadlockSquares, "Deadlock square");

        for (Position goal : this.goals) {
            if (wallCells[index(goal)]) {
                throw new IllegalArgumentException("Goal " + goal + " overlaps a wall");
            }
        }
        for (Position square : this.deadlockSquares) {
            if (wallCells[index(square)] || goalCells[index(square)]) {
                throw new IllegalArgumentException("Deadlock square " + square + " must be a non-wall, non-goal square");
            }
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Set<Position> getWalls() {
        return walls;
    }

    /**
     * Returns the goals in ascending position order; the list index is the goal index used by
     * distance tables.
     */
    public List<Position> getGoals() {
        return goals;
    }

    public int getGoalCount() {
        return goals.size();
    }

    public Set<Position> getDeadlockSquares() {
        return deadlockSquares;
    }

    public boolean isInside(Position position) {
        return position.x() >= 0 && position.x() < width && position.y() >= 0 && position.y() < height;
    }

    /**
     * Returns {@code true} if {@code position} is a wall. Positions outside the grid are not walls.
     */
    public boolean isWall(Position position) {
        return isInside(position) && wallCells[index(position)];
    }

    public boolean isGoal(Position position) {
        return isInside(position) && goalCells[index(position)];
    }

    public boolean isDeadlockSquare(Position position) {
        return isInside(position) && deadlockCells[index(position)];
    }

    /**
     * Returns {@code true} if {@code position} is inside the grid and not a wall.
     */
    public boolean isWalkable(Position position) {
        return isInside(position) && !wallCells[index(position)];
    }

    /**
     * Returns {@code true} if any box of {@code state} stands on a precomputed deadlock square.
     */
    public boolean hasBoxOnDeadlockSquare(State state) {
        for (Position box : state.getBoxes()) {
            if (isDeadlockSquare(box)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if the box set of {@code state} equals the goal set.
     */
    public boolean isSolved(State state) {
        return state.getBoxes().equals(goals);
    }

    /**
     * Returns the row-major cell index of an in-bounds position.
     */
    public int index(Position position) {
        return position.y() * width + position.x();
    }

    public Position positionAt(int index) {
        return new Position(index % width, index / width);
    }

    public int getCellCount() {
        return width * height;
    }

    private boolean[] toCells(Collection<Position> positions, String kind) {
        boolean[] cells = new boolean[width * height];
        for (Position position : positions) {
            if (!isInside(position)) {
                throw new IllegalArgumentException(kind + " " + position + " is outside the " + width + "x" + height + " grid");
            }
            cells[index(position)] = true;
        }
        return cells;
    }
}
