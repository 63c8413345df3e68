package com.sokoban.core;

/**
 * Immutable grid coordinate. {@code x} grows to the right, {@code y} grows downward, and
 * {@code (0, 0)} is the top-left cell of the puzzle.
 *
 * <p>Positions are ordered row-major (by {@code y}, then {@code x}) so that collections of positions
 * can be kept in a canonical order.
 */
public record Position(int x, int y) implements Comparable<Position> {

    /**
     * Returns the neighbouring position one step in {@code direction}.
     */
    public Position step(Direction direction) {
        return new Position(x + direction.dx(), y + direction.dy());
    }

    /**
     * Returns the neighbouring position one step against {@code direction}.
     */
    public Position stepBack(Direction direction) {
        return new Position(x - direction.dx(), y - direction.dy());
    }

    public int manhattanDistance(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public int compareTo(Position other) {
        int byRow = Integer.compare(y, other.y);
        return byRow != 0 ? byRow : Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
