package com.sokoban.core;

import java.util.Objects;

/**
 * Renders a state back into the standard text format.
 */
public final class PuzzleRenderer {

    private PuzzleRenderer() {
    }

    /**
     * Returns the grid for {@code state} as newline-separated rows without a trailing newline.
     */
    public static String render(State state, PuzzleStatic puzzle) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(puzzle, "puzzle");
        char[][] grid = new char[puzzle.getHeight()][puzzle.getWidth()];
        for (int y = 0; y < puzzle.getHeight(); y++) {
            for (int x = 0; x < puzzle.getWidth(); x++) {
                Position position = new Position(x, y);
                if (puzzle.isWall(position)) {
                    grid[y][x] = PuzzleParser.WALL;
                } else if (puzzle.isGoal(position)) {
                    grid[y][x] = PuzzleParser.GOAL;
                } else {
                    grid[y][x] = PuzzleParser.FLOOR;
                }
            }
        }
        for (Position box : state.getBoxes()) {
            grid[box.y()][box.x()] = puzzle.isGoal(box) ? PuzzleParser.BOX_ON_GOAL : PuzzleParser.BOX;
        }
        Position player = state.getPlayer();
        grid[player.y()][player.x()] = puzzle.isGoal(player) ? PuzzleParser.PLAYER_ON_GOAL : PuzzleParser.PLAYER;

        StringBuilder text = new StringBuilder((puzzle.getWidth() + 1) * puzzle.getHeight());
        for (int y = 0; y < grid.length; y++) {
            if (y > 0) {
                text.append('\n');
            }
            text.append(grid[y]);
        }
        return text.toString();
    }
}
