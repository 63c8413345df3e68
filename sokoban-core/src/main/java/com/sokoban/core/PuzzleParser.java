package com.sokoban.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads the standard Sokoban text format.
 *
 * <pre>
 * #  wall            @  player           $  box
 * .  goal            +  player on goal   *  box on goal
 * </pre>
 *
 * Leading and trailing blank lines are dropped and every row is right-padded with floor to the
 * length of the longest row. Any other character is floor.
 */
public final class PuzzleParser {

    public static final char WALL = '#';
    public static final char PLAYER = '@';
    public static final char PLAYER_ON_GOAL = '+';
    public static final char BOX = '$';
    public static final char BOX_ON_GOAL = '*';
    public static final char GOAL = '.';
    public static final char FLOOR = ' ';

    private PuzzleParser() {
    }

    /**
     * Converts the puzzle text into a rectangular character grid. Returns an empty array for text
     * that contains only blank lines.
     */
    public static char[][] toGrid(String puzzleText) {
        Objects.requireNonNull(puzzleText, "puzzleText");
        List<String> lines = new ArrayList<>(Arrays.asList(puzzleText.split("\r?\n", -1)));
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }

        int width = 0;
        for (String line : lines) {
            width = Math.max(width, line.length());
        }

        char[][] grid = new char[lines.size()][width];
        for (int y = 0; y < lines.size(); y++) {
            String line = lines.get(y);
            Arrays.fill(grid[y], FLOOR);
            line.getChars(0, line.length(), grid[y], 0);
        }
        return grid;
    }

    /**
     * Parses the puzzle text and validates that it describes a puzzle that can be searched.
     *
     * @throws InvalidPuzzleException if the grid is empty, has no player or several players, has no
     *         boxes or no goals, or the box count differs from the goal count
     */
    public static ParsedPuzzle parse(String puzzleText) {
        char[][] grid = toGrid(puzzleText);
        if (grid.length == 0 || grid[0].length == 0) {
            throw new InvalidPuzzleException("Empty puzzle");
        }

        int height = grid.length;
        int width = grid[0].length;
        Position player = null;
        List<Position> boxes = new ArrayList<>();
        List<Position> goals = new ArrayList<>();
        List<Position> walls = new ArrayList<>();

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Position position = new Position(x, y);
                switch (grid[y][x]) {
                    case WALL:
                        walls.add(position);
                        break;
                    case PLAYER:
                        player = placePlayer(player, position);
                        break;
                    case PLAYER_ON_GOAL:
                        player = placePlayer(player, position);
                        goals.add(position);
                        break;
                    case BOX:
                        boxes.add(position);
                        break;
                    case BOX_ON_GOAL:
                        boxes.add(position);
                        goals.add(position);
                        break;
                    case GOAL:
                        goals.add(position);
                        break;
                    default:
                        break;
                }
            }
        }

        if (player == null) {
            throw new InvalidPuzzleException("No player found in puzzle");
        }
        if (boxes.isEmpty()) {
            throw new InvalidPuzzleException("No boxes found in puzzle");
        }
        if (goals.isEmpty()) {
            throw new InvalidPuzzleException("No goals found in puzzle");
        }
        if (boxes.size() != goals.size()) {
            throw new InvalidPuzzleException("Box count (" + boxes.size() + ") != goal count (" + goals.size() + ")");
        }

        PuzzleStatic puzzle = PuzzleStatic.create(walls, goals, width, height);
        return new ParsedPuzzle(puzzle, new State(player, boxes));
    }

    private static Position placePlayer(Position current, Position candidate) {
        if (current != null) {
            throw new InvalidPuzzleException("More than one player found in puzzle: " + current + " and " + candidate);
        }
        return candidate;
    }
}
