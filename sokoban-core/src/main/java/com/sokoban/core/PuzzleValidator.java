package com.sokoban.core;

import com.sokoban.core.ai.GoalDistanceTable;
import com.sokoban.core.deadlock.DeadlockCheck;
import com.sokoban.core.deadlock.DeadlockDetector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a puzzle text without solving it. Errors make the puzzle unusable; warnings describe
 * puzzles that parse but cannot be solved as given.
 */
public final class PuzzleValidator {

    private final DeadlockDetector deadlockDetector;

    public PuzzleValidator() {
        this(DeadlockDetector.standard());
    }

    public PuzzleValidator(DeadlockDetector deadlockDetector) {
        this.deadlockDetector = Objects.requireNonNull(deadlockDetector, "deadlockDetector");
    }

    /**
     * Validation outcome.
     *
     * @param valid    {@code true} if there are no errors
     * @param errors   blocking problems
     * @param warnings non-blocking observations
     */
    public record Report(boolean valid, List<String> errors, List<String> warnings) {

        public Report {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    public Report validate(String puzzleText) {
        Objects.requireNonNull(puzzleText, "puzzleText");
        char[][] grid = PuzzleParser.toGrid(puzzleText);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int players = 0;
        int boxes = 0;
        int goals = 0;
        for (char[] row : grid) {
            for (char cell : row) {
                if (cell == PuzzleParser.PLAYER || cell == PuzzleParser.PLAYER_ON_GOAL) {
                    players++;
                }
                if (cell == PuzzleParser.BOX || cell == PuzzleParser.BOX_ON_GOAL) {
                    boxes++;
                }
                if (cell == PuzzleParser.GOAL || cell == PuzzleParser.BOX_ON_GOAL || cell == PuzzleParser.PLAYER_ON_GOAL) {
                    goals++;
                }
            }
        }

        if (grid.length == 0) {
            errors.add("Puzzle is empty");
        }
        if (players == 0) {
            errors.add("Must have exactly one player (@)");
        } else if (players > 1) {
            errors.add("Can only have one player");
        }
        if (boxes == 0) {
            errors.add("Must have at least one box ($)");
        }
        if (goals == 0) {
            errors.add("Must have at least one goal (.)");
        }
        if (boxes != goals && boxes > 0 && goals > 0) {
            warnings.add("Box count (" + boxes + ") doesn't match goal count (" + goals + ")");
        }

        if (errors.isEmpty() && boxes == goals) {
            ParsedPuzzle parsed = PuzzleParser.parse(puzzleText);
            addSolvabilityWarnings(parsed, warnings);
        }
        return new Report(errors.isEmpty(), errors, warnings);
    }

    private void addSolvabilityWarnings(ParsedPuzzle parsed, List<String> warnings) {
        PuzzleStatic puzzle = parsed.puzzle();
        State initial = parsed.initialState();
        GoalDistanceTable table = GoalDistanceTable.precompute(puzzle);
        for (Position box : initial.getBoxes()) {
            if (table.isWalledOff(box)) {
                warnings.add("Box at " + box + " is walled off from every goal");
            }
        }
        Optional<DeadlockCheck> deadlock = deadlockDetector.findDeadlock(initial, puzzle);
        deadlock.ifPresent(check -> warnings.add("Initial position is deadlocked (" + check.getName() + ")"));
    }
}
