package com.sokoban.core.ai;

import com.sokoban.core.InvalidPuzzleException;
import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.PuzzleParser;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that solves a puzzle given as text. Problems with the puzzle never escape as exceptions;
 * they are reported through {@link SolveResult#reason()}.
 */
public final class SokobanSolver {

    private static final Logger LOGGER = Logger.getLogger(SokobanSolver.class.getName());

    private final Searcher searcher;

    public SokobanSolver() {
        this(new AStarSearcher());
    }

    public SokobanSolver(Searcher searcher) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
    }

    /**
     * Solves {@code puzzleText} with the default budget (60 seconds, 10 000 000 states).
     */
    public static SolveResult solvePuzzle(String puzzleText) {
        return new SokobanSolver().solve(puzzleText, SearchConstraints.defaults());
    }

    /**
     * Solves {@code puzzleText} within {@code timeoutSeconds} of wall-clock time and {@code maxStates}
     * expansions.
     *
     * @throws IllegalArgumentException if the timeout is negative or {@code maxStates} is negative
     */
    public static SolveResult solvePuzzle(String puzzleText, double timeoutSeconds, long maxStates) {
        SearchConstraints constraints = new SearchConstraints(SearchConstraints.secondsToDuration(timeoutSeconds),
                maxStates);
        return new SokobanSolver().solve(puzzleText, constraints);
    }

    public SolveResult solve(String puzzleText, SearchConstraints constraints) {
        Objects.requireNonNull(constraints, "constraints");
        long start = System.nanoTime();
        ParsedPuzzle parsed = null;
        try {
            parsed = PuzzleParser.parse(puzzleText == null ? "" : puzzleText);
            return searcher.search(parsed, constraints);
        } catch (InvalidPuzzleException ex) {
            LOGGER.fine(() -> "Rejected puzzle: " + ex.getMessage());
            return invalid(ex.getMessage(), parsed, start);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Unexpected failure while solving puzzle", ex);
            String message = ex.getMessage() != null ? ex.getMessage() : ex.toString();
            return invalid(message, parsed, start);
        }
    }

    private static SolveResult invalid(String message, ParsedPuzzle parsed, long start) {
        return SolveResult.failed(FailureReason.INVALID_PUZZLE, message, 0L,
                Duration.ofNanos(System.nanoTime() - start), parsed, SearchTelemetry.empty());
    }
}
