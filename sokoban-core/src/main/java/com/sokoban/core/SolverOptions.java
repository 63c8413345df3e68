package com.sokoban.core;

import com.sokoban.core.ai.HeuristicType;
import com.sokoban.core.ai.SearchConstraints;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Command-line configuration shared by the solver and playback front-ends.
 *
 * @param puzzleFile   the puzzle file to read, or {@code null} when a preset is used
 * @param presetId     the bundled preset to solve, or {@code null} when a file is used
 * @param timeLimit    wall-clock budget
 * @param maxStates    expansion budget
 * @param heuristic    frontier-ordering estimate
 * @param verbose      print the puzzle and the move listing
 * @param delayMillis  pause between playback frames
 */
public record SolverOptions(Path puzzleFile, String presetId, Duration timeLimit, long maxStates,
        HeuristicType heuristic, boolean verbose, long delayMillis) {

    public static final long DEFAULT_DELAY_MILLIS = 300L;

    public SolverOptions {
        if ((puzzleFile == null) == (presetId == null)) {
            throw new IllegalArgumentException("Exactly one of a puzzle file or --preset must be given");
        }
        if (delayMillis < 0L) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
    }

    /**
     * Parses {@code <puzzleFile>|--preset=<id> [--timeout=<seconds>] [--max-states=<n>]
     * [--heuristic=goal|manhattan] [--verbose] [--delay=<millis>]}.
     *
     * @throws IllegalArgumentException for unknown options or malformed values
     */
    public static SolverOptions parse(String[] args) {
        Path puzzleFile = null;
        String presetId = null;
        Duration timeLimit = SearchConstraints.DEFAULT_TIME_LIMIT;
        long maxStates = SearchConstraints.DEFAULT_MAX_STATES;
        HeuristicType heuristic = HeuristicType.GOAL_DISTANCE;
        boolean verbose = false;
        long delayMillis = DEFAULT_DELAY_MILLIS;

        for (String option : args) {
            if (option.startsWith("--preset=")) {
                presetId = option.substring("--preset=".length());
            } else if (option.startsWith("--timeout=")) {
                timeLimit = SearchConstraints.secondsToDuration(parseNumber(option, "--timeout="));
            } else if (option.startsWith("--max-states=")) {
                maxStates = (long) parseNumber(option, "--max-states=");
            } else if (option.startsWith("--heuristic=")) {
                heuristic = HeuristicType.fromOptionName(option.substring("--heuristic=".length()));
            } else if (option.startsWith("--delay=")) {
                delayMillis = (long) parseNumber(option, "--delay=");
            } else if ("--verbose".equals(option) || "-v".equals(option)) {
                verbose = true;
            } else if (option.startsWith("-")) {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            } else if (puzzleFile == null) {
                puzzleFile = Paths.get(option);
            } else {
                throw new IllegalArgumentException("Puzzle file specified more than once: " + option);
            }
        }
        return new SolverOptions(puzzleFile, presetId, timeLimit, maxStates, heuristic, verbose, delayMillis);
    }

    public SearchConstraints toConstraints() {
        return new SearchConstraints(timeLimit, maxStates, heuristic);
    }

    /**
     * Returns a label for the puzzle source, used in console output.
     */
    public String sourceLabel() {
        return puzzleFile != null ? puzzleFile.toString() : "preset " + presetId;
    }

    /**
     * Reads the puzzle text from the file or the preset catalog.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the preset does not exist
     */
    public String loadPuzzleText() throws IOException {
        if (puzzleFile != null) {
            return Files.readString(puzzleFile, StandardCharsets.UTF_8);
        }
        return PuzzleCatalog.load().find(presetId)
                .map(PuzzleCatalog.Preset::puzzle)
                .orElseThrow(() -> new IllegalArgumentException("Unknown preset: " + presetId));
    }

    private static double parseNumber(String option, String prefix) {
        String value = option.substring(prefix.length());
        double parsed = Double.parseDouble(value);
        if (Double.isNaN(parsed) || parsed < 0.0) {
            throw new IllegalArgumentException(prefix.substring(0, prefix.length() - 1) + " must be non-negative: " + value);
        }
        return parsed;
    }
}
