package com.sokoban.core;

import com.sokoban.core.ai.SokobanSolver;
import com.sokoban.core.ai.SolveResult;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point that solves one puzzle and prints the solution and search statistics.
 * Exits with status 1 when no solution is found.
 */
public final class SolverRunner {

    private static final Logger LOGGER = Logger.getLogger(SolverRunner.class.getName());

    private SolverRunner() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the solver for {@code args} and returns the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        SolverOptions options;
        try {
            options = SolverOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.FINE, "Failed to parse arguments", ex);
            err.println("Error: " + ex.getMessage());
            printUsage(err);
            return 1;
        }

        String puzzleText;
        try {
            puzzleText = options.loadPuzzleText();
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read puzzle " + options.sourceLabel(), ex);
            err.println("Error: Could not read '" + options.sourceLabel() + "'.");
            return 1;
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return 1;
        }

        out.println("Puzzle: " + options.sourceLabel());
        if (options.verbose()) {
            out.println("Puzzle contents:");
            out.println(puzzleText);
            out.println();
        }

        SolveResult result = new SokobanSolver().solve(puzzleText, options.toConstraints());
        printResult(result, options.verbose(), out);
        return result.success() ? 0 : 1;
    }

    /**
     * Prints the solution or the failure, followed by the search statistics.
     */
    public static void printResult(SolveResult result, boolean verbose, PrintStream out) {
        if (result.success()) {
            out.printf(Locale.ROOT, "Solution found in %d pushes!%n%n", result.length());
            out.printf(Locale.ROOT, "Solution: %s%n%n", result.solution());
            out.println("Statistics:");
            out.printf(Locale.ROOT, "  States explored: %,d%n", result.statesExplored());
            out.printf(Locale.ROOT, "  Time elapsed: %.2f seconds%n", result.timeElapsedSeconds());
            out.printf(Locale.ROOT, "  Solution length: %d pushes%n", result.length());
            out.println("  Optimality: Guaranteed (A*)");
            if (verbose) {
                out.println();
                out.println("Move sequence:");
                for (int i = 0; i < result.pushes().size(); i++) {
                    Direction direction = result.pushes().get(i).direction();
                    out.printf(Locale.ROOT, "  %d. %c (%s)%n", i + 1, direction.symbol(), direction.label());
                }
            }
            return;
        }

        out.println("No solution found.");
        out.println();
        out.println("Statistics:");
        out.printf(Locale.ROOT, "  States explored: %,d%n", result.statesExplored());
        out.printf(Locale.ROOT, "  Time elapsed: %.2f seconds%n", result.timeElapsedSeconds());
        out.println("  Termination reason: " + result.reason().code());
        if (result.error() != null) {
            out.println("  Error: " + result.error());
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: SolverRunner <puzzleFile>|--preset=<id> [--timeout=<seconds>] [--max-states=<n>] "
                + "[--heuristic=goal|manhattan] [--verbose]");
    }
}
