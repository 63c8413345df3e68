package com.sokoban.core.ai;

import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Push;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a solve attempt. Successful results carry a push-optimal solution; failed results carry
 * a {@link FailureReason} and a human readable error.
 *
 * @param success        {@code true} if a solution was found
 * @param solution       the pushes as a string over {@code U}, {@code D}, {@code L}, {@code R}; empty on failure
 * @param pushes         the pushes with the box each one moves; empty on failure
 * @param reason         the failure reason, or {@code null} on success
 * @param error          the failure message, or {@code null} on success
 * @param statesExplored number of expanded states
 * @param elapsed        wall-clock time of the attempt
 * @param optimal        {@code true} for every successful result
 * @param puzzle         the parsed puzzle, or {@code null} if parsing failed
 * @param telemetry      search counters
 */
public record SolveResult(
        boolean success,
        String solution,
        List<Push> pushes,
        FailureReason reason,
        String error,
        long statesExplored,
        Duration elapsed,
        boolean optimal,
        ParsedPuzzle puzzle,
        SearchTelemetry telemetry) {

    public SolveResult {
        solution = solution == null ? "" : solution;
        pushes = pushes == null ? List.of() : List.copyOf(pushes);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        if (success && reason != null) {
            throw new IllegalArgumentException("A successful result cannot carry a failure reason");
        }
        if (!success) {
            Objects.requireNonNull(reason, "reason");
        }
    }

    public static SolveResult solved(String solution, List<Push> pushes, long statesExplored, Duration elapsed,
            ParsedPuzzle puzzle, SearchTelemetry telemetry) {
        return new SolveResult(true, solution, pushes, null, null, statesExplored, elapsed, true, puzzle, telemetry);
    }

    public static SolveResult failed(FailureReason reason, String error, long statesExplored, Duration elapsed,
            ParsedPuzzle puzzle, SearchTelemetry telemetry) {
        return new SolveResult(false, "", List.of(), reason, error, statesExplored, elapsed, false, puzzle, telemetry);
    }

    /**
     * Returns the number of pushes in the solution.
     */
    public int length() {
        return solution.length();
    }

    public double timeElapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
}
