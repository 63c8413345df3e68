package com.sokoban.core.ai;

import com.sokoban.core.MoveGenerator;
import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Push;
import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Best-first (A*) search over push states with time and state budgets.
 *
 * <p>Every push costs one, the estimate is admissible, and the frontier is ordered by
 * {@code f = g + h} with ties broken by insertion order, so the returned solution has the minimum
 * number of pushes and is the same on every run. Successors are pruned when a box lands on a
 * precomputed deadlock square or when the estimate proves them unsolvable.
 *
 * <p>Instances hold no per-search state and can be reused; each call owns its own frontier and tables.
 */
public final class AStarSearcher implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(AStarSearcher.class.getName());

    @Override
    public SolveResult search(ParsedPuzzle parsed, SearchConstraints constraints) {
        Objects.requireNonNull(parsed, "parsed");
        Objects.requireNonNull(constraints, "constraints");

        long searchStart = System.nanoTime();
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        SearchTelemetry.Recorder recorder = new SearchTelemetry.Recorder(searchStart);

        PuzzleStatic puzzle = parsed.puzzle();
        State initial = parsed.initialState();
        GoalDistanceTable table = GoalDistanceTable.precompute(puzzle);
        Heuristic heuristic = constraints.heuristic().create(puzzle, table);
        recorder.precomputeNanos = System.nanoTime() - searchStart;

        if (puzzle.isSolved(initial)) {
            return finish(SolveResult.solved("", List.of(), 0L, elapsedSince(searchStart), parsed,
                    recorder.snapshot(System.nanoTime())));
        }
        if (puzzle.hasBoxOnDeadlockSquare(initial)) {
            return finish(failure(FailureReason.UNSOLVABLE, "No solution exists: a box starts on a deadlock square",
                    parsed, recorder, searchStart));
        }
        int initialEstimate = heuristic.estimate(initial.getBoxes());
        if (initialEstimate == Heuristic.INFINITE) {
            return finish(failure(FailureReason.UNSOLVABLE, "No solution exists: a box is walled off from every goal",
                    parsed, recorder, searchStart));
        }

        PriorityQueue<SearchNode> frontier = new PriorityQueue<>();
        Set<State> finalized = new HashSet<>();
        Map<State, Integer> bestCost = new HashMap<>();
        long sequence = 0L;

        frontier.add(new SearchNode(initial, null, null, 0, initialEstimate, sequence++));
        bestCost.put(initial, 0);
        recorder.frontierSize(frontier.size());

        while (!frontier.isEmpty()) {
            if (timeLimitNanos != Long.MAX_VALUE && System.nanoTime() - searchStart > timeLimitNanos) {
                return finish(failure(FailureReason.TIMEOUT, "Search terminated: timeout reached", parsed, recorder,
                        searchStart));
            }
            if (recorder.statesExplored >= constraints.maxStates()) {
                return finish(failure(FailureReason.TIMEOUT, "Search terminated: max states reached", parsed,
                        recorder, searchStart));
            }

            SearchNode current = frontier.poll();
            if (!finalized.add(current.state())) {
                recorder.staleEntriesSkipped++;
                continue;
            }
            recorder.statesExplored++;

            for (Push push : MoveGenerator.generateMoves(current.state(), puzzle)) {
                recorder.successorsGenerated++;
                State successor = push.result();
                if (finalized.contains(successor)) {
                    continue;
                }
                if (puzzle.hasBoxOnDeadlockSquare(successor)) {
                    recorder.deadlockPrunes++;
                    continue;
                }

                int cost = current.cost() + 1;
                if (puzzle.isSolved(successor)) {
                    List<Push> pushes = reconstruct(current, push);
                    return finish(SolveResult.solved(toSolutionString(pushes), pushes, recorder.statesExplored,
                            elapsedSince(searchStart), parsed, recorder.snapshot(System.nanoTime())));
                }

                Integer known = bestCost.get(successor);
                if (known != null && known <= cost) {
                    continue;
                }
                bestCost.put(successor, cost);
                int estimate = heuristic.estimate(successor.getBoxes());
                if (estimate == Heuristic.INFINITE) {
                    recorder.heuristicPrunes++;
                    continue;
                }
                frontier.add(new SearchNode(successor, current, push, cost, cost + estimate, sequence++));
                recorder.frontierSize(frontier.size());
            }
        }

        return finish(failure(FailureReason.UNSOLVABLE, "No solution exists", parsed, recorder, searchStart));
    }

    /**
     * Converts pushes into the {@code U}/{@code D}/{@code L}/{@code R} solution string.
     */
    public static String toSolutionString(List<Push> pushes) {
        StringBuilder solution = new StringBuilder(pushes.size());
        for (Push push : pushes) {
            solution.append(push.direction().symbol());
        }
        return solution.toString();
    }

    private static List<Push> reconstruct(SearchNode last, Push finalPush) {
        List<Push> pushes = new ArrayList<>(last.cost() + 1);
        pushes.add(finalPush);
        SearchNode node = last;
        while (node.push() != null) {
            pushes.add(node.push());
            node = node.parent();
        }
        Collections.reverse(pushes);
        return pushes;
    }

    private static SolveResult failure(FailureReason reason, String error, ParsedPuzzle parsed,
            SearchTelemetry.Recorder recorder, long searchStart) {
        return SolveResult.failed(reason, error, recorder.statesExplored, elapsedSince(searchStart), parsed,
                recorder.snapshot(System.nanoTime()));
    }

    private static SolveResult finish(SolveResult result) {
        LOGGER.info(() -> result.success()
                ? String.format("A* solved puzzle in %d pushes (explored=%d, elapsed=%.3fs)", result.length(),
                        result.statesExplored(), result.timeElapsedSeconds())
                : String.format("A* stopped: %s (explored=%d, elapsed=%.3fs)", result.reason(),
                        result.statesExplored(), result.timeElapsedSeconds()));
        return result;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static long toTimeLimitNanos(Duration timeLimit) {
        if (timeLimit.equals(SearchConstraints.NO_TIME_LIMIT)) {
            return Long.MAX_VALUE;
        }
        try {
            return timeLimit.toNanos();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Frontier entry; {@code priority} is {@code g + h}, {@code sequence} the insertion counter.
     */
    private record SearchNode(State state, SearchNode parent, Push push, int cost, int priority, long sequence)
            implements Comparable<SearchNode> {

        @Override
        public int compareTo(SearchNode other) {
            int byPriority = Integer.compare(priority, other.priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
