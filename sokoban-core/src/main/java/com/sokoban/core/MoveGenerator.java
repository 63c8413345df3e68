package com.sokoban.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Player reachability and box-push enumeration.
 */
public final class MoveGenerator {

    private MoveGenerator() {
    }

    /**
     * Returns every square the player can walk to from {@code player} without pushing, treating walls
     * and boxes as obstacles. The start square is always included.
     */
    public static Set<Position> reachable(Position player, Collection<Position> boxes, PuzzleStatic puzzle) {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(boxes, "boxes");
        Objects.requireNonNull(puzzle, "puzzle");
        boolean[] blocked = new boolean[puzzle.getCellCount()];
        for (Position box : boxes) {
            if (puzzle.isInside(box)) {
                blocked[puzzle.index(box)] = true;
            }
        }
        boolean[] visited = flood(player, blocked, puzzle);
        Set<Position> result = new LinkedHashSet<>();
        result.add(player);
        for (int cell = 0; cell < visited.length; cell++) {
            if (visited[cell]) {
                result.add(puzzle.positionAt(cell));
            }
        }
        return result;
    }

    public static Set<Position> reachable(State state, PuzzleStatic puzzle) {
        return reachable(state.getPlayer(), state.getBoxes(), puzzle);
    }

    /**
     * Enumerates all legal pushes from {@code state}. Boxes are visited in ascending position order
     * and directions in {@link Direction} declaration order, so the result is deterministic.
     */
    public static List<Push> generateMoves(State state, PuzzleStatic puzzle) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(puzzle, "puzzle");
        boolean[] reachable = reachableCells(state, puzzle);
        List<Push> pushes = new ArrayList<>();
        for (Position box : state.getBoxes()) {
            for (Direction direction : Direction.values()) {
                Position target = box.step(direction);
                if (canPush(state, puzzle, reachable, box, direction, target)) {
                    pushes.add(new Push(direction, box, target, state.withPush(box, target)));
                }
            }
        }
        return pushes;
    }

    /**
     * Applies one push in {@code direction} while replaying a known solution. The first box, in
     * ascending position order, that can legally be pushed that way from the player's reachable area
     * is moved. Use {@link #applyMove(State, Direction, Position, PuzzleStatic)} when the box is known.
     *
     * @throws IllegalReplayException if no box can be pushed in {@code direction}
     */
    public static State applyMove(State state, Direction direction, PuzzleStatic puzzle) {
        List<State> candidates = candidates(state, direction, puzzle);
        if (candidates.isEmpty()) {
            throw new IllegalReplayException("No valid " + direction.symbol() + " push from " + state);
        }
        return candidates.get(0);
    }

    /**
     * Pushes the box on {@code box} one square in {@code direction}.
     *
     * @throws IllegalReplayException if there is no box on {@code box} or the push is not legal
     */
    public static State applyMove(State state, Direction direction, Position box, PuzzleStatic puzzle) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(box, "box");
        Objects.requireNonNull(puzzle, "puzzle");
        if (!state.hasBox(box)) {
            throw new IllegalReplayException("No box at " + box + " in " + state);
        }
        Position target = box.step(direction);
        if (!canPush(state, puzzle, reachableCells(state, puzzle), box, direction, target)) {
            throw new IllegalReplayException("Box at " + box + " cannot be pushed " + direction.label() + " from "
                    + state);
        }
        return state.withPush(box, target);
    }

    public static State applyPush(State state, Push push, PuzzleStatic puzzle) {
        Objects.requireNonNull(push, "push");
        return applyMove(state, push.direction(), push.from(), puzzle);
    }

    /**
     * Replays a solution string and returns every visited state, starting with {@code initial}.
     * When several boxes can take a push, the box is chosen so that the remaining pushes stay legal
     * and, if possible, end with every box on a goal.
     *
     * @throws IllegalReplayException if the string contains a symbol other than {@code U}, {@code D},
     *         {@code L} or {@code R}, or no choice of boxes makes every push legal
     */
    public static List<State> replay(State initial, String solution, PuzzleStatic puzzle) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(puzzle, "puzzle");
        List<Direction> directions = parseSolution(solution);
        for (boolean requireSolved : new boolean[] {true, false}) {
            List<State> states = new ArrayList<>(directions.size() + 1);
            states.add(initial);
            if (extend(states, directions, puzzle, requireSolved, new HashSet<>())) {
                return states;
            }
        }
        // Reports the first illegal push on the greedy path.
        State current = initial;
        for (Direction direction : directions) {
            current = applyMove(current, direction, puzzle);
        }
        throw new IllegalReplayException("Solution \"" + solution + "\" cannot be replayed from " + initial);
    }

    /**
     * Converts a {@code U}/{@code D}/{@code L}/{@code R} string into directions.
     *
     * @throws IllegalReplayException if the string contains any other symbol
     */
    public static List<Direction> parseSolution(String solution) {
        Objects.requireNonNull(solution, "solution");
        List<Direction> directions = new ArrayList<>(solution.length());
        for (int i = 0; i < solution.length(); i++) {
            try {
                directions.add(Direction.fromSymbol(solution.charAt(i)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalReplayException("Illegal move " + (i + 1) + " in solution \"" + solution + "\"", ex);
            }
        }
        return directions;
    }

    private static boolean extend(List<State> states, List<Direction> directions, PuzzleStatic puzzle,
            boolean requireSolved, Set<ReplayStep> deadEnds) {
        int step = states.size() - 1;
        State current = states.get(step);
        if (step == directions.size()) {
            return !requireSolved || puzzle.isSolved(current);
        }
        ReplayStep key = new ReplayStep(step, current);
        if (deadEnds.contains(key)) {
            return false;
        }
        for (State next : candidates(current, directions.get(step), puzzle)) {
            states.add(next);
            if (extend(states, directions, puzzle, requireSolved, deadEnds)) {
                return true;
            }
            states.remove(states.size() - 1);
        }
        deadEnds.add(key);
        return false;
    }

    private static List<State> candidates(State state, Direction direction, PuzzleStatic puzzle) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(puzzle, "puzzle");
        boolean[] reachable = reachableCells(state, puzzle);
        List<State> candidates = new ArrayList<>(1);
        for (Position box : state.getBoxes()) {
            Position target = box.step(direction);
            if (canPush(state, puzzle, reachable, box, direction, target)) {
                candidates.add(state.withPush(box, target));
            }
        }
        return candidates;
    }

    private record ReplayStep(int step, State state) {
    }

    private static boolean canPush(State state, PuzzleStatic puzzle, boolean[] reachable, Position box,
            Direction direction, Position target) {
        Position pushFrom = box.stepBack(direction);
        if (!puzzle.isInside(pushFrom) || !reachable[puzzle.index(pushFrom)]) {
            return false;
        }
        return puzzle.isWalkable(target) && !state.hasBox(target);
    }

    private static boolean[] reachableCells(State state, PuzzleStatic puzzle) {
        boolean[] blocked = new boolean[puzzle.getCellCount()];
        for (Position box : state.getBoxes()) {
            blocked[puzzle.index(box)] = true;
        }
        return flood(state.getPlayer(), blocked, puzzle);
    }

    private static boolean[] flood(Position start, boolean[] blocked, PuzzleStatic puzzle) {
        boolean[] visited = new boolean[puzzle.getCellCount()];
        if (!puzzle.isInside(start)) {
            return visited;
        }
        ArrayDeque<Position> queue = new ArrayDeque<>();
        visited[puzzle.index(start)] = true;
        queue.add(start);
        while (!queue.isEmpty()) {
            Position current = queue.poll();
            for (Direction direction : Direction.values()) {
                Position next = current.step(direction);
                if (!puzzle.isWalkable(next)) {
                    continue;
                }
                int cell = puzzle.index(next);
                if (blocked[cell] || visited[cell]) {
                    continue;
                }
                visited[cell] = true;
                queue.add(next);
            }
        }
        return visited;
    }
}
