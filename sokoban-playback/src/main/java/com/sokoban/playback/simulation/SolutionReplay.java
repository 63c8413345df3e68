package com.sokoban.playback.simulation;

import com.sokoban.core.Direction;
import com.sokoban.core.IllegalReplayException;
import com.sokoban.core.MoveGenerator;
import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Position;
import com.sokoban.core.Push;
import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;
import com.sokoban.playback.model.PlaybackFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Replays a solved puzzle push by push and publishes one {@link PlaybackFrame} per position.
 */
public final class SolutionReplay {

    private final ParsedPuzzle puzzle;
    private final List<Push> pushes;
    private final Consumer<PlaybackFrame> frameListener;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public SolutionReplay(ParsedPuzzle puzzle, List<Push> pushes, Consumer<PlaybackFrame> frameListener) {
        this.puzzle = Objects.requireNonNull(puzzle, "puzzle");
        this.pushes = List.copyOf(Objects.requireNonNull(pushes, "pushes"));
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    /**
     * Creates a replay of a {@code U}/{@code D}/{@code L}/{@code R} solution string. The boxes are
     * resolved up front with {@link MoveGenerator#replay}.
     *
     * @throws IllegalReplayException if the string cannot be replayed on {@code puzzle}
     */
    public static SolutionReplay ofSolution(ParsedPuzzle puzzle, String solution,
            Consumer<PlaybackFrame> frameListener) {
        Objects.requireNonNull(puzzle, "puzzle");
        List<Direction> directions = MoveGenerator.parseSolution(solution);
        List<State> states = MoveGenerator.replay(puzzle.initialState(), solution, puzzle.puzzle());
        List<Push> pushes = new ArrayList<>(directions.size());
        for (int i = 0; i < directions.size(); i++) {
            State next = states.get(i + 1);
            Position from = next.getPlayer();
            pushes.add(new Push(directions.get(i), from, from.step(directions.get(i)), next));
        }
        return new SolutionReplay(puzzle, pushes, frameListener);
    }

    /**
     * Requests cooperative cancellation; the replay stops before the next push.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the replay and returns every published frame, starting with the initial position.
     *
     * @throws IllegalReplayException if a push is not legal or the last position is not solved
     */
    public List<PlaybackFrame> run() {
        PuzzleStatic statics = puzzle.puzzle();
        State state = puzzle.initialState();
        int total = pushes.size();
        List<PlaybackFrame> frames = new ArrayList<>(total + 1);
        publish(frames, PlaybackFrame.initial(state, total, statics.isSolved(state)));

        for (int i = 0; i < total; i++) {
            if (isCancelled()) {
                return frames;
            }
            Push push = pushes.get(i);
            state = MoveGenerator.applyPush(state, push, statics);
            publish(frames, new PlaybackFrame(state, push, i + 1, total, statics.isSolved(state)));
        }

        if (!statics.isSolved(state)) {
            throw new IllegalReplayException("Replayed pushes do not solve the puzzle, last state " + state);
        }
        return frames;
    }

    private void publish(List<PlaybackFrame> frames, PlaybackFrame frame) {
        frames.add(frame);
        frameListener.accept(frame);
    }
}
