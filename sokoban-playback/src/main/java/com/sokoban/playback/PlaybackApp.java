package com.sokoban.playback;

import com.sokoban.core.IllegalReplayException;
import com.sokoban.core.SolverOptions;
import com.sokoban.core.SolverRunner;
import com.sokoban.core.ai.SokobanSolver;
import com.sokoban.core.ai.SolveResult;
import com.sokoban.playback.model.PlaybackFrame;
import com.sokoban.playback.simulation.SolutionReplay;
import com.sokoban.playback.ui.TerminalBoardView;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves a puzzle and animates the solution in the terminal, one push per frame.
 */
public final class PlaybackApp {

    private static final Logger LOGGER = Logger.getLogger(PlaybackApp.class.getName());

    private PlaybackApp() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err, true);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs solve and playback for {@code args} and returns the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err, boolean clearScreen) {
        SolverOptions options;
        String puzzleText;
        try {
            options = SolverOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return 1;
        }
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
        out.println("Solving...");
        SolveResult result = new SokobanSolver().solve(puzzleText, options.toConstraints());
        SolverRunner.printResult(result, options.verbose(), out);
        if (!result.success()) {
            return 1;
        }
        if (options.verbose()) {
            out.println("Telemetry: " + result.telemetry());
        }

        out.println();
        TerminalBoardView view = new TerminalBoardView(result.puzzle().puzzle(), out, clearScreen);
        SolutionReplay replay = new SolutionReplay(result.puzzle(), result.pushes(),
                frame -> showFrame(view, frame, options.delayMillis()));
        List<PlaybackFrame> frames;
        try {
            frames = replay.run();
        } catch (IllegalReplayException ex) {
            LOGGER.log(Level.WARNING, "Replay of solution failed", ex);
            err.println("Error: " + ex.getMessage());
            return 1;
        } catch (PlaybackInterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("Playback interrupted.");
            return 1;
        }
        if (frames.get(frames.size() - 1).solved()) {
            out.println("Solution complete!");
        }
        return 0;
    }

    private static void showFrame(TerminalBoardView view, PlaybackFrame frame, long delayMillis) {
        view.draw(frame);
        if (delayMillis > 0 && !frame.isLast()) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException ex) {
                throw new PlaybackInterruptedException(ex);
            }
        }
    }

    private static final class PlaybackInterruptedException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        PlaybackInterruptedException(InterruptedException cause) {
            super(cause);
        }
    }
}
