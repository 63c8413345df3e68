package com.sokoban.playback.ui;

import com.sokoban.core.PuzzleRenderer;
import com.sokoban.core.PuzzleStatic;
import com.sokoban.playback.model.PlaybackFrame;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Draws playback frames on a text terminal.
 */
public final class TerminalBoardView {

    private static final String CLEAR_SCREEN = "\033[H\033[2J";

    private final PuzzleStatic puzzle;
    private final PrintStream out;
    private final boolean clearBetweenFrames;

    public TerminalBoardView(PuzzleStatic puzzle, PrintStream out, boolean clearBetweenFrames) {
        this.puzzle = Objects.requireNonNull(puzzle, "puzzle");
        this.out = Objects.requireNonNull(out, "out");
        this.clearBetweenFrames = clearBetweenFrames;
    }

    /**
     * Returns the header line for {@code frame}, e.g. {@code "Move 2/5: U"}.
     */
    public static String header(PlaybackFrame frame) {
        if (!frame.hasLastPush()) {
            return "Initial state:";
        }
        return "Move " + frame.pushNumber() + "/" + frame.totalPushes() + ": " + frame.lastPush().direction().symbol();
    }

    public String render(PlaybackFrame frame) {
        return header(frame) + System.lineSeparator() + PuzzleRenderer.render(frame.state(), puzzle)
                + System.lineSeparator();
    }

    public void draw(PlaybackFrame frame) {
        if (clearBetweenFrames && frame.hasLastPush()) {
            out.print(CLEAR_SCREEN);
        }
        out.println(render(frame));
        out.flush();
    }
}
