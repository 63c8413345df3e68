package com.sokoban.playback.ui;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.PuzzleParser;
import com.sokoban.playback.model.PlaybackFrame;
import com.sokoban.playback.simulation.SolutionReplay;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class TerminalBoardViewTest {

    private static final ParsedPuzzle PUZZLE = PuzzleParser.parse(String.join("\n",
            "####",
            "#. #",
            "#$ #",
            "#@ #",
            "####"));

    @Test
    void headersNumberEachPush() {
        List<PlaybackFrame> frames = SolutionReplay.ofSolution(PUZZLE, "U", frame -> { }).run();

        assertEquals("Initial state:", TerminalBoardView.header(frames.get(0)));
        assertEquals("Move 1/1: U", TerminalBoardView.header(frames.get(1)));
    }

    @Test
    void drawsHeaderAndGrid() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        TerminalBoardView view = new TerminalBoardView(PUZZLE.puzzle(), new PrintStream(bytes, true,
                StandardCharsets.UTF_8), false);

        SolutionReplay.ofSolution(PUZZLE, "U", view::draw).run();

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Initial state:"));
        assertTrue(output.contains("#$ #"));
        assertTrue(output.contains("Move 1/1: U"));
        assertTrue(output.contains("#* #"));
        assertFalse(output.contains("\033[2J"));
    }

    @Test
    void clearsScreenBetweenFramesWhenAsked() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        TerminalBoardView view = new TerminalBoardView(PUZZLE.puzzle(), new PrintStream(bytes, true,
                StandardCharsets.UTF_8), true);

        SolutionReplay.ofSolution(PUZZLE, "U", view::draw).run();

        assertTrue(bytes.toString(StandardCharsets.UTF_8).contains("\033[H\033[2J"));
    }
}
