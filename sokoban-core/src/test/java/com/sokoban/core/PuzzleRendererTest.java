package com.sokoban.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class PuzzleRendererTest {

    @Test
    void rendersInitialStateAsParsed() {
        String text = String.join("\n",
                "####",
                "#. #",
                "#$ #",
                "#@ #",
                "####");
        ParsedPuzzle parsed = PuzzleParser.parse(text);

        assertEquals(text, PuzzleRenderer.render(parsed.initialState(), parsed.puzzle()));
    }

    @Test
    void marksObjectsStandingOnGoals() {
        ParsedPuzzle parsed = PuzzleParser.parse(String.join("\n",
                "####",
                "#. #",
                "#$ #",
                "#@ #",
                "####"));
        State solved = MoveGenerator.applyMove(parsed.initialState(), Direction.UP, parsed.puzzle());

        assertEquals(String.join("\n",
                "####",
                "#* #",
                "#@ #",
                "#  #",
                "####"), PuzzleRenderer.render(solved, parsed.puzzle()));
    }

    @Test
    void rendersPlayerOnGoal() {
        String text = String.join("\n",
                "######",
                "#+$$.#",
                "######");
        ParsedPuzzle parsed = PuzzleParser.parse(text);

        assertEquals(text, PuzzleRenderer.render(parsed.initialState(), parsed.puzzle()));
    }
}
