package com.sokoban.core.deadlock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Position;
import com.sokoban.core.PuzzleParser;
import com.sokoban.core.State;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeadlockDetectorTest {

    private static final String CORNER = String.join("\n",
            "####",
            "#$ #",
            "#  #",
            "#@.#",
            "####");

    private static final String BLOCK = String.join("\n",
            "#######",
            "#     #",
            "# $$  #",
            "# $$  #",
            "#.... #",
            "#@    #",
            "#######");

    private static final String ROW_ON_WALL = String.join("\n",
            "########",
            "# $$$  #",
            "#      #",
            "#  ... #",
            "#@     #",
            "########");

    private static final String OPEN = String.join("\n",
            "######",
            "#    #",
            "# $  #",
            "#  . #",
            "#@   #",
            "######");

    @Test
    void standardDetectorRunsChecksInOrder() {
        List<DeadlockCheck> checks = DeadlockDetector.standard().getChecks();

        assertEquals(3, checks.size());
        assertSame(DeadlockSquareCheck.getInstance(), checks.get(0));
        assertSame(FreezeDeadlockCheck.getInstance(), checks.get(1));
        assertSame(SquareBlockDeadlockCheck.getInstance(), checks.get(2));
    }

    @Test
    void cornerBoxIsReportedByFirstMatchingCheck() {
        ParsedPuzzle parsed = PuzzleParser.parse(CORNER);

        DeadlockCheck check = DeadlockDetector.standard().findDeadlock(parsed.initialState(), parsed.puzzle())
                .orElseThrow();

        assertEquals("Deadlock square", check.getName());
        assertTrue(FreezeDeadlockCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
    }

    @Test
    void blockOfFourBoxesIsDeadlocked() {
        ParsedPuzzle parsed = PuzzleParser.parse(BLOCK);

        assertTrue(SquareBlockDeadlockCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertFalse(DeadlockSquareCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertFalse(FreezeDeadlockCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertEquals("2x2 block", DeadlockDetector.standard()
                .findDeadlock(parsed.initialState(), parsed.puzzle()).orElseThrow().getName());
    }

    @Test
    void blockOnGoalsIsNotDeadlocked() {
        ParsedPuzzle parsed = PuzzleParser.parse(String.join("\n",
                "######",
                "#    #",
                "# ** #",
                "# ** #",
                "#@   #",
                "######"));

        assertFalse(SquareBlockDeadlockCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertFalse(DeadlockDetector.standard().isDeadlocked(parsed.initialState(), parsed.puzzle()));
    }

    @Test
    void neighbouringBoxesFreezeBoxAgainstWall() {
        ParsedPuzzle parsed = PuzzleParser.parse(ROW_ON_WALL);
        State state = parsed.initialState();
        FreezeDeadlockCheck freeze = FreezeDeadlockCheck.getInstance();

        assertFalse(parsed.puzzle().isDeadlockSquare(new Position(3, 1)));
        assertTrue(freeze.isFrozen(new Position(3, 1), state, parsed.puzzle()));
        assertFalse(freeze.isFrozen(new Position(2, 1), state, parsed.puzzle()));
        assertTrue(freeze.isDeadlocked(state, parsed.puzzle()));
        assertFalse(DeadlockSquareCheck.getInstance().isDeadlocked(state, parsed.puzzle()));
        assertEquals("Freeze", DeadlockDetector.standard().findDeadlock(state, parsed.puzzle()).orElseThrow()
                .getName());
    }

    @Test
    void movingNeighbourAwayUnfreezesBox() {
        ParsedPuzzle parsed = PuzzleParser.parse(ROW_ON_WALL);
        State state = parsed.initialState().withPush(new Position(4, 1), new Position(4, 2));
        FreezeDeadlockCheck freeze = FreezeDeadlockCheck.getInstance();

        assertFalse(freeze.isFrozen(new Position(3, 1), state, parsed.puzzle()));
        assertFalse(freeze.isDeadlocked(state, parsed.puzzle()));
    }

    @Test
    void frozenBoxOnGoalIsIgnored() {
        ParsedPuzzle parsed = PuzzleParser.parse(String.join("\n",
                "#####",
                "#*  #",
                "#  @#",
                "#####"));

        assertTrue(FreezeDeadlockCheck.getInstance().isFrozen(new Position(1, 1), parsed.initialState(),
                parsed.puzzle()));
        assertFalse(FreezeDeadlockCheck.getInstance().isDeadlocked(parsed.initialState(), parsed.puzzle()));
    }

    @Test
    void openPositionPassesEveryCheck() {
        ParsedPuzzle parsed = PuzzleParser.parse(OPEN);

        assertFalse(DeadlockDetector.standard().isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertFalse(DeadlockDetector.standard().findDeadlock(parsed.initialState(), parsed.puzzle()).isPresent());
    }

    @Test
    void customDetectorUsesOnlyGivenChecks() {
        ParsedPuzzle parsed = PuzzleParser.parse(BLOCK);
        DeadlockDetector detector = new DeadlockDetector(List.of(DeadlockSquareCheck.getInstance()));

        assertFalse(detector.isDeadlocked(parsed.initialState(), parsed.puzzle()));
        assertFalse(new DeadlockDetector(List.of()).isDeadlocked(
                new State(new Position(1, 5), parsed.initialState().getBoxes()), parsed.puzzle()));
    }
}
