package com.sokoban.playback.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sokoban.core.Direction;
import com.sokoban.core.IllegalReplayException;
import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Position;
import com.sokoban.core.PuzzleCatalog;
import com.sokoban.core.PuzzleParser;
import com.sokoban.core.ai.SokobanSolver;
import com.sokoban.core.ai.SolveResult;
import com.sokoban.playback.model.PlaybackFrame;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SolutionReplayTest {

    private static final ParsedPuzzle TWO_PUSHES = PuzzleParser.parse(String.join("\n",
            "#####",
            "#.  #",
            "#   #",
            "#$  #",
            "#@  #",
            "#####"));

    private static final String BOX_ALREADY_ON_GOAL = String.join("\n",
            "#######",
            "#     #",
            "# * $ #",
            "#   . #",
            "#@    #",
            "#######");

    @Test
    void publishesOneFramePerPush() {
        List<PlaybackFrame> published = new ArrayList<>();

        List<PlaybackFrame> frames = SolutionReplay.ofSolution(TWO_PUSHES, "UU", published::add).run();

        assertEquals(frames, published);
        assertEquals(3, frames.size());
        assertNull(frames.get(0).lastPush());
        assertFalse(frames.get(0).solved());
        PlaybackFrame second = frames.get(1);
        assertEquals(1, second.pushNumber());
        assertEquals(2, second.totalPushes());
        assertEquals(Direction.UP, second.lastPush().direction());
        assertEquals(new Position(1, 3), second.lastPush().from());
        assertEquals(new Position(1, 2), second.lastPush().to());
        assertTrue(frames.get(2).solved());
        assertTrue(frames.get(2).isLast());
    }

    @Test
    void emptySolutionPublishesInitialFrameOnly() {
        ParsedPuzzle solved = PuzzleParser.parse("#####\n#@* #\n#####");

        List<PlaybackFrame> frames = SolutionReplay.ofSolution(solved, "", frame -> { }).run();

        assertEquals(1, frames.size());
        assertTrue(frames.get(0).solved());
        assertTrue(frames.get(0).isLast());
    }

    @Test
    void cancellationStopsBeforeNextPush() {
        List<PlaybackFrame> published = new ArrayList<>();
        SolutionReplay[] holder = new SolutionReplay[1];
        holder[0] = SolutionReplay.ofSolution(TWO_PUSHES, "UU", frame -> {
            published.add(frame);
            if (frame.pushNumber() == 1) {
                holder[0].cancel();
            }
        });

        holder[0].run();

        assertTrue(holder[0].isCancelled());
        assertEquals(2, published.size());
    }

    @Test
    void illegalPushIsRejected() {
        assertThrows(IllegalReplayException.class,
                () -> SolutionReplay.ofSolution(TWO_PUSHES, "UL", frame -> { }).run());
    }

    @Test
    void incompleteSolutionIsRejected() {
        SolutionReplay replay = SolutionReplay.ofSolution(TWO_PUSHES, "U", frame -> { });

        IllegalReplayException ex = assertThrows(IllegalReplayException.class, replay::run);
        assertTrue(ex.getMessage().startsWith("Replayed pushes do not solve the puzzle"));
    }

    @Test
    void unknownSymbolIsRejected() {
        assertThrows(IllegalReplayException.class,
                () -> SolutionReplay.ofSolution(TWO_PUSHES, "U?", frame -> { }).run());
    }

    @Test
    void solverPushesPickTheBoxTheSearchMoved() {
        SolveResult result = SokobanSolver.solvePuzzle(BOX_ALREADY_ON_GOAL);

        List<PlaybackFrame> frames = new SolutionReplay(result.puzzle(), result.pushes(), frame -> { }).run();

        assertEquals("D", result.solution());
        assertEquals(new Position(4, 2), frames.get(1).lastPush().from());
        assertTrue(frames.get(1).solved());
    }

    @Test
    void everyPresetPlaysBackToSolved() {
        for (PuzzleCatalog.Preset preset : PuzzleCatalog.load().list()) {
            SolveResult result = SokobanSolver.solvePuzzle(preset.puzzle());
            assertTrue(result.success(), preset.id());

            List<PlaybackFrame> fromPushes = new SolutionReplay(result.puzzle(), result.pushes(), frame -> { }).run();
            List<PlaybackFrame> fromString = SolutionReplay.ofSolution(result.puzzle(), result.solution(), frame -> { })
                    .run();

            assertTrue(fromPushes.get(fromPushes.size() - 1).solved(), preset.id());
            assertTrue(fromString.get(fromString.size() - 1).solved(), preset.id());
        }
    }
}
