package com.sokoban.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sokoban.core.ParsedPuzzle;
import com.sokoban.core.Position;
import com.sokoban.core.PuzzleParser;
import com.sokoban.core.PuzzleStatic;
import java.util.List;
import org.junit.jupiter.api.Test;

class GoalDistanceTableTest {

    private static final String SIMPLE = String.join("\n",
            "####",
            "#. #",
            "#$ #",
            "#@ #",
            "####");

    private static final String SPLIT = String.join("\n",
            "#######",
            "#  #  #",
            "#@$#. #",
            "#  #  #",
            "#######");

    @Test
    void measuresWalkingDistanceFromEachGoal() {
        GoalDistanceTable table = GoalDistanceTable.precompute(PuzzleParser.parse(SIMPLE).puzzle());

        assertEquals(1, table.getGoalCount());
        assertEquals(0, table.distance(new Position(1, 1), 0));
        assertEquals(1, table.distance(new Position(1, 2), 0));
        assertEquals(2, table.distance(new Position(1, 3), 0));
        assertEquals(3, table.distance(new Position(2, 3), 0));
        assertEquals(1, table.nearestGoalDistance(new Position(2, 1)));
    }

    @Test
    void wallsAndOutsideSquaresAreUnreachable() {
        GoalDistanceTable table = GoalDistanceTable.precompute(PuzzleParser.parse(SIMPLE).puzzle());

        assertEquals(GoalDistanceTable.UNREACHABLE, table.nearestGoalDistance(new Position(0, 0)));
        assertEquals(GoalDistanceTable.UNREACHABLE, table.nearestGoalDistance(new Position(-1, 2)));
        assertEquals(GoalDistanceTable.UNREACHABLE, table.distance(new Position(9, 9), 0));
        assertThrows(IllegalArgumentException.class, () -> table.distance(new Position(1, 1), 1));
    }

    @Test
    void detectsSquaresCutOffFromGoals() {
        GoalDistanceTable table = GoalDistanceTable.precompute(PuzzleParser.parse(SPLIT).puzzle());

        assertTrue(table.isWalledOff(new Position(2, 2)));
        assertFalse(table.isWalledOff(new Position(5, 3)));
    }

    @Test
    void heuristicsSumPerBoxDistances() {
        ParsedPuzzle parsed = PuzzleParser.parse(String.join("\n",
                "######",
                "#    #",
                "# $$ #",
                "# .. #",
                "# @  #",
                "######"));
        PuzzleStatic puzzle = parsed.puzzle();
        GoalDistanceTable table = GoalDistanceTable.precompute(puzzle);

        assertEquals(2, new GoalDistanceHeuristic(table).estimate(parsed.initialState().getBoxes()));
        assertEquals(2, new ManhattanHeuristic(puzzle.getGoals(), table).estimate(parsed.initialState().getBoxes()));
        assertEquals(0, new GoalDistanceHeuristic(table).estimate(puzzle.getGoals()));
        assertEquals(6, new ManhattanHeuristic(puzzle.getGoals(), table)
                .estimate(List.of(new Position(1, 1), new Position(4, 1))));
    }

    @Test
    void walledOffBoxMakesEstimateInfinite() {
        ParsedPuzzle parsed = PuzzleParser.parse(SPLIT);
        PuzzleStatic puzzle = parsed.puzzle();
        GoalDistanceTable table = GoalDistanceTable.precompute(puzzle);

        for (HeuristicType type : HeuristicType.values()) {
            assertEquals(Heuristic.INFINITE, type.create(puzzle, table).estimate(parsed.initialState().getBoxes()));
        }
    }

    @Test
    void heuristicTypesResolveFromOptionNames() {
        assertEquals(HeuristicType.GOAL_DISTANCE, HeuristicType.fromOptionName("goal"));
        assertEquals(HeuristicType.MANHATTAN, HeuristicType.fromOptionName(" Manhattan "));
        assertEquals(HeuristicType.GOAL_DISTANCE, HeuristicType.fromOptionName("goal_distance"));
        assertThrows(IllegalArgumentException.class, () -> HeuristicType.fromOptionName("euclid"));
    }
}
