package com.sokoban.core.ai;

import com.sokoban.core.PuzzleStatic;
import java.util.Locale;

/**
 * Frontier-ordering estimates available to {@link AStarSearcher}. Both are admissible.
 */
public enum HeuristicType {
    GOAL_DISTANCE("goal"),
    MANHATTAN("manhattan");

    private final String optionName;

    HeuristicType(String optionName) {
        this.optionName = optionName;
    }

    public String optionName() {
        return optionName;
    }

    public Heuristic create(PuzzleStatic puzzle, GoalDistanceTable table) {
        switch (this) {
            case MANHATTAN:
                return new ManhattanHeuristic(puzzle.getGoals(), table);
            case GOAL_DISTANCE:
            default:
                return new GoalDistanceHeuristic(table);
        }
    }

    /**
     * Resolves a command-line option value such as {@code goal} or {@code manhattan}.
     */
    public static HeuristicType fromOptionName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (HeuristicType type : values()) {
            if (type.optionName.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown heuristic: " + name);
    }
}
