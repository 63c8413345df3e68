package com.sokoban.core.ai;

import com.sokoban.core.ParsedPuzzle;

/**
 * Generic interface for push-optimal puzzle search implementations.
 */
public interface Searcher {

    /**
     * Searches for a push-optimal solution of {@code puzzle} within the supplied budget.
     *
     * @param puzzle the parsed puzzle and its starting state
     * @param constraints the limits guiding the search execution
     * @return the result of the search; never {@code null}
     */
    SolveResult search(ParsedPuzzle puzzle, SearchConstraints constraints);
}
