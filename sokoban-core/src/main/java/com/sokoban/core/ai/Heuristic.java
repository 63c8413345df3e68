package com.sokoban.core.ai;

import com.sokoban.core.Position;
import java.util.Collection;

/**
 * Lower bound on the number of pushes still needed to solve a box configuration.
 * Implementations must be admissible so that A* returns push-optimal solutions.
 */
public interface Heuristic {

    /** Estimate for configurations that provably cannot be solved. */
    int INFINITE = Integer.MAX_VALUE;

    /**
     * Estimates the remaining pushes for {@code boxes}.
     *
     * @param boxes the current box positions
     * @return a non-negative lower bound, or {@link #INFINITE} if some box is walled off from every goal
     */
    int estimate(Collection<Position> boxes);
}
