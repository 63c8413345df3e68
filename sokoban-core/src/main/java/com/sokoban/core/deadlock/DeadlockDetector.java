package com.sokoban.core.deadlock;

import com.sokoban.core.PuzzleStatic;
import com.sokoban.core.State;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a fixed sequence of {@link DeadlockCheck}s and reports a deadlock as soon as one of them does.
 *
 * The standard detector registers, cheapest first:
 * 1. DeadlockSquareCheck - a box on a precomputed corner square
 * 2. FreezeDeadlockCheck - a box off goal that cannot be pushed in any direction
 * 3. SquareBlockDeadlockCheck - four boxes filling a 2x2 block that is not all goals
 */
public final class DeadlockDetector {

    private static final DeadlockDetector STANDARD = new DeadlockDetector(List.of(
            DeadlockSquareCheck.getInstance(),
            FreezeDeadlockCheck.getInstance(),
            SquareBlockDeadlockCheck.getInstance()));

    private final List<DeadlockCheck> checks;

    public DeadlockDetector(List<DeadlockCheck> checks) {
        Objects.requireNonNull(checks, "checks");
        List<DeadlockCheck> copy = new ArrayList<>(checks.size());
        for (DeadlockCheck check : checks) {
            copy.add(Objects.requireNonNull(check, "check"));
        }
        this.checks = Collections.unmodifiableList(copy);
    }

    public static DeadlockDetector standard() {
        return STANDARD;
    }

    /**
     * Returns {@code true} if any registered check proves {@code state} unsolvable.
     */
    public boolean isDeadlocked(State state, PuzzleStatic puzzle) {
        return findDeadlock(state, puzzle).isPresent();
    }

    /**
     * Returns the first check that reports {@code state} as deadlocked, if any.
     */
    public Optional<DeadlockCheck> findDeadlock(State state, PuzzleStatic puzzle) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(puzzle, "puzzle");
        for (DeadlockCheck check : checks) {
            if (check.isDeadlocked(state, puzzle)) {
                return Optional.of(check);
            }
        }
        return Optional.empty();
    }

    public List<DeadlockCheck> getChecks() {
        return checks;
    }
}
