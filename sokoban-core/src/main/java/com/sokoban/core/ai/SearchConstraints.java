package com.sokoban.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search budget passed to {@link Searcher} implementations.
 *
 * @param timeLimit wall-clock budget; {@link #NO_TIME_LIMIT} means unlimited, {@link Duration#ZERO} allows no
 *                  search at all
 * @param maxStates maximum number of expanded states
 * @param heuristic estimate used to order the frontier
 */
public record SearchConstraints(Duration timeLimit, long maxStates, HeuristicType heuristic) {

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(60);
    public static final long DEFAULT_MAX_STATES = 10_000_000L;
    public static final Duration NO_TIME_LIMIT = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999L);

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(heuristic, "heuristic");
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (maxStates < 0L) {
            throw new IllegalArgumentException("maxStates must not be negative");
        }
    }

    public SearchConstraints(Duration timeLimit, long maxStates) {
        this(timeLimit, maxStates, HeuristicType.GOAL_DISTANCE);
    }

    public static SearchConstraints defaults() {
        return new SearchConstraints(DEFAULT_TIME_LIMIT, DEFAULT_MAX_STATES);
    }

    /**
     * Converts a timeout in (possibly fractional) seconds into a {@link Duration}. An infinite timeout
     * maps to {@link #NO_TIME_LIMIT}; zero is a zero budget.
     */
    public static Duration secondsToDuration(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0.0) {
            throw new IllegalArgumentException("Timeout must be a non-negative number of seconds: " + seconds);
        }
        if (Double.isInfinite(seconds)) {
            return NO_TIME_LIMIT;
        }
        return Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000.0));
    }

    public SearchConstraints withHeuristic(HeuristicType type) {
        return new SearchConstraints(timeLimit, maxStates, type);
    }
}
