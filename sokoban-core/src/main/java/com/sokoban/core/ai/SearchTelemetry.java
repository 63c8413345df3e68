package com.sokoban.core.ai;

/**
 * Instrumentation data captured during a single {@link Searcher#search} call.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L, 0L, 0, 0L, 0L);

    private final long statesExplored;
    private final long successorsGenerated;
    private final long deadlockPrunes;
    private final long heuristicPrunes;
    private final long staleEntriesSkipped;
    private final int peakFrontierSize;
    private final long precomputeNanos;
    private final long searchNanos;

    public SearchTelemetry(long statesExplored, long successorsGenerated, long deadlockPrunes, long heuristicPrunes,
            long staleEntriesSkipped, int peakFrontierSize, long precomputeNanos, long searchNanos) {
        this.statesExplored = statesExplored;
        this.successorsGenerated = successorsGenerated;
        this.deadlockPrunes = deadlockPrunes;
        this.heuristicPrunes = heuristicPrunes;
        this.staleEntriesSkipped = staleEntriesSkipped;
        this.peakFrontierSize = peakFrontierSize;
        this.precomputeNanos = precomputeNanos;
        this.searchNanos = searchNanos;
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public long statesExplored() {
        return statesExplored;
    }

    public long successorsGenerated() {
        return successorsGenerated;
    }

    /** Successors dropped because a box landed on a deadlock square. */
    public long deadlockPrunes() {
        return deadlockPrunes;
    }

    /** Successors dropped because the heuristic proved them unsolvable. */
    public long heuristicPrunes() {
        return heuristicPrunes;
    }

    /** Frontier entries popped after their state had already been expanded. */
    public long staleEntriesSkipped() {
        return staleEntriesSkipped;
    }

    public int peakFrontierSize() {
        return peakFrontierSize;
    }

    public long precomputeNanos() {
        return precomputeNanos;
    }

    public long searchNanos() {
        return searchNanos;
    }

    public double precomputeMillis() {
        return precomputeNanos / 1_000_000.0;
    }

    public double searchMillis() {
        return searchNanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("SearchTelemetry[explored=%d, generated=%d, deadlockPrunes=%d, heuristicPrunes=%d, "
                + "stale=%d, peakFrontier=%d, precompute=%.2fms, search=%.2fms]", statesExplored,
                successorsGenerated, deadlockPrunes, heuristicPrunes, staleEntriesSkipped, peakFrontierSize,
                precomputeMillis(), searchMillis());
    }

    /**
     * Mutable counters owned by one running search.
     */
    static final class Recorder {

        long statesExplored;
        long successorsGenerated;
        long deadlockPrunes;
        long heuristicPrunes;
        long staleEntriesSkipped;
        int peakFrontierSize;
        long precomputeNanos;
        private final long startNanos;

        Recorder(long startNanos) {
            this.startNanos = startNanos;
        }

        void frontierSize(int size) {
            if (size > peakFrontierSize) {
                peakFrontierSize = size;
            }
        }

        SearchTelemetry snapshot(long nowNanos) {
            long searchNanos = Math.max(0L, nowNanos - startNanos - precomputeNanos);
            return new SearchTelemetry(statesExplored, successorsGenerated, deadlockPrunes, heuristicPrunes,
                    staleEntriesSkipped, peakFrontierSize, precomputeNanos, searchNanos);
        }
    }
}
