package com.sokoban.playback.model;

import com.sokoban.core.Push;
import com.sokoban.core.State;
import java.util.Objects;

/**
 * Snapshot of a single position while a solution is replayed.
 *
 * @param state      the state after {@code lastPush}
 * @param lastPush   the push that produced {@code state}, or {@code null} for the initial frame
 * @param pushNumber number of pushes applied so far
 * @param totalPushes length of the replayed solution
 * @param solved     {@code true} if every box is on a goal
 */
public record PlaybackFrame(State state, Push lastPush, int pushNumber, int totalPushes, boolean solved) {

    public PlaybackFrame {
        Objects.requireNonNull(state, "state");
        if (pushNumber < 0 || pushNumber > totalPushes) {
            throw new IllegalArgumentException("Push number " + pushNumber + " outside 0.." + totalPushes);
        }
        if ((lastPush == null) != (pushNumber == 0)) {
            throw new IllegalArgumentException("Only the initial frame has no push");
        }
    }

    public static PlaybackFrame initial(State state, int totalPushes, boolean solved) {
        return new PlaybackFrame(state, null, 0, totalPushes, solved);
    }

    public boolean hasLastPush() {
        return lastPush != null;
    }

    public boolean isLast() {
        return pushNumber == totalPushes;
    }
}
