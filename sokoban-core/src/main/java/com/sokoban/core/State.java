package com.sokoban.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dynamic search state: the player position and the box configuration.
 *
 * <p>Equality and hashing depend only on the player position and the set of boxes, so two states
 * reached through different push sequences collapse into one search node. Boxes are stored in
 * ascending {@link Position} order, which also fixes the enumeration order used by move generation.
 */
public final class State {

    private final Position player;
    private final List<Position> boxes;
    private final int hash;

    public State(Position player, Collection<Position> boxes) {
        this(Objects.requireNonNull(player, "player"), sortedCopy(boxes), true);
    }

    private State(Position player, List<Position> sortedBoxes, boolean ignored) {
        this.player = player;
        this.boxes = sortedBoxes;
        this.hash = 31 * player.hashCode() + sortedBoxes.hashCode();
    }

    public Position getPlayer() {
        return player;
    }

    /**
     * Returns the boxes in ascending position order. The list is unmodifiable.
     */
    public List<Position> getBoxes() {
        return boxes;
    }

    public int getBoxCount() {
        return boxes.size();
    }

    /**
     * Returns {@code true} if a box occupies {@code position}.
     */
    public boolean hasBox(Position position) {
        return Collections.binarySearch(boxes, position) >= 0;
    }

    /**
     * Returns the state that results from moving the box on {@code from} to {@code to}; the player
     * ends up on the square the box left.
     *
     * @throws IllegalArgumentException if there is no box on {@code from} or {@code to} is occupied
     */
    public State withPush(Position from, Position to) {
        int index = Collections.binarySearch(boxes, from);
        if (index < 0) {
            throw new IllegalArgumentException("No box at " + from);
        }
        if (hasBox(to)) {
            throw new IllegalArgumentException("Square " + to + " is already occupied by a box");
        }
        List<Position> updated = new ArrayList<>(boxes);
        updated.remove(index);
        int insertAt = -Collections.binarySearch(updated, to) - 1;
        updated.add(insertAt, to);
        return new State(from, Collections.unmodifiableList(updated), true);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof State)) {
            return false;
        }
        State other = (State) obj;
        return hash == other.hash && player.equals(other.player) && boxes.equals(other.boxes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "State(player=" + player + ", boxes=" + boxes + ")";
    }

    private static List<Position> sortedCopy(Collection<Position> boxes) {
        Objects.requireNonNull(boxes, "boxes");
        List<Position> sorted = new ArrayList<>(boxes.size());
        for (Position box : boxes) {
            sorted.add(Objects.requireNonNull(box, "box"));
        }
        Collections.sort(sorted);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).equals(sorted.get(i - 1))) {
                throw new IllegalArgumentException("Duplicate box at " + sorted.get(i));
            }
        }
        return Collections.unmodifiableList(sorted);
    }
}
