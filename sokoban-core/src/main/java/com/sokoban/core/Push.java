package com.sokoban.core;

import java.util.Objects;

/**
 * A single box push: the edge label of the search graph.
 *
 * @param direction the push direction
 * @param from      the square the box leaves (and the player ends on)
 * @param to        the square the box is pushed onto
 * @param result    the state after the push
 */
public record Push(Direction direction, Position from, Position to, State result) {

    public Push {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(result, "result");
    }
}
