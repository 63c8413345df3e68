package com.sokoban.core;

/**
 * The four orthogonal push directions together with their solution-string symbols.
 * Declaration order is the enumeration order used by move generation.
 */
public enum Direction {
    UP('U', 0, -1, "Up"),
    DOWN('D', 0, 1, "Down"),
    LEFT('L', -1, 0, "Left"),
    RIGHT('R', 1, 0, "Right");

    private final char symbol;
    private final int dx;
    private final int dy;
    private final String label;

    Direction(char symbol, int dx, int dy, String label) {
        this.symbol = symbol;
        this.dx = dx;
        this.dy = dy;
        this.label = label;
    }

    public char symbol() {
        return symbol;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /**
     * Returns the human readable name, e.g. {@code "Up"}.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a solution-string symbol ({@code U}, {@code D}, {@code L} or {@code R}).
     *
     * @throws IllegalArgumentException if the symbol is not a push direction
     */
    public static Direction fromSymbol(char symbol) {
        for (Direction direction : values()) {
            if (direction.symbol == symbol) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Invalid direction symbol: '" + symbol + "'");
    }
}
