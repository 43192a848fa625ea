package com.gridarena.protocol;

import java.util.Locale;

/**
 * The four directions a player can move in, with their row/column offsets.
 */
public enum Direction {
    UP(-1, 0),
    DOWN(1, 0),
    LEFT(0, -1),
    RIGHT(0, 1);

    private final int rowOffset;
    private final int colOffset;

    Direction(int rowOffset, int colOffset) {
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
    }

    public int getRowOffset() {
        return rowOffset;
    }

    public int getColOffset() {
        return colOffset;
    }

    /**
     * Parses a direction token, ignoring case.
     *
     * @return the direction, or null if the token names none
     */
    public static Direction parse(String token) {
        if (token == null) {
            return null;
        }
        try {
            return Direction.valueOf(token.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
