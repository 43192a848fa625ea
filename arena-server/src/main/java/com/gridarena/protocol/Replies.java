package com.gridarena.protocol;

/**
 * Fixed texts sent to a single client. Each goes out followed by
 * {@link #LINE_END}.
 */
public final class Replies {

    public static final String LINE_END = "\n";

    public static final String MOVE_USAGE = "Usage: MOVE <UP|DOWN|LEFT|RIGHT>";
    public static final String INVALID_DIRECTION = "Invalid direction. Use UP, DOWN, LEFT, or RIGHT.";
    public static final String OUT_OF_BOUNDS = "Move blocked: out of bounds.";
    public static final String OBSTACLE = "Move blocked: obstacle in the way.";
    public static final String CELL_OCCUPIED = "Move blocked: another player is in that cell.";
    public static final String NO_TARGETS = "No targets adjacent to attack.";
    public static final String UNKNOWN_COMMAND = "Unknown command. Available commands: MOVE, ATTACK, QUIT.";
    public static final String SERVER_FULL = "Server full. Try again later.";
    public static final String NO_SLOT = "Server error: no slot available.";

    private Replies() {
    }

    public static String welcome(char symbol) {
        return "Welcome to the game! You are player " + symbol + ".";
    }

    /**
     * Appends the line terminator.
     */
    public static String line(String text) {
        return text + LINE_END;
    }
}
