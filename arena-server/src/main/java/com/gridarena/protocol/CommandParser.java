package com.gridarena.protocol;

import java.util.Locale;

/**
 * Turns a line of client text into a {@link Command}.
 *
 * Keywords are case-insensitive and tokens are split on whitespace.
 * MOVE takes the first token after it as its direction and ignores the
 * rest. ATTACK and QUIT must stand alone on the line.
 *
 * A keyword must be a token of its own: a direction glued to it, as in
 * {@code MOVEUP}, is not a move and parses as an unknown command. Earlier
 * servers matched on the {@code MOVE} prefix and accepted that form.
 *
 * Stateless and thread-safe.
 */
public class CommandParser {

    public Command parse(String line) {
        if (line == null) {
            return Command.of(CommandType.UNKNOWN);
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Command.of(CommandType.UNKNOWN);
        }

        String[] tokens = trimmed.split("\\s+");
        String keyword = tokens[0].toUpperCase(Locale.ROOT);

        return switch (keyword) {
            case "MOVE" -> Command.move(tokens.length > 1 ? tokens[1] : null);
            case "ATTACK" -> standalone(CommandType.ATTACK, tokens);
            case "QUIT" -> standalone(CommandType.QUIT, tokens);
            default -> Command.of(CommandType.UNKNOWN);
        };
    }

    private static Command standalone(CommandType type, String[] tokens) {
        return Command.of(tokens.length == 1 ? type : CommandType.UNKNOWN);
    }
}
