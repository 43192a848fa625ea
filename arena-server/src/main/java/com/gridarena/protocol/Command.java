package com.gridarena.protocol;

/**
 * One parsed line of client input.
 *
 * Immutable. The argument is only set for MOVE, and holds the raw direction
 * token (possibly null when the client sent none).
 */
public final class Command {

    private final CommandType type;
    private final String argument;

    private Command(CommandType type, String argument) {
        this.type = type;
        this.argument = argument;
    }

    public static Command move(String direction) {
        return new Command(CommandType.MOVE, direction);
    }

    public static Command of(CommandType type) {
        return new Command(type, null);
    }

    public CommandType getType() {
        return type;
    }

    public String getArgument() {
        return argument;
    }

    public boolean hasArgument() {
        return argument != null;
    }

    @Override
    public String toString() {
        return argument == null ? type.name() : type + " " + argument;
    }
}
