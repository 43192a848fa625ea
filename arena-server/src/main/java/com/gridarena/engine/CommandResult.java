package com.gridarena.engine;

/**
 * Outcome of processing one command line.
 *
 * APPLIED means shared state changed and a snapshot was broadcast.
 * REJECTED carries a reply for the issuing player only; nothing changed.
 * TERMINATED means the session is over and its connection should close.
 */
public final class CommandResult {

    public enum Status {
        APPLIED,
        REJECTED,
        TERMINATED
    }

    private static final CommandResult APPLIED = new CommandResult(Status.APPLIED, null);
    private static final CommandResult TERMINATED = new CommandResult(Status.TERMINATED, null);

    private final Status status;
    private final String reply;

    private CommandResult(Status status, String reply) {
        this.status = status;
        this.reply = reply;
    }

    public static CommandResult applied() {
        return APPLIED;
    }

    public static CommandResult rejected(String reply) {
        return new CommandResult(Status.REJECTED, reply);
    }

    public static CommandResult terminated() {
        return TERMINATED;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The text for the issuing player, or null when there is none.
     */
    public String getReply() {
        return reply;
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public boolean isTerminated() {
        return status == Status.TERMINATED;
    }

    @Override
    public String toString() {
        return reply == null ? status.name() : status + "(" + reply + ")";
    }
}
