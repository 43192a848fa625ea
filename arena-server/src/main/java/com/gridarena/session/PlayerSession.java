package com.gridarena.session;

import com.gridarena.protocol.Replies;

/**
 * A connection that has been given a player slot.
 *
 * Ties the slot index to the transport that took it, so a command or a
 * disconnect can tell whether the slot still belongs to this connection or
 * has since been freed and reused.
 */
public final class PlayerSession {

    private final int slotIndex;
    private final char symbol;
    private final Transport transport;

    public PlayerSession(int slotIndex, char symbol, Transport transport) {
        this.slotIndex = slotIndex;
        this.symbol = symbol;
        this.transport = transport;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public char getSymbol() {
        return symbol;
    }

    public Transport getTransport() {
        return transport;
    }

    /**
     * Sends one line to this player only. Never call while holding the game guard.
     */
    public boolean reply(String text) {
        return transport.send(Replies.line(text));
    }

    @Override
    public String toString() {
        return "PlayerSession{" +
                "symbol=" + symbol +
                ", transport=" + transport.describe() +
                '}';
    }
}
