package com.gridarena.state;

import com.gridarena.session.Transport;

/**
 * One of the fixed player slots in the {@link Roster}.
 *
 * The symbol is bound to the slot index for the life of the process; the
 * rest of the record is reset each time a new connection takes the slot.
 *
 * Not thread-safe. Slots are only read or written while the
 * {@link GameState} guard is held.
 */
public class PlayerSlot {

    public static final int MAX_HP = 100;

    private final int index;
    private final char symbol;

    private Cell position;
    private int health;
    private Transport transport;
    private boolean occupied;

    PlayerSlot(int index, char symbol) {
        this.index = index;
        this.symbol = symbol;
        this.position = Cell.of(0, 0);
    }

    public int getIndex() {
        return index;
    }

    public char getSymbol() {
        return symbol;
    }

    public Cell getPosition() {
        return position;
    }

    public int getHealth() {
        return health;
    }

    public Transport getTransport() {
        return transport;
    }

    public boolean isOccupied() {
        return occupied;
    }

    /**
     * Moves the player. Callers have already checked bounds, obstacles and
     * other players.
     */
    public void moveTo(Cell cell) {
        this.position = cell;
    }

    /**
     * Subtracts damage, clamping at zero.
     *
     * @return true if the player has no health left
     */
    public boolean takeDamage(int damage) {
        health = Math.max(0, health - damage);
        return health == 0;
    }

    void occupy(Transport transport, Cell position) {
        this.transport = transport;
        this.position = position;
        this.health = MAX_HP;
        this.occupied = true;
    }

    /**
     * Marks the slot free and hands back the transport it held, or null.
     */
    Transport release() {
        Transport previous = transport;
        this.transport = null;
        this.occupied = false;
        return previous;
    }

    @Override
    public String toString() {
        return "PlayerSlot{" +
                "symbol=" + symbol +
                ", position=" + position +
                ", health=" + health +
                ", occupied=" + occupied +
                '}';
    }
}
