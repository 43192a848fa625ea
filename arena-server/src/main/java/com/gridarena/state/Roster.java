package com.gridarena.state;

import com.gridarena.session.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * The table of player slots and the count of occupied ones.
 *
 * Holds no lock of its own: every method must be called with the
 * {@link GameState} guard held, which is what keeps the occupied count in
 * step with the per-slot flags.
 */
public class Roster {

    private static final Logger logger = LoggerFactory.getLogger(Roster.class);

    public static final int MAX_PLAYERS = 4;

    private final Arena arena;
    private final PlayerSlot[] slots;
    private int occupiedCount;

    public Roster(Arena arena) {
        this.arena = arena;
        this.slots = new PlayerSlot[MAX_PLAYERS];
        for (int i = 0; i < MAX_PLAYERS; i++) {
            slots[i] = new PlayerSlot(i, (char) ('A' + i));
        }
    }

    /**
     * Returns the lowest free slot index, or -1 if every slot is taken.
     */
    public int findFreeSlot() {
        for (int i = 0; i < MAX_PLAYERS; i++) {
            if (!slots[i].isOccupied()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * True if no occupied slot other than {@code excludingSlot} stands on the cell.
     * Pass -1 to check against every slot.
     */
    public boolean isCellFree(Cell cell, int excludingSlot) {
        for (PlayerSlot slot : slots) {
            if (slot.getIndex() != excludingSlot && slot.isOccupied() && slot.getPosition().equals(cell)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Puts a new player into a free slot at a random open cell with full health.
     *
     * Placement redraws until it lands on a cell that is neither an obstacle
     * nor taken. At most 5 obstacles and 3 other players cover 8 of the 25
     * cells, so an open cell always exists.
     *
     * @throws IllegalStateException if the slot is already occupied
     */
    public PlayerSlot occupy(int index, Transport transport, Random random) {
        PlayerSlot slot = getSlot(index);
        if (slot.isOccupied()) {
            throw new IllegalStateException("Slot " + slot.getSymbol() + " is already occupied");
        }

        Cell position;
        do {
            position = Cell.of(random.nextInt(Arena.GRID_SIZE), random.nextInt(Arena.GRID_SIZE));
        } while (arena.isObstacle(position) || !isCellFree(position, index));

        slot.occupy(transport, position);
        occupiedCount++;
        return slot;
    }

    /**
     * Frees a slot and closes its transport.
     *
     * Idempotent: freeing a slot that is already free changes nothing, so the
     * quit, disconnect, death and failed-delivery paths can all call this
     * without double-counting. The slot is marked free before the transport
     * is closed, so a close callback that re-enters the roster sees it free.
     *
     * @return true if the slot was occupied
     */
    public boolean free(int index) {
        PlayerSlot slot = getSlot(index);
        boolean wasOccupied = slot.isOccupied();
        Transport transport = slot.release();
        if (wasOccupied) {
            occupiedCount--;
            logger.debug("Slot {} freed ({} occupied)", slot.getSymbol(), occupiedCount);
        }
        if (transport != null) {
            transport.close();
        }
        return wasOccupied;
    }

    /**
     * True if the slot is occupied by this exact connection. A slot freed and
     * then taken by a new connection is no longer held by the old one.
     */
    public boolean isHeldBy(int index, Transport transport) {
        PlayerSlot slot = getSlot(index);
        return slot.isOccupied() && slot.getTransport() == transport;
    }

    public int countOccupied() {
        return occupiedCount;
    }

    public PlayerSlot getSlot(int index) {
        if (index < 0 || index >= MAX_PLAYERS) {
            throw new IllegalArgumentException("No such slot: " + index);
        }
        return slots[index];
    }

    /**
     * Returns the occupied slots in ascending index order.
     */
    public List<PlayerSlot> occupiedSlots() {
        List<PlayerSlot> result = new ArrayList<>(MAX_PLAYERS);
        for (PlayerSlot slot : slots) {
            if (slot.isOccupied()) {
                result.add(slot);
            }
        }
        return result;
    }

    /**
     * Returns the occupied slot standing on the cell, or null.
     */
    public PlayerSlot slotAt(Cell cell) {
        for (PlayerSlot slot : slots) {
            if (slot.isOccupied() && slot.getPosition().equals(cell)) {
                return slot;
            }
        }
        return null;
    }
}
