package com.gridarena.engine;

import com.gridarena.session.Transport;
import com.gridarena.state.Arena;
import com.gridarena.state.Cell;
import com.gridarena.state.GameState;
import com.gridarena.state.PlayerSlot;
import com.gridarena.state.Roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders the full game state as text and sends it to every player.
 *
 * Both operations require the caller to already hold the {@link GameState}
 * guard. A player whose delivery fails is freed right there, still under
 * the guard, so no other command can observe a slot that was just written
 * to but is really gone. Its removal is not broadcast separately; the next
 * state change shows the smaller roster.
 */
public class Broadcaster {

    private static final Logger logger = LoggerFactory.getLogger(Broadcaster.class);

    static final char OBSTACLE = 'X';
    static final char EMPTY = '.';

    private final GameState gameState;

    public Broadcaster(GameState gameState) {
        this.gameState = gameState;
    }

    /**
     * Renders the grid, row by row, followed by one status line per player.
     *
     * <pre>
     * Grid:
     * . X . . .
     * . . A . .
     * ...
     * Players:
     * A: HP=100 at (1,2)
     * </pre>
     *
     * Every cell is followed by a single space.
     */
    public String renderSnapshot() {
        gameState.requireGuard();

        Arena arena = gameState.getArena();
        Roster roster = gameState.getRoster();

        StringBuilder sb = new StringBuilder(256);
        sb.append("Grid:\n");
        for (int r = 0; r < Arena.GRID_SIZE; r++) {
            for (int c = 0; c < Arena.GRID_SIZE; c++) {
                Cell cell = Cell.of(r, c);
                char marker = arena.isObstacle(cell) ? OBSTACLE : EMPTY;
                PlayerSlot occupant = roster.slotAt(cell);
                if (occupant != null) {
                    marker = occupant.getSymbol();
                }
                sb.append(marker).append(' ');
            }
            sb.append('\n');
        }

        sb.append("Players:\n");
        for (PlayerSlot slot : roster.occupiedSlots()) {
            sb.append(slot.getSymbol())
                    .append(": HP=").append(slot.getHealth())
                    .append(" at (").append(slot.getPosition().getRow())
                    .append(',').append(slot.getPosition().getCol())
                    .append(")\n");
        }
        return sb.toString();
    }

    /**
     * Sends the current snapshot to every occupied slot, freeing any slot
     * whose delivery fails.
     *
     * @return the number of players the snapshot reached
     */
    public int broadcast() {
        gameState.requireGuard();

        String snapshot = renderSnapshot();
        Roster roster = gameState.getRoster();
        List<PlayerSlot> recipients = roster.occupiedSlots();

        int delivered = 0;
        for (PlayerSlot slot : recipients) {
            // Freed by an earlier failure in this same pass
            if (!slot.isOccupied()) {
                continue;
            }
            Transport transport = slot.getTransport();
            if (transport != null && transport.send(snapshot)) {
                delivered++;
            } else {
                logger.warn("Broadcast: delivery to player {} failed, removing player", slot.getSymbol());
                roster.free(slot.getIndex());
            }
        }

        logger.debug("Broadcast snapshot to {} of {} players", delivered, recipients.size());
        return delivered;
    }
}
