package com.gridarena.session;

import com.gridarena.engine.Broadcaster;
import com.gridarena.protocol.Replies;
import com.gridarena.state.GameState;
import com.gridarena.state.PlayerSlot;
import com.gridarena.state.Roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves connections into and out of player slots.
 *
 * Thread Safety:
 * - Join and leave both run their roster changes and the resulting
 *   broadcast under the {@link GameState} guard
 * - Replies to the joining connection (welcome, server full) are sent
 *   after the guard is released
 *
 * Leave is idempotent with every other way a slot gets freed (quit,
 * death in combat, failed broadcast delivery): it only frees the slot if
 * the slot is still held by the leaving connection.
 */
public class SessionLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycle.class);

    private final GameState gameState;
    private final Broadcaster broadcaster;

    public SessionLifecycle(GameState gameState, Broadcaster broadcaster) {
        this.gameState = gameState;
        this.broadcaster = broadcaster;
    }

    /**
     * Gives a new connection a player slot and announces it.
     *
     * If the game is full the connection is told so and closed. A connection
 * that cannot receive its welcome is treated as gone and removed again.
     *
     * @param transport The newly accepted connection
     * @return the session for the new player, or null if the connection was turned away or lost
     */
    public PlayerSession join(Transport transport) {
        PlayerSession session;
        String refusal = null;

        gameState.lock();
        try {
            Roster roster = gameState.getRoster();
            if (roster.countOccupied() >= Roster.MAX_PLAYERS) {
                refusal = Replies.SERVER_FULL;
                session = null;
            } else {
                int index = roster.findFreeSlot();
                if (index < 0) {
                    logger.error("Occupied count is {} but no free slot was found", roster.countOccupied());
                    refusal = Replies.NO_SLOT;
                    session = null;
                } else {
                    PlayerSlot slot = roster.occupy(index, transport, gameState.getRandom());
                    session = new PlayerSession(index, slot.getSymbol(), transport);
                    logger.info("New player {} joined at position {} ({})",
                            slot.getSymbol(), slot.getPosition(), transport.describe());
                    broadcaster.broadcast();
                }
            }
        } finally {
            gameState.unlock();
        }

        if (session == null) {
            logger.info("Refused connection {}: {}", transport.describe(), refusal);
            transport.send(Replies.line(refusal));
            transport.close();
            return null;
        }

        if (!session.reply(Replies.welcome(session.getSymbol()))) {
            logger.warn("Welcome to player {} could not be delivered, removing player", session.getSymbol());
            leave(session);
            return null;
        }
        return session;
    }

    /**
     * Removes a session's player if it is still in the game, announces the
     * change, and closes the session's connection.
     *
     * @return true if this call freed the slot
     */
    public boolean leave(PlayerSession session) {
        boolean freed = false;

        gameState.lock();
        try {
            Roster roster = gameState.getRoster();
            if (roster.isHeldBy(session.getSlotIndex(), session.getTransport())) {
                roster.free(session.getSlotIndex());
                freed = true;
                broadcaster.broadcast();
            }
        } finally {
            gameState.unlock();
        }

        session.getTransport().close();
        logger.info("Player {} disconnected", session.getSymbol());
        return freed;
    }
}
