package com.gridarena.engine;

import com.gridarena.protocol.Command;
import com.gridarena.protocol.CommandParser;
import com.gridarena.protocol.Direction;
import com.gridarena.protocol.Replies;
import com.gridarena.session.PlayerSession;
import com.gridarena.state.Arena;
import com.gridarena.state.Cell;
import com.gridarena.state.GameState;
import com.gridarena.state.PlayerSlot;
import com.gridarena.state.Roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies one line of player input to the shared game.
 *
 * Each command is validated and applied under the {@link GameState} guard,
 * and a snapshot is broadcast before the guard is released if anything
 * changed. Rejections come back as a {@link CommandResult} carrying the
 * reply text; the caller sends it once the guard is released.
 *
 * Thread-safe: one instance serves every session.
 */
public class CommandProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    public static final int DAMAGE = 20;

    private final GameState gameState;
    private final Broadcaster broadcaster;
    private final CommandParser parser;

    public CommandProcessor(GameState gameState, Broadcaster broadcaster) {
        this.gameState = gameState;
        this.broadcaster = broadcaster;
        this.parser = new CommandParser();
    }

    /**
     * Parses and applies a command from the given session.
     */
    public CommandResult process(PlayerSession session, String line) {
        Command command = parser.parse(line);
        logger.debug("Player {} sent {}", session.getSymbol(), command);

        return switch (command.getType()) {
            case MOVE -> handleMove(session, command);
            case ATTACK -> handleAttack(session);
            case QUIT -> handleQuit(session);
            default -> CommandResult.rejected(Replies.UNKNOWN_COMMAND);
        };
    }

    private CommandResult handleMove(PlayerSession session, Command command) {
        if (!command.hasArgument()) {
            return CommandResult.rejected(Replies.MOVE_USAGE);
        }
        Direction direction = Direction.parse(command.getArgument());
        if (direction == null) {
            return CommandResult.rejected(Replies.INVALID_DIRECTION);
        }

        gameState.lock();
        try {
            Roster roster = gameState.getRoster();
            if (!roster.isHeldBy(session.getSlotIndex(), session.getTransport())) {
                return CommandResult.terminated();
            }

            PlayerSlot slot = roster.getSlot(session.getSlotIndex());
            Cell target = slot.getPosition().offset(direction);

            if (!Arena.isInBounds(target)) {
                return CommandResult.rejected(Replies.OUT_OF_BOUNDS);
            }
            if (gameState.getArena().isObstacle(target)) {
                return CommandResult.rejected(Replies.OBSTACLE);
            }
            if (!roster.isCellFree(target, slot.getIndex())) {
                return CommandResult.rejected(Replies.CELL_OCCUPIED);
            }

            slot.moveTo(target);
            broadcaster.broadcast();
            return CommandResult.applied();
        } finally {
            gameState.unlock();
        }
    }

    private CommandResult handleAttack(PlayerSession session) {
        gameState.lock();
        try {
            Roster roster = gameState.getRoster();
            if (!roster.isHeldBy(session.getSlotIndex(), session.getTransport())) {
                return CommandResult.terminated();
            }

            PlayerSlot attacker = roster.getSlot(session.getSlotIndex());

            // Fix the target list before any damage so a death cannot change who else is hit
            List<PlayerSlot> targets = new ArrayList<>();
            for (PlayerSlot other : roster.occupiedSlots()) {
                if (other != attacker && attacker.getPosition().isAdjacentTo(other.getPosition())) {
                    targets.add(other);
                }
            }

            if (targets.isEmpty()) {
                return CommandResult.rejected(Replies.NO_TARGETS);
            }

            for (PlayerSlot target : targets) {
                if (target.takeDamage(DAMAGE)) {
                    logger.info("Player {} was defeated by player {}", target.getSymbol(), attacker.getSymbol());
                    roster.free(target.getIndex());
                }
            }

            broadcaster.broadcast();
            return CommandResult.applied();
        } finally {
            gameState.unlock();
        }
    }

    private CommandResult handleQuit(PlayerSession session) {
        gameState.lock();
        try {
            Roster roster = gameState.getRoster();
            if (roster.isHeldBy(session.getSlotIndex(), session.getTransport())) {
                roster.free(session.getSlotIndex());
                logger.info("Player {} quit", session.getSymbol());
                broadcaster.broadcast();
            }
            return CommandResult.terminated();
        } finally {
            gameState.unlock();
        }
    }
}
