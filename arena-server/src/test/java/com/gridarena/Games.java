package com.gridarena;

import com.gridarena.session.PlayerSession;
import com.gridarena.state.Arena;
import com.gridarena.state.Cell;
import com.gridarena.state.GameState;
import com.gridarena.state.PlayerSlot;
import com.gridarena.state.Roster;

import java.util.List;
import java.util.Random;

/**
 * Fixtures for building games with a known layout.
 */
final class Games {

    /**
     * Obstacles used by most tests:
     * <pre>
     * . . . . X
     * . . . . .
     * . . . . .
     * . . . X .
     * X . . . .
     * </pre>
     */
    static final List<Cell> OBSTACLES = List.of(Cell.of(0, 4), Cell.of(3, 3), Cell.of(4, 0));

    private Games() {
    }

    static GameState fixedGame() {
        return new GameState(Arena.withObstacles(OBSTACLES), new Random(42));
    }

    /**
     * Seats a player in the next free slot and moves it to the given cell,
     * without broadcasting.
     */
    static PlayerSession place(GameState game, RecordingTransport transport, Cell cell) {
        game.lock();
        try {
            Roster roster = game.getRoster();
            int index = roster.findFreeSlot();
            PlayerSlot slot = roster.occupy(index, transport, game.getRandom());
            slot.moveTo(cell);
            return new PlayerSession(index, slot.getSymbol(), transport);
        } finally {
            game.unlock();
        }
    }

    static PlayerSlot slot(GameState game, int index) {
        game.lock();
        try {
            return game.getRoster().getSlot(index);
        } finally {
            game.unlock();
        }
    }

    static int occupiedCount(GameState game) {
        game.lock();
        try {
            return game.getRoster().countOccupied();
        } finally {
            game.unlock();
        }
    }
}
