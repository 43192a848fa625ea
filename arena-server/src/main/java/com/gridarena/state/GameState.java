package com.gridarena.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The shared game: arena, roster and the guard that protects them.
 *
 * Thread Safety Strategy:
 * - One exclusive lock covers the arena and the roster as a single unit
 * - Every check-then-act sequence (join, move, attack, quit, disconnect)
 *   runs entirely inside lock()/unlock()
 * - Broadcasts run while the lock is held, so every snapshot shows the
 *   state left by one complete command
 *
 * The lock is reentrant so a transport whose close callback runs on the
 * calling thread can re-enter the leave path without deadlocking.
 *
 * One instance lives for the whole server run and is handed to every
 * session; there is no static game state.
 */
public class GameState {

    private static final Logger logger = LoggerFactory.getLogger(GameState.class);

    private final Arena arena;
    private final Roster roster;
    private final Random random;
    private final ReentrantLock guard;

    public GameState(Arena arena, Random random) {
        this.arena = arena;
        this.roster = new Roster(arena);
        this.random = random;
        this.guard = new ReentrantLock();
    }

    /**
     * Creates a game with a randomly generated arena.
     */
    public static GameState create(Random random) {
        return new GameState(Arena.random(random), random);
    }

    public static GameState create() {
        return create(new Random());
    }

    // === Guard ===

    /**
     * Blocks until this thread holds the guard. Always pair with
     * {@link #unlock()} in a finally block.
     */
    public void lock() {
        guard.lock();
    }

    public void unlock() {
        guard.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return guard.isHeldByCurrentThread();
    }

    /**
     * Fails fast when a caller touches shared state without the guard.
     *
     * @throws IllegalStateException if the current thread does not hold the guard
     */
    public void requireGuard() {
        if (!isHeldByCurrentThread()) {
            logger.error("Game state accessed without holding the guard");
            throw new IllegalStateException("Game state guard not held by " + Thread.currentThread().getName());
        }
    }

    // === State ===

    public Arena getArena() {
        return arena;
    }

    /**
     * The roster. Callers must hold the guard for every access.
     */
    public Roster getRoster() {
        return roster;
    }

    /**
     * Random source for spawn placement. Only used under the guard.
     */
    public Random getRandom() {
        return random;
    }
}
