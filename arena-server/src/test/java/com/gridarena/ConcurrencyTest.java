package com.gridarena;

import com.gridarena.engine.Broadcaster;
import com.gridarena.engine.CommandProcessor;
import com.gridarena.engine.CommandResult;
import com.gridarena.session.PlayerSession;
import com.gridarena.session.SessionLifecycle;
import com.gridarena.state.Arena;
import com.gridarena.state.Cell;
import com.gridarena.state.GameState;
import com.gridarena.state.PlayerSlot;
import com.gridarena.state.Roster;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the shared-state guard under concurrent sessions:
 * - Invariants hold at every point another thread can observe
 * - Snapshots always describe one complete state
 * - No deadlock between sessions broadcasting to each other
 */
@DisplayName("Concurrency Tests")
class ConcurrencyTest {

    private static final String[] COMMANDS = {
            "MOVE UP", "MOVE DOWN", "MOVE LEFT", "MOVE RIGHT", "ATTACK", "ATTACK", "MOVE", "JUMP"
    };

    private GameState game;
    private SessionLifecycle lifecycle;
    private CommandProcessor processor;

    @BeforeEach
    void setUp() {
        game = GameState.create(new Random(2024));
        Broadcaster broadcaster = new Broadcaster(game);
        lifecycle = new SessionLifecycle(game, broadcaster);
        processor = new CommandProcessor(game, broadcaster);
    }

    /**
     * Checks every roster invariant. Caller holds the guard.
     */
    private void assertInvariants() {
        Roster roster = game.getRoster();
        Arena arena = game.getArena();
        Set<Cell> positions = new HashSet<>();
        int occupied = 0;

        for (int i = 0; i < Roster.MAX_PLAYERS; i++) {
            PlayerSlot slot = roster.getSlot(i);
            if (!slot.isOccupied()) {
                assertNull(slot.getTransport(), "Free slot still holds a transport");
                continue;
            }
            occupied++;
            assertTrue(Arena.isInBounds(slot.getPosition()), "Out of bounds: " + slot);
            assertFalse(arena.isObstacle(slot.getPosition()), "On obstacle: " + slot);
            assertTrue(positions.add(slot.getPosition()), "Shared cell: " + slot);
            assertTrue(slot.getHealth() > 0 && slot.getHealth() <= PlayerSlot.MAX_HP, "Bad health: " + slot);
        }
        assertEquals(occupied, roster.countOccupied(), "Occupied count drifted");
    }

    /**
     * A snapshot is consistent when the grid shows exactly the players listed
     * beneath it, each at the listed position.
     */
    private static void assertSnapshotConsistent(String snapshot) {
        String[] lines = snapshot.split("\n");
        assertEquals("Grid:", lines[0]);
        Map<Character, String> onGrid = new HashMap<>();
        for (int r = 0; r < Arena.GRID_SIZE; r++) {
            String row = lines[1 + r];
            for (int c = 0; c < Arena.GRID_SIZE; c++) {
                char marker = row.charAt(c * 2);
                if (marker >= 'A' && marker <= 'D') {
                    onGrid.put(marker, "(" + r + "," + c + ")");
                }
            }
        }
        assertEquals("Players:", lines[1 + Arena.GRID_SIZE]);

        Map<Character, String> listed = new HashMap<>();
        for (int i = 2 + Arena.GRID_SIZE; i < lines.length; i++) {
            String line = lines[i];
            listed.put(line.charAt(0), line.substring(line.indexOf(" at ") + 4));
        }
        assertEquals(onGrid, listed, "Grid and player list disagree:\n" + snapshot);
    }

    // ==========================================
    // Test: Invariants Under Contention
    // ==========================================

    @Test
    @DisplayName("Invariants hold while four sessions act at once")
    void testInvariantsUnderContention() throws Exception {
        int threadCount = Roster.MAX_PLAYERS;
        int commandsPerThread = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount + 1);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threadCount);
        List<RecordingTransport> transports = new CopyOnWriteArrayList<>();
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger rejoins = new AtomicInteger();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            final int seed = t;
            executor.submit(() -> {
                Random random = new Random(seed);
                try {
                    startLatch.await();
                    PlayerSession session = null;
                    for (int i = 0; i < commandsPerThread; i++) {
                        if (session == null) {
                            RecordingTransport transport = new RecordingTransport("t" + seed + "-" + i);
                            transports.add(transport);
                            session = lifecycle.join(transport);
                            if (session == null) {
                                continue;
                            }
                            rejoins.incrementAndGet();
                        }
                        CommandResult result = processor.process(session, COMMANDS[random.nextInt(COMMANDS.length)]);
                        if (result.isApplied()) {
                            applied.incrementAndGet();
                        } else if (result.isTerminated()) {
                            session = null;
                        }
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    endLatch.countDown();
                }
            });
        }

        // Observer: inspects state between commands
        Future<?> observer = executor.submit(() -> {
            while (endLatch.getCount() > 0) {
                game.lock();
                try {
                    assertInvariants();
                } finally {
                    game.unlock();
                }
                Thread.yield();
            }
            return null;
        });

        startLatch.countDown();
        assertTrue(endLatch.await(60, TimeUnit.SECONDS), "Sessions should finish without deadlock");
        observer.get(10, TimeUnit.SECONDS);
        executor.shutdown();

        assertTrue(failures.isEmpty(), "Session threads failed: " + failures);

        game.lock();
        try {
            assertInvariants();
        } finally {
            game.unlock();
        }

        for (RecordingTransport transport : transports) {
            for (String snapshot : transport.snapshots()) {
                assertSnapshotConsistent(snapshot);
            }
        }

        System.out.println("✓ Concurrent sessions:");
        System.out.println("  Applied commands: " + applied.get());
        System.out.println("  Joins: " + rejoins.get());
    }

    // ==========================================
    // Test: Join/Leave Races
    // ==========================================

    @Test
    @DisplayName("Concurrent joins never exceed four players")
    void testConcurrentJoins() throws Exception {
        int connections = 20;
        ExecutorService executor = Executors.newFixedThreadPool(connections);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<PlayerSession>> results = new ArrayList<>();

        for (int i = 0; i < connections; i++) {
            final RecordingTransport transport = new RecordingTransport("c" + i);
            results.add(executor.submit(() -> {
                startLatch.await();
                return lifecycle.join(transport);
            }));
        }

        startLatch.countDown();
        int admitted = 0;
        Set<Character> symbols = new HashSet<>();
        for (Future<PlayerSession> result : results) {
            PlayerSession session = result.get(10, TimeUnit.SECONDS);
            if (session != null) {
                admitted++;
                symbols.add(session.getSymbol());
            }
        }
        executor.shutdown();

        assertEquals(Roster.MAX_PLAYERS, admitted);
        assertEquals(Set.of('A', 'B', 'C', 'D'), symbols);
        assertEquals(Roster.MAX_PLAYERS, Games.occupiedCount(game));
    }

    @Test
    @DisplayName("Quit and disconnect racing on one session free the slot once")
    void testQuitDisconnectRace() throws Exception {
        for (int round = 0; round < 200; round++) {
            RecordingTransport observerTransport = new RecordingTransport("observer");
            PlayerSession observer = lifecycle.join(observerTransport);
            PlayerSession racer = lifecycle.join(new RecordingTransport("racer"));

            CountDownLatch go = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            Future<?> quit = executor.submit(() -> {
                go.await();
                return processor.process(racer, "QUIT");
            });
            Future<?> leave = executor.submit(() -> {
                go.await();
                return lifecycle.leave(racer);
            });
            go.countDown();
            quit.get(5, TimeUnit.SECONDS);
            leave.get(5, TimeUnit.SECONDS);
            executor.shutdown();

            assertEquals(1, Games.occupiedCount(game), "Round " + round);
            lifecycle.leave(observer);
            assertEquals(0, Games.occupiedCount(game), "Round " + round);
        }
    }
}
