package com.gridarena.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

/**
 * The fixed grid and its obstacles.
 *
 * Obstacles are placed once when the arena is built and never change, so
 * an Arena can be read from any thread. It is still read under the
 * {@link GameState} guard together with the roster, since the two are
 * evaluated as one unit.
 */
public class Arena {

    private static final Logger logger = LoggerFactory.getLogger(Arena.class);

    public static final int GRID_SIZE = 5;
    public static final int MIN_OBSTACLES = 3;
    public static final int MAX_OBSTACLES = 5;

    private final boolean[][] obstacles;
    private final Set<Cell> obstacleCells;

    private Arena(Set<Cell> obstacleCells) {
        this.obstacles = new boolean[GRID_SIZE][GRID_SIZE];
        for (Cell cell : obstacleCells) {
            obstacles[cell.getRow()][cell.getCol()] = true;
        }
        this.obstacleCells = Collections.unmodifiableSet(obstacleCells);
    }

    /**
     * Builds an arena with between {@value #MIN_OBSTACLES} and {@value #MAX_OBSTACLES}
     * obstacles at random cells. A cell drawn twice is re-rolled.
     */
    public static Arena random(Random random) {
        int count = MIN_OBSTACLES + random.nextInt(MAX_OBSTACLES - MIN_OBSTACLES + 1);
        Set<Cell> cells = new LinkedHashSet<>();
        while (cells.size() < count) {
            cells.add(Cell.of(random.nextInt(GRID_SIZE), random.nextInt(GRID_SIZE)));
        }
        logger.info("Arena initialized with {} obstacles at {}", count, cells);
        return new Arena(cells);
    }

    /**
     * Builds an arena with exactly the given obstacles.
     *
     * @throws IllegalArgumentException if any cell lies outside the grid
     */
    public static Arena withObstacles(Collection<Cell> cells) {
        Set<Cell> copy = new LinkedHashSet<>();
        for (Cell cell : cells) {
            if (!isInBounds(cell)) {
                throw new IllegalArgumentException("Obstacle outside the grid: " + cell);
            }
            copy.add(cell);
        }
        return new Arena(copy);
    }

    public static boolean isInBounds(Cell cell) {
        return cell.getRow() >= 0 && cell.getRow() < GRID_SIZE
                && cell.getCol() >= 0 && cell.getCol() < GRID_SIZE;
    }

    /**
     * True if the cell holds an obstacle. Cells outside the grid are not obstacles.
     */
    public boolean isObstacle(Cell cell) {
        return isInBounds(cell) && obstacles[cell.getRow()][cell.getCol()];
    }

    public Set<Cell> getObstacles() {
        return obstacleCells;
    }

    public int getObstacleCount() {
        return obstacleCells.size();
    }
}
