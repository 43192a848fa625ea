package com.gridarena.state;

import com.gridarena.protocol.Direction;

import java.util.Objects;

/**
 * A (row, col) coordinate on the arena grid.
 *
 * Immutable; moving produces a new Cell rather than changing this one.
 * A Cell may lie outside the grid (the target of a blocked move), so
 * bounds are checked by {@link Arena#isInBounds(Cell)}, not here.
 */
public final class Cell {

    private final int row;
    private final int col;

    public Cell(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static Cell of(int row, int col) {
        return new Cell(row, col);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Returns the neighbouring cell one step in the given direction.
     */
    public Cell offset(Direction direction) {
        return new Cell(row + direction.getRowOffset(), col + direction.getColOffset());
    }

    /**
     * True if the other cell is at Manhattan distance exactly 1.
     * Diagonal neighbours are not adjacent.
     */
    public boolean isAdjacentTo(Cell other) {
        int dr = Math.abs(other.row - row);
        int dc = Math.abs(other.col - col);
        return (dr == 1 && dc == 0) || (dr == 0 && dc == 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell cell = (Cell) o;
        return row == cell.row && col == cell.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
