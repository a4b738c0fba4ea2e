package com.tictactoe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * State of a match: the grid, the run length needed to win and the number of
 * occupied squares.
 *
 * <p>The search engine shares one instance across its whole tree. Every
 * speculative {@link #place} must be undone by exactly one {@link #clear} before
 * the recursive call that issued it returns.
 */
public final class Position {
    private final Grid grid;
    private final int winLength;
    private int moveCount;

    public Position(int rows, int cols, int winLength) {
        this(new Grid(rows, cols), winLength);
    }

    /**
     * Starts from a copy of a pre-populated grid; the move counter is derived from
     * its occupied squares. Later changes to {@code grid} do not reach this position.
     */
    public Position(Grid grid, int winLength) {
        int longest = Math.max(grid.getRows(), grid.getCols());
        if (winLength < 1 || winLength > longest) {
            throw new IllegalArgumentException("win length must be in [1," + longest + "], got " + winLength);
        }
        this.grid = new Grid(grid);
        this.winLength = winLength;
        this.moveCount = grid.countOccupied();
    }

    public Position copy() {
        return new Position(grid, winLength);
    }

    public int getRows() {
        return grid.getRows();
    }

    public int getCols() {
        return grid.getCols();
    }

    public int getWinLength() {
        return winLength;
    }

    public int getMoveCount() {
        return moveCount;
    }

    public boolean isFull() {
        return moveCount == getRows() * getCols();
    }

    public boolean isInside(Coords c) {
        return grid.isInside(c);
    }

    public Square getSquare(int row, int col) {
        return grid.get(row, col);
    }

    public Square getSquare(Coords c) {
        return grid.get(c);
    }

    public boolean isEmpty(Coords c) {
        return grid.isEmpty(c.getRow(), c.getCol());
    }

    public boolean place(Coords c, PlayerId player) {
        if (!grid.set(c.getRow(), c.getCol(), player.getSquare())) {
            return false;
        }
        moveCount++;
        return true;
    }

    public void clear(Coords c) {
        if (grid.isEmpty(c.getRow(), c.getCol())) {
            return;
        }
        grid.reset(c.getRow(), c.getCol());
        moveCount--;
    }

    public List<Coords> emptyCells() {
        List<Coords> cells = new ArrayList<>(getRows() * getCols() - moveCount);
        for (int r = 0; r < getRows(); r++) {
            for (int c = 0; c < getCols(); c++) {
                if (grid.isEmpty(r, c)) {
                    cells.add(new Coords(r, c));
                }
            }
        }
        return cells;
    }

    public boolean isWinningMove(Coords c, PlayerId player) {
        Square mark = player.getSquare();
        for (Delta d : Delta.LINE_FAMILIES) {
            int run = 1 + countDirection(c, d, mark, true) + countDirection(c, d, mark, false);
            if (run >= winLength) {
                return true;
            }
        }
        return false;
    }

    private int countDirection(Coords from, Delta d, Square mark, boolean forward) {
        int n = 0;
        Coords t = forward ? from.plus(d) : from.minus(d);
        while (grid.isInside(t) && grid.get(t) == mark) {
            n++;
            t = forward ? t.plus(d) : t.minus(d);
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position)) {
            return false;
        }
        Position other = (Position) o;
        return winLength == other.winLength && moveCount == other.moveCount && grid.equals(other.grid);
    }

    @Override
    public int hashCode() {
        return 31 * grid.hashCode() + winLength;
    }
}
