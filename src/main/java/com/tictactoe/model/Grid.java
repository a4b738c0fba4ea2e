package com.tictactoe.model;

import java.util.Arrays;

public final class Grid {
    private final int rows;
    private final int cols;
    private final Square[][] squares;

    public Grid(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("grid must be at least 1x1, got " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.squares = new Square[rows][cols];
        for (Square[] line : squares) {
            Arrays.fill(line, Square.EMPTY);
        }
    }

    public Grid(Grid other) {
        this.rows = other.rows;
        this.cols = other.cols;
        this.squares = new Square[rows][];
        for (int r = 0; r < rows; r++) {
            this.squares[r] = other.squares[r].clone();
        }
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public boolean isInside(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public boolean isInside(Coords c) {
        return isInside(c.getRow(), c.getCol());
    }

    public Square get(int row, int col) {
        checkIndex(row, col);
        return squares[row][col];
    }

    public Square get(Coords c) {
        return get(c.getRow(), c.getCol());
    }

    public boolean isEmpty(int row, int col) {
        return get(row, col) == Square.EMPTY;
    }

    /**
     * Occupies an empty square.
     *
     * @return false, leaving the grid untouched, when the square is already occupied
     */
    public boolean set(int row, int col, Square value) {
        checkIndex(row, col);
        if (squares[row][col] != Square.EMPTY) {
            return false;
        }
        squares[row][col] = value;
        return true;
    }

    public void reset(int row, int col) {
        checkIndex(row, col);
        squares[row][col] = Square.EMPTY;
    }

    public int countOccupied() {
        int n = 0;
        for (Square[] line : squares) {
            for (Square s : line) {
                if (s != Square.EMPTY) {
                    n++;
                }
            }
        }
        return n;
    }

    private void checkIndex(int row, int col) {
        if (!isInside(row, col)) {
            throw new IndexOutOfBoundsException(
                "square {" + row + "," + col + "} outside " + rows + "x" + cols + " grid");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Grid)) {
            return false;
        }
        Grid other = (Grid) o;
        return rows == other.rows && cols == other.cols && Arrays.deepEquals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(squares);
    }
}
