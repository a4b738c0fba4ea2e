package com.tictactoe.model;

public final class Coords {
    private final int row;
    private final int col;

    public Coords(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public Coords plus(Delta d) {
        return new Coords(row + d.getRowStep(), col + d.getColStep());
    }

    public Coords minus(Delta d) {
        return new Coords(row - d.getRowStep(), col - d.getColStep());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coords)) {
            return false;
        }
        Coords other = (Coords) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "{" + row + "," + col + "}";
    }
}
