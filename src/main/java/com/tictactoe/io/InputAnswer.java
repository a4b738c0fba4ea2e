package com.tictactoe.io;

/**
 * One attempt at reading a "row col" pair from the player.
 */
public final class InputAnswer {
    private final boolean exhausted;
    private final boolean malformed;
    private final int row;
    private final int col;

    private InputAnswer(boolean exhausted, boolean malformed, int row, int col) {
        this.exhausted = exhausted;
        this.malformed = malformed;
        this.row = row;
        this.col = col;
    }

    public static InputAnswer of(int row, int col) {
        return new InputAnswer(false, false, row, col);
    }

    public static InputAnswer malformed() {
        return new InputAnswer(false, true, -1, -1);
    }

    public static InputAnswer exhausted() {
        return new InputAnswer(true, false, -1, -1);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public boolean isMalformed() {
        return malformed;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }
}
