package com.tictactoe.model;

public enum Square {
    EMPTY(' '),
    FIRST('X'),
    SECOND('O');

    private final char symbol;

    Square(char symbol) {
        this.symbol = symbol;
    }

    public char asChar() {
        return symbol;
    }

    public static Square fromChar(char ch) {
        if (ch == 'X') {
            return FIRST;
        }
        if (ch == 'O') {
            return SECOND;
        }
        return EMPTY;
    }
}
