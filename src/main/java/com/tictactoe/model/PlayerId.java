package com.tictactoe.model;

public enum PlayerId {
    FIRST(1, Square.FIRST),
    SECOND(2, Square.SECOND);

    private final int number;
    private final Square square;

    PlayerId(int number, Square square) {
        this.number = number;
        this.square = square;
    }

    public int getNumber() {
        return number;
    }

    public Square getSquare() {
        return square;
    }

    public char getSymbol() {
        return square.asChar();
    }

    public PlayerId next() {
        return this == FIRST ? SECOND : FIRST;
    }

    public static PlayerId forMoveCount(int moveCount) {
        return moveCount % 2 == 0 ? FIRST : SECOND;
    }

    @Override
    public String toString() {
        return String.valueOf(getSymbol());
    }
}
