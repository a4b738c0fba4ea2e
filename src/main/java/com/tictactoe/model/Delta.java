package com.tictactoe.model;

public final class Delta {
    public static final Delta VERTICAL = new Delta(1, 0);
    public static final Delta HORIZONTAL = new Delta(0, 1);
    public static final Delta DIAGONAL = new Delta(1, 1);
    public static final Delta ANTI_DIAGONAL = new Delta(1, -1);

    static final Delta[] LINE_FAMILIES = {VERTICAL, HORIZONTAL, DIAGONAL, ANTI_DIAGONAL};

    private final int rowStep;
    private final int colStep;

    public Delta(int rowStep, int colStep) {
        this.rowStep = rowStep;
        this.colStep = colStep;
    }

    public int getRowStep() {
        return rowStep;
    }

    public int getColStep() {
        return colStep;
    }

    @Override
    public String toString() {
        return "(" + rowStep + "," + colStep + ")";
    }
}
