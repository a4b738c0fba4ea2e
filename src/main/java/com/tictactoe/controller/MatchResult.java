package com.tictactoe.controller;

import com.tictactoe.model.PlayerId;

public final class MatchResult {
    public enum State {
        IN_PROGRESS,
        WON,
        DRAW
    }

    private static final MatchResult IN_PROGRESS = new MatchResult(State.IN_PROGRESS, null, 0);

    private final State state;
    private final PlayerId winner;
    private final int moves;

    private MatchResult(State state, PlayerId winner, int moves) {
        this.state = state;
        this.winner = winner;
        this.moves = moves;
    }

    public static MatchResult inProgress() {
        return IN_PROGRESS;
    }

    public static MatchResult won(PlayerId winner, int moves) {
        return new MatchResult(State.WON, winner, moves);
    }

    public static MatchResult draw(int moves) {
        return new MatchResult(State.DRAW, null, moves);
    }

    public State getState() {
        return state;
    }

    public boolean isOver() {
        return state != State.IN_PROGRESS;
    }

    public PlayerId getWinner() {
        return winner;
    }

    public int getMoves() {
        return moves;
    }

    @Override
    public String toString() {
        if (state == State.WON) {
            return "WON(" + winner + ")";
        }
        return state.name();
    }
}
