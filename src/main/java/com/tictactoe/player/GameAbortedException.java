package com.tictactoe.player;

/**
 * Thrown when a player stops answering, e.g. its input stream ended. The match is
 * over and cannot be resumed.
 */
public class GameAbortedException extends RuntimeException {
    public GameAbortedException(String message) {
        super(message);
    }
}
