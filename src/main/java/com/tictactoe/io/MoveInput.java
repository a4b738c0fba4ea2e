package com.tictactoe.io;

/**
 * Source of coordinates typed by a human player.
 */
public interface MoveInput {
    /**
     * Blocks until the player answers. Never returns null.
     */
    InputAnswer read();
}
