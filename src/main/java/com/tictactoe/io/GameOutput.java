package com.tictactoe.io;

/**
 * Sink for everything a match tells its players: prompts, board renderings, engine
 * reports and the final announcement.
 */
public interface GameOutput {
    void print(String text);

    default void println(String line) {
        print(line + "\n");
    }
}
