package com.tictactoe.io;

import java.io.PrintStream;
import java.util.Objects;

public final class PrintStreamGameOutput implements GameOutput {
    private final PrintStream out;

    public PrintStreamGameOutput(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }
}
