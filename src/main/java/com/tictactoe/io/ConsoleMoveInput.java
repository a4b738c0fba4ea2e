package com.tictactoe.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads one "row col" answer per line. Blank lines are skipped.
 */
public final class ConsoleMoveInput implements MoveInput {
    private final BufferedReader reader;

    public ConsoleMoveInput(InputStream in) {
        this(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public ConsoleMoveInput(Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    @Override
    public InputAnswer read() {
        String line;
        try {
            do {
                line = reader.readLine();
                if (line == null) {
                    return InputAnswer.exhausted();
                }
                line = line.trim();
            } while (line.isEmpty());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read player input", e);
        }
        String[] parts = line.split("\\s+");
        if (parts.length < 2) {
            return InputAnswer.malformed();
        }
        try {
            return InputAnswer.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException ignored) {
            return InputAnswer.malformed();
        }
    }
}
