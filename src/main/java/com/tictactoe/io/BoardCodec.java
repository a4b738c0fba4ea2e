package com.tictactoe.io;

import com.tictactoe.model.Grid;
import com.tictactoe.model.Position;
import com.tictactoe.model.Square;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Text form of a board, as printed during a match:
 *
 * <pre>
 * +-+-+-+
 * |X| |O|
 * +-+-+-+
 * </pre>
 *
 * When reading, only lines starting with {@code |} matter and a {@code <<EOF} line
 * stops the scan.
 */
public final class BoardCodec {
    public static final String END_MARKER = "<<EOF";

    private BoardCodec() {
    }

    public static Position read(Path file, int winLength) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, winLength);
        }
    }

    public static Position parse(String text, int winLength) {
        try {
            return read(new StringReader(text), winLength);
        } catch (IOException e) {
            throw new IllegalStateException("StringReader failed", e);
        }
    }

    public static Position read(Reader source, int winLength) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<String> lines = new ArrayList<>();
        int cols = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.startsWith("|")) {
                lines.add(line);
                // column count comes from the last row seen
                cols = (line.length() - 1) / 2;
            } else if (END_MARKER.equals(line)) {
                break;
            }
        }
        if (lines.isEmpty() || cols < 1) {
            throw new IllegalArgumentException("no board rows found");
        }
        Grid grid = new Grid(lines.size(), cols);
        for (int r = 0; r < lines.size(); r++) {
            String row = lines.get(r);
            for (int c = 0; c < cols; c++) {
                int idx = c * 2 + 1;
                Square s = idx < row.length() ? Square.fromChar(row.charAt(idx)) : Square.EMPTY;
                if (s != Square.EMPTY) {
                    grid.set(r, c, s);
                }
            }
        }
        return new Position(grid, Math.min(winLength, Math.max(grid.getRows(), grid.getCols())));
    }

    public static String render(Position position) {
        StringBuilder sb = new StringBuilder((position.getRows() * 2 + 1) * (position.getCols() * 2 + 2));
        drawLine(sb, position.getCols());
        for (int r = 0; r < position.getRows(); r++) {
            sb.append("\n|");
            for (int c = 0; c < position.getCols(); c++) {
                sb.append(position.getSquare(r, c).asChar()).append('|');
            }
            sb.append('\n');
            drawLine(sb, position.getCols());
        }
        return sb.append('\n').toString();
    }

    private static void drawLine(StringBuilder sb, int cols) {
        sb.append('+');
        for (int c = 0; c < cols; c++) {
            sb.append("-+");
        }
    }
}
