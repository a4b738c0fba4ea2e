package com.tictactoe.tools;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Match settings. Defaults come from system properties, then environment variables,
 * then built-in values; command-line flags override all of them.
 *
 * <p>Config:
 * <ul>
 * <li>{@code ttt.rows} / {@code TTT_ROWS}</li>
 * <li>{@code ttt.cols} / {@code TTT_COLS}</li>
 * <li>{@code ttt.win} / {@code TTT_WIN}</li>
 * <li>{@code ttt.negamax.depth} / {@code TTT_NEGAMAX_DEPTH}</li>
 * <li>{@code ttt.alphabeta.depth} / {@code TTT_ALPHABETA_DEPTH}</li>
 * </ul>
 */
public final class GameSettings {
    static final int DEFAULT_ROWS = 8;
    static final int DEFAULT_COLS = 8;
    static final int DEFAULT_WIN = 4;
    static final int DEFAULT_NEGAMAX_DEPTH = 3;
    static final int DEFAULT_ALPHABETA_DEPTH = 5;

    private int rows;
    private int cols;
    private int winLength;
    private int negamaxDepth;
    private int alphaBetaDepth;
    private Path boardFile;
    private final List<String> playerTokens = new ArrayList<>(2);

    private GameSettings() {
    }

    public static GameSettings fromEnvironment() {
        GameSettings s = new GameSettings();
        s.rows = positiveSetting("ttt.rows", "TTT_ROWS", DEFAULT_ROWS);
        s.cols = positiveSetting("ttt.cols", "TTT_COLS", DEFAULT_COLS);
        s.winLength = positiveSetting("ttt.win", "TTT_WIN", DEFAULT_WIN);
        s.negamaxDepth = depthSetting("ttt.negamax.depth", "TTT_NEGAMAX_DEPTH", DEFAULT_NEGAMAX_DEPTH);
        s.alphaBetaDepth = depthSetting("ttt.alphabeta.depth", "TTT_ALPHABETA_DEPTH", DEFAULT_ALPHABETA_DEPTH);
        return s;
    }

    /**
     * Applies command-line arguments on top of the environment defaults.
     *
     * @throws IllegalArgumentException when a flag misses its value
     */
    public static GameSettings parse(String[] args) {
        GameSettings s = fromEnvironment();
        for (int i = 0; i < args.length; i++) {
            String opt = args[i];
            switch (opt) {
                case "--board":
                case "-b":
                    s.boardFile = Paths.get(value(args, ++i, opt));
                    break;
                case "--rows":
                    s.rows = parsePositive(value(args, ++i, opt), s.rows);
                    break;
                case "--cols":
                    s.cols = parsePositive(value(args, ++i, opt), s.cols);
                    break;
                case "--win":
                    s.winLength = parsePositive(value(args, ++i, opt), s.winLength);
                    break;
                case "--negamax-depth":
                    s.negamaxDepth = parseDepth(value(args, ++i, opt), s.negamaxDepth);
                    break;
                case "--alphabeta-depth":
                    s.alphaBetaDepth = parseDepth(value(args, ++i, opt), s.alphaBetaDepth);
                    break;
                default:
                    s.playerTokens.add(opt);
                    break;
            }
        }
        return s;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int getWinLength() {
        return winLength;
    }

    public int getNegamaxDepth() {
        return negamaxDepth;
    }

    public int getAlphaBetaDepth() {
        return alphaBetaDepth;
    }

    /**
     * @return the saved board to start from, or null for an empty grid
     */
    public Path getBoardFile() {
        return boardFile;
    }

    public List<String> getPlayerTokens() {
        return Collections.unmodifiableList(playerTokens);
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length) {
            throw new IllegalArgumentException("missing value after " + opt);
        }
        return args[i];
    }

    private static int positiveSetting(String prop, String env, int defaultValue) {
        return parsePositive(readSetting(prop, env), defaultValue);
    }

    private static int depthSetting(String prop, String env, int defaultValue) {
        return parseDepth(readSetting(prop, env), defaultValue);
    }

    private static String readSetting(String prop, String env) {
        String v = System.getProperty(prop);
        if (v == null || v.trim().isEmpty()) {
            v = System.getenv(env);
        }
        if (v == null || v.trim().isEmpty()) {
            return null;
        }
        return v;
    }

    static int parsePositive(String raw, int fallback) {
        int v = parseInt(raw, fallback);
        return v > 0 ? v : fallback;
    }

    static int parseDepth(String raw, int fallback) {
        int v = parseInt(raw, fallback);
        return v >= 0 ? v : fallback;
    }

    private static int parseInt(String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }
}
