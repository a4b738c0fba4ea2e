package com.tictactoe.tools;

import com.tictactoe.ai.AlphaBetaNegamaxSearch;
import com.tictactoe.ai.NegamaxSearch;
import com.tictactoe.ai.SearchResult;
import com.tictactoe.ai.SearchStrategy;
import com.tictactoe.io.BoardCodec;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Search benchmark runner:
 * - node count and time of negamax vs. negamax-ab per position and depth
 * - flags any position where the two root scores disagree
 */
public final class SearchBenchmarkMain {
    private static final Map<String, String> POSITIONS = new LinkedHashMap<>();

    static {
        POSITIONS.put("3x3 empty",
            "| | | |\n| | | |\n| | | |\n");
        POSITIONS.put("3x3 opening",
            "|X| | |\n| |O| |\n| | | |\n");
        POSITIONS.put("3x3 X threatens",
            "|X|X| |\n| |O| |\n| | |O|\n");
        POSITIONS.put("4x4 k3 midgame",
            "|X| | | |\n| |O| | |\n| | |X| |\n|O| | | |\n");
    }

    static final class Row {
        final String position;
        final int depth;
        final String strategy;
        final SearchResult result;
        final double millis;

        Row(String position, int depth, String strategy, SearchResult result, double millis) {
            this.position = position;
            this.depth = depth;
            this.strategy = strategy;
            this.result = result;
            this.millis = millis;
        }
    }

    private SearchBenchmarkMain() {
    }

    public static void main(String[] args) {
        int maxDepth = intArg(args, "--maxDepth", 4);
        int winLength = intArg(args, "--win", 3);
        List<Row> rows = run(maxDepth, winLength);
        System.out.println(renderReport(rows));
        long mismatches = countMismatches(rows);
        if (mismatches > 0) {
            System.out.println("WARNING: " + mismatches + " score mismatch(es) between strategies");
        }
    }

    static List<Row> run(int maxDepth, int winLength) {
        List<Row> rows = new ArrayList<>();
        SearchStrategy[] strategies = {new NegamaxSearch(), new AlphaBetaNegamaxSearch()};
        for (Map.Entry<String, String> e : POSITIONS.entrySet()) {
            for (int depth = 0; depth <= maxDepth; depth++) {
                for (SearchStrategy strategy : strategies) {
                    Position position = BoardCodec.parse(e.getValue(), winLength);
                    PlayerId toMove = PlayerId.forMoveCount(position.getMoveCount());
                    long t0 = System.nanoTime();
                    SearchResult result = strategy.search(position, toMove, depth);
                    double ms = (System.nanoTime() - t0) / 1_000_000.0;
                    rows.add(new Row(e.getKey(), depth, strategy.getName(), result, ms));
                }
            }
        }
        return rows;
    }

    static long countMismatches(List<Row> rows) {
        long n = 0;
        for (int i = 0; i + 1 < rows.size(); i += 2) {
            if (rows.get(i).result.getScore() != rows.get(i + 1).result.getScore()) {
                n++;
            }
        }
        return n;
    }

    static String renderReport(List<Row> rows) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-18s %5s %-11s %-8s %6s %10s %10s%n",
            "position", "depth", "strategy", "move", "score", "nodes", "ms"));
        for (Row r : rows) {
            sb.append(String.format(Locale.ROOT, "%-18s %5d %-11s %-8s %6d %10d %10.2f%n",
                r.position, r.depth, r.strategy, String.valueOf(r.result.getBestMove()),
                r.result.getScore(), r.result.getNodes(), r.millis));
        }
        return sb.toString();
    }

    private static int intArg(String[] args, String key, int defaultValue) {
        String raw = argValue(args, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignore) {
            return defaultValue;
        }
    }

    private static String argValue(String[] args, String key) {
        for (int i = 0; i + 1 < args.length; i++) {
            if (key.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }
}
