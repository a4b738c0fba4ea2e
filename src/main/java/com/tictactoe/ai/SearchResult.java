package com.tictactoe.ai;

import com.tictactoe.model.Coords;

import java.util.Locale;

public final class SearchResult {
    private final Coords bestMove;
    private final int score;
    private final int depth;
    private final long nodes;

    public SearchResult(Coords bestMove, int score, int depth, long nodes) {
        this.bestMove = bestMove;
        this.score = score;
        this.depth = depth;
        this.nodes = nodes;
    }

    static SearchResult noMove(int depth) {
        return new SearchResult(null, 0, depth, 0L);
    }

    public Coords getBestMove() {
        return bestMove;
    }

    public boolean hasMove() {
        return bestMove != null;
    }

    public int getScore() {
        return score;
    }

    public int getDepth() {
        return depth;
    }

    public long getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SearchResult{move=%s, score=%d, depth=%d, nodes=%d}",
            bestMove, score, depth, nodes);
    }
}
