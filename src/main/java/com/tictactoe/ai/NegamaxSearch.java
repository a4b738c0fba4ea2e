package com.tictactoe.ai;

import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

/**
 * Exhaustive negamax to a fixed depth. Only terminal positions are scored: a win
 * costs the side to move {@code -WIN_SCORE + remainingDepth}, everything else is 0.
 * Not thread-safe.
 */
public final class NegamaxSearch implements SearchStrategy {
    private long nodes;

    @Override
    public SearchResult search(Position position, PlayerId player, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
        nodes = 0L;
        Coords best = null;
        int max = Integer.MIN_VALUE;
        for (Coords where : position.emptyCells()) {
            position.place(where, player);
            int eval = -negamax(position, depth, player, where);
            position.clear(where);
            if (eval > max) {
                max = eval;
                best = where;
            }
        }
        if (best == null) {
            return SearchResult.noMove(depth);
        }
        return new SearchResult(best, max, depth, nodes);
    }

    private int negamax(Position position, int depth, PlayerId who, Coords current) {
        nodes++;
        if (position.isWinningMove(current, who)) {
            return -WIN_SCORE + depth;
        }
        if (depth == 0) {
            return 0;
        }
        int max = Integer.MIN_VALUE;
        PlayerId adv = who.next();
        for (Coords child : position.emptyCells()) {
            position.place(child, adv);
            int eval = -negamax(position, depth - 1, adv, child);
            position.clear(child);
            if (eval > max) {
                max = eval;
            }
        }
        // no child node
        if (max == Integer.MIN_VALUE) {
            return 0;
        }
        return max;
    }

    @Override
    public String getName() {
        return "negamax";
    }
}
