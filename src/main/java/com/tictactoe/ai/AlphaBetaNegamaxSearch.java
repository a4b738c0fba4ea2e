package com.tictactoe.ai;

import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

/**
 * Negamax with alpha-beta pruning (fail-soft). Returns the same root score as
 * {@link NegamaxSearch}; among equally scored root moves it may keep a different
 * one because cut-off siblings are never looked at. Not thread-safe.
 */
public final class AlphaBetaNegamaxSearch implements SearchStrategy {
    private long nodes;
    private long cutoffs;

    @Override
    public SearchResult search(Position position, PlayerId player, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
        nodes = 0L;
        cutoffs = 0L;
        Coords best = null;
        int max = Integer.MIN_VALUE;
        int alpha = -WIN_SCORE;
        int beta = WIN_SCORE;
        for (Coords where : position.emptyCells()) {
            position.place(where, player);
            int eval = -negamax(position, depth, player, where, -beta, -alpha);
            position.clear(where);
            if (eval > max) {
                max = eval;
                best = where;
            }
            if (eval > alpha) {
                alpha = eval;
                if (alpha >= beta) {
                    cutoffs++;
                    break;
                }
            }
        }
        if (best == null) {
            return SearchResult.noMove(depth);
        }
        return new SearchResult(best, max, depth, nodes);
    }

    private int negamax(Position position, int depth, PlayerId who, Coords current, int alpha, int beta) {
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
            int eval = -negamax(position, depth - 1, adv, child, -beta, -alpha);
            position.clear(child);
            if (eval > max) {
                max = eval;
            }
            if (eval > alpha) {
                alpha = eval;
                if (alpha >= beta) {
                    cutoffs++;
                    break;
                }
            }
        }
        if (max == Integer.MIN_VALUE) {
            return 0;
        }
        return max;
    }

    public long getLastCutoffs() {
        return cutoffs;
    }

    @Override
    public String getName() {
        return "negamax-ab";
    }
}
