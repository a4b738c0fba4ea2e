package com.tictactoe.player;

import com.tictactoe.ai.SearchResult;
import com.tictactoe.ai.SearchStrategy;
import com.tictactoe.io.GameOutput;
import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

import java.util.Objects;

/**
 * Computer player backed by a search strategy with a fixed depth and a fixed side.
 * Each choice is reported as {@code <engine> plays at {r,c} (score)}, followed by a
 * hint when the score announces a forced result.
 */
public abstract class SearchDecisionSource implements DecisionSource {
    static final int FORCED_RESULT_THRESHOLD = 950;

    private final SearchStrategy strategy;
    private final int depth;
    private final PlayerId id;
    private final String name;
    private final GameOutput output;
    private SearchResult lastResult;

    protected SearchDecisionSource(SearchStrategy strategy, int depth, PlayerId id, String name, GameOutput output) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.depth = depth;
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.output = Objects.requireNonNull(output, "output");
    }

    /**
     * Searches for this source's own side.
     *
     * @throws IllegalStateException if the match asks this source to move for the other side
     */
    @Override
    public Coords choose(Position position, PlayerId player) {
        if (player != id) {
            throw new IllegalStateException(name + " plays " + id + ", asked to move for " + player);
        }
        SearchResult result = strategy.search(position, id, depth);
        if (!result.hasMove()) {
            throw new IllegalStateException("no empty square left to play");
        }
        lastResult = result;
        output.println("negamax plays at " + result.getBestMove() + " (" + result.getScore() + ")");
        if (result.getScore() > FORCED_RESULT_THRESHOLD) {
            output.println("You'll lose!");
        } else if (result.getScore() < -FORCED_RESULT_THRESHOLD) {
            output.println("You should win...");
        }
        return result.getBestMove();
    }

    /**
     * Outcome of the latest {@link #choose} call, null before the first one.
     */
    public SearchResult getLastResult() {
        return lastResult;
    }

    public int getDepth() {
        return depth;
    }

    public PlayerId getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }
}
