package com.tictactoe.ai;

import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

/**
 * Game-tree search that picks a move for one side.
 *
 * <p>Implementations explore by placing and clearing marks on the given position and
 * hand it back exactly as they received it. Scores are bounded by
 * [{@code -WIN_SCORE}, {@code WIN_SCORE}].
 */
public interface SearchStrategy {
    int WIN_SCORE = 1000;

    /**
     * @param depth remaining depth given to the nodes reached by the root moves
     * @return the best move and its score; no move and a score of 0 on a full board
     */
    SearchResult search(Position position, PlayerId player, int depth);

    String getName();
}
