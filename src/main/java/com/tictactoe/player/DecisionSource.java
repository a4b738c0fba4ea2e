package com.tictactoe.player;

import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

/**
 * Decides where a player puts its next mark. The match asks every player the same
 * way, whether a human or a search engine answers.
 */
public interface DecisionSource {
    /**
     * Chooses the next move. The position may be used as scratch space but must be
     * handed back unchanged.
     *
     * @param player the side whose turn it is
     * @return a square inside the grid
     * @throws GameAbortedException when the player can no longer answer
     */
    Coords choose(Position position, PlayerId player);

    String getName();
}
