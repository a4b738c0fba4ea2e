package com.tictactoe.controller;

import com.tictactoe.io.BoardCodec;
import com.tictactoe.io.GameOutput;
import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;
import com.tictactoe.player.DecisionSource;
import com.tictactoe.player.GameAbortedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs one match between two decision sources on a shared position.
 *
 * <p>The side to move follows the parity of the occupied squares, so a match can
 * start from a loaded mid-game position.
 */
public class MatchController {
    private final Position position;
    private final GameOutput output;
    private final List<DecisionSource> players = new ArrayList<>(2);
    private MatchResult result = MatchResult.inProgress();

    public MatchController(Position position, GameOutput output) {
        this.position = Objects.requireNonNull(position, "position");
        this.output = Objects.requireNonNull(output, "output");
    }

    /**
     * Registers the next player: the first call seats 'X', the second 'O'.
     */
    public void addPlayer(DecisionSource player) {
        if (players.size() == 2) {
            throw new IllegalStateException("a match has exactly two players");
        }
        players.add(Objects.requireNonNull(player, "player"));
    }

    public List<DecisionSource> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public Position getPosition() {
        return position;
    }

    public MatchResult getResult() {
        return result;
    }

    /**
     * Plays until a side completes a run or the grid is full.
     *
     * @throws GameAbortedException if a player gives up; the position keeps the moves made so far
     */
    public MatchResult play() {
        if (players.size() != 2) {
            throw new IllegalStateException("two players are required, got " + players.size());
        }
        if (result.isOver()) {
            return result;
        }
        PlayerId player = PlayerId.forMoveCount(position.getMoveCount());
        while (!position.isFull()) {
            DecisionSource source = players.get(player.getNumber() - 1);
            output.print("Moves: " + position.getMoveCount()
                + " ; Player " + player.getNumber() + ", " + source.getName() + ", ");
            Coords c = source.choose(position, player);
            if (!position.isInside(c)) {
                throw new IllegalStateException(source.getName() + " chose " + c + " outside the grid");
            }
            if (position.place(c, player)) {
                output.print(BoardCodec.render(position));
                if (position.isWinningMove(c, player)) {
                    output.println("Player " + player.getNumber() + ", " + source.getName() + ", has won!");
                    result = MatchResult.won(player, position.getMoveCount());
                    return result;
                }
                player = player.next();
            } else {
                output.println("Cannot play there, try again.");
            }
        }
        output.println("Draw. Nobody wins.");
        result = MatchResult.draw(position.getMoveCount());
        return result;
    }
}
