package com.tictactoe.player;

import com.tictactoe.io.GameOutput;
import com.tictactoe.io.InputAnswer;
import com.tictactoe.io.MoveInput;
import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;

import java.util.Objects;

/**
 * Asks a person for "row col" until the answer lies inside the grid. Whether the
 * square is free is left to the match.
 */
public final class HumanDecisionSource implements DecisionSource {
    private final String name;
    private final MoveInput input;
    private final GameOutput output;

    public HumanDecisionSource(String name, MoveInput input, GameOutput output) {
        this.name = Objects.requireNonNull(name, "name");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    public Coords choose(Position position, PlayerId player) {
        while (true) {
            output.print("Where? (row col)");
            InputAnswer answer = input.read();
            if (answer.isExhausted()) {
                throw new GameAbortedException("Ah ah, you gave up!");
            }
            if (answer.isMalformed()) {
                output.print("Invalid numbers, try again: ");
            } else if (answer.getRow() < 0 || answer.getRow() >= position.getRows()) {
                output.print("line out of range [0," + position.getRows() + "[, try again: ");
            } else if (answer.getCol() < 0 || answer.getCol() >= position.getCols()) {
                output.print("column out of range [0," + position.getCols() + "[, try again: ");
            } else {
                return new Coords(answer.getRow(), answer.getCol());
            }
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
