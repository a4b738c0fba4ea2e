package com.tictactoe.player;

import com.tictactoe.ai.NegamaxSearch;
import com.tictactoe.io.GameOutput;
import com.tictactoe.model.PlayerId;

public final class NegamaxDecisionSource extends SearchDecisionSource {
    public static final String DEFAULT_NAME = "(AI-negamax)";

    public NegamaxDecisionSource(int depth, PlayerId id, GameOutput output) {
        super(new NegamaxSearch(), depth, id, DEFAULT_NAME, output);
    }
}
