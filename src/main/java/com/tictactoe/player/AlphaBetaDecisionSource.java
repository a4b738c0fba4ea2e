package com.tictactoe.player;

import com.tictactoe.ai.AlphaBetaNegamaxSearch;
import com.tictactoe.io.GameOutput;
import com.tictactoe.model.PlayerId;

public final class AlphaBetaDecisionSource extends SearchDecisionSource {
    public static final String DEFAULT_NAME = "(AI-negamax-AB)";

    public AlphaBetaDecisionSource(int depth, PlayerId id, GameOutput output) {
        super(new AlphaBetaNegamaxSearch(), depth, id, DEFAULT_NAME, output);
    }
}
