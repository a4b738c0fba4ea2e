package com.tictactoe.tools;

import com.tictactoe.io.GameOutput;
import com.tictactoe.io.MoveInput;
import com.tictactoe.model.PlayerId;
import com.tictactoe.player.AlphaBetaDecisionSource;
import com.tictactoe.player.DecisionSource;
import com.tictactoe.player.HumanDecisionSource;
import com.tictactoe.player.NegamaxDecisionSource;

import java.util.Locale;

/**
 * Turns a command-line player token into a decision source:
 * {@code n}/{@code negamax}, {@code a}/{@code negamax-ab}, {@code h}/{@code human}.
 * Any other token is a human player named after the token.
 */
public final class PlayerFactory {
    public static final String HUMAN_NAME = "(Human)";

    private final GameSettings settings;
    private final MoveInput input;
    private final GameOutput output;

    public PlayerFactory(GameSettings settings, MoveInput input, GameOutput output) {
        this.settings = settings;
        this.input = input;
        this.output = output;
    }

    public DecisionSource create(String token, PlayerId id) {
        String t = token.trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "n":
            case "negamax":
                return new NegamaxDecisionSource(settings.getNegamaxDepth(), id, output);
            case "a":
            case "negamax-ab":
                return new AlphaBetaDecisionSource(settings.getAlphaBetaDepth(), id, output);
            case "h":
            case "human":
                return new HumanDecisionSource(HUMAN_NAME, input, output);
            default:
                return new HumanDecisionSource(token, input, output);
        }
    }
}
