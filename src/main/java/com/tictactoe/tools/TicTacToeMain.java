package com.tictactoe.tools;

import com.tictactoe.controller.MatchController;
import com.tictactoe.io.BoardCodec;
import com.tictactoe.io.ConsoleMoveInput;
import com.tictactoe.io.GameOutput;
import com.tictactoe.io.MoveInput;
import com.tictactoe.io.PrintStreamGameOutput;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;
import com.tictactoe.player.GameAbortedException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Console entry point.
 *
 * <pre>
 * TicTacToeMain [--board|-b file] [--rows n] [--cols n] [--win k]
 *               [--negamax-depth d] [--alphabeta-depth d] &lt;player&gt; &lt;player&gt;
 * </pre>
 */
public final class TicTacToeMain {
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private TicTacToeMain() {
    }

    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != EXIT_SUCCESS) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        GameSettings settings;
        try {
            settings = GameSettings.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(out);
            return EXIT_FAILURE;
        }
        List<String> tokens = settings.getPlayerTokens();
        if (tokens.size() != 2) {
            printUsage(out);
            return EXIT_FAILURE;
        }

        GameOutput output = new PrintStreamGameOutput(out);
        MoveInput input = new ConsoleMoveInput(in);
        try {
            Position position = loadPosition(settings);
            MatchController match = new MatchController(position, output);
            PlayerFactory factory = new PlayerFactory(settings, input, output);
            PlayerId id = PlayerId.FIRST;
            for (String token : tokens) {
                match.addPlayer(factory.create(token, id));
                id = id.next();
            }
            output.print(BoardCodec.render(position));
            match.play();
            return EXIT_SUCCESS;
        } catch (IOException e) {
            err.println("Cannot open " + settings.getBoardFile() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException e) {
            err.println("Cannot read moves: " + e.getCause().getMessage());
            return EXIT_FAILURE;
        } catch (GameAbortedException e) {
            err.println();
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static Position loadPosition(GameSettings settings) throws IOException {
        if (settings.getBoardFile() != null) {
            return BoardCodec.read(settings.getBoardFile(), settings.getWinLength());
        }
        int longest = Math.max(settings.getRows(), settings.getCols());
        return new Position(settings.getRows(), settings.getCols(), Math.min(settings.getWinLength(), longest));
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: TicTacToeMain [options] <player> <player>");
        out.println("\t[options]");
        out.println("\t\t--board <filename>");
        out.println("\t\t--rows <n> --cols <n> --win <k>");
        out.println("\t\t--negamax-depth <d> --alphabeta-depth <d>");
        out.println("\t<player>");
        out.println("\t\tn==ai player, (n)egamax");
        out.println("\t\ta==ai player, negamax-(a)lphabeta");
        out.println("\t\th==(h)uman player");
    }
}
