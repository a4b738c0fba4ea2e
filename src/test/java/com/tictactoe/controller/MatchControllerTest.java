package com.tictactoe.controller;

import com.tictactoe.io.RecordingOutput;
import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;
import com.tictactoe.model.Positions;
import com.tictactoe.model.Square;
import com.tictactoe.player.AlphaBetaDecisionSource;
import com.tictactoe.player.GameAbortedException;
import com.tictactoe.player.NegamaxDecisionSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchControllerTest {

    @Test
    void shouldStopAtFirstCompletedRun() {
        RecordingOutput out = new RecordingOutput();
        MatchController match = new MatchController(new Position(3, 3, 3), out);
        match.addPlayer(new ScriptedDecisionSource("alice", 0, 0, 0, 1, 0, 2));
        match.addPlayer(new ScriptedDecisionSource("bob", 1, 0, 1, 1));

        MatchResult result = match.play();

        assertEquals(MatchResult.State.WON, result.getState());
        assertEquals(PlayerId.FIRST, result.getWinner());
        assertEquals(5, result.getMoves());
        assertTrue(out.text().startsWith("Moves: 0 ; Player 1, alice, "));
        assertTrue(out.text().contains("Moves: 1 ; Player 2, bob, "));
        assertTrue(out.text().endsWith("Player 1, alice, has won!\n"));
    }

    @Test
    void occupiedSquareShouldNotPassTheTurn() {
        RecordingOutput out = new RecordingOutput();
        MatchController match = new MatchController(new Position(3, 3, 3), out);
        ScriptedDecisionSource bob = new ScriptedDecisionSource("bob", 0, 0, 1, 1, 2, 1);
        match.addPlayer(new ScriptedDecisionSource("alice", 0, 0, 0, 1, 0, 2));
        match.addPlayer(bob);

        MatchResult result = match.play();

        assertTrue(out.text().contains("Cannot play there, try again.\nMoves: 1 ; Player 2, bob, "));
        assertEquals(3, bob.getCalls());
        assertEquals(PlayerId.FIRST, result.getWinner());
        assertEquals(Square.SECOND, match.getPosition().getSquare(new Coords(1, 1)));
    }

    @Test
    void fullBoardWithoutRunShouldBeADraw() {
        RecordingOutput out = new RecordingOutput();
        MatchController match = new MatchController(new Position(3, 3, 3), out);
        match.addPlayer(new ScriptedDecisionSource("x", 0, 0, 0, 2, 1, 0, 2, 1, 2, 2));
        match.addPlayer(new ScriptedDecisionSource("o", 0, 1, 1, 1, 1, 2, 2, 0));

        MatchResult result = match.play();

        assertEquals(MatchResult.State.DRAW, result.getState());
        assertNull(result.getWinner());
        assertEquals(9, result.getMoves());
        assertTrue(out.text().endsWith("Draw. Nobody wins.\n"));
    }

    @Test
    void loadedPositionDecidesWhoMovesFirst() {
        Position p = Positions.of(3, "X..", "...", "...");
        MatchController match = new MatchController(p, new RecordingOutput());
        ScriptedDecisionSource x = new ScriptedDecisionSource("x", 0, 1, 2, 2);
        ScriptedDecisionSource o = new ScriptedDecisionSource("o", 1, 0, 1, 1, 1, 2);
        match.addPlayer(x);
        match.addPlayer(o);

        MatchResult result = match.play();

        assertEquals(PlayerId.SECOND, result.getWinner());
        assertEquals(3, o.getCalls());
        assertEquals(2, x.getCalls());
    }

    @Test
    void abortShouldPropagateAndKeepPlayedMoves() {
        MatchController match = new MatchController(new Position(3, 3, 3), new RecordingOutput());
        match.addPlayer(new ScriptedDecisionSource("x", 1, 1));
        match.addPlayer(new ScriptedDecisionSource("o"));

        assertThrows(GameAbortedException.class, match::play);
        assertEquals(1, match.getPosition().getMoveCount());
        assertFalse(match.getResult().isOver());
    }

    @Test
    void shouldRequireTwoPlayers() {
        MatchController match = new MatchController(new Position(3, 3, 3), new RecordingOutput());
        match.addPlayer(new ScriptedDecisionSource("x"));
        assertThrows(IllegalStateException.class, match::play);
        match.addPlayer(new ScriptedDecisionSource("o"));
        assertEquals(2, match.getPlayers().size());
        assertThrows(IllegalStateException.class, () -> match.addPlayer(new ScriptedDecisionSource("z")));
    }

    @Test
    void negamaxMirrorMatchShouldDraw() {
        RecordingOutput out = new RecordingOutput();
        MatchController match = new MatchController(new Position(3, 3, 3), out);
        match.addPlayer(new NegamaxDecisionSource(3, PlayerId.FIRST, out));
        match.addPlayer(new NegamaxDecisionSource(3, PlayerId.SECOND, out));

        MatchResult result = match.play();

        assertEquals(MatchResult.State.DRAW, result.getState());
        assertTrue(match.getPosition().isFull());
    }

    @Test
    void deeperAlphaBetaShouldBeatShallowNegamax() {
        MatchController match = new MatchController(new Position(3, 3, 3), new RecordingOutput());
        RecordingOutput out = new RecordingOutput();
        match.addPlayer(new AlphaBetaDecisionSource(5, PlayerId.FIRST, out));
        match.addPlayer(new NegamaxDecisionSource(3, PlayerId.SECOND, out));

        MatchResult result = match.play();

        assertEquals(PlayerId.FIRST, result.getWinner());
        assertEquals(7, result.getMoves());
    }

    @Test
    void searchPlayerShouldFinishFromLoadedThreat() {
        RecordingOutput out = new RecordingOutput();
        MatchController match = new MatchController(Positions.of(3, "XX.", "OO.", "..."), out);
        match.addPlayer(new NegamaxDecisionSource(2, PlayerId.FIRST, out));
        match.addPlayer(new AlphaBetaDecisionSource(2, PlayerId.SECOND, out));

        MatchResult result = match.play();

        assertEquals(PlayerId.FIRST, result.getWinner());
        assertEquals(5, result.getMoves());
        assertTrue(out.text().contains("negamax plays at {0,2} (998)\nYou'll lose!\n"));
    }

    @Test
    void playingAgainAfterTheEndReturnsTheSameResult() {
        MatchController match = new MatchController(new Position(1, 3, 3), new RecordingOutput());
        match.addPlayer(new ScriptedDecisionSource("x", 0, 0, 0, 2));
        match.addPlayer(new ScriptedDecisionSource("o", 0, 1));
        MatchResult first = match.play();
        assertEquals(MatchResult.State.DRAW, first.getState());
        assertEquals(first, match.play());
    }
}
