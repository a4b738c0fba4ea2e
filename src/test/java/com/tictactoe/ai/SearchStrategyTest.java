package com.tictactoe.ai;

import com.tictactoe.model.Coords;
import com.tictactoe.model.PlayerId;
import com.tictactoe.model.Position;
import com.tictactoe.model.Positions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract shared by both strategies.
 */
class SearchStrategyTest {

    static Stream<SearchStrategy> strategies() {
        return Stream.of(new NegamaxSearch(), new AlphaBetaNegamaxSearch());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void shouldLeavePositionUntouched(SearchStrategy strategy) {
        Position p = Positions.of(3, "X..", ".O.", "...");
        Position before = p.copy();
        strategy.search(p, PlayerId.FIRST, 4);
        assertEquals(before, p);
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void shouldReturnASquareThatWasEmpty(SearchStrategy strategy) {
        Position p = Positions.of(3, "XOX", ".O.", "X..");
        SearchResult r = strategy.search(p, PlayerId.SECOND, 3);
        assertTrue(r.hasMove());
        assertTrue(p.isEmpty(r.getBestMove()));
    }

    static Stream<Arguments> immediateWinLayouts() {
        return Stream.of(
            Arguments.of((Object) new String[] {"XX.", "...", "..."}),
            Arguments.of((Object) new String[] {"XX.", ".O.", "..O"}),
            Arguments.of((Object) new String[] {"XX.", "OO.", "..."}),
            Arguments.of((Object) new String[] {"XX.", "O..", ".O."})
        );
    }

    @ParameterizedTest
    @MethodSource("immediateWinLayouts")
    void negamaxShouldCompleteTheRowAtDepthOne(String[] rows) {
        Position p = Positions.of(3, rows);
        SearchResult r = new NegamaxSearch().search(p, PlayerId.FIRST, 1);
        assertEquals(new Coords(0, 2), r.getBestMove());
        assertEquals(SearchStrategy.WIN_SCORE - 1, r.getScore());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void shouldTakeTheWinWhenOpponentThreatens(SearchStrategy strategy) {
        for (int depth = 1; depth <= 4; depth++) {
            Position p = Positions.of(3, "XX.", "OO.", "...");
            SearchResult r = strategy.search(p, PlayerId.FIRST, depth);
            assertEquals(new Coords(0, 2), r.getBestMove(), "depth " + depth);
            assertEquals(SearchStrategy.WIN_SCORE - depth, r.getScore(), "depth " + depth);
            assertEquals(depth, r.getDepth());
        }
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void shouldBlockAnImmediateThreat(SearchStrategy strategy) {
        Position p = Positions.of(3, "XX.", ".O.", "...");
        SearchResult r = strategy.search(p, PlayerId.SECOND, 2);
        assertEquals(new Coords(0, 2), r.getBestMove());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void fullBoardShouldScoreZeroWithoutMove(SearchStrategy strategy) {
        Position p = Positions.of(3, "XOX", "XOO", "OXX");
        SearchResult r = strategy.search(p, PlayerId.FIRST, 3);
        assertFalse(r.hasMove());
        assertNull(r.getBestMove());
        assertEquals(0, r.getScore());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void lastSquareWithoutWinShouldScoreZero(SearchStrategy strategy) {
        Position p = Positions.of(3, "XOX", "XOO", "OX.");
        for (int depth = 0; depth <= 3; depth++) {
            SearchResult r = strategy.search(p, PlayerId.FIRST, depth);
            assertEquals(new Coords(2, 2), r.getBestMove());
            assertEquals(0, r.getScore(), "depth " + depth);
        }
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void depthZeroOnEmptyBoardShouldScoreZero(SearchStrategy strategy) {
        Position p = new Position(3, 3, 3);
        SearchResult r = strategy.search(p, PlayerId.FIRST, 0);
        assertTrue(p.isEmpty(r.getBestMove()));
        assertEquals(new Coords(0, 0), r.getBestMove());
        assertEquals(0, r.getScore());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void depthZeroStillSeesAWinningMove(SearchStrategy strategy) {
        Position p = Positions.of(3, "XX.", "...", "...");
        SearchResult r = strategy.search(p, PlayerId.FIRST, 0);
        assertEquals(new Coords(0, 2), r.getBestMove());
        assertEquals(SearchStrategy.WIN_SCORE, r.getScore());
    }

    @ParameterizedTest
    @MethodSource("strategies")
    void shouldRejectNegativeDepth(SearchStrategy strategy) {
        Position p = new Position(3, 3, 3);
        assertThrows(IllegalArgumentException.class, () -> strategy.search(p, PlayerId.FIRST, -1));
    }
}
