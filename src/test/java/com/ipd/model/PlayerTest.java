package com.ipd.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class PlayerTest {
    private static final PlayerType COOPERATOR = PlayerType.stateless("Cooperator", "Cooperator",
        Classifier.deterministic(0), Strategy.constant(Action.COOPERATE));

    @Test
    void historyIsReadOnlyForStrategies() {
        Player player = COOPERATOR.newPlayer();
        player.recordMove(Action.DEFECT);
        player.recordMove(Action.COOPERATE);

        assertEquals(List.of(Action.DEFECT, Action.COOPERATE), player.history());
        assertEquals(Action.COOPERATE, player.lastMove());
        assertThrows(UnsupportedOperationException.class, () -> player.history().add(Action.DEFECT));
    }

    @Test
    void startsWithUnknownLength() {
        Player player = COOPERATOR.newPlayer();
        assertNull(player.lastMove());
        assertFalse(player.matchAttributes().isLengthKnown());
        assertEquals(MatchAttributes.UNKNOWN_LENGTH, player.matchAttributes().length());
    }

    @Test
    void rejectsStrategyWithoutAction() {
        PlayerType broken = PlayerType.stateless("Broken", "Broken", Classifier.deterministic(0),
            (self, opponent) -> null);
        Player player = broken.newPlayer();
        assertThrows(IllegalStateException.class, () -> player.decide(COOPERATOR.newPlayer()));
    }

    @Test
    void opponentOnlyStrategiesSeeTheOpponent() {
        PlayerType mirror = PlayerType.stateless("Mirror", "Mirror", Classifier.deterministic(1),
            Strategy.ofOpponent(opponent -> opponent.lastMove() == null ? Action.DEFECT : opponent.lastMove()));
        Player player = mirror.newPlayer();
        Player opponent = COOPERATOR.newPlayer();

        assertEquals(Action.DEFECT, player.decide(opponent));
        opponent.recordMove(Action.COOPERATE);
        assertEquals(Action.COOPERATE, player.decide(opponent));
    }

    @Test
    void rejectsInvalidMatchLength() {
        assertThrows(IllegalArgumentException.class, () -> new MatchAttributes(-2));
        assertThrows(IllegalArgumentException.class, () -> MatchAttributes.ofLength(-1));
    }
}
