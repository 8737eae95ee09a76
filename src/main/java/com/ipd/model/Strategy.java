package com.ipd.model;

import java.util.function.Function;

/**
 * A decision rule. The acting player is always passed explicitly, strategies that only look at the opponent are
 * adapted through {@link #ofOpponent(Function)}.
 *
 * <p>A strategy instance belongs to exactly one {@link Player}; any state it keeps is private to that player.
 */
@FunctionalInterface
public interface Strategy {
    Action decide(Player self, Player opponent);

    static Strategy ofOpponent(Function<Player, Action> rule) {
        return (self, opponent) -> rule.apply(opponent);
    }

    static Strategy constant(Action action) {
        return (self, opponent) -> action;
    }
}
