package com.ipd.transformer;

import com.ipd.model.Action;
import com.ipd.model.Player;

/**
 * Intercepts the action proposed by a wrapped strategy and returns the action actually played.
 *
 * <p>Implementations keeping state must be created per player, see {@link Transformer#ofStateful}.
 */
@FunctionalInterface
public interface StrategyWrapper {
  Action wrap(Player self, Player opponent, Action proposed);

  static StrategyWrapper identity() {
    return (self, opponent, proposed) -> proposed;
  }
}
